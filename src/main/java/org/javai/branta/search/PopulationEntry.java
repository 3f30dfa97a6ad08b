package org.javai.branta.search;

import org.javai.branta.grammar.Grammar;

/**
 * A scored grammar kept in the population.
 *
 * @param grammar the candidate
 * @param id grammar id; the seed has id 0 and every proposed mutant takes the next id
 * @param score fitness in [0, 1]
 */
public record PopulationEntry(Grammar grammar, long id, double score) {
}
