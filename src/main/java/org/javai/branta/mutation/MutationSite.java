package org.javai.branta.mutation;

/**
 * A position inside one alternative of one rule.
 *
 * @param rule the rule name
 * @param bodyIndex index of the alternative within the rule
 * @param position index of the symbol within the alternative
 */
public record MutationSite(String rule, int bodyIndex, int position) {
}
