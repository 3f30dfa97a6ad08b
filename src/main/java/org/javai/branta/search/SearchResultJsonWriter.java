package org.javai.branta.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.javai.branta.grammar.Grammar;
import org.javai.branta.grammar.Rule;
import org.javai.branta.grammar.Symbol;

/**
 * Writes a {@link SearchResult} as JSON.
 * <p>
 * The document holds the best score and grammar id, the number of generations run, the best
 * grammar (entry, rendering and rules, each body a list of symbols in rendering notation) and
 * the population as id/score pairs in ascending score order.
 */
public class SearchResultJsonWriter {

	private final ObjectMapper mapper;

	public SearchResultJsonWriter() {
		this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
	}

	public String toJson(SearchResult result) {
		try {
			return mapper.writeValueAsString(toNode(result));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize search result", e);
		}
	}

	public void write(SearchResult result, Path path) throws IOException {
		Files.writeString(path, toJson(result), StandardCharsets.UTF_8);
	}

	ObjectNode toNode(SearchResult result) {
		ObjectNode json = mapper.createObjectNode();
		json.put("bestScore", result.bestScore());
		json.put("bestId", result.best().id());
		json.put("generationsRun", result.generationsRun());
		json.put("goodEnough", result.isGoodEnough());
		json.set("grammar", grammarNode(result.bestGrammar()));

		ArrayNode population = json.putArray("population");
		for (PopulationEntry entry : result.population()) {
			population.addObject()
					.put("id", entry.id())
					.put("score", entry.score());
		}
		return json;
	}

	private ObjectNode grammarNode(Grammar grammar) {
		ObjectNode json = mapper.createObjectNode();
		json.put("entry", grammar.entry());
		json.put("rendering", grammar.render());
		ObjectNode rules = json.putObject("rules");
		for (Rule rule : grammar.rules().values()) {
			ArrayNode bodies = rules.putArray(rule.name());
			for (List<Symbol> body : rule.bodies()) {
				ArrayNode symbols = bodies.addArray();
				body.forEach(symbol -> symbols.add(symbol.render()));
			}
		}
		return json;
	}
}
