package org.javai.branta.search;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads {@link SearchConfig} from YAML.
 * <p>
 * Keys are snake_case; missing keys keep their defaults and unknown keys are rejected:
 *
 * <pre>
 * population_size: 20
 * generations: 30
 * cascade_lengths: [1, 2, 4, 8, 16]
 * stop_when_good_enough: false
 * max_attempts_per_generation: 32
 * max_parse_steps: 200000
 * max_enumerated_body_length: 10
 * random_seed: 42
 * </pre>
 */
public class SearchConfigLoader {

	public static final String DEFAULT_RESOURCE = "META-INF/branta-search.yml";

	private static final Set<String> KEYS = Set.of(
			"population_size",
			"generations",
			"cascade_lengths",
			"stop_when_good_enough",
			"max_attempts_per_generation",
			"max_parse_steps",
			"max_enumerated_body_length",
			"random_seed"
	);

	private final Yaml yaml = new Yaml();

	/**
	 * Loads the configuration bundled on the classpath.
	 */
	public SearchConfig loadDefault() {
		try (InputStream is = SearchConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
			if (is == null) {
				throw new SearchConfigException("Resource not found: " + DEFAULT_RESOURCE);
			}
			return load(is);
		}
		catch (SearchConfigException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SearchConfigException("Failed to load search config from resource: " + DEFAULT_RESOURCE, e);
		}
	}

	public SearchConfig load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return build(yaml.load(reader));
		}
		catch (SearchConfigException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SearchConfigException("Failed to load search config from path: " + path, e);
		}
	}

	public SearchConfig load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		}
		catch (SearchConfigException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SearchConfigException("Failed to load search config from input stream", e);
		}
	}

	public SearchConfig loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		}
		catch (SearchConfigException e) {
			throw e;
		}
		catch (Exception e) {
			throw new SearchConfigException("Failed to load search config from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private SearchConfig build(Object document) {
		if (document == null) {
			return SearchConfig.defaults();
		}
		if (!(document instanceof Map)) {
			throw new SearchConfigException("Search config must be a mapping");
		}
		Map<String, Object> data = (Map<String, Object>) document;
		for (String key : data.keySet()) {
			if (!KEYS.contains(key)) {
				throw new SearchConfigException("Unknown search config key: " + key);
			}
		}

		SearchConfig defaults = SearchConfig.defaults();
		return new SearchConfig(
				intValue(data, "population_size", defaults.populationSize()),
				intValue(data, "generations", defaults.generations()),
				cascadeLengths(data.get("cascade_lengths"), defaults.cascadeLengths()),
				booleanValue(data, "stop_when_good_enough", defaults.stopWhenGoodEnough()),
				intValue(data, "max_attempts_per_generation", defaults.maxAttemptsPerGeneration()),
				longValue(data, "max_parse_steps", defaults.maxParseSteps()),
				intValue(data, "max_enumerated_body_length", defaults.maxEnumeratedBodyLength()),
				data.get("random_seed") != null ? longValue(data, "random_seed", 0L) : null
		);
	}

	private int intValue(Map<String, Object> data, String key, int fallback) {
		Object value = data.get(key);
		return value == null ? fallback : toInt(key, value);
	}

	private long longValue(Map<String, Object> data, String key, long fallback) {
		Object value = data.get(key);
		return value == null ? fallback : toLong(key, value);
	}

	private static int toInt(String key, Object value) {
		long number = toLong(key, value);
		if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
			throw new SearchConfigException("'" + key + "' is out of range: " + value);
		}
		return (int) number;
	}

	// YAML integers arrive as Integer, Long or BigInteger; only the first two fit a long.
	private static long toLong(String key, Object value) {
		if (value instanceof Integer || value instanceof Long) {
			return ((Number) value).longValue();
		}
		if (value instanceof Number) {
			throw new SearchConfigException("'" + key + "' must be an integer in range but was: " + value);
		}
		throw new SearchConfigException("'" + key + "' must be a number but was: " + value);
	}

	private boolean booleanValue(Map<String, Object> data, String key, boolean fallback) {
		Object value = data.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Boolean flag) {
			return flag;
		}
		throw new SearchConfigException("'" + key + "' must be true or false but was: " + value);
	}

	private List<Integer> cascadeLengths(Object value, List<Integer> fallback) {
		if (value == null) {
			return fallback;
		}
		if (!(value instanceof List<?> list)) {
			throw new SearchConfigException("'cascade_lengths' must be a list but was: " + value);
		}
		return list.stream()
				.map(element -> toInt("cascade_lengths", element))
				.toList();
	}
}
