package org.javai.branta.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SearchConfigLoaderTest {

	private final SearchConfigLoader loader = new SearchConfigLoader();

	@Test
	void bundledResourceMatchesTheDefaults() {
		SearchConfig config = loader.loadDefault();

		assertThat(config).isEqualTo(SearchConfig.defaults());
		assertThat(config.populationSize()).isEqualTo(20);
		assertThat(config.generations()).isEqualTo(30);
		assertThat(config.cascadeLengths()).containsExactly(1, 2, 4, 8, 16);
		assertThat(config.stopWhenGoodEnough()).isFalse();
		assertThat(config.randomSeed()).isNull();
	}

	@Test
	void missingKeysKeepTheirDefaults() {
		SearchConfig config = loader.loadString("""
				generations: 5
				random_seed: 42
				stop_when_good_enough: true
				""");

		assertThat(config.generations()).isEqualTo(5);
		assertThat(config.randomSeed()).isEqualTo(42L);
		assertThat(config.stopWhenGoodEnough()).isTrue();
		assertThat(config.populationSize()).isEqualTo(SearchConfig.DEFAULT_POPULATION_SIZE);
		assertThat(config.maxParseSteps()).isEqualTo(SearchConfig.defaults().maxParseSteps());
	}

	@Test
	void emptyDocumentGivesTheDefaults() {
		assertThat(loader.loadString("")).isEqualTo(SearchConfig.defaults());
	}

	@Test
	void loadsFromAFile(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("search.yml");
		Files.writeString(file, "population_size: 8\ncascade_lengths: [3, 5]\nmax_parse_steps: 5000000000\n");

		SearchConfig config = loader.load(file);

		assertThat(config.populationSize()).isEqualTo(8);
		assertThat(config.cascadeLengths()).containsExactly(3, 5);
		assertThat(config.maxParseSteps()).isEqualTo(5_000_000_000L);
	}

	@Test
	void loadsFromAStream() {
		SearchConfig config = loader.load(new ByteArrayInputStream(
				"max_attempts_per_generation: 4".getBytes(StandardCharsets.UTF_8)));

		assertThat(config.maxAttemptsPerGeneration()).isEqualTo(4);
	}

	@Test
	void rejectsUnknownKeys() {
		assertThatThrownBy(() -> loader.loadString("population: 10"))
				.isInstanceOf(SearchConfigException.class)
				.hasMessageContaining("Unknown search config key: population");
	}

	@Test
	void rejectsValuesOfTheWrongType() {
		assertThatThrownBy(() -> loader.loadString("generations: many"))
				.isInstanceOf(SearchConfigException.class)
				.hasMessageContaining("generations");
		assertThatThrownBy(() -> loader.loadString("stop_when_good_enough: 1"))
				.isInstanceOf(SearchConfigException.class);
		assertThatThrownBy(() -> loader.loadString("cascade_lengths: 4"))
				.isInstanceOf(SearchConfigException.class);
	}

	@Test
	void rejectsFractionalAndOversizedIntegers() {
		assertThatThrownBy(() -> loader.loadString("cascade_lengths: [1, 1.5]"))
				.isInstanceOf(SearchConfigException.class)
				.hasMessageContaining("cascade_lengths");
		assertThatThrownBy(() -> loader.loadString("cascade_lengths: [8589934593]"))
				.isInstanceOf(SearchConfigException.class)
				.hasMessageContaining("out of range");
		assertThatThrownBy(() -> loader.loadString("generations: 2.5"))
				.isInstanceOf(SearchConfigException.class)
				.hasMessageContaining("generations");
		assertThatThrownBy(() -> loader.loadString("population_size: 8589934593"))
				.isInstanceOf(SearchConfigException.class)
				.hasMessageContaining("out of range");
	}

	@Test
	void rejectsOutOfRangeValues() {
		assertThatThrownBy(() -> loader.loadString("population_size: 0"))
				.isInstanceOf(SearchConfigException.class);
		assertThatThrownBy(() -> loader.loadString("cascade_lengths: []"))
				.isInstanceOf(SearchConfigException.class);
		assertThatThrownBy(() -> loader.loadString("max_enumerated_body_length: 21"))
				.isInstanceOf(SearchConfigException.class);
	}

	@Test
	void rejectsDocumentsThatAreNotMappings() {
		assertThatThrownBy(() -> loader.loadString("- 1\n- 2\n"))
				.isInstanceOf(SearchConfigException.class)
				.hasMessageContaining("mapping");
	}

	@Test
	void wrapsUnreadableFiles(@TempDir Path dir) {
		assertThatThrownBy(() -> loader.load(dir.resolve("missing.yml")))
				.isInstanceOf(SearchConfigException.class)
				.hasMessageContaining("missing.yml")
				.hasCauseInstanceOf(NoSuchFileException.class);
	}

	@Test
	void withersKeepTheOtherSettings() {
		SearchConfig config = SearchConfig.defaults().withGenerations(3).withRandomSeed(9L);

		assertThat(config.generations()).isEqualTo(3);
		assertThat(config.randomSeed()).isEqualTo(9L);
		assertThat(config.cascadeLengths()).isEqualTo(List.of(1, 2, 4, 8, 16));
	}
}
