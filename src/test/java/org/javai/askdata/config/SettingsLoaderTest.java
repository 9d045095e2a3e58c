package org.javai.askdata.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.javai.askdata.generation.OracleClients;
import org.javai.askdata.validation.ValidatorPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SettingsLoaderTest {

	private final SettingsLoader loader = new SettingsLoader(Map.of());

	@Nested
	@DisplayName("Defaults")
	class Defaults {

		@Test
		@DisplayName("an empty document yields the defaults")
		void emptyDocument() {
			assertThat(loader.loadString("")).isEqualTo(AskDataSettings.defaults());
		}

		@Test
		@DisplayName("the bundled file matches the built-in defaults")
		void bundledFile() {
			AskDataSettings settings = loader.load();

			assertThat(settings.oracle().model()).isEqualTo(OracleClients.GROQ_DEFAULT_MODEL);
			assertThat(settings.oracle().baseUrl()).isEqualTo(OracleClients.GROQ_BASE_URL);
			assertThat(settings.oracle().temperature()).isEqualTo(0.1);
			assertThat(settings.oracle().maxRetries()).isEqualTo(1);
			assertThat(settings.database().path()).isEqualTo(Path.of("data", "banking.db"));
			assertThat(settings.execution().toLimits().maxRows()).isEqualTo(1000);
			assertThat(settings.visualization().displayThreshold()).isEqualTo(500);
			assertThat(settings.validator().toPolicy()).isEqualTo(ValidatorPolicy.defaults());
			assertThat(settings.intentScreen().enabled()).isFalse();
			assertThat(settings.history().maxTurns()).isEqualTo(3);
			assertThat(settings.sampleQuestions()).isEqualTo(AskDataSettings.DEFAULT_SAMPLE_QUESTIONS);
		}
	}

	@Nested
	@DisplayName("Overrides")
	class Overrides {

		@Test
		@DisplayName("file values replace defaults section by section")
		void fileValues() {
			AskDataSettings settings = loader.loadString("""
					oracle:
					  model: llama-3.1-8b-instant
					  timeout_seconds: 10
					  max_retries: 2
					execution:
					  max_rows: 50
					validator:
					  parse_check: false
					  extra_denied_keywords: [sleep, randomblob]
					intent_screen:
					  enabled: true
					sample_questions:
					  - How many customers live in Leeds?
					""");

			assertThat(settings.oracle().model()).isEqualTo("llama-3.1-8b-instant");
			assertThat(settings.oracle().timeout()).isEqualTo(Duration.ofSeconds(10));
			assertThat(settings.oracle().maxRetries()).isEqualTo(2);
			assertThat(settings.oracle().maxTokens()).isEqualTo(1000);
			assertThat(settings.execution().maxRows()).isEqualTo(50);
			assertThat(settings.execution().timeoutSeconds()).isEqualTo(30);
			assertThat(settings.validator().toPolicy().parseCheck()).isFalse();
			assertThat(settings.validator().extraDeniedKeywords()).containsExactly("sleep", "randomblob");
			assertThat(settings.intentScreen().enabled()).isTrue();
			assertThat(settings.sampleQuestions()).containsExactly("How many customers live in Leeds?");
		}

		@Test
		@DisplayName("environment variables win over the file")
		void environment() {
			SettingsLoader withEnv = new SettingsLoader(Map.of(
					SettingsLoader.ENV_API_KEY, "gsk_test",
					SettingsLoader.ENV_MODEL, "mixtral-8x7b",
					SettingsLoader.ENV_DATABASE_PATH, "/tmp/other.db"));

			AskDataSettings settings = withEnv.loadString("""
					oracle:
					  model: from-file
					database:
					  path: from/file.db
					""");

			assertThat(settings.oracle().apiKey()).isEqualTo("gsk_test");
			assertThat(settings.oracle().hasApiKey()).isTrue();
			assertThat(settings.oracle().model()).isEqualTo("mixtral-8x7b");
			assertThat(settings.database().path()).isEqualTo(Path.of("/tmp/other.db"));
		}

		@Test
		@DisplayName("the API key never appears in the string form")
		void maskedKey() {
			AskDataSettings settings = new SettingsLoader(Map.of(SettingsLoader.ENV_API_KEY, "gsk_secret")).loadString("");

			assertThat(settings.oracle().toString()).doesNotContain("gsk_secret").contains("****");
		}

		@Test
		@DisplayName("reads from a file")
		void fromFile(@TempDir Path dir) throws IOException {
			Path file = dir.resolve("askdata.yml");
			Files.writeString(file, "history:\n  max_turns: 5\n");

			assertThat(loader.load(file).history().maxTurns()).isEqualTo(5);
		}
	}

	@Nested
	@DisplayName("Errors")
	class Errors {

		@Test
		@DisplayName("malformed YAML")
		void malformed() {
			assertThatThrownBy(() -> loader.loadString("oracle: [unclosed"))
					.isInstanceOf(SettingsException.class)
					.hasMessageStartingWith("Malformed settings YAML");
		}

		@Test
		@DisplayName("a document that is not a mapping")
		void notAMapping() {
			assertThatThrownBy(() -> loader.loadString("- a\n- b\n"))
					.isInstanceOf(SettingsException.class)
					.hasMessageContaining("mapping");
		}

		@Test
		@DisplayName("a value of the wrong type names its key")
		void wrongType() {
			assertThatThrownBy(() -> loader.loadString("execution:\n  max_rows: lots\n"))
					.isInstanceOf(SettingsException.class)
					.hasMessageContaining("execution.max_rows");
			assertThatThrownBy(() -> loader.loadString("validator:\n  extra_denied_keywords: sleep\n"))
					.isInstanceOf(SettingsException.class)
					.hasMessageContaining("validator.extra_denied_keywords");
		}

		@Test
		@DisplayName("a value out of range")
		void outOfRange() {
			assertThatThrownBy(() -> loader.loadString("oracle:\n  max_retries: 5\n"))
					.isInstanceOf(SettingsException.class)
					.hasMessageContaining("oracle.max_retries");
			assertThatThrownBy(() -> loader.loadString("oracle:\n  temperature: 1.5\n"))
					.isInstanceOf(SettingsException.class)
					.hasMessageContaining("oracle.temperature");
		}

		@Test
		@DisplayName("a missing file")
		void missingFile(@TempDir Path dir) {
			assertThatThrownBy(() -> loader.load(dir.resolve("absent.yml")))
					.isInstanceOf(SettingsException.class)
					.hasMessageContaining("absent.yml");
		}
	}
}
