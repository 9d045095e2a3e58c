package org.javai.askdata.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.askdata.config.AskDataSettings.DatabaseSettings;
import org.javai.askdata.config.AskDataSettings.ExecutionSettings;
import org.javai.askdata.config.AskDataSettings.HistorySettings;
import org.javai.askdata.config.AskDataSettings.IntentScreenSettings;
import org.javai.askdata.config.AskDataSettings.OracleSettings;
import org.javai.askdata.config.AskDataSettings.ValidatorSettings;
import org.javai.askdata.config.AskDataSettings.VisualizationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@link AskDataSettings} from YAML.
 *
 * <p>Keys are snake_case and grouped by section ({@code oracle}, {@code database},
 * {@code execution}, {@code visualization}, {@code validator}, {@code intent_screen},
 * {@code history}, {@code sample_questions}). Missing keys take their defaults. After the
 * file is read, the environment variables {@code GROQ_API_KEY}, {@code ASKDATA_DATABASE_PATH}
 * and {@code ASKDATA_MODEL} override the corresponding values.</p>
 */
public class SettingsLoader {

	private static final Logger logger = LoggerFactory.getLogger(SettingsLoader.class);

	public static final String DEFAULT_RESOURCE = "askdata.yml";
	public static final String ENV_API_KEY = "GROQ_API_KEY";
	public static final String ENV_DATABASE_PATH = "ASKDATA_DATABASE_PATH";
	public static final String ENV_MODEL = "ASKDATA_MODEL";

	private final Yaml yaml = new Yaml();
	private final Map<String, String> environment;

	public SettingsLoader() {
		this(System.getenv());
	}

	/**
	 * @param environment variables consulted for overrides
	 */
	public SettingsLoader(Map<String, String> environment) {
		this.environment = environment != null ? Map.copyOf(environment) : Map.of();
	}

	/**
	 * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults if there is none.
	 */
	public AskDataSettings load() {
		InputStream in = SettingsLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
		if (in == null) {
			logger.info("No {} on the classpath; using defaults", DEFAULT_RESOURCE);
			return applyEnvironment(AskDataSettings.defaults());
		}
		try (InputStream stream = in) {
			return load(stream);
		}
		catch (IOException e) {
			throw new SettingsException("Failed to read " + DEFAULT_RESOURCE + " from the classpath", e);
		}
	}

	public AskDataSettings load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return load(reader);
		}
		catch (IOException e) {
			throw new SettingsException("Failed to read settings from path: " + path, e);
		}
	}

	public AskDataSettings load(InputStream inputStream) {
		try {
			return fromYaml(yaml.load(inputStream));
		}
		catch (YAMLException e) {
			throw new SettingsException("Malformed settings YAML: " + e.getMessage(), e);
		}
	}

	public AskDataSettings load(Reader reader) {
		try {
			return fromYaml(yaml.load(reader));
		}
		catch (YAMLException e) {
			throw new SettingsException("Malformed settings YAML: " + e.getMessage(), e);
		}
	}

	public AskDataSettings loadString(String yamlContent) {
		try {
			return fromYaml(yaml.load(yamlContent));
		}
		catch (YAMLException e) {
			throw new SettingsException("Malformed settings YAML: " + e.getMessage(), e);
		}
	}

	private AskDataSettings fromYaml(Object document) {
		if (document == null) {
			return applyEnvironment(AskDataSettings.defaults());
		}
		if (!(document instanceof Map<?, ?> root)) {
			throw new SettingsException("Settings must be a YAML mapping, got: " + document.getClass().getSimpleName());
		}
		try {
			AskDataSettings settings = new AskDataSettings(
					oracle(section(root, "oracle")),
					database(section(root, "database")),
					execution(section(root, "execution")),
					visualization(section(root, "visualization")),
					validator(section(root, "validator")),
					intentScreen(section(root, "intent_screen")),
					history(section(root, "history")),
					stringList(root, "sample_questions", "sample_questions", null));
			return applyEnvironment(settings);
		}
		catch (IllegalArgumentException e) {
			throw new SettingsException("Invalid settings: " + e.getMessage(), e);
		}
	}

	private AskDataSettings applyEnvironment(AskDataSettings settings) {
		OracleSettings oracle = settings.oracle();
		DatabaseSettings database = settings.database();
		String apiKey = environment.get(ENV_API_KEY);
		String model = environment.get(ENV_MODEL);
		String databasePath = environment.get(ENV_DATABASE_PATH);
		if (isSet(apiKey) || isSet(model)) {
			oracle = new OracleSettings(oracle.baseUrl(),
					isSet(model) ? model : oracle.model(),
					isSet(apiKey) ? apiKey : oracle.apiKey(),
					oracle.temperature(), oracle.maxTokens(), oracle.timeoutSeconds(), oracle.maxRetries());
		}
		if (isSet(databasePath)) {
			database = new DatabaseSettings(Path.of(databasePath));
		}
		return new AskDataSettings(oracle, database, settings.execution(), settings.visualization(),
				settings.validator(), settings.intentScreen(), settings.history(), settings.sampleQuestions());
	}

	private static OracleSettings oracle(Map<?, ?> map) {
		OracleSettings d = OracleSettings.defaults();
		return new OracleSettings(
				string(map, "base_url", "oracle", d.baseUrl()),
				string(map, "model", "oracle", d.model()),
				string(map, "api_key", "oracle", d.apiKey()),
				decimal(map, "temperature", "oracle", d.temperature()),
				integer(map, "max_tokens", "oracle", d.maxTokens()),
				integer(map, "timeout_seconds", "oracle", d.timeoutSeconds()),
				integer(map, "max_retries", "oracle", d.maxRetries()));
	}

	private static DatabaseSettings database(Map<?, ?> map) {
		String path = string(map, "path", "database", null);
		return new DatabaseSettings(path != null ? Path.of(path) : null);
	}

	private static ExecutionSettings execution(Map<?, ?> map) {
		ExecutionSettings d = ExecutionSettings.defaults();
		return new ExecutionSettings(
				integer(map, "max_rows", "execution", d.maxRows()),
				integer(map, "timeout_seconds", "execution", d.timeoutSeconds()));
	}

	private static VisualizationSettings visualization(Map<?, ?> map) {
		VisualizationSettings d = VisualizationSettings.defaults();
		return new VisualizationSettings(
				integer(map, "display_threshold", "visualization", d.displayThreshold()),
				integer(map, "max_columns", "visualization", d.maxColumns()));
	}

	private static ValidatorSettings validator(Map<?, ?> map) {
		ValidatorSettings d = ValidatorSettings.defaults();
		return new ValidatorSettings(
				bool(map, "parse_check", "validator", d.parseCheck()),
				stringList(map, "extra_denied_keywords", "validator.extra_denied_keywords", d.extraDeniedKeywords()));
	}

	private static IntentScreenSettings intentScreen(Map<?, ?> map) {
		return new IntentScreenSettings(bool(map, "enabled", "intent_screen",
				IntentScreenSettings.defaults().enabled()));
	}

	private static HistorySettings history(Map<?, ?> map) {
		return new HistorySettings(integer(map, "max_turns", "history", HistorySettings.defaults().maxTurns()));
	}

	private static Map<?, ?> section(Map<?, ?> root, String key) {
		Object value = root.get(key);
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map<?, ?> map)) {
			throw new SettingsException("'" + key + "' must be a mapping");
		}
		return map;
	}

	private static String string(Map<?, ?> map, String key, String section, String fallback) {
		Object value = map.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Map<?, ?> || value instanceof List<?>) {
			throw new SettingsException("'" + section + "." + key + "' must be a scalar");
		}
		return value.toString();
	}

	private static int integer(Map<?, ?> map, String key, String section, int fallback) {
		Object value = map.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Integer i) {
			return i;
		}
		throw new SettingsException("'" + section + "." + key + "' must be an integer, got: " + value);
	}

	private static double decimal(Map<?, ?> map, String key, String section, double fallback) {
		Object value = map.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Number n) {
			return n.doubleValue();
		}
		throw new SettingsException("'" + section + "." + key + "' must be a number, got: " + value);
	}

	private static boolean bool(Map<?, ?> map, String key, String section, boolean fallback) {
		Object value = map.get(key);
		if (value == null) {
			return fallback;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		throw new SettingsException("'" + section + "." + key + "' must be true or false, got: " + value);
	}

	private static List<String> stringList(Map<?, ?> map, String key, String name, List<String> fallback) {
		Object value = map.get(key);
		if (value == null) {
			return fallback;
		}
		if (!(value instanceof List<?> list)) {
			throw new SettingsException("'" + name + "' must be a list");
		}
		List<String> result = new ArrayList<>(list.size());
		for (Object item : list) {
			if (item != null) {
				result.add(item.toString());
			}
		}
		return result;
	}

	private static boolean isSet(String value) {
		return value != null && !value.isBlank();
	}
}
