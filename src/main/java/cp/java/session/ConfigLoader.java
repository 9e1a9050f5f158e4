package cp.java.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Loads {@link SessionConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>YAML layout:
 * <pre>
 * github_access_tokens: [ "ghp_...", "ghp_..." ]
 * threads: 0
 * local: ""
 * csv_path: ""
 * debug: false
 * silent: false
 * log_format: text
 * api_base_url: https://api.github.com
 * request_timeout_ms: 30000
 * pool:
 *   replica_margin: 1
 *   poll_interval_ms: 1000
 * </pre>
 *
 * <p>Every key can be overridden by an environment variable named
 * {@code CLIENTPOOL_} plus the upper-cased key (nested keys joined with
 * {@code _}, e.g. {@code CLIENTPOOL_POOL_POLL_INTERVAL_MS}). The token list
 * is comma-separated. A variable counts as set only if its trimmed value is
 * non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "client-pool.yaml";
    static final String ENV_PREFIX = "CLIENTPOOL_";

    private ConfigLoader() {
        // Utility class, no instantiation
    }

    /**
     * Loads configuration, applying overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML file
     * @return the loaded configuration
     * @throws ConfigLoadException if the file is missing, unreadable or invalid
     */
    public static SessionConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration, applying overrides from the given lookup.
     *
     * @param configPath path to the YAML file
     * @param envLookup  environment variable lookup; null means undefined
     * @return the loaded configuration
     * @throws ConfigLoadException if the file is missing, unreadable or invalid
     */
    public static SessionConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }

        try {
            return mapToConfig(root, envLookup);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the config file path from command-line arguments.
     *
     * @param args command-line arguments
     * @return the path following {@code --config}, or the default file name
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static SessionConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        SessionConfig.Builder builder = SessionConfig.builder();

        // --- YAML ---
        JsonNode tokens = root.path("github_access_tokens");
        if (!tokens.isMissingNode() && !tokens.isNull()) {
            if (!tokens.isArray()) {
                throw new IllegalArgumentException("github_access_tokens must be a list");
            }
            List<String> values = new ArrayList<>();
            tokens.forEach(node -> values.add(node.asText()));
            builder.githubAccessTokens(values);
        }
        if (root.has("threads")) builder.threads(intValue(root, "threads"));
        if (root.has("local")) builder.local(root.get("local").asText());
        if (root.has("csv_path")) builder.csvPath(root.get("csv_path").asText());
        if (root.has("debug")) builder.debug(root.get("debug").asBoolean());
        if (root.has("silent")) builder.silent(root.get("silent").asBoolean());
        if (root.has("log_format")) builder.logFormat(root.get("log_format").asText().toLowerCase());
        if (root.has("api_base_url")) builder.apiBaseUrl(URI.create(root.get("api_base_url").asText()));
        if (root.has("request_timeout_ms")) {
            builder.requestTimeout(Duration.ofMillis(intValue(root, "request_timeout_ms")));
        }

        JsonNode pool = root.path("pool");
        if (pool.has("replica_margin")) builder.replicaMargin(intValue(pool, "replica_margin"));
        if (pool.has("poll_interval_ms")) {
            builder.pollInterval(Duration.ofMillis(intValue(pool, "poll_interval_ms")));
        }

        // --- Environment overlay ---
        String envTokens = env(envLookup, "GITHUB_ACCESS_TOKENS");
        if (envTokens != null) {
            builder.githubAccessTokens(Arrays.stream(envTokens.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList());
        }
        String envThreads = env(envLookup, "THREADS");
        if (envThreads != null) builder.threads(parseInt("THREADS", envThreads));
        String envLocal = env(envLookup, "LOCAL");
        if (envLocal != null) builder.local(envLocal);
        String envCsv = env(envLookup, "CSV_PATH");
        if (envCsv != null) builder.csvPath(envCsv);
        String envDebug = env(envLookup, "DEBUG");
        if (envDebug != null) builder.debug(Boolean.parseBoolean(envDebug));
        String envSilent = env(envLookup, "SILENT");
        if (envSilent != null) builder.silent(Boolean.parseBoolean(envSilent));
        String envFormat = env(envLookup, "LOG_FORMAT");
        if (envFormat != null) builder.logFormat(envFormat.toLowerCase());
        String envBaseUrl = env(envLookup, "API_BASE_URL");
        if (envBaseUrl != null) builder.apiBaseUrl(URI.create(envBaseUrl));
        String envTimeout = env(envLookup, "REQUEST_TIMEOUT_MS");
        if (envTimeout != null) builder.requestTimeout(Duration.ofMillis(parseInt("REQUEST_TIMEOUT_MS", envTimeout)));
        String envMargin = env(envLookup, "POOL_REPLICA_MARGIN");
        if (envMargin != null) builder.replicaMargin(parseInt("POOL_REPLICA_MARGIN", envMargin));
        String envPoll = env(envLookup, "POOL_POLL_INTERVAL_MS");
        if (envPoll != null) builder.pollInterval(Duration.ofMillis(parseInt("POOL_POLL_INTERVAL_MS", envPoll)));

        return builder.build();
    }

    private static int intValue(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new IllegalArgumentException(field + " must be an integer, got: " + node.asText());
        }
        return node.asInt();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(ENV_PREFIX + name + " must be an integer, got: " + value, e);
        }
    }

    private static String env(Function<String, String> envLookup, String key) {
        String value = envLookup.apply(ENV_PREFIX + key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
