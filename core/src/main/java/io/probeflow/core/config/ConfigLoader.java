package io.probeflow.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.probeflow.core.model.BackpressureMode;
import io.probeflow.core.model.PolicyExpression;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link RouterConfig} from the {@code router:} section of a YAML file,
 * with an environment variable overlay.
 *
 * <pre>
 * router:
 *   queue-capacity: 1024
 *   backpressure: block        # block | drop-oldest | drop-newest
 *   shutdown-timeout-ms: 5000
 *   default-policy: all        # all | unique | first | registered name
 *   jmx-enabled: false
 *   instance: default
 * </pre>
 *
 * <p>
 * Every key can be overridden by an environment variable
 * ({@code PROBEFLOW_QUEUE_CAPACITY}, {@code PROBEFLOW_BACKPRESSURE},
 * {@code PROBEFLOW_SHUTDOWN_TIMEOUT_MS}, {@code PROBEFLOW_DEFAULT_POLICY},
 * {@code PROBEFLOW_JMX_ENABLED}, {@code PROBEFLOW_INSTANCE}). Env vars take
 * precedence over YAML values. An env var is considered "set" if and only if
 * it is defined AND its trimmed value is non-empty.
 */
public final class ConfigLoader {

    static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link RouterConfig} from the given YAML file, applying overrides
     * from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the configuration with defaults applied
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static RouterConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link RouterConfig} from the given YAML file, applying overrides
     * from the supplied lookup function. Returning {@code null} from
     * {@code envLookup} means the variable is not defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the configuration with env overrides applied
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static RouterConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return fromTree(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Builds a configuration from environment variables alone, on top of the
     * defaults.
     */
    public static RouterConfig fromEnvironment(Function<String, String> envLookup) {
        try {
            return fromTree(YAML_MAPPER.createObjectNode(), envLookup);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Invalid probeflow environment configuration", e);
        }
    }

    /** Maps a parsed YAML tree onto the builder, then overlays env vars. */
    static RouterConfig fromTree(JsonNode root, Function<String, String> envLookup) {
        RouterConfig.Builder builder = RouterConfig.builder();

        JsonNode router = root.path("router");
        if (router.has("queue-capacity")) builder.queueCapacity(router.get("queue-capacity").asInt());
        if (router.has("backpressure"))
            builder.backpressure(BackpressureMode.parse(router.get("backpressure").asText()));
        if (router.has("shutdown-timeout-ms"))
            builder.shutdownTimeoutMs(router.get("shutdown-timeout-ms").asInt());
        if (router.has("default-policy"))
            builder.defaultPolicy(PolicyExpression.parse(router.get("default-policy").asText()));
        if (router.has("jmx-enabled")) builder.jmxEnabled(router.get("jmx-enabled").asBoolean());
        if (router.has("instance")) builder.instanceName(router.get("instance").asText());

        // --- Environment variable overlay ---
        envInt(envLookup, "PROBEFLOW_QUEUE_CAPACITY", builder::queueCapacity);
        envString(envLookup, "PROBEFLOW_BACKPRESSURE", v -> builder.backpressure(BackpressureMode.parse(v)));
        envInt(envLookup, "PROBEFLOW_SHUTDOWN_TIMEOUT_MS", builder::shutdownTimeoutMs);
        envString(envLookup, "PROBEFLOW_DEFAULT_POLICY", v -> builder.defaultPolicy(PolicyExpression.parse(v)));
        envBool(envLookup, "PROBEFLOW_JMX_ENABLED", builder::jmxEnabled);
        envString(envLookup, "PROBEFLOW_INSTANCE", builder::instanceName);

        return builder.build();
    }

    // --- Env var helpers ---

    /**
     * Returns {@code true} if the env var is "set": defined AND non-blank after
     * trimming.
     */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: '" + raw + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
