package org.hastats.migrations.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Map;

import org.hastats.migrations.pipeline.error.ConfigurationException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds a {@link MigrationConfig} from three layers, later ones winning: built-in defaults,
 * an optional YAML file, then environment variables (so secrets can stay out of the file).
 *
 * Nested sections merge key by key; lists and scalars replace the default wholesale. Unknown
 * keys are rejected so a misspelt option does not silently fall back to its default.
 */
@Slf4j
public class MigrationConfigLoader {

    static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Map<String, String[]> ENVIRONMENT_KEYS = Map.of(
        "HA_DATABASE_PATH", new String[] {"databasePath"},
        "INFLUX_URL", new String[] {"influx", "url"},
        "INFLUX_TOKEN", new String[] {"influx", "token"},
        "INFLUX_ORG", new String[] {"influx", "org"},
        "INFLUX_BUCKET_RECENT", new String[] {"influx", "recentBucket"},
        "INFLUX_BUCKET_HISTORICAL", new String[] {"influx", "historicalBucket"},
        "BATCH_SIZE", new String[] {"recordBatchSize"},
        "PROGRESS_INTERVAL", new String[] {"progressInterval"},
        "CHECKPOINT_FILE", new String[] {"checkpointFile"},
        "RESUME_ENABLED", new String[] {"resume"}
    );

    /** Comma-separated lists, replacing the configured list. */
    private static final Map<String, String> LIST_ENVIRONMENT_KEYS = Map.of(
        "INCLUDE_DOMAINS", "includeDomains",
        "INCLUDE_UNITS", "includeUnits",
        "INCLUDE_SOURCES", "specialSources",
        "EXCLUDE_PATTERNS", "excludePatterns"
    );

    private final Map<String, String> environment;

    public MigrationConfigLoader() {
        this(System.getenv());
    }

    public MigrationConfigLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * @param file YAML file to read, or null to use defaults and environment only
     */
    public MigrationConfig load(Path file) {
        if (file == null) {
            return parse("");
        }
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Configuration file not found: " + file);
        }
        try {
            log.info("Loading configuration from {}", file.toAbsolutePath());
            return parse(Files.readString(file));
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read configuration file " + file, e);
        }
    }

    public MigrationConfig parse(String yaml) {
        ObjectNode merged = YAML_MAPPER.valueToTree(MigrationConfig.defaults());
        try {
            JsonNode overrides = YAML_MAPPER.readTree(yaml);
            if (overrides != null && !overrides.isMissingNode() && !overrides.isNull()) {
                if (!overrides.isObject()) {
                    throw new ConfigurationException("Configuration must be a YAML mapping");
                }
                merge(merged, overrides);
            }
            applyEnvironment(merged);
            return YAML_MAPPER.treeToValue(merged, MigrationConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getOriginalMessage(), e);
        }
    }

    private void applyEnvironment(ObjectNode root) {
        ENVIRONMENT_KEYS.forEach((variable, path) -> {
            String value = environment.get(variable);
            if (value == null || value.isBlank()) {
                return;
            }
            ObjectNode parent = root;
            for (int i = 0; i < path.length - 1; i++) {
                parent = section(parent, path[i]);
            }
            parent.put(path[path.length - 1], value.trim());
            log.debug("Configuration key {} taken from environment variable {}", String.join(".", path), variable);
        });
        LIST_ENVIRONMENT_KEYS.forEach((variable, key) -> {
            String value = environment.get(variable);
            if (value == null || value.isBlank()) {
                return;
            }
            ArrayNode list = section(root, "classifier").putArray(key);
            Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .forEach(list::add);
            log.debug("Configuration key classifier.{} taken from environment variable {}", key, variable);
        });
    }

    private static ObjectNode section(ObjectNode parent, String name) {
        JsonNode existing = parent.get(name);
        return existing instanceof ObjectNode object ? object : parent.putObject(name);
    }

    static void merge(ObjectNode target, JsonNode overrides) {
        Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing instanceof ObjectNode existingObject && field.getValue().isObject()) {
                merge(existingObject, field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
