package io.storvix.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.storvix.core.config.OnboardResult.ConfigAction;
import io.storvix.core.config.model.StorvixConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes {@code config.json}. The file holds only what the operator set; every read is
 * layered over {@link StorvixConfig#defaults()}, and secrets from the environment are applied by
 * {@link #loadEffective(Path)} without ever reaching the file.
 */
public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> environment) {
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Reads the config file merged over the defaults, exactly as it would be saved.
     *
     * @throws IOException when the file is not a JSON object or a section holds an invalid value
     */
    public StorvixConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return StorvixConfig.defaults();
        }

        JsonNode existing = mapper.readTree(Files.readString(configPath));
        if (existing == null || existing.isMissingNode()) {
            return StorvixConfig.defaults();
        }
        if (!existing.isObject()) {
            throw new IOException("Invalid config " + configPath + ": expected a JSON object");
        }
        ObjectNode defaults = mapper.valueToTree(StorvixConfig.defaults());
        existing.fieldNames().forEachRemaining(section -> {
            if (!defaults.has(section)) {
                LOG.warn("Ignoring unknown config section '{}' in {}", section, configPath);
            }
        });
        try {
            return mapper.treeToValue(layer(defaults, existing), StorvixConfig.class);
        } catch (JsonProcessingException e) {
            throw new IOException("Invalid config " + configPath + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * {@link #load(Path)} with the mail key and sender taken from the environment where set.
     */
    public StorvixConfig loadEffective(Path configPath) throws IOException {
        return load(configPath).withEnvironment(environment);
    }

    public void save(Path configPath, StorvixConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Path tmp = configPath.resolveSibling(configPath.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, configPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Writes the config (fresh defaults, or the existing values with any newly added defaults) and
     * lays out the workspace the scheduler reads from.
     */
    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        ConfigAction action;
        StorvixConfig config;
        if (!Files.exists(configPath)) {
            action = ConfigAction.CREATED;
            config = StorvixConfig.defaults();
        } else if (overwrite) {
            action = ConfigAction.OVERWRITTEN;
            config = StorvixConfig.defaults();
        } else {
            action = ConfigAction.MERGED;
            config = load(configPath);
        }
        save(configPath, config);

        Path workspace = ConfigPaths.resolveWorkspace(config.storage().workspace());
        List<Path> seeded = WorkspaceBootstrap.ensureWorkspace(workspace);
        boolean relay = config.withEnvironment(environment).mail().configured();
        LOG.info("Onboarded {} ({}), workspace {}, {} backend", configPath, action, workspace, config.storage().backend());
        return new OnboardResult(
            configPath,
            action,
            workspace,
            config.storage().backend(),
            ConfigPaths.scheduleStore(workspace, config.storage().sqlite()),
            ConfigPaths.usersFile(workspace),
            ConfigPaths.systemsFile(workspace),
            ConfigPaths.reportsDirectory(workspace),
            seeded,
            relay
        );
    }

    // objects merge key by key, anything else in the file replaces the default
    private JsonNode layer(JsonNode defaults, JsonNode overrides) {
        if (defaults == null || !defaults.isObject() || overrides == null || !overrides.isObject()) {
            return overrides == null ? defaults : overrides;
        }
        ObjectNode merged = ((ObjectNode) defaults).deepCopy();
        overrides.fields().forEachRemaining(entry ->
            merged.set(entry.getKey(), layer(merged.get(entry.getKey()), entry.getValue())));
        return merged;
    }
}
