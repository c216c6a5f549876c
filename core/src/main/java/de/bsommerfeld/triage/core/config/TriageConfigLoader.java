package de.bsommerfeld.triage.core.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link TriageConfig} from TOML. Keys missing from the document keep
 * their defaults; a missing file yields the full default profile.
 */
public final class TriageConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TriageConfigLoader.class);
    private static final TomlMapper MAPPER = TomlMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    private TriageConfigLoader() {
    }

    public static TriageConfig load(Path path) {
        if (!Files.exists(path)) {
            LOG.info("No configuration at {}, using defaults", path.toAbsolutePath());
            return new TriageConfig();
        }
        LOG.info("Loading configuration from: {}", path.toAbsolutePath());
        try {
            return parse(Files.readString(path));
        } catch (IOException e) {
            throw new TriageConfigurationException("Failed to read configuration: " + path, e);
        }
    }

    public static TriageConfig parse(String toml) {
        if (toml == null || toml.isBlank())
            return new TriageConfig();
        try {
            TriageConfig config = MAPPER.readValue(toml, TriageConfig.class);
            return config != null ? config : new TriageConfig();
        } catch (IOException e) {
            throw new TriageConfigurationException("Malformed configuration: " + e.getMessage(), e);
        }
    }
}
