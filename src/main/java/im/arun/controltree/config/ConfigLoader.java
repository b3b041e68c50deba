package im.arun.controltree.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Map;

/**
 * Loads {@link ControlTreeConfig} from YAML and merges per-run overrides.
 * Lookup order: explicit file, then {@code controltree.yaml} on the classpath, then built-in defaults.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CLASSPATH_CONFIG = "controltree.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ControlTreeConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private ControlTreeConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.debug("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), ControlTreeConfig.class);
                }
                logger.warn("Config file {} not found, falling back to bundled configuration", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(CLASSPATH_CONFIG)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, ControlTreeConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", CLASSPATH_CONFIG);
            return new ControlTreeConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new ControlTreeConfig();
        }
    }

    public ControlTreeConfig load() {
        return load(Map.of());
    }

    public ControlTreeConfig load(Map<String, Object> userOptions) {
        ControlTreeConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            switch (key) {
                case "requirements_header":
                case "requirementsHeader":
                    if (value instanceof String) config.setRequirementsHeader((String) value);
                    break;
                case "wrap_width":
                case "wrapWidth":
                    if (value instanceof Integer) config.setWrapWidth((Integer) value);
                    break;
                case "column_gap_pt":
                case "columnGapPt":
                    if (value instanceof Number) config.setColumnGapPt(((Number) value).doubleValue());
                    break;
                case "row_gap_factor":
                case "rowGapFactor":
                    if (value instanceof Number) config.setRowGapFactor(((Number) value).doubleValue());
                    break;
                case "id_prefix":
                case "idPrefix":
                    if (value instanceof String) config.setIdPrefix((String) value);
                    break;
                case "level":
                    if (value instanceof String) config.setLevel((String) value);
                    break;
                case "status":
                    if (value instanceof String) config.setStatus((String) value);
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    /**
     * Copy the loaded configuration. Values left null in a YAML file fall back to the built-in defaults.
     */
    private ControlTreeConfig copyConfig(ControlTreeConfig source) {
        ControlTreeConfig copy = new ControlTreeConfig();
        if (source.getRequirementsHeader() != null) {
            copy.setRequirementsHeader(source.getRequirementsHeader());
        }
        if (source.getIgnoredCellPrefixes() != null) {
            copy.setIgnoredCellPrefixes(new ArrayList<>(source.getIgnoredCellPrefixes()));
        }
        copy.setColumnGapPt(source.getColumnGapPt());
        copy.setRowGapFactor(source.getRowGapFactor());
        copy.setWrapWidth(source.getWrapWidth());
        if (source.getIdPrefix() != null) {
            copy.setIdPrefix(source.getIdPrefix());
        }
        if (source.getLevel() != null) {
            copy.setLevel(source.getLevel());
        }
        if (source.getStatus() != null) {
            copy.setStatus(source.getStatus());
        }
        if (source.getHeaderTemplate() != null) {
            copy.setHeaderTemplate(source.getHeaderTemplate());
        }
        if (source.getNotionNote() != null) {
            copy.setNotionNote(source.getNotionNote());
        }
        return copy;
    }
}
