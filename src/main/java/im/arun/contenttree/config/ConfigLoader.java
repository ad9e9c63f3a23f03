package im.arun.contenttree.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
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
import java.util.List;
import java.util.Map;

/**
 * Loads {@link ContentTreeConfig} from YAML and merges per-call overrides.
 * Lookup order: the explicit path, then classpath {@code content-tree.yaml},
 * then built-in defaults.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String RESOURCE_NAME = "content-tree.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ContentTreeConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private ContentTreeConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.debug("Loading configuration from {}", path);
                    return sanitize(yamlMapper.readValue(path.toFile(), ContentTreeConfig.class), path.toString());
                }
                logger.warn("Config file {} not found, falling back to classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
                if (resourceStream != null) {
                    return sanitize(yamlMapper.readValue(resourceStream, ContentTreeConfig.class), RESOURCE_NAME);
                }
            }

            logger.warn("No {} found, using default configuration", RESOURCE_NAME);
            return new ContentTreeConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new ContentTreeConfig();
        }
    }

    /**
     * Replaces values a YAML file may carry but the core cannot run with:
     * a non-positive batch size, a null list or separator, null placeholder
     * entries.
     */
    private ContentTreeConfig sanitize(ContentTreeConfig loaded, String source) {
        ContentTreeConfig defaults = new ContentTreeConfig();
        if (loaded == null) {
            logger.warn("{} is empty, using default configuration", source);
            return defaults;
        }
        if (loaded.getExportBatchSize() <= 0) {
            logger.warn("Ignoring invalid export batch size {} in {}, using {}",
                loaded.getExportBatchSize(), source, defaults.getExportBatchSize());
            loaded.setExportBatchSize(defaults.getExportBatchSize());
        }
        if (loaded.getBreadcrumbSeparator() == null) {
            logger.warn("Missing breadcrumb separator in {}, using \"{}\"", source, defaults.getBreadcrumbSeparator());
            loaded.setBreadcrumbSeparator(defaults.getBreadcrumbSeparator());
        }
        if (loaded.getUntitledLabel() == null) {
            logger.warn("Missing untitled label in {}, using \"{}\"", source, defaults.getUntitledLabel());
            loaded.setUntitledLabel(defaults.getUntitledLabel());
        }
        List<String> placeholders = loaded.getPlaceholderNames();
        if (placeholders == null) {
            logger.warn("Missing placeholder names in {}, using defaults", source);
            loaded.setPlaceholderNames(defaults.getPlaceholderNames());
        } else if (placeholders.contains(null)) {
            logger.warn("Dropping null placeholder names in {}", source);
            List<String> names = new ArrayList<>();
            for (String name : placeholders) {
                if (name != null) {
                    names.add(name);
                }
            }
            loaded.setPlaceholderNames(names);
        }
        return loaded;
    }

    public ContentTreeConfig load() {
        return load(null);
    }

    public ContentTreeConfig load(Map<String, Object> userOptions) {
        ContentTreeConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "max_nesting_depth":
                case "maxNestingDepth":
                    if (value instanceof Integer) config.setMaxNestingDepth((Integer) value);
                    break;
                case "export_batch_size":
                case "exportBatchSize":
                    if (value instanceof Integer && (Integer) value > 0) {
                        config.setExportBatchSize((Integer) value);
                    } else {
                        logger.warn("Ignoring invalid export batch size: {}", value);
                    }
                    break;
                case "breadcrumb_separator":
                case "breadcrumbSeparator":
                    if (value instanceof String) config.setBreadcrumbSeparator((String) value);
                    break;
                case "untitled_label":
                case "untitledLabel":
                    if (value instanceof String) config.setUntitledLabel((String) value);
                    break;
                case "placeholder_names":
                case "placeholderNames":
                    if (value instanceof List) {
                        List<String> names = new ArrayList<>();
                        for (Object name : (List<?>) value) {
                            if (name != null) {
                                names.add(String.valueOf(name));
                            }
                        }
                        config.setPlaceholderNames(names);
                    }
                    break;
                case "enforce_unique_ids":
                case "enforceUniqueIds":
                    config.setEnforceUniqueIds(parseBoolean(value));
                    break;
                case "pretty_json":
                case "prettyJson":
                    config.setPrettyJson(parseBoolean(value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private ContentTreeConfig copyConfig(ContentTreeConfig source) {
        ContentTreeConfig copy = new ContentTreeConfig();
        copy.setMaxNestingDepth(source.getMaxNestingDepth());
        copy.setExportBatchSize(source.getExportBatchSize());
        copy.setBreadcrumbSeparator(source.getBreadcrumbSeparator());
        copy.setUntitledLabel(source.getUntitledLabel());
        copy.setPlaceholderNames(new ArrayList<>(source.getPlaceholderNames()));
        copy.setEnforceUniqueIds(source.isEnforceUniqueIds());
        copy.setPrettyJson(source.isPrettyJson());
        return copy;
    }
}
