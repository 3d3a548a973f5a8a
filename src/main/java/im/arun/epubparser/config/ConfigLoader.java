package im.arun.epubparser.config;

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
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "config.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final EpubParserConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private EpubParserConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled resource
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.debug("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), EpubParserConfig.class);
                }
                logger.warn("Configuration file {} does not exist", path);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, EpubParserConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new EpubParserConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new EpubParserConfig();
        }
    }

    public EpubParserConfig load() {
        return load(null);
    }

    public EpubParserConfig load(Map<String, Object> userOptions) {
        EpubParserConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "extraction_directory":
                case "extractionDirectory":
                    if (value == null || value instanceof String) config.setExtractionDirectory((String) value);
                    break;
                case "archive_extensions":
                case "archiveExtensions":
                    if (value instanceof Collection) config.setArchiveExtensions(toStringList((Collection<?>) value));
                    break;
                case "entry_encoding":
                case "entryEncoding":
                    if (value instanceof String) config.setEntryEncoding((String) value);
                    break;
                case "pretty_print":
                case "prettyPrint":
                    config.setPrettyPrint(parseBoolean(value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    private List<String> toStringList(Collection<?> values) {
        List<String> result = new ArrayList<>();
        for (Object value : values) {
            if (value != null) {
                result.add(value.toString());
            }
        }
        return result;
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

    private EpubParserConfig copyConfig(EpubParserConfig source) {
        EpubParserConfig copy = new EpubParserConfig();
        copy.setExtractionDirectory(source.getExtractionDirectory());
        copy.setArchiveExtensions(new ArrayList<>(source.getArchiveExtensions()));
        copy.setEntryEncoding(source.getEntryEncoding());
        copy.setPrettyPrint(source.isPrettyPrint());
        return copy;
    }
}
