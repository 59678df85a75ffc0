package com.diagramparser.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ParserConfig} from YAML.
 *
 * <p>Uses Jackson to deserialize {@code diagram-parser.yaml}. A missing, unreadable
 * or invalid file never fails the caller: a warning is logged and
 * {@link ParserConfig#defaults()} is returned.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ParserConfig config = ConfigLoader.load(Path.of("diagram-parser.yaml"));
 * DiagramParser parser = new DiagramParser(config);
 * }</pre>
 */
public class ConfigLoader {

    /** Name of the classpath resource read by {@link #loadFromClasspath()}. */
    public static final String DEFAULT_RESOURCE = "diagram-parser.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code diagram-parser.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ParserConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ParserConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ParserConfig.defaults();
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            log.debug("Loading configuration from: {}", configPath);
            ParserConfig config = read(in);
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ParserConfig.defaults();
        }
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, or defaults if it is absent or invalid.
     *
     * @return loaded configuration or defaults
     */
    public static ParserConfig loadFromClasspath() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ConfigLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.debug("No {} on classpath. Using defaults.", DEFAULT_RESOURCE);
                return ParserConfig.defaults();
            }
            return read(in);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to parse classpath resource {}. Using defaults. Error: {}",
                DEFAULT_RESOURCE, e.getMessage());
            return ParserConfig.defaults();
        }
    }

    private static ParserConfig read(InputStream in) throws IOException {
        try {
            ParserConfig config = YAML_MAPPER.readValue(in, ParserConfig.class);
            // An empty document deserializes to null
            return config == null ? ParserConfig.defaults() : config;
        } catch (MismatchedInputException e) {
            if (e.getMessage() != null && e.getMessage().contains("No content to map")) {
                return ParserConfig.defaults();
            }
            throw e;
        }
    }
}
