package org.processdiagram.converter.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import org.processdiagram.converter.layout.Direction;
import org.processdiagram.converter.layout.LayoutMode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads {@link ConverterConfig} from JSON. Every document is checked against
 * {@value #SCHEMA_RESOURCE} before it is bound.
 */
@Slf4j
public class ConverterConfigLoader {
    public static final String SCHEMA_RESOURCE = "schemas/converter_config_schema.json";

    public static final String ENV_LAYOUT = "DIAGRAM_CONVERTER_LAYOUT";
    public static final String ENV_DIRECTION = "DIAGRAM_CONVERTER_DIRECTION";
    public static final String ENV_THEME = "DIAGRAM_CONVERTER_THEME";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    public static ConverterConfig load(Path configFile) {
        try (InputStream in = Files.newInputStream(configFile)) {
            return load(in, configFile.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file: " + configFile, e);
        }
    }

    public static ConverterConfig loadFromClasspath(String resourcePath) {
        try (InputStream in = ConverterConfigLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new ConfigurationException("Config resource not found on classpath: " + resourcePath, List.of());
            }
            return load(in, resourcePath);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config resource: " + resourcePath, e);
        }
    }

    public static ConverterConfig fromJson(String json) {
        try {
            return bind(mapper.readTree(json), "inline JSON");
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Config is not valid JSON", e);
        }
    }

    /**
     * Defaults with environment overrides applied.
     */
    public static ConverterConfig fromEnvironment(Map<String, String> environment) {
        return applyEnvironment(ConverterConfig.defaults(), environment);
    }

    /**
     * Overrides layout mode, direction and theme from {@value #ENV_LAYOUT}, {@value #ENV_DIRECTION}
     * and {@value #ENV_THEME} when they are set and not blank.
     *
     * @param config      the configuration to update
     * @param environment usually {@code System.getenv()}
     * @return the same configuration instance
     */
    public static ConverterConfig applyEnvironment(ConverterConfig config, Map<String, String> environment) {
        try {
            String layout = environment.get(ENV_LAYOUT);
            if (layout != null && !layout.isBlank()) {
                config.layoutMode = LayoutMode.fromValue(layout);
            }
            String direction = environment.get(ENV_DIRECTION);
            if (direction != null && !direction.isBlank()) {
                config.direction = Direction.fromValue(direction);
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid environment override", List.of(e.getMessage()));
        }
        String theme = environment.get(ENV_THEME);
        if (theme != null && !theme.isBlank()) {
            config.theme = theme.trim();
        }
        return config;
    }

    /**
     * Validates a config document against the schema.
     *
     * @return the schema violations, empty when the document is valid
     */
    public static Set<ValidationMessage> validate(JsonNode configNode) {
        try (InputStream schemaStream = ConverterConfigLoader.class.getClassLoader()
                .getResourceAsStream(SCHEMA_RESOURCE)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            JsonSchema schema = factory.getSchema(mapper.readTree(schemaStream));
            return schema.validate(configNode);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema resource: " + SCHEMA_RESOURCE, e);
        }
    }

    private static ConverterConfig load(InputStream in, String origin) throws IOException {
        JsonNode node;
        try {
            node = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Config is not valid JSON: " + origin, e);
        }
        return bind(node, origin);
    }

    private static ConverterConfig bind(JsonNode node, String origin) {
        if (node == null || node.isMissingNode()) {
            return ConverterConfig.defaults();
        }
        Set<ValidationMessage> problems = validate(node);
        if (!problems.isEmpty()) {
            List<String> messages = problems.stream().map(ValidationMessage::getMessage).sorted().toList();
            messages.forEach(message -> log.warn("Config {}: {}", origin, message));
            throw new ConfigurationException("Config " + origin + " is invalid", messages);
        }
        try {
            ConverterConfig config = mapper.treeToValue(node, ConverterConfig.class);
            log.debug("Loaded config from {}: layout={}, direction={}, theme={}",
                    origin, config.layoutMode, config.direction, config.theme);
            return config;
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Failed to bind config " + origin, e);
        }
    }
}
