package org.bpmn.pst.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loads and validates the converter configuration.
 */
@Slf4j
public class ConverterConfigHelper {
    public static final String DEFAULT_CONFIG_RESOURCE = "config/converter-config.json";
    private static final String SCHEMA_RESOURCE = "config/converter_config_schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /**
     * Loads the configuration bundled on the classpath.
     */
    public static ConverterConfig loadDefault() {
        ClassLoader cl = ConverterConfigHelper.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                log.warn("Config resource {} not found, using built-in defaults", DEFAULT_CONFIG_RESOURCE);
                return new ConverterConfig();
            }
            return readValidated(mapper.readTree(in), DEFAULT_CONFIG_RESOURCE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read config resource: " + DEFAULT_CONFIG_RESOURCE, e);
        }
    }

    /**
     * Loads a configuration file from disk.
     *
     * @param configFilePath path to the JSON file
     * @return the parsed configuration, defaults filled in for missing values
     * @throws IllegalArgumentException if the file does not match the configuration schema
     */
    public static ConverterConfig loadConfigFile(String configFilePath) {
        File file = new File(configFilePath);
        if (!file.isFile()) {
            throw new IllegalArgumentException("Config file not found: " + configFilePath);
        }
        try {
            return readValidated(mapper.readTree(file), configFilePath);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read config file: " + configFilePath, e);
        }
    }

    /**
     * Validates a configuration tree against the bundled JSON schema.
     *
     * @return the validation messages, empty when valid
     */
    public static Set<ValidationMessage> validate(JsonNode configNode) {
        ClassLoader cl = ConverterConfigHelper.class.getClassLoader();
        try (InputStream schemaStream = cl.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            JsonSchema schema = factory.getSchema(mapper.readTree(schemaStream));
            return schema.validate(configNode);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read schema resource: " + SCHEMA_RESOURCE, e);
        }
    }

    private static ConverterConfig readValidated(JsonNode configNode, String source) throws IOException {
        Set<ValidationMessage> errors = validate(configNode);
        if (!errors.isEmpty()) {
            String details = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Config " + source + " is invalid: " + details);
        }
        ConverterConfig config = mapper.treeToValue(configNode, ConverterConfig.class);
        log.debug("Loaded config from {}", source);
        return config;
    }
}
