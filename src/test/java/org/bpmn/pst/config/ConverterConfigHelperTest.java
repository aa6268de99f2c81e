package org.bpmn.pst.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.ValidationMessage;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConverterConfigHelperTest {
    private static final String CUSTOM_CONFIG = "src/test/resources/config/custom-config.json";
    private static final String INVALID_CONFIG = "src/test/resources/config/invalid-config.json";

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldLoadBundledDefaults() {
        ConverterConfig config = ConverterConfigHelper.loadDefault();

        assertEquals(100, config.layout.originX);
        assertEquals(100, config.layout.taskWidth);
        assertEquals(36, config.layout.eventSize);
        assertEquals(200, config.layout.sequencePitch);
        assertEquals(256, config.limits.maxNestingDepth);
        assertEquals(100000, config.limits.maxTreeNodes);
        assertEquals("Process_1", config.output.processId);
        assertEquals("Definitions_1", config.output.definitionsId);
    }

    @Test
    void shouldOverrideOnlyGivenValues() {
        ConverterConfig config = ConverterConfigHelper.loadConfigFile(CUSTOM_CONFIG);

        assertEquals(0, config.layout.originX);
        assertEquals(50, config.layout.originY);
        assertEquals(120, config.layout.sequencePitch);
        assertEquals(100, config.layout.taskWidth);
        assertEquals(256, config.limits.maxNestingDepth);
        assertEquals("Process_custom", config.output.processId);
        assertEquals("BPMNDiagram_1", config.output.diagramId);
    }

    @Test
    void shouldRejectConfigViolatingSchema() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConverterConfigHelper.loadConfigFile(INVALID_CONFIG));

        assertTrue(e.getMessage().contains("is invalid"));
        assertTrue(e.getMessage().contains("taskWidth"));
        assertTrue(e.getMessage().contains("maxNestingDepth"));
    }

    @Test
    void shouldRejectMissingFile() {
        assertThrows(IllegalArgumentException.class,
                () -> ConverterConfigHelper.loadConfigFile("src/test/resources/config/nope.json"));
    }

    @Test
    void shouldReportUnknownProperties() throws Exception {
        JsonNode node = mapper.readTree("{\"layout\": {\"tskWidth\": 10}}");

        Set<ValidationMessage> errors = ConverterConfigHelper.validate(node);

        assertFalse(errors.isEmpty());
    }

    @Test
    void shouldRejectInvalidXmlId() throws Exception {
        JsonNode node = mapper.readTree("{\"output\": {\"processId\": \"1 bad id\"}}");

        assertFalse(ConverterConfigHelper.validate(node).isEmpty());
    }

    @Test
    void shouldAcceptEmptyConfig() throws Exception {
        assertTrue(ConverterConfigHelper.validate(mapper.readTree("{}")).isEmpty());
    }
}
