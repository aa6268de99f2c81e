package org.bpmn.pst.bpmn;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.xml.ModelException;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Schema validation of BPMN documents through the Camunda model API. Used on input files by the
 * {@code validate} command and on generated diagrams before they are written.
 */
@Slf4j
public class BpmnValidator {

    /**
     * Validates a BPMN file from disk.
     *
     * @throws ModelException if the file is not a schema-valid BPMN document
     */
    public static void validate(File bpmnFile) {
        BpmnModelInstance modelInstance = Bpmn.readModelFromFile(bpmnFile);
        Bpmn.validateModel(modelInstance);
        log.debug("BPMN file {} is valid", bpmnFile);
    }

    /**
     * Validates BPMN XML held in memory, e.g. a generated diagram before it is written.
     */
    public static void validateXml(String bpmnXml) {
        validate(new ByteArrayInputStream(bpmnXml.getBytes(StandardCharsets.UTF_8)));
    }

    public static void validate(InputStream bpmnStream) {
        Bpmn.validateModel(Bpmn.readModelFromStream(bpmnStream));
    }
}
