package org.bpmn.pst.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Identifiers written into generated BPMN documents.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OutputSettings {
    public String definitionsId = "Definitions_1";
    public String targetNamespace = "http://example.bpmn";
    public String processId = "Process_1";
    public String diagramId = "BPMNDiagram_1";
}
