package org.bpmn.pst.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Root configuration file structure.
 * Every section falls back to built-in defaults when missing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConverterConfig {
    public LayoutSettings layout = new LayoutSettings();
    public LimitSettings limits = new LimitSettings();
    public OutputSettings output = new OutputSettings();
}
