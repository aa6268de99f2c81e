package org.bpmn.pst.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class LimitSettings {
    /**
     * Deepest split/loop nesting accepted by structuring, rendering and the text parser.
     */
    public int maxNestingDepth = 256;

    /**
     * Most tree nodes one structuring run may emit.
     */
    public int maxTreeNodes = 100000;
}
