package org.bpmn.pst.bpmn.models;

public enum EventRole {
    START,
    END,
    INTERMEDIATE
}
