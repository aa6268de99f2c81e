package org.bpmn.pst.pst;

import org.bpmn.pst.bpmn.models.GatewayKind;

import java.util.Arrays;
import java.util.Optional;

/**
 * Tag of a tree node. The enum name doubles as the keyword of the text notation.
 */
public enum PstType {
    TASK(true),
    EVENT(true),
    NULL(true),
    LOOPBACK(true),
    SEQ(false),
    XOR(false),
    AND(false),
    LOOP(false);

    private final boolean leaf;

    PstType(boolean leaf) {
        this.leaf = leaf;
    }

    public boolean isLeaf() {
        return leaf;
    }

    public static Optional<PstType> fromKeyword(String keyword) {
        return Arrays.stream(values())
                .filter(t -> t.name().equals(keyword))
                .findFirst();
    }

    public static PstType ofBranch(GatewayKind kind) {
        return switch (kind) {
            case EXCLUSIVE -> XOR;
            case PARALLEL -> AND;
        };
    }
}
