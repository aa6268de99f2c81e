package org.bpmn.pst.pst;

import org.bpmn.pst.bpmn.models.GatewayKind;

import java.util.List;

/**
 * Node of a Process Structure Tree. Trees are immutable and own their children.
 */
public sealed interface PstNode
        permits PstNode.Task, PstNode.Event, PstNode.Null, PstNode.Sequence,
        PstNode.Branch, PstNode.Loop, PstNode.Loopback {

    PstType type();

    default List<PstNode> children() {
        return List.of();
    }

    record Task(String label) implements PstNode {
        public Task {
            requireLabel(label, "Task");
        }

        @Override
        public PstType type() {
            return PstType.TASK;
        }
    }

    record Event(String label) implements PstNode {
        public Event {
            requireLabel(label, "Event");
        }

        @Override
        public PstType type() {
            return PstType.EVENT;
        }
    }

    record Null() implements PstNode {
        @Override
        public PstType type() {
            return PstType.NULL;
        }
    }

    record Sequence(List<PstNode> children) implements PstNode {
        public Sequence {
            children = requireChildren(children, "Sequence");
        }

        @Override
        public PstType type() {
            return PstType.SEQ;
        }
    }

    /**
     * @param label the split's label, null when unknown (e.g. parsed from text without one)
     */
    record Branch(GatewayKind kind, String label, List<PstNode> children) implements PstNode {
        public Branch {
            if (kind == null) {
                throw new IllegalArgumentException("Branch needs a gateway kind");
            }
            children = requireChildren(children, "Branch");
        }

        @Override
        public PstType type() {
            return PstType.ofBranch(kind);
        }
    }

    record Loop(PstNode condition, PstNode body) implements PstNode {
        public Loop {
            if (condition == null || body == null) {
                throw new IllegalArgumentException("Loop needs both a condition and a body");
            }
        }

        @Override
        public PstType type() {
            return PstType.LOOP;
        }

        @Override
        public List<PstNode> children() {
            return List.of(condition, body);
        }
    }

    record Loopback(String targetLabel) implements PstNode {
        public Loopback {
            requireLabel(targetLabel, "Loopback");
        }

        @Override
        public PstType type() {
            return PstType.LOOPBACK;
        }
    }

    /**
     * Wraps collected nodes the way every builder does: nothing becomes Null, a single node stays
     * itself, several become a Sequence.
     */
    static PstNode collapse(List<PstNode> nodes) {
        if (nodes.isEmpty()) {
            return new Null();
        }
        if (nodes.size() == 1) {
            return nodes.get(0);
        }
        return new Sequence(nodes);
    }

    private static void requireLabel(String label, String what) {
        if (label == null) {
            throw new IllegalArgumentException(what + " label must not be null");
        }
    }

    private static List<PstNode> requireChildren(List<PstNode> children, String what) {
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException(what + " needs at least one child");
        }
        for (PstNode child : children) {
            if (child == null) {
                throw new IllegalArgumentException(what + " children must not be null");
            }
        }
        return List.copyOf(children);
    }
}
