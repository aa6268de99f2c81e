package org.bpmn.pst.layout;

/**
 * Hands out element ids "Prefix_n" from one counter shared by every prefix.
 * One allocator belongs to one render run.
 */
public class IdAllocator {
    private int next = 1;

    public String next(String prefix) {
        return prefix + "_" + next++;
    }
}
