package org.bpmn.pst.structuring;

import lombok.extern.slf4j.Slf4j;
import org.bpmn.pst.bpmn.models.FlowGraph;
import org.bpmn.pst.bpmn.models.GatewayKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the gateway where the branches of a split come back together.
 * <p>
 * Each outgoing branch is explored breadth-first. Candidates are nodes reached from every branch
 * that are gateways of the split's kind with more than one incoming flow. The candidate whose
 * latest-arriving branch is closest wins; ties go to the node that comes first in the document.
 * This approximates a post-dominator and can pick the wrong merge when merges criss-cross.
 */
@Slf4j
public class JoinAnalyzer {
    private final FlowGraph graph;

    public JoinAnalyzer(FlowGraph graph) {
        this.graph = graph;
    }

    public Optional<String> findJoin(String splitId, GatewayKind kind) {
        List<String> outs = graph.successors(splitId);
        if (outs.size() <= 1) {
            return Optional.empty();
        }

        List<Map<String, Integer>> distancesPerBranch = new ArrayList<>(outs.size());
        for (String branchStart : outs) {
            distancesPerBranch.add(shortestDistances(branchStart));
        }

        String best = null;
        int bestScore = Integer.MAX_VALUE;
        // document order makes ties deterministic
        for (String candidate : graph.nodesById().keySet()) {
            if (!isMergeOfKind(candidate, kind)) {
                continue;
            }
            int score = latestArrival(candidate, distancesPerBranch);
            if (score < bestScore) {
                best = candidate;
                bestScore = score;
            }
        }

        if (best == null) {
            log.debug("No join found for split '{}' ({})", splitId, kind);
        } else {
            log.debug("Join for split '{}' ({}) is '{}' at distance {}", splitId, kind, best, bestScore);
        }
        return Optional.ofNullable(best);
    }

    /**
     * Breadth-first distances, in edges, from {@code start} to every node it reaches.
     */
    Map<String, Integer> shortestDistances(String start) {
        Map<String, Integer> distances = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        distances.put(start, 0);
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int next = distances.get(current) + 1;
            for (String successor : graph.successors(current)) {
                if (!distances.containsKey(successor)) {
                    distances.put(successor, next);
                    queue.add(successor);
                }
            }
        }
        return distances;
    }

    private boolean isMergeOfKind(String id, GatewayKind kind) {
        return graph.node(id).isGateway(kind) && graph.inDegree(id) > 1;
    }

    /**
     * Maximum distance over all branches, or {@link Integer#MAX_VALUE} if some branch never reaches
     * the node.
     */
    private static int latestArrival(String id, List<Map<String, Integer>> distancesPerBranch) {
        int latest = 0;
        for (Map<String, Integer> distances : distancesPerBranch) {
            Integer distance = distances.get(id);
            if (distance == null) {
                return Integer.MAX_VALUE;
            }
            latest = Math.max(latest, distance);
        }
        return latest;
    }
}
