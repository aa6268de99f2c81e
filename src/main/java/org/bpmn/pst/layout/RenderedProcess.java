package org.bpmn.pst.layout;

import org.bpmn.pst.bpmn.models.FlowGraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of rendering a tree: a new flow graph plus the diagram geometry for it.
 *
 * @param graph  the generated process
 * @param shapes shape bounds by flow node id, in placement order
 * @param edges  connector geometry, one entry per sequence flow whose ends both have bounds
 */
public record RenderedProcess(
        FlowGraph graph,
        Map<String, Bounds> shapes,
        List<DiagramEdge> edges
) {
    public RenderedProcess {
        shapes = Collections.unmodifiableMap(new LinkedHashMap<>(shapes));
        edges = List.copyOf(edges);
    }

    /**
     * @param id        id of the diagram edge element
     * @param flowId    id of the sequence flow it draws
     * @param waypoints polyline points from source to target
     */
    public record DiagramEdge(String id, String flowId, List<Waypoint> waypoints) {
        public DiagramEdge {
            waypoints = List.copyOf(waypoints);
        }
    }
}
