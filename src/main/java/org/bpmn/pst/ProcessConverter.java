package org.bpmn.pst;

import lombok.extern.slf4j.Slf4j;
import org.bpmn.pst.bpmn.BpmnGenerator;
import org.bpmn.pst.bpmn.models.FlowGraph;
import org.bpmn.pst.config.ConverterConfig;
import org.bpmn.pst.layout.PstRenderer;
import org.bpmn.pst.layout.RenderedProcess;
import org.bpmn.pst.pst.PstNode;
import org.bpmn.pst.pst.PstParser;
import org.bpmn.pst.pst.PstPrinter;
import org.bpmn.pst.structuring.StructuringEngine;
import org.w3c.dom.Document;

/**
 * Both conversion directions, wired with one configuration.
 */
@Slf4j
public class ProcessConverter {
    private final ConverterConfig config;

    public ProcessConverter(ConverterConfig config) {
        this.config = config;
    }

    public PstNode toTree(FlowGraph graph) {
        PstNode tree = new StructuringEngine(graph, config.limits.maxNestingDepth, config.limits.maxTreeNodes).structure();
        log.info("Structured process '{}' into a {} tree", graph.processId(), tree.type());
        return tree;
    }

    public String toTreeText(FlowGraph graph) {
        return PstPrinter.print(toTree(graph));
    }

    public PstNode parseTree(String text) {
        return PstParser.parse(text, config.limits.maxNestingDepth);
    }

    public RenderedProcess render(PstNode tree) {
        return new PstRenderer(config.layout, config.output.processId, config.limits.maxNestingDepth).render(tree);
    }

    public Document toBpmnDocument(PstNode tree) {
        return BpmnGenerator.createBpmnDocument(render(tree), config.output);
    }
}
