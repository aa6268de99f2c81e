package org.bpmn.pst.bpmn;

import lombok.extern.slf4j.Slf4j;
import org.bpmn.pst.bpmn.models.EventRole;
import org.bpmn.pst.bpmn.models.FlowGraph;
import org.bpmn.pst.bpmn.models.FlowNode;
import org.bpmn.pst.bpmn.models.GatewayKind;
import org.bpmn.pst.bpmn.models.NodeKind;
import org.bpmn.pst.bpmn.models.SequenceFlow;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the flow graph of a BPMN 2.0 process.
 */
@Slf4j
public class BpmnHelper {
    static final String BPMN_NS = "http://www.omg.org/spec/BPMN/20100524/MODEL";

    // All task flavours are structured the same way
    private static final Set<String> TASK_TYPES = Set.of(
            "task", "userTask", "manualTask", "scriptTask", "serviceTask",
            "businessRuleTask", "sendTask", "receiveTask", "callActivity", "subProcess"
    );

    private static final Map<String, EventRole> EVENT_TYPES = Map.of(
            "startEvent", EventRole.START,
            "endEvent", EventRole.END,
            "intermediateCatchEvent", EventRole.INTERMEDIATE,
            "intermediateThrowEvent", EventRole.INTERMEDIATE
    );

    private static final Map<String, GatewayKind> GATEWAY_TYPES = Map.of(
            "exclusiveGateway", GatewayKind.EXCLUSIVE,
            "parallelGateway", GatewayKind.PARALLEL
    );

    // Flow nodes we recognize but cannot structure
    private static final Set<String> UNSUPPORTED_TYPES = Set.of(
            "inclusiveGateway", "eventBasedGateway", "complexGateway", "boundaryEvent",
            "adHocSubProcess", "transaction"
    );

    /**
     * Parses a BPMN file and returns the flow graph of its first non-empty process.
     *
     * @param bpmnFilePath the path to the BPMN file
     * @return the flow graph
     * @throws IllegalArgumentException if the process references missing or unsupported elements
     * @throws RuntimeException         if the file cannot be read or is not well-formed XML
     */
    public static FlowGraph parseBpmnFile(String bpmnFilePath) {
        log.info("Loading BPMN file {}", bpmnFilePath);
        try (InputStream in = new FileInputStream(new File(bpmnFilePath))) {
            return parseBpmn(in, bpmnFilePath);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed to parse BPMN file: " + bpmnFilePath, e);
        }
    }

    /**
     * Parses BPMN XML from a stream.
     *
     * @param in         the XML content
     * @param sourceName name used in error messages
     */
    public static FlowGraph parseBpmn(InputStream in, String sourceName) {
        Document doc;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            doc = builder.parse(in);
        } catch (Exception e) {
            throw new RuntimeException("Failed to parse BPMN document: " + sourceName, e);
        }

        Element definitionsEl = doc.getDocumentElement();
        if (!"definitions".equals(definitionsEl.getLocalName()) || !BPMN_NS.equals(definitionsEl.getNamespaceURI())) {
            throw new IllegalArgumentException("Root element is not BPMN 'definitions' in " + sourceName);
        }

        Element processEl = findProcess(doc, sourceName);
        return parseProcess(processEl);
    }

    /**
     * Picks the first process that contains flow nodes; collaboration diagrams often carry empty
     * processes for black-box pools.
     */
    private static Element findProcess(Document doc, String sourceName) {
        NodeList processNodes = doc.getElementsByTagNameNS(BPMN_NS, "process");
        if (processNodes.getLength() == 0) {
            throw new IllegalArgumentException("No process found in " + sourceName);
        }
        for (int i = 0; i < processNodes.getLength(); i++) {
            Element processEl = (Element) processNodes.item(i);
            for (Element child : childElements(processEl)) {
                if (isFlowNodeType(child.getLocalName())) {
                    return processEl;
                }
            }
        }
        return (Element) processNodes.item(0);
    }

    /**
     * Parses the direct children of a process element. Contents of sub-processes are not read, a
     * sub-process is a single task for structuring.
     */
    private static FlowGraph parseProcess(Element processEl) {
        String processId = processEl.getAttribute("id");

        List<FlowNode> nodes = new ArrayList<>();
        Map<String, String> unsupportedById = new HashMap<>();
        List<Element> flowElements = new ArrayList<>();

        for (Element el : childElements(processEl)) {
            String type = el.getLocalName();
            String id = el.getAttribute("id");
            if ("sequenceFlow".equals(type)) {
                flowElements.add(el);
            } else if (UNSUPPORTED_TYPES.contains(type)) {
                unsupportedById.put(id, type);
            } else if (isFlowNodeType(type)) {
                nodes.add(parseFlowNode(el, type, id));
            }
        }

        List<SequenceFlow> flows = new ArrayList<>();
        for (Element flowEl : flowElements) {
            SequenceFlow flow = parseSequenceFlow(flowEl);
            rejectUnsupported(flow, flow.sourceRef(), unsupportedById);
            rejectUnsupported(flow, flow.targetRef(), unsupportedById);
            flows.add(flow);
        }
        if (!unsupportedById.isEmpty()) {
            log.warn("Ignoring unconnected unsupported elements in process '{}': {}", processId, unsupportedById.keySet());
        }

        FlowGraph graph = new FlowGraph(processId, nodes, flows);
        log.debug("Process '{}' has {} flow nodes and {} sequence flows", processId, nodes.size(), flows.size());
        return graph;
    }

    private static FlowNode parseFlowNode(Element el, String type, String id) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Flow node of type '" + type + "' has no id");
        }
        String name = el.hasAttribute("name") ? el.getAttribute("name") : null;

        FlowNode.FlowNodeBuilder builder = FlowNode.builder()
                .id(id)
                .name(name)
                .elementType(type);
        if (TASK_TYPES.contains(type)) {
            builder.kind(NodeKind.TASK);
        } else if (EVENT_TYPES.containsKey(type)) {
            builder.kind(NodeKind.EVENT).eventRole(EVENT_TYPES.get(type));
        } else {
            builder.kind(NodeKind.GATEWAY).gatewayKind(GATEWAY_TYPES.get(type));
        }
        return builder.build();
    }

    /**
     * Parses a sequenceFlow element.
     */
    private static SequenceFlow parseSequenceFlow(Element flowEl) {
        String flowId = flowEl.getAttribute("id");
        String flowName = flowEl.hasAttribute("name") ? flowEl.getAttribute("name") : null;
        String sourceRef = flowEl.getAttribute("sourceRef");
        String targetRef = flowEl.getAttribute("targetRef");
        if (sourceRef.isEmpty() || targetRef.isEmpty()) {
            throw new IllegalArgumentException("Sequence flow '" + flowId + "' needs both sourceRef and targetRef");
        }
        return new SequenceFlow(flowId, flowName, sourceRef, targetRef);
    }

    private static void rejectUnsupported(SequenceFlow flow, String ref, Map<String, String> unsupportedById) {
        String type = unsupportedById.get(ref);
        if (type != null) {
            throw new IllegalArgumentException(String.format(
                    "Sequence flow '%s' connects element '%s' of unsupported type '%s'", flow.id(), ref, type));
        }
    }

    private static boolean isFlowNodeType(String type) {
        return TASK_TYPES.contains(type) || EVENT_TYPES.containsKey(type) || GATEWAY_TYPES.containsKey(type);
    }

    private static List<Element> childElements(Element parent) {
        List<Element> children = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && BPMN_NS.equals(node.getNamespaceURI())) {
                children.add((Element) node);
            }
        }
        return children;
    }
}
