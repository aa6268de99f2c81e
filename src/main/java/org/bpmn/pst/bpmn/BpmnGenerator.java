package org.bpmn.pst.bpmn;

import lombok.extern.slf4j.Slf4j;
import org.bpmn.pst.bpmn.models.FlowGraph;
import org.bpmn.pst.bpmn.models.FlowNode;
import org.bpmn.pst.bpmn.models.GatewayKind;
import org.bpmn.pst.bpmn.models.SequenceFlow;
import org.bpmn.pst.config.OutputSettings;
import org.bpmn.pst.layout.Bounds;
import org.bpmn.pst.layout.RenderedProcess;
import org.bpmn.pst.layout.Waypoint;
import org.bpmn.pst.util.FileOutput;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Map;

/**
 * Builds BPMN 2.0 XML, including the BPMNDI diagram section, for a rendered process.
 */
@Slf4j
public class BpmnGenerator {
    private static final String BPMN_NS = BpmnHelper.BPMN_NS;
    private static final String BPMNDI_NS = "http://www.omg.org/spec/BPMN/20100524/DI";
    private static final String DC_NS = "http://www.omg.org/spec/DD/20100524/DC";
    private static final String DI_NS = "http://www.omg.org/spec/DD/20100524/DI";
    private static final String XMLNS_NS = "http://www.w3.org/2000/xmlns/";

    /**
     * Creates the BPMN document for a rendered process.
     *
     * @param rendered the graph and geometry produced by the renderer
     * @param output   ids written into the document
     * @return the DOM document
     */
    public static Document createBpmnDocument(RenderedProcess rendered, OutputSettings output) {
        Document doc;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            doc = factory.newDocumentBuilder().newDocument();
        } catch (Exception e) {
            throw new RuntimeException("Failed to create BPMN document", e);
        }

        Element definitions = doc.createElementNS(BPMN_NS, "bpmn2:definitions");
        definitions.setAttributeNS(XMLNS_NS, "xmlns:bpmn2", BPMN_NS);
        definitions.setAttributeNS(XMLNS_NS, "xmlns:bpmndi", BPMNDI_NS);
        definitions.setAttributeNS(XMLNS_NS, "xmlns:dc", DC_NS);
        definitions.setAttributeNS(XMLNS_NS, "xmlns:di", DI_NS);
        definitions.setAttribute("id", output.definitionsId);
        definitions.setAttribute("targetNamespace", output.targetNamespace);
        doc.appendChild(definitions);

        FlowGraph graph = rendered.graph();
        String processId = graph.processId() != null ? graph.processId() : output.processId;

        Element process = doc.createElementNS(BPMN_NS, "bpmn2:process");
        process.setAttribute("id", processId);
        process.setAttribute("isExecutable", "false");
        definitions.appendChild(process);

        Map<String, FlowNode> nodes = graph.nodesById();
        for (FlowNode node : nodes.values()) {
            process.appendChild(createFlowNodeElement(doc, node, graph));
        }
        for (SequenceFlow flow : graph.flows()) {
            Element flowEl = doc.createElementNS(BPMN_NS, "bpmn2:sequenceFlow");
            flowEl.setAttribute("id", flow.id());
            flowEl.setAttribute("sourceRef", flow.sourceRef());
            flowEl.setAttribute("targetRef", flow.targetRef());
            process.appendChild(flowEl);
        }

        Element diagram = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNDiagram");
        diagram.setAttribute("id", output.diagramId);
        definitions.appendChild(diagram);

        Element plane = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNPlane");
        plane.setAttribute("id", output.diagramId + "_plane");
        plane.setAttribute("bpmnElement", processId);
        diagram.appendChild(plane);

        for (Map.Entry<String, Bounds> shape : rendered.shapes().entrySet()) {
            plane.appendChild(createShapeElement(doc, nodes.get(shape.getKey()), shape.getValue()));
        }
        for (RenderedProcess.DiagramEdge edge : rendered.edges()) {
            Element edgeEl = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNEdge");
            edgeEl.setAttribute("id", edge.id());
            edgeEl.setAttribute("bpmnElement", edge.flowId());
            for (Waypoint point : edge.waypoints()) {
                Element waypoint = doc.createElementNS(DI_NS, "di:waypoint");
                waypoint.setAttribute("x", formatNumber(point.x()));
                waypoint.setAttribute("y", formatNumber(point.y()));
                edgeEl.appendChild(waypoint);
            }
            plane.appendChild(edgeEl);
        }

        return doc;
    }

    /**
     * Flow node element with its incoming flows listed before its outgoing flows, as the BPMN
     * schema orders them.
     */
    private static Element createFlowNodeElement(Document doc, FlowNode node, FlowGraph graph) {
        Element el = doc.createElementNS(BPMN_NS, "bpmn2:" + node.elementType());
        el.setAttribute("id", node.id());
        if (node.name() != null) {
            el.setAttribute("name", node.name());
        }
        for (SequenceFlow flow : graph.flows()) {
            if (flow.targetRef().equals(node.id())) {
                appendRef(doc, el, "bpmn2:incoming", flow.id());
            }
        }
        for (SequenceFlow flow : graph.flows()) {
            if (flow.sourceRef().equals(node.id())) {
                appendRef(doc, el, "bpmn2:outgoing", flow.id());
            }
        }
        return el;
    }

    private static void appendRef(Document doc, Element parent, String tag, String flowId) {
        Element ref = doc.createElementNS(BPMN_NS, tag);
        ref.setTextContent(flowId);
        parent.appendChild(ref);
    }

    private static Element createShapeElement(Document doc, FlowNode node, Bounds bounds) {
        Element shape = doc.createElementNS(BPMNDI_NS, "bpmndi:BPMNShape");
        shape.setAttribute("id", node.id() + "_di");
        shape.setAttribute("bpmnElement", node.id());
        if (node.isGateway(GatewayKind.EXCLUSIVE) || node.isGateway(GatewayKind.PARALLEL)) {
            shape.setAttribute("isMarkerVisible", "true");
        }
        Element boundsEl = doc.createElementNS(DC_NS, "dc:Bounds");
        boundsEl.setAttribute("x", formatNumber(bounds.x()));
        boundsEl.setAttribute("y", formatNumber(bounds.y()));
        boundsEl.setAttribute("width", formatNumber(bounds.width()));
        boundsEl.setAttribute("height", formatNumber(bounds.height()));
        shape.appendChild(boundsEl);
        return shape;
    }

    /**
     * Serializes a BPMN document as indented XML.
     */
    public static String toXmlString(Document doc) {
        try {
            TransformerFactory transformerFactory = TransformerFactory.newInstance();
            Transformer transformer = transformerFactory.newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");

            StringWriter stringWriter = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(stringWriter));

            // Remove extra blank lines (consecutive newlines)
            return stringWriter.toString().replaceAll("(\r?\n)\\s*\r?\n", "$1");
        } catch (Exception e) {
            throw new RuntimeException("Failed to serialize BPMN document", e);
        }
    }

    /**
     * Writes a BPMN Document to a file. The file only appears once it is complete and schema-valid.
     *
     * @param doc            the Document to write
     * @param outputFilePath the output file path
     * @throws org.camunda.bpm.model.xml.ModelException if the document is not valid BPMN
     * @throws RuntimeException if writing fails
     */
    public static void writeBpmnDocument(Document doc, String outputFilePath) {
        String xmlContent = toXmlString(doc);
        BpmnValidator.validateXml(xmlContent);
        FileOutput.writeAtomically(Path.of(outputFilePath), xmlContent);
        log.info("BPMN diagram written to {}", outputFilePath);
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
