package org.flowcanvas.interchange.bpmn;

import org.flowcanvas.interchange.bpmn.models.ColorScheme;
import org.flowcanvas.interchange.bpmn.models.ColorStyle;
import org.flowcanvas.interchange.bpmn.models.EventDefinitionType;
import org.flowcanvas.interchange.bpmn.models.FlowEdge;
import org.flowcanvas.interchange.bpmn.models.FlowElement;
import org.flowcanvas.interchange.bpmn.models.NodeKind;
import org.flowcanvas.interchange.bpmn.models.Point;
import org.flowcanvas.interchange.config.CodecConfig;
import org.flowcanvas.interchange.graph.ProcessGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BpmnEncoderTest {
    private IdAllocator ids;
    private BpmnEncoder encoder;

    @BeforeEach
    void setUp() {
        ids = new IdAllocator(new Random(17));
        encoder = new BpmnEncoder(ids, new CodecConfig());
    }

    static Element byId(Document doc, String id) {
        NodeList all = doc.getElementsByTagName("*");
        for (int i = 0; i < all.getLength(); i++) {
            Element element = (Element) all.item(i);
            if (id.equals(element.getAttribute("id"))) {
                return element;
            }
        }
        return null;
    }

    static List<Element> byLocalName(Document doc, String namespace, String localName) {
        List<Element> found = new ArrayList<>();
        NodeList all = doc.getElementsByTagNameNS(namespace, localName);
        for (int i = 0; i < all.getLength(); i++) {
            found.add((Element) all.item(i));
        }
        return found;
    }

    static List<String> childTexts(Element parent, String localName) {
        List<String> texts = new ArrayList<>();
        for (Element child : XmlSupport.childElements(parent)) {
            if (localName.equals(XmlSupport.localName(child))) {
                texts.add(child.getTextContent());
            }
        }
        return texts;
    }

    static Element shapeOf(Document doc, String bpmnElement) {
        for (Element shape : byLocalName(doc, BpmnNamespaces.BPMNDI_NS, "BPMNShape")) {
            if (bpmnElement.equals(shape.getAttribute("bpmnElement"))) {
                return shape;
            }
        }
        return null;
    }

    static Element edgeOf(Document doc, String bpmnElement) {
        for (Element edge : byLocalName(doc, BpmnNamespaces.BPMNDI_NS, "BPMNEdge")) {
            if (bpmnElement.equals(edge.getAttribute("bpmnElement"))) {
                return edge;
            }
        }
        return null;
    }

    static List<Point> waypoints(Element edge) {
        List<Point> points = new ArrayList<>();
        for (Element child : XmlSupport.childElements(edge)) {
            if ("waypoint".equals(XmlSupport.localName(child))) {
                points.add(new Point(Double.parseDouble(child.getAttribute("x")), Double.parseDouble(child.getAttribute("y"))));
            }
        }
        return points;
    }

    static Element bounds(Element shape) {
        for (Element child : XmlSupport.childElements(shape)) {
            if ("Bounds".equals(XmlSupport.localName(child))) {
                return child;
            }
        }
        return null;
    }

    private static ProcessGraph minimalGraph() {
        ProcessGraph graph = new ProcessGraph();
        graph.addNode(FlowElement.builder().id("Start").kind(NodeKind.START_EVENT).name("Begin").position(new Point(100, 100)).build());
        graph.addNode(FlowElement.builder().id("Work").kind(NodeKind.TASK).name("Do work").position(new Point(200, 80)).build());
        graph.addNode(FlowElement.builder().id("End").kind(NodeKind.END_EVENT).position(new Point(400, 100)).build());
        return graph;
    }

    @Test
    void shouldEncodeMinimalProcess() {
        ProcessGraph graph = minimalGraph();
        FlowEdge first = graph.connect("Start", "Work", ids);
        FlowEdge second = graph.connect("Work", "End", ids);

        String xml = encoder.encode(graph);
        Document doc = XmlSupport.parseDocument(xml);

        Element definitions = doc.getDocumentElement();
        assertEquals("http://bpmn.io/schema/bpmn", definitions.getAttribute("targetNamespace"));
        assertEquals("flowcanvas", definitions.getAttribute("exporter"));
        assertTrue(definitions.getAttribute("id").startsWith("Definitions_"));
        assertTrue(byLocalName(doc, BpmnNamespaces.BPMN_NS, "collaboration").isEmpty());

        Element process = byLocalName(doc, BpmnNamespaces.BPMN_NS, "process").get(0);
        assertEquals("false", process.getAttribute("isExecutable"));
        assertTrue(process.getAttribute("id").startsWith("Process_"));

        Element work = byId(doc, "Work");
        assertEquals("Do work", work.getAttribute("name"));
        assertEquals(List.of(first.id()), childTexts(work, "incoming"));
        assertEquals(List.of(second.id()), childTexts(work, "outgoing"));
        assertFalse(byId(doc, "End").hasAttribute("name"));

        Element plane = byLocalName(doc, BpmnNamespaces.BPMNDI_NS, "BPMNPlane").get(0);
        assertEquals(process.getAttribute("id"), plane.getAttribute("bpmnElement"));
        Element startBounds = bounds(shapeOf(doc, "Start"));
        assertEquals("100", startBounds.getAttribute("x"));
        assertEquals("36", startBounds.getAttribute("width"));
        assertEquals(List.of(new Point(136, 118), new Point(200, 120)), waypoints(edgeOf(doc, first.id())));

        assertDoesNotThrow(() -> BpmnValidator.validate(xml));
    }

    @Test
    void shouldLabelOnlyNamedExternalLabelNodes() {
        Document doc = XmlSupport.parseDocument(encoder.encode(minimalGraph()));

        assertEquals(2, XmlSupport.childElements(shapeOf(doc, "Start")).size());
        assertEquals(1, XmlSupport.childElements(shapeOf(doc, "Work")).size());
        assertEquals(1, XmlSupport.childElements(shapeOf(doc, "End")).size());
    }

    @Test
    void shouldWriteCollaborationForParticipants() {
        ProcessGraph graph = new ProcessGraph();
        graph.addNode(FlowElement.builder().id("Pool_A").kind(NodeKind.PARTICIPANT).name("Buyer").position(new Point(0, 0)).build());
        graph.addNode(FlowElement.builder().id("Pool_B").kind(NodeKind.PARTICIPANT).name("Seller").position(new Point(0, 300)).build());
        graph.addNode(FlowElement.builder().id("Ask").kind(NodeKind.TASK).participantId("Pool_A").position(new Point(100, 50)).build());
        graph.addNode(FlowElement.builder().id("Answer").kind(NodeKind.TASK).participantId("Pool_B").position(new Point(100, 50)).build());
        FlowEdge message = graph.connect("Ask", "Answer", ids);

        String xml = encoder.encode(graph);
        Document doc = XmlSupport.parseDocument(xml);

        Element collaboration = byLocalName(doc, BpmnNamespaces.BPMN_NS, "collaboration").get(0);
        assertTrue(collaboration.getAttribute("id").startsWith("Collaboration_"));
        List<Element> processes = byLocalName(doc, BpmnNamespaces.BPMN_NS, "process");
        assertEquals(2, processes.size());
        assertEquals("Buyer", processes.get(0).getAttribute("name"));
        assertEquals(processes.get(0).getAttribute("id"), byId(doc, "Pool_A").getAttribute("processRef"));

        Element flow = byId(doc, message.id());
        assertEquals("messageFlow", XmlSupport.localName(flow));
        assertSame(collaboration, flow.getParentNode());

        Element askBounds = bounds(shapeOf(doc, "Ask"));
        assertEquals("100", askBounds.getAttribute("x"));
        assertEquals("50", askBounds.getAttribute("y"));
        Element answerBounds = bounds(shapeOf(doc, "Answer"));
        assertEquals("350", answerBounds.getAttribute("y"));
        assertEquals("true", shapeOf(doc, "Pool_B").getAttribute("isHorizontal"));
        assertEquals(collaboration.getAttribute("id"),
                byLocalName(doc, BpmnNamespaces.BPMNDI_NS, "BPMNPlane").get(0).getAttribute("bpmnElement"));

        assertDoesNotThrow(() -> BpmnValidator.validate(xml));
    }

    @Test
    void shouldLeaveBlackBoxPoolWithoutProcess() {
        ProcessGraph graph = new ProcessGraph();
        graph.addNode(FlowElement.builder().id("Pool_A").kind(NodeKind.PARTICIPANT).name("Us").build());
        graph.addNode(FlowElement.builder().id("Pool_B").kind(NodeKind.PARTICIPANT).name("Them").position(new Point(0, 300)).build());
        graph.addNode(FlowElement.builder().id("Send").kind(NodeKind.TASK).participantId("Pool_A").build());
        graph.connect("Send", "Pool_B", ids);

        Document doc = XmlSupport.parseDocument(encoder.encode(graph));

        assertEquals(1, byLocalName(doc, BpmnNamespaces.BPMN_NS, "process").size());
        assertFalse(byId(doc, "Pool_B").hasAttribute("processRef"));
        assertEquals(1, byLocalName(doc, BpmnNamespaces.BPMN_NS, "messageFlow").size());
    }

    @Test
    void shouldSkipMisclassifiedEdgesWithWarnings() {
        ProcessGraph graph = new ProcessGraph();
        graph.addNode(FlowElement.builder().id("Pool_A").kind(NodeKind.PARTICIPANT).build());
        graph.addNode(FlowElement.builder().id("Pool_B").kind(NodeKind.PARTICIPANT).position(new Point(0, 300)).build());
        graph.addNode(FlowElement.builder().id("A1").kind(NodeKind.TASK).participantId("Pool_A").build());
        graph.addNode(FlowElement.builder().id("A2").kind(NodeKind.TASK).participantId("Pool_A").build());
        graph.addNode(FlowElement.builder().id("B1").kind(NodeKind.TASK).participantId("Pool_B").build());
        graph.addEdge(FlowEdge.builder().id("Across").sourceId("A1").targetId("B1").build());
        graph.addEdge(FlowEdge.builder().id("Inside").sourceId("A1").targetId("A2").messageFlow(true).build());
        graph.addEdge(FlowEdge.builder().id("Dangling").sourceId("A1").targetId("Gone").build());

        EncodeResult result = encoder.encodeWithReport(graph);
        Document doc = XmlSupport.parseDocument(result.xml());

        assertNull(byId(doc, "Across"));
        assertNull(byId(doc, "Inside"));
        assertNull(byId(doc, "Dangling"));
        assertEquals(List.of(WarningKind.CROSS_BOUNDARY_FLOW, WarningKind.INTRA_BOUNDARY_MESSAGE_FLOW,
                        WarningKind.UNRESOLVED_REFERENCE).stream().sorted().toList(),
                result.warnings().stream().map(CodecWarning::kind).sorted().toList());
        assertTrue(childTexts(byId(doc, "A1"), "outgoing").isEmpty());
    }

    @Test
    void shouldEscapeNamesAndDocumentation() {
        ProcessGraph graph = new ProcessGraph();
        String name = "Check <price> & \"terms\"";
        graph.addNode(FlowElement.builder().id("Task_1").kind(NodeKind.TASK).name(name)
                .documentation("a < b && c > d").build());

        String xml = encoder.encode(graph);
        Element task = byId(XmlSupport.parseDocument(xml), "Task_1");

        assertFalse(xml.contains("<price>"));
        assertEquals(name, task.getAttribute("name"));
        assertEquals(List.of("a < b && c > d"), childTexts(task, "documentation"));
    }

    @Test
    void shouldSynthesizeEventDefinition() {
        ProcessGraph graph = new ProcessGraph();
        graph.addNode(FlowElement.builder().id("Timer").kind(NodeKind.START_EVENT)
                .eventDefinition(EventDefinitionType.TIMER).build());

        Element timer = byId(XmlSupport.parseDocument(encoder.encode(graph)), "Timer");

        List<Element> children = XmlSupport.childElements(timer);
        assertEquals(1, children.size());
        assertEquals("timerEventDefinition", XmlSupport.localName(children.get(0)));
        assertEquals("Timer_def", children.get(0).getAttribute("id"));
    }

    @Test
    void shouldSynthesizeDataObjectForNewReference() {
        ProcessGraph graph = new ProcessGraph();
        graph.addNode(FlowElement.builder().id("Invoice").kind(NodeKind.DATA_OBJECT).name("Invoice").build());

        String xml = encoder.encode(graph);
        Document doc = XmlSupport.parseDocument(xml);

        assertEquals("DataObject_Invoice", byId(doc, "Invoice").getAttribute("dataObjectRef"));
        assertEquals("dataObject", XmlSupport.localName(byId(doc, "DataObject_Invoice")));
        assertDoesNotThrow(() -> BpmnValidator.validate(xml));
    }

    @Test
    void shouldWriteEditorColoursAsExtensionElements() {
        ProcessGraph graph = new ProcessGraph();
        graph.addNode(FlowElement.builder().id("Task_1").kind(NodeKind.TASK)
                .style(new ColorStyle("#c8e6c9", null, (ColorScheme) null)).build());

        Element shape = shapeOf(XmlSupport.parseDocument(encoder.encode(graph)), "Task_1");

        Element extension = ColorStyles.extensionElements(shape);
        assertNotNull(extension);
        Element fill = XmlSupport.childElements(extension).get(0);
        assertEquals("200", fill.getAttribute("red"));
        assertEquals("230", fill.getAttribute("green"));
        assertEquals("201", fill.getAttribute("blue"));
    }

    @Test
    void shouldRegenerateWaypointsOfMovedNode() throws IOException {
        ProcessGraph graph = new BpmnDecoder(ids, DecodeMode.LENIENT)
                .decode(BpmnDecoderTest.read(BpmnDecoderTest.COLLABORATION_BPMN)).graph();
        FlowElement task = graph.node("Task_Order");
        graph.replaceNode(task.toBuilder().position(new Point(200, 40)).build());

        Document doc = XmlSupport.parseDocument(encoder.encode(graph));

        Element taskBounds = bounds(shapeOf(doc, "Task_Order"));
        assertEquals("360", taskBounds.getAttribute("x"));
        assertEquals("120", taskBounds.getAttribute("y"));
        assertEquals(List.of(new Point(288, 140), new Point(360, 160)), waypoints(edgeOf(doc, "Flow_1")));
        assertEquals(2, waypoints(edgeOf(doc, "Flow_2")).size());
        // untouched flows keep their path
        assertEquals(List.of(new Point(288, 510), new Point(340, 510)), waypoints(edgeOf(doc, "Flow_3")));
        assertEquals("#bbdefb", shapeOf(doc, "Task_Order").getAttributeNS(BpmnNamespaces.BIOC_NS, "fill"));
    }

    @Test
    void shouldDropDeletedNodeEverywhere() throws IOException {
        ProcessGraph graph = new BpmnDecoder(ids, DecodeMode.LENIENT)
                .decode(BpmnDecoderTest.read(BpmnDecoderTest.COLLABORATION_BPMN)).graph();
        graph.removeNode("EndEvent_1");

        String xml = encoder.encode(graph);
        Document doc = XmlSupport.parseDocument(xml);

        assertNull(byId(doc, "EndEvent_1"));
        assertNull(byId(doc, "Flow_2"));
        assertNull(edgeOf(doc, "Flow_2"));
        assertNull(shapeOf(doc, "EndEvent_1"));
        assertTrue(childTexts(byId(doc, "Lane_Support"), "flowNodeRef").isEmpty());
        assertEquals(List.of("StartEvent_1", "Task_Order"), childTexts(byId(doc, "Lane_Sales"), "flowNodeRef"));
        assertTrue(childTexts(byId(doc, "Task_Order"), "outgoing").isEmpty());
        assertDoesNotThrow(() -> BpmnValidator.validate(xml));
    }

    @Test
    void shouldHonourIndentAmount() {
        CodecConfig config = new CodecConfig();
        config.indentAmount = 0;

        String xml = new BpmnEncoder(ids, config).encode(minimalGraph());

        assertFalse(xml.contains("\n  <bpmn:process"));
        assertTrue(xml.startsWith("<?xml"));
    }

    @Test
    void shouldFormatWholeNumbersWithoutFraction() {
        assertEquals("120", BpmnEncoder.formatNumber(120.0));
        assertEquals("-5", BpmnEncoder.formatNumber(-5));
        assertEquals("12.5", BpmnEncoder.formatNumber(12.5));
    }

    @Test
    void shouldStartRootElementOnItsOwnLine() {
        List<String> lines = new BpmnEncoder(ids, new CodecConfig()).encode(minimalGraph()).lines().toList();

        assertTrue(lines.get(0).startsWith("<?xml"));
        assertTrue(lines.get(0).endsWith("?>"));
        assertTrue(lines.get(1).startsWith("<bpmn:definitions"));
    }
}
