package org.flowcanvas.interchange.bpmn;

import org.flowcanvas.interchange.bpmn.models.FlowEdge;
import org.flowcanvas.interchange.bpmn.models.FlowElement;
import org.flowcanvas.interchange.bpmn.models.PreservedContent;
import org.flowcanvas.interchange.config.CodecConfig;
import org.flowcanvas.interchange.graph.ProcessGraph;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.io.IOException;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RoundTripTest {

    private static ProcessGraph decode(String xml) {
        DecodeResult result = new BpmnDecoder(new IdAllocator(new Random(9)), DecodeMode.STRICT).decode(xml);
        assertFalse(result.hasWarnings());
        return result.graph();
    }

    private static ProcessGraph decodeLenient(String xml) {
        return new BpmnDecoder(new IdAllocator(new Random(9)), DecodeMode.LENIENT).decode(xml).graph();
    }

    private static NodeList processes(String xml) {
        return XmlSupport.parseDocument(xml).getElementsByTagNameNS(BpmnNamespaces.BPMN_NS, "process");
    }

    private static String encode(ProcessGraph graph) {
        return new BpmnEncoder(new IdAllocator(new Random(9)), new CodecConfig()).encode(graph);
    }

    private static String normalize(String markup) {
        return markup.replaceAll(">\\s+<", "><").trim();
    }

    private static List<String> normalize(List<String> fragments) {
        return fragments.stream().map(RoundTripTest::normalize).toList();
    }

    private static void assertSamePreserved(PreservedContent expected, PreservedContent actual, String id) {
        assertEquals(expected.attributes(), actual.attributes(), id);
        assertEquals(expected.documentation(), actual.documentation(), id);
        assertEquals(normalize(expected.fragments()), normalize(actual.fragments()), id);
    }

    private static void assertSameGraph(ProcessGraph expected, ProcessGraph actual) {
        assertEquals(expected.nodes().stream().map(FlowElement::id).toList(),
                actual.nodes().stream().map(FlowElement::id).toList());
        assertEquals(expected.edges().stream().map(FlowEdge::id).toList(),
                actual.edges().stream().map(FlowEdge::id).toList());

        for (FlowElement before : expected.nodes()) {
            FlowElement after = actual.node(before.id());
            assertEquals(before.kind(), after.kind(), before.id());
            assertEquals(before.elementType(), after.elementType(), before.id());
            assertEquals(before.name(), after.name(), before.id());
            assertEquals(before.position(), after.position(), before.id());
            assertEquals(before.size(), after.size(), before.id());
            assertEquals(before.participantId(), after.participantId(), before.id());
            assertEquals(before.laneId(), after.laneId(), before.id());
            assertEquals(before.flowNodeRefs(), after.flowNodeRefs(), before.id());
            assertEquals(before.eventDefinition(), after.eventDefinition(), before.id());
            assertEquals(before.style(), after.style(), before.id());
            assertEquals(before.documentation(), after.documentation(), before.id());
            assertEquals(before.shape(), after.shape(), before.id());
            assertSamePreserved(before.preserved(), after.preserved(), before.id());
            if (before.processMeta() != null) {
                assertEquals(before.processMeta().processId(), after.processMeta().processId());
                assertEquals(before.processMeta().laneSetId(), after.processMeta().laneSetId());
                assertSamePreserved(before.processMeta().content(), after.processMeta().content(), before.id());
            }
        }
        for (FlowEdge before : expected.edges()) {
            FlowEdge after = actual.edge(before.id());
            assertEquals(before.sourceId(), after.sourceId(), before.id());
            assertEquals(before.targetId(), after.targetId(), before.id());
            assertEquals(before.messageFlow(), after.messageFlow(), before.id());
            assertEquals(before.name(), after.name(), before.id());
            assertEquals(before.diagram(), after.diagram(), before.id());
            assertSamePreserved(before.preserved(), after.preserved(), before.id());
        }

        assertEquals(expected.documentMeta().definitionsId(), actual.documentMeta().definitionsId());
        assertEquals(expected.documentMeta().definitionsAttributes(), actual.documentMeta().definitionsAttributes());
        assertEquals(normalize(expected.documentMeta().rootFragments()), normalize(actual.documentMeta().rootFragments()));
        assertEquals(expected.documentMeta().collaborationId(), actual.documentMeta().collaborationId());
        assertEquals(expected.documentMeta().diagramId(), actual.documentMeta().diagramId());
        assertEquals(expected.documentMeta().planeId(), actual.documentMeta().planeId());
        assertEquals(expected.documentMeta().diagramFragments().size(), actual.documentMeta().diagramFragments().size());
    }

    @Test
    void shouldRoundTripCollaboration() throws IOException {
        ProcessGraph first = decode(BpmnDecoderTest.read(BpmnDecoderTest.COLLABORATION_BPMN));

        String xml = encode(first);
        ProcessGraph second = decode(xml);

        assertSameGraph(first, second);
        assertDoesNotThrow(() -> BpmnValidator.validate(xml));
    }

    @Test
    void shouldRoundTripArtifactsAndNestedContent() throws IOException {
        ProcessGraph first = decode(BpmnDecoderTest.read(BpmnDecoderTest.ARTIFACTS_BPMN));

        String xml = encode(first);
        ProcessGraph second = decode(xml);

        assertSameGraph(first, second);
        assertTrue(xml.contains("${approved &amp;&amp; score"));
        assertDoesNotThrow(() -> BpmnValidator.validate(xml));
    }

    @Test
    void shouldBeStableOnSecondPass() throws IOException {
        String once = encode(decode(BpmnDecoderTest.read(BpmnDecoderTest.COLLABORATION_BPMN)));
        String twice = encode(decode(once));

        assertEquals(once, twice);
    }

    @Test
    void shouldKeepDiExtensionColours() {
        String xml = BpmnDecoderTest.HEADER
                + "<bpmn:process id=\"Process_1\"><bpmn:task id=\"Task_1\"/></bpmn:process>"
                + "<bpmndi:BPMNDiagram id=\"D\"><bpmndi:BPMNPlane id=\"P\" bpmnElement=\"Process_1\">"
                + "<bpmndi:BPMNShape id=\"S1\" bpmnElement=\"Task_1\"><dc:Bounds x=\"10\" y=\"20\" width=\"100\" height=\"80\"/>"
                + "<bpmndi:BPMNExtensionElements><bpmndi:fillColor red=\"200\" green=\"230\" blue=\"201\"/>"
                + "<bpmndi:strokeColor red=\"56\" green=\"142\" blue=\"60\"/></bpmndi:BPMNExtensionElements>"
                + "</bpmndi:BPMNShape></bpmndi:BPMNPlane></bpmndi:BPMNDiagram>" + BpmnDecoderTest.FOOTER;
        ProcessGraph first = decode(xml);

        ProcessGraph second = decode(encode(first));

        assertEquals(first.node("Task_1").style(), second.node("Task_1").style());
        assertEquals("rgb(56, 142, 60)", second.node("Task_1").style().stroke());
    }

    @Test
    void shouldKeepLanesWithTheirProcessWithoutParticipant() {
        String xml = BpmnDecoderTest.HEADER
                + "<bpmn:process id=\"P1\" isExecutable=\"false\">"
                + "<bpmn:laneSet id=\"LaneSet_1\"><bpmn:lane id=\"L1\"><bpmn:flowNodeRef>S1</bpmn:flowNodeRef></bpmn:lane></bpmn:laneSet>"
                + "<bpmn:startEvent id=\"S1\"/>"
                + "</bpmn:process>"
                + "<bpmn:process id=\"P2\" isExecutable=\"false\">"
                + "<bpmn:laneSet id=\"LaneSet_2\"><bpmn:lane id=\"L2\"><bpmn:flowNodeRef>E2</bpmn:flowNodeRef></bpmn:lane></bpmn:laneSet>"
                + "<bpmn:endEvent id=\"E2\"/>"
                + "</bpmn:process>" + BpmnDecoderTest.FOOTER;

        String encoded = encode(decodeLenient(xml));

        NodeList processes = processes(encoded);
        assertEquals(2, processes.getLength());
        Element p1 = (Element) processes.item(0);
        assertEquals("P1", p1.getAttribute("id"));
        assertEquals("L1", ((Element) p1.getElementsByTagNameNS(BpmnNamespaces.BPMN_NS, "lane").item(0)).getAttribute("id"));
        assertEquals(1, p1.getElementsByTagNameNS(BpmnNamespaces.BPMN_NS, "startEvent").getLength());
        Element p2 = (Element) processes.item(1);
        assertEquals("P2", p2.getAttribute("id"));
        assertEquals("LaneSet_2", ((Element) p2.getElementsByTagNameNS(BpmnNamespaces.BPMN_NS, "laneSet").item(0)).getAttribute("id"));

        ProcessGraph again = decodeLenient(encoded);
        assertEquals("L1", again.node("S1").laneId());
        assertEquals("L2", again.node("E2").laneId());
    }

    @Test
    void shouldKeepProcessRecordWhenItsFirstNodeIsRemoved() {
        String xml = BpmnDecoderTest.HEADER.replace(" id=\"Definitions_1\"", " xmlns:x=\"urn:example:x\" id=\"Definitions_1\"")
                + "<bpmn:process id=\"Order\" isExecutable=\"true\">"
                + "<bpmn:extensionElements><x:props level=\"2\"/></bpmn:extensionElements>"
                + "<bpmn:startEvent id=\"S1\"/><bpmn:endEvent id=\"E1\"/>"
                + "</bpmn:process>" + BpmnDecoderTest.FOOTER;
        ProcessGraph graph = decodeLenient(xml);

        graph.removeNode("S1");
        String encoded = encode(graph);

        Element process = (Element) processes(encoded).item(0);
        assertEquals("Order", process.getAttribute("id"));
        assertEquals("true", process.getAttribute("isExecutable"));
        assertEquals(1, process.getElementsByTagNameNS("urn:example:x", "props").getLength());
        assertEquals(1, process.getElementsByTagNameNS(BpmnNamespaces.BPMN_NS, "endEvent").getLength());
    }

    @Test
    void shouldKeepEveryColourSchemeOfAShape() {
        String xml = BpmnDecoderTest.HEADER.replace(" id=\"Definitions_1\"",
                " xmlns:bioc=\"" + BpmnNamespaces.BIOC_NS + "\" xmlns:color=\"" + BpmnNamespaces.COLOR_NS + "\""
                        + " id=\"Definitions_1\"")
                + "<bpmn:process id=\"Process_1\"><bpmn:task id=\"Task_1\"/></bpmn:process>"
                + "<bpmndi:BPMNDiagram id=\"D\"><bpmndi:BPMNPlane id=\"P\" bpmnElement=\"Process_1\">"
                + "<bpmndi:BPMNShape id=\"S1\" bpmnElement=\"Task_1\" bioc:stroke=\"#0d4372\" bioc:fill=\"#bbdefb\""
                + " color:background-color=\"#bbdefb\" color:border-color=\"#0d4372\">"
                + "<dc:Bounds x=\"10\" y=\"20\" width=\"100\" height=\"80\"/>"
                + "</bpmndi:BPMNShape></bpmndi:BPMNPlane></bpmndi:BPMNDiagram>" + BpmnDecoderTest.FOOTER;
        ProcessGraph first = decode(xml);

        String encoded = encode(first);

        Element shape = (Element) XmlSupport.parseDocument(encoded)
                .getElementsByTagNameNS(BpmnNamespaces.BPMNDI_NS, "BPMNShape").item(0);
        assertEquals("#bbdefb", shape.getAttributeNS(BpmnNamespaces.BIOC_NS, "fill"));
        assertEquals("#0d4372", shape.getAttributeNS(BpmnNamespaces.BIOC_NS, "stroke"));
        assertEquals("#bbdefb", shape.getAttributeNS(BpmnNamespaces.COLOR_NS, "background-color"));
        assertEquals("#0d4372", shape.getAttributeNS(BpmnNamespaces.COLOR_NS, "border-color"));
        assertEquals(first.node("Task_1").style(), decode(encoded).node("Task_1").style());
    }
}
