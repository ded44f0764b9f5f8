package org.flowcanvas.interchange.bpmn;

import org.flowcanvas.interchange.bpmn.models.BpmnElementType;
import org.flowcanvas.interchange.bpmn.models.Bounds;
import org.flowcanvas.interchange.bpmn.models.DiagramEdge;
import org.flowcanvas.interchange.bpmn.models.DiagramFragment;
import org.flowcanvas.interchange.bpmn.models.DiagramShape;
import org.flowcanvas.interchange.bpmn.models.DocumentMeta;
import org.flowcanvas.interchange.bpmn.models.EventDefinitionType;
import org.flowcanvas.interchange.bpmn.models.FlowEdge;
import org.flowcanvas.interchange.bpmn.models.FlowElement;
import org.flowcanvas.interchange.bpmn.models.NodeKind;
import org.flowcanvas.interchange.bpmn.models.Point;
import org.flowcanvas.interchange.bpmn.models.PreservedContent;
import org.flowcanvas.interchange.bpmn.models.ProcessMeta;
import org.flowcanvas.interchange.bpmn.models.Size;
import org.flowcanvas.interchange.graph.ProcessGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.BPMNDI_NS;
import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.BPMN_NS;
import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.DC_NS;
import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.DI_NS;

/**
 * Turns BPMN 2.0 XML into a {@link ProcessGraph}.
 * <p>
 * Participants, lanes and the direct children of each process that the element type table
 * knows become nodes; sequence and message flows become edges. Everything else is kept in
 * the preservation records so that {@link BpmnEncoder} can write it back.
 */
public class BpmnDecoder {
    private static final Logger log = LoggerFactory.getLogger(BpmnDecoder.class);

    private static final Point FIRST_PARTICIPANT = new Point(50, 50);
    private static final double PARTICIPANT_SPACING = 280;
    private static final Point FIRST_UNPLACED_NODE = new Point(100, 100);
    private static final double UNPLACED_NODE_SPACING = 150;

    /**
     * Process children that become nodes or edges and so are not kept as process fragments.
     */
    private static final Set<String> PROCESS_GRAPH_CHILDREN;

    static {
        Set<String> names = Arrays.stream(BpmnElementType.values())
                .map(BpmnElementType::localName)
                .collect(Collectors.toCollection(HashSet::new));
        names.add("sequenceFlow");
        PROCESS_GRAPH_CHILDREN = Set.copyOf(names);
    }

    private final IdAllocator ids;
    private final DecodeMode mode;

    public BpmnDecoder() {
        this(new IdAllocator(), DecodeMode.LENIENT);
    }

    /**
     * @param ids  allocator of the editing session; it is reseeded from the decoded ids
     * @param mode whether anomalies are skipped with a warning or abort decoding
     */
    public BpmnDecoder(IdAllocator ids, DecodeMode mode) {
        this.ids = ids;
        this.mode = mode;
    }

    /**
     * Decodes a complete BPMN document.
     *
     * @throws MalformedDocumentException if the text is not well-formed XML
     * @throws StrictDecodingException    in strict mode, on the first anomaly
     */
    public DecodeResult decode(String xml) {
        Document doc = XmlSupport.parseDocument(xml);
        Element definitionsEl = doc.getDocumentElement();
        if (!"definitions".equals(XmlSupport.localName(definitionsEl))) {
            throw new BpmnCodecException("Root element is not 'definitions' but '" + definitionsEl.getNodeName() + "'");
        }

        DecodeRun run = new DecodeRun(new WarningSink(mode));
        run.decode(definitionsEl);

        ids.reseedFrom(run.seenIds);
        log.debug("Decoded {} node(s) and {} edge(s) with {} warning(s)",
                run.graph.nodes().size(), run.graph.edges().size(), run.sink.warnings().size());
        return new DecodeResult(run.graph, run.sink.warnings());
    }

    /**
     * State of one {@link #decode(String)} call.
     */
    private final class DecodeRun {
        final WarningSink sink;
        final ProcessGraph graph = new ProcessGraph();
        final Set<String> seenIds = new HashSet<>();
        final Map<String, Element> shapesByElement = new LinkedHashMap<>();
        final Map<String, Element> edgesByElement = new LinkedHashMap<>();
        final Map<String, String> participantByProcess = new HashMap<>();
        final List<String> rootFragments = new ArrayList<>();
        final List<PendingFlow> pendingFlows = new ArrayList<>();
        int unplacedNodes;
        Set<String> documentIds;

        DecodeRun(WarningSink sink) {
            this.sink = sink;
        }

        void decode(Element definitionsEl) {
            Map<String, String> namespaces = new LinkedHashMap<>();
            ElementPreserver.collectNamespaces(definitionsEl, namespaces);

            Element collaborationEl = null;
            Element diagramEl = null;
            List<Element> processEls = new ArrayList<>();
            for (Element child : XmlSupport.childElements(definitionsEl)) {
                if (collaborationEl == null && XmlSupport.isElement(child, BPMN_NS, "collaboration")) {
                    collaborationEl = child;
                } else if (XmlSupport.isElement(child, BPMN_NS, "process")) {
                    processEls.add(child);
                } else if (diagramEl == null && XmlSupport.isElement(child, BPMNDI_NS, "BPMNDiagram")) {
                    diagramEl = child;
                } else {
                    rootFragments.add(XmlSupport.serializeNode(child));
                }
            }

            Element planeEl = null;
            if (diagramEl != null) {
                planeEl = firstChild(diagramEl, BPMNDI_NS, "BPMNPlane");
                if (planeEl != null) {
                    indexDiagram(planeEl);
                }
            }

            // Participants come first so process nodes can be tagged with their owner
            String collaborationId = null;
            PreservedContent collaboration = PreservedContent.EMPTY;
            if (collaborationEl != null) {
                collaborationId = idOf(collaborationEl, "collaboration");
                seenIds.add(collaborationId);
                collaboration = ElementPreserver.capture(collaborationEl, Set.of("participant", "messageFlow"));
                parseParticipants(collaborationEl);
            }

            for (Element processEl : processEls) {
                parseProcess(processEl);
            }

            // Flows are resolved only once every node of every process is known
            for (PendingFlow flow : pendingFlows) {
                parseSequenceFlow(flow);
            }
            if (collaborationEl != null) {
                parseMessageFlows(collaborationEl);
            }

            Map<String, String> definitionsAttributes = ElementPreserver.attributes(definitionsEl);
            String definitionsId = definitionsAttributes.remove("id");
            graph.setDocumentMeta(new DocumentMeta(
                    definitionsId,
                    definitionsAttributes,
                    namespaces,
                    rootFragments,
                    collaborationId,
                    collaboration,
                    diagramEl == null ? null : emptyToNull(diagramEl.getAttribute("id")),
                    planeEl == null ? null : emptyToNull(planeEl.getAttribute("id")),
                    unclaimedDiagramRecords()));
        }

        /**
         * Indexes shapes and edges by the element they draw; the first record of an element wins.
         */
        private void indexDiagram(Element planeEl) {
            for (Element record : XmlSupport.childElements(planeEl)) {
                Map<String, Element> index;
                if (XmlSupport.isElement(record, BPMNDI_NS, "BPMNShape")) {
                    index = shapesByElement;
                } else if (XmlSupport.isElement(record, BPMNDI_NS, "BPMNEdge")) {
                    index = edgesByElement;
                } else {
                    continue;
                }
                String bpmnElement = record.getAttribute("bpmnElement");
                if (bpmnElement.isEmpty()) {
                    continue;
                }
                if (index.containsKey(bpmnElement)) {
                    sink.report(WarningKind.DUPLICATE_IDENTIFIER, bpmnElement,
                            "Duplicate diagram record " + record.getAttribute("id") + " for " + bpmnElement + " ignored");
                    continue;
                }
                index.put(bpmnElement, record);
            }
        }

        private void parseParticipants(Element collaborationEl) {
            int ordinal = 0;
            for (Element participantEl : XmlSupport.childElements(collaborationEl)) {
                if (!XmlSupport.isElement(participantEl, BPMN_NS, "participant")) {
                    continue;
                }
                String id = idOf(participantEl, NodeKind.PARTICIPANT.tag());
                if (!claim(id)) {
                    continue;
                }

                Element shapeEl = shapesByElement.get(id);
                DiagramShape shape = shapeEl == null ? null : parseShape(shapeEl);
                Point position;
                Size size;
                if (shape != null && shape.bounds() != null) {
                    position = shape.bounds().origin();
                    size = shape.bounds().size();
                } else {
                    position = new Point(FIRST_PARTICIPANT.x(), FIRST_PARTICIPANT.y() + ordinal * PARTICIPANT_SPACING);
                    size = DiagramLayoutDeriver.PARTICIPANT_SIZE;
                }
                ordinal++;

                String processRef = emptyToNull(participantEl.getAttribute("processRef"));
                if (processRef != null) {
                    participantByProcess.putIfAbsent(processRef, id);
                }

                PreservedContent preserved = ElementPreserver.capture(participantEl);
                graph.addNode(FlowElement.builder()
                        .id(id)
                        .kind(NodeKind.PARTICIPANT)
                        .name(participantEl.getAttribute("name"))
                        .position(position)
                        .size(size)
                        .processRef(processRef)
                        .style(shapeEl == null ? null : ColorStyles.read(shapeEl))
                        .documentation(firstDocumentation(preserved))
                        .preserved(preserved)
                        .shape(shape)
                        .build());
            }
        }

        private void parseProcess(Element processEl) {
            String processId = idOf(processEl, "process");
            if (!claim(processId)) {
                return;
            }
            FlowElement participant = graph.node(participantByProcess.get(processId));
            Point origin = participant == null ? null : participant.position();

            // Parse lanes (top level of the first lane set; nested lane sets stay preserved)
            String laneSetId = null;
            String first = null;
            Map<String, String> laneByNode = new HashMap<>();
            Element laneSetEl = firstChild(processEl, BPMN_NS, "laneSet");
            if (laneSetEl != null) {
                laneSetId = emptyToNull(laneSetEl.getAttribute("id"));
                first = parseLanes(laneSetEl, participant, laneByNode);
            }

            // Parse flow nodes and artifacts
            for (Element child : XmlSupport.childElements(processEl)) {
                if (XmlSupport.isElement(child, BPMN_NS, "sequenceFlow")) {
                    pendingFlows.add(new PendingFlow(child));
                    continue;
                }
                BpmnElementType type = elementType(child);
                if (type == null) {
                    continue;
                }
                FlowElement node = parseFlowNode(child, type, participant, origin, laneByNode);
                if (node != null && first == null) {
                    first = node.id();
                }
            }

            ProcessMeta meta = new ProcessMeta(processId, laneSetId,
                    ElementPreserver.capture(processEl, PROCESS_GRAPH_CHILDREN));
            if (participant != null) {
                graph.replaceNode(graph.node(participant.id()).toBuilder().processMeta(meta).build());
            } else if (first != null) {
                // the process record travels with its first node, lanes included
                graph.replaceNode(graph.node(first).toBuilder().processMeta(meta).build());
            } else {
                // nothing to hang the process on; keep it whole
                log.debug("Process {} has no participant and no nodes, preserved as is", processId);
                rootFragments.add(XmlSupport.serializeNode(processEl));
            }
        }

        /**
         * @return id of the first lane added, or null when none was
         */
        private String parseLanes(Element laneSetEl, FlowElement participant, Map<String, String> laneByNode) {
            String first = null;
            int ordinal = 0;
            for (Element laneEl : XmlSupport.childElements(laneSetEl)) {
                if (!XmlSupport.isElement(laneEl, BPMN_NS, "lane")) {
                    continue;
                }
                String id = idOf(laneEl, NodeKind.LANE.tag());
                if (!claim(id)) {
                    continue;
                }

                List<String> flowNodeRefs = new ArrayList<>();
                for (Element refEl : XmlSupport.childElements(laneEl)) {
                    if (XmlSupport.isElement(refEl, BPMN_NS, "flowNodeRef")) {
                        String ref = refEl.getTextContent().trim();
                        if (!ref.isEmpty()) {
                            flowNodeRefs.add(ref);
                            laneByNode.putIfAbsent(ref, id);
                        }
                    }
                }

                Element shapeEl = shapesByElement.get(id);
                DiagramShape shape = shapeEl == null ? null : parseShape(shapeEl);
                Point position;
                Size size;
                if (shape != null && shape.bounds() != null) {
                    position = participant == null
                            ? shape.bounds().origin()
                            : CoordinateNormalizer.toRelative(shape.bounds().origin(), participant.position());
                    size = shape.bounds().size();
                } else {
                    double width = participant == null || participant.size() == null
                            ? DiagramLayoutDeriver.defaultSize(NodeKind.LANE).width()
                            : participant.size().width() - DiagramLayoutDeriver.PARTICIPANT_LABEL_BAND;
                    position = new Point(DiagramLayoutDeriver.PARTICIPANT_LABEL_BAND, ordinal * DiagramLayoutDeriver.LANE_HEIGHT);
                    size = new Size(width, DiagramLayoutDeriver.LANE_HEIGHT);
                }
                ordinal++;

                PreservedContent preserved = ElementPreserver.capture(laneEl);
                graph.addNode(FlowElement.builder()
                        .id(id)
                        .kind(NodeKind.LANE)
                        .name(laneEl.getAttribute("name"))
                        .position(position)
                        .size(size)
                        .participantId(participant == null ? null : participant.id())
                        .flowNodeRefs(flowNodeRefs)
                        .style(shapeEl == null ? null : ColorStyles.read(shapeEl))
                        .documentation(firstDocumentation(preserved))
                        .preserved(preserved)
                        .shape(shape)
                        .build());
                if (first == null) {
                    first = id;
                }
            }
            return first;
        }

        private FlowElement parseFlowNode(Element nodeEl, BpmnElementType type, FlowElement participant,
                                          Point origin, Map<String, String> laneByNode) {
            NodeKind kind = type.kind();
            String id = idOf(nodeEl, kind.tag());
            if (!claim(id)) {
                return null;
            }

            Element shapeEl = shapesByElement.get(id);
            DiagramShape shape = shapeEl == null ? null : parseShape(shapeEl);
            Point position;
            if (shape != null && shape.bounds() != null) {
                Point absolute = shape.bounds().origin();
                position = origin == null ? absolute : CoordinateNormalizer.toContentRelative(absolute, origin);
            } else {
                position = new Point(FIRST_UNPLACED_NODE.x() + unplacedNodes * UNPLACED_NODE_SPACING, FIRST_UNPLACED_NODE.y());
                unplacedNodes++;
            }

            String name;
            PreservedContent preserved;
            if (kind == NodeKind.TEXT_ANNOTATION) {
                // the annotation text is its label
                Element textEl = firstChild(nodeEl, BPMN_NS, "text");
                name = textEl == null ? "" : textEl.getTextContent();
                preserved = ElementPreserver.capture(nodeEl, Set.of("text"));
            } else {
                name = nodeEl.getAttribute("name");
                preserved = ElementPreserver.capture(nodeEl);
            }

            FlowElement node = FlowElement.builder()
                    .id(id)
                    .kind(kind)
                    .elementType(type)
                    .name(name)
                    .position(position)
                    .size(shape != null && shape.bounds() != null ? shape.bounds().size() : null)
                    .participantId(participant == null ? null : participant.id())
                    .laneId(laneByNode.get(id))
                    .eventDefinition(kind.isEvent() ? eventDefinition(nodeEl) : null)
                    .style(shapeEl == null ? null : ColorStyles.read(shapeEl))
                    .documentation(firstDocumentation(preserved))
                    .preserved(preserved)
                    .shape(shape)
                    .build();
            graph.addNode(node);
            return node;
        }

        private void parseSequenceFlow(PendingFlow pending) {
            Element flowEl = pending.element();
            String id = idOf(flowEl, "sequenceFlow");
            if (!claim(id)) {
                return;
            }
            FlowElement source = graph.node(flowEl.getAttribute("sourceRef"));
            FlowElement target = graph.node(flowEl.getAttribute("targetRef"));
            if (source == null || target == null) {
                sink.report(WarningKind.UNRESOLVED_REFERENCE, id, "Sequence flow " + id + " references missing element "
                        + (source == null ? flowEl.getAttribute("sourceRef") : flowEl.getAttribute("targetRef")));
                return;
            }
            if (ProcessGraph.requiresMessageFlow(source, target)) {
                sink.report(WarningKind.CROSS_BOUNDARY_FLOW, id, "Sequence flow " + id + " connects "
                        + source.id() + " and " + target.id() + " across participants, dropped");
                return;
            }
            graph.addEdge(parseEdge(flowEl, id, source, target, false));
        }

        private void parseMessageFlows(Element collaborationEl) {
            for (Element flowEl : XmlSupport.childElements(collaborationEl)) {
                if (!XmlSupport.isElement(flowEl, BPMN_NS, "messageFlow")) {
                    continue;
                }
                String id = idOf(flowEl, "messageFlow");
                if (!claim(id)) {
                    continue;
                }
                FlowElement source = graph.node(flowEl.getAttribute("sourceRef"));
                FlowElement target = graph.node(flowEl.getAttribute("targetRef"));
                if (source == null || target == null) {
                    sink.report(WarningKind.UNRESOLVED_REFERENCE, id, "Message flow " + id + " references missing element "
                            + (source == null ? flowEl.getAttribute("sourceRef") : flowEl.getAttribute("targetRef")));
                    continue;
                }
                if (!ProcessGraph.requiresMessageFlow(source, target)) {
                    sink.report(WarningKind.INTRA_BOUNDARY_MESSAGE_FLOW, id, "Message flow " + id
                            + " stays inside one participant, dropped");
                    continue;
                }
                graph.addEdge(parseEdge(flowEl, id, source, target, true));
            }
        }

        private FlowEdge parseEdge(Element flowEl, String id, FlowElement source, FlowElement target, boolean messageFlow) {
            PreservedContent preserved = ElementPreserver.capture(flowEl);
            Element diEl = edgesByElement.get(id);
            return FlowEdge.builder()
                    .id(id)
                    .sourceId(source.id())
                    .targetId(target.id())
                    .messageFlow(messageFlow)
                    .name(flowEl.getAttribute("name"))
                    .documentation(firstDocumentation(preserved))
                    .preserved(preserved)
                    .diagram(diEl == null ? null : parseDiagramEdge(diEl))
                    .build();
        }

        /**
         * Diagram records of elements that did not become nodes or edges, e.g. the content of
         * a collapsed sub-process.
         */
        private List<DiagramFragment> unclaimedDiagramRecords() {
            List<DiagramFragment> fragments = new ArrayList<>();
            for (Map<String, Element> index : List.of(shapesByElement, edgesByElement)) {
                for (Map.Entry<String, Element> record : index.entrySet()) {
                    String bpmnElement = record.getKey();
                    if (graph.node(bpmnElement) == null && graph.edge(bpmnElement) == null) {
                        fragments.add(new DiagramFragment(bpmnElement, XmlSupport.serializeNode(record.getValue())));
                    }
                }
            }
            return fragments;
        }

        /**
         * Id of an element, or a fallback id when it has none.
         */
        private String idOf(Element element, String tag) {
            String id = element.getAttribute("id");
            if (id.isEmpty()) {
                // fallback ids must not clash with what the document declares
                ids.reseedFrom(documentIds(element.getOwnerDocument()));
                id = ids.nextFallbackId(tag);
                log.debug("<{}> without id, using {}", element.getNodeName(), id);
            }
            return id;
        }

        private Set<String> documentIds(Document doc) {
            if (documentIds == null) {
                documentIds = new HashSet<>();
                NodeList all = doc.getElementsByTagName("*");
                for (int i = 0; i < all.getLength(); i++) {
                    String id = ((Element) all.item(i)).getAttribute("id");
                    if (!id.isEmpty()) {
                        documentIds.add(id);
                    }
                }
            }
            return documentIds;
        }

        /**
         * Records an id as taken; a second element with the same id is skipped.
         */
        private boolean claim(String id) {
            if (!seenIds.add(id)) {
                sink.report(WarningKind.DUPLICATE_IDENTIFIER, id, "Duplicate id " + id + " ignored");
                return false;
            }
            return true;
        }
    }

    private record PendingFlow(Element element) {
    }

    private static BpmnElementType elementType(Element element) {
        BpmnElementType type = BpmnElementType.fromLocalName(XmlSupport.localName(element));
        if (type == null || !XmlSupport.isElement(element, BPMN_NS, type.localName())) {
            return null;
        }
        return type;
    }

    private static EventDefinitionType eventDefinition(Element eventEl) {
        for (Element child : XmlSupport.childElements(eventEl)) {
            EventDefinitionType type = EventDefinitionType.fromLocalName(XmlSupport.localName(child));
            if (type != null && XmlSupport.isElement(child, BPMN_NS, type.localName())) {
                return type;
            }
        }
        return null;
    }

    static DiagramShape parseShape(Element shapeEl) {
        Element boundsEl = firstChild(shapeEl, DC_NS, "Bounds");
        Element labelEl = firstChild(shapeEl, BPMNDI_NS, "BPMNLabel");
        Element labelBoundsEl = labelEl == null ? null : firstChild(labelEl, DC_NS, "Bounds");
        Element extensionEl = ColorStyles.extensionElements(shapeEl);

        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap map = shapeEl.getAttributes();
        for (int i = 0; i < map.getLength(); i++) {
            Node attribute = map.item(i);
            String name = attribute.getNodeName();
            if (name.equals("id") || name.equals("bpmnElement") || ColorStyles.isColorAttribute(attribute)
                    || ElementPreserver.isNamespaceDeclaration(attribute)) {
                continue;
            }
            attributes.put(name, attribute.getNodeValue());
        }

        return new DiagramShape(
                emptyToNull(shapeEl.getAttribute("id")),
                boundsEl == null ? null : parseBounds(boundsEl),
                labelBoundsEl == null ? null : parseBounds(labelBoundsEl),
                attributes,
                extensionEl == null ? null : XmlSupport.serializeNode(extensionEl));
    }

    static DiagramEdge parseDiagramEdge(Element edgeEl) {
        List<Point> waypoints = new ArrayList<>();
        Bounds labelBounds = null;
        for (Element child : XmlSupport.childElements(edgeEl)) {
            if (XmlSupport.isElement(child, DI_NS, "waypoint")) {
                waypoints.add(new Point(number(child, "x"), number(child, "y")));
            } else if (XmlSupport.isElement(child, BPMNDI_NS, "BPMNLabel")) {
                Element boundsEl = firstChild(child, DC_NS, "Bounds");
                labelBounds = boundsEl == null ? null : parseBounds(boundsEl);
            }
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap map = edgeEl.getAttributes();
        for (int i = 0; i < map.getLength(); i++) {
            Node attribute = map.item(i);
            String name = attribute.getNodeName();
            if (!name.equals("id") && !name.equals("bpmnElement") && !ElementPreserver.isNamespaceDeclaration(attribute)) {
                attributes.put(name, attribute.getNodeValue());
            }
        }
        return new DiagramEdge(emptyToNull(edgeEl.getAttribute("id")), waypoints, labelBounds, attributes);
    }

    private static Bounds parseBounds(Element boundsEl) {
        return new Bounds(number(boundsEl, "x"), number(boundsEl, "y"),
                number(boundsEl, "width"), number(boundsEl, "height"));
    }

    private static double number(Element element, String attribute) {
        String value = element.getAttribute(attribute);
        if (value.isEmpty()) {
            return 0;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Non-numeric {}=\"{}\" on <{}>, using 0", attribute, value, element.getNodeName());
            return 0;
        }
    }

    private static Element firstChild(Element parent, String namespace, String localName) {
        for (Element child : XmlSupport.childElements(parent)) {
            if (XmlSupport.isElement(child, namespace, localName)) {
                return child;
            }
        }
        return null;
    }

    private static String firstDocumentation(PreservedContent preserved) {
        return preserved.documentation().isEmpty() ? null : preserved.documentation().get(0);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
