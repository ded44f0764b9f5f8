package org.flowcanvas.interchange.bpmn;

import org.flowcanvas.interchange.bpmn.models.BpmnElementType;
import org.flowcanvas.interchange.bpmn.models.Bounds;
import org.flowcanvas.interchange.bpmn.models.DiagramFragment;
import org.flowcanvas.interchange.bpmn.models.DocumentMeta;
import org.flowcanvas.interchange.bpmn.models.EventDefinitionType;
import org.flowcanvas.interchange.bpmn.models.FlowEdge;
import org.flowcanvas.interchange.bpmn.models.FlowElement;
import org.flowcanvas.interchange.bpmn.models.NodeKind;
import org.flowcanvas.interchange.bpmn.models.Point;
import org.flowcanvas.interchange.bpmn.models.PreservedContent;
import org.flowcanvas.interchange.bpmn.models.ProcessMeta;
import org.flowcanvas.interchange.config.CodecConfig;
import org.flowcanvas.interchange.graph.ProcessGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.BPMNDI_NS;
import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.BPMNDI_PREFIX;
import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.BPMN_NS;
import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.BPMN_PREFIX;
import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.DC_NS;
import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.DC_PREFIX;
import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.DI_NS;
import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.DI_PREFIX;

/**
 * Writes a {@link ProcessGraph} as BPMN 2.0 XML with a freshly derived diagram section.
 * <p>
 * Preserved attributes, documentation and fragments are replayed; {@code incoming},
 * {@code outgoing} and lane membership are regenerated from the graph.
 */
public class BpmnEncoder {
    private static final Logger log = LoggerFactory.getLogger(BpmnEncoder.class);

    private static final String DEFAULT_DIAGRAM_ID = "BPMNDiagram_1";
    private static final String DEFAULT_PLANE_ID = "BPMNPlane_1";
    private static final String DATA_OBJECT_PREFIX = "DataObject_";

    /**
     * Process children that schema order places before the lane set.
     */
    private static final Set<String> PROCESS_LEADING = Set.of(
            "extensionElements", "auditing", "monitoring", "categoryValueRef",
            "property", "ioSpecification", "ioBinding");
    private static final Set<String> ARTIFACTS = Set.of("association", "textAnnotation", "group");
    private static final Set<String> PROCESS_TRAILING = Set.of(
            "resourceRole", "performer", "humanPerformer", "potentialOwner", "correlationSubscription", "supports");
    private static final Set<String> ROOT_TRAILING = Set.of("relationship");

    private final IdAllocator ids;
    private final CodecConfig config;

    public BpmnEncoder() {
        this(new IdAllocator(), new CodecConfig());
    }

    /**
     * @param ids allocator for the ids the graph does not provide (processes, collaboration, definitions)
     */
    public BpmnEncoder(IdAllocator ids, CodecConfig config) {
        this.ids = ids;
        this.config = config;
    }

    public String encode(ProcessGraph graph) {
        return encodeWithReport(graph).xml();
    }

    /**
     * Encodes the graph and reports what had to be left out.
     */
    public EncodeResult encodeWithReport(ProcessGraph graph) {
        EncodeRun run = new EncodeRun(graph, new WarningSink(DecodeMode.LENIENT));
        String xml = XmlSupport.serializeDocument(run.encode(), config.indentAmount);
        return new EncodeResult(xml, run.sink.warnings());
    }

    /**
     * A process to write: its id, its preservation record and its members.
     */
    private static final class ProcessPlan {
        final String id;
        final ProcessMeta meta;
        final FlowElement participant;
        final List<FlowElement> lanes = new ArrayList<>();
        final List<FlowElement> nodes = new ArrayList<>();
        final List<FlowEdge> flows = new ArrayList<>();

        ProcessPlan(String id, ProcessMeta meta, FlowElement participant) {
            this.id = id;
            this.meta = meta;
            this.participant = participant;
        }

        PreservedContent content() {
            return meta == null ? PreservedContent.EMPTY : meta.content();
        }
    }

    /**
     * State of one {@link #encodeWithReport(ProcessGraph)} call.
     */
    private final class EncodeRun {
        final ProcessGraph graph;
        final WarningSink sink;
        final DocumentMeta meta;
        final Map<String, String> namespaces;
        final Set<String> takenIds;
        final Document doc = XmlSupport.newDocument();

        final List<FlowElement> participants = new ArrayList<>();
        final List<FlowEdge> sequenceFlows = new ArrayList<>();
        final List<FlowEdge> messageFlows = new ArrayList<>();
        final Map<String, List<String>> incoming = new HashMap<>();
        final Map<String, List<String>> outgoing = new HashMap<>();
        final Map<String, Bounds> boundsById = new HashMap<>();

        EncodeRun(ProcessGraph graph, WarningSink sink) {
            this.graph = graph;
            this.sink = sink;
            this.meta = graph.documentMeta();
            this.namespaces = declarations(meta);
            this.takenIds = new HashSet<>(graph.ids());
            Set<String> documentIds = new HashSet<>();
            documentIds.add(meta.definitionsId());
            documentIds.add(meta.collaborationId());
            for (FlowElement node : graph.nodes()) {
                if (node.processMeta() != null) {
                    documentIds.add(node.processMeta().processId());
                }
                if (node.processRef() != null) {
                    documentIds.add(node.processRef());
                }
            }
            documentIds.remove(null);
            takenIds.addAll(documentIds);
        }

        Document encode() {
            Element definitions = doc.createElementNS(BPMN_NS, BPMN_PREFIX + ":definitions");
            doc.appendChild(definitions);
            for (Map.Entry<String, String> ns : namespaces.entrySet()) {
                String attrName = ns.getKey().isEmpty() ? "xmlns" : "xmlns:" + ns.getKey();
                definitions.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, attrName, ns.getValue());
            }
            definitions.setAttribute("id", meta.definitionsId() != null ? meta.definitionsId() : newId("definitions"));
            ElementPreserver.replayAttributes(definitions, meta.definitionsAttributes(), Set.of("id"), namespaces);
            setIfAbsent(definitions, "targetNamespace", config.targetNamespace);
            setIfAbsent(definitions, "exporter", config.exporter);
            setIfAbsent(definitions, "exporterVersion", config.exporterVersion);

            partitionEdges();

            for (String fragment : meta.rootFragments()) {
                if (!ROOT_TRAILING.contains(ElementPreserver.fragmentName(fragment))) {
                    appendFragment(definitions, fragment);
                }
            }

            List<ProcessPlan> plans = planProcesses();
            String collaborationId = null;
            if (!participants.isEmpty()) {
                collaborationId = meta.collaborationId() != null ? meta.collaborationId() : newId("collaboration");
                definitions.appendChild(writeCollaboration(collaborationId, plans));
            }
            for (ProcessPlan plan : plans) {
                definitions.appendChild(writeProcess(plan));
            }

            String planeElement = collaborationId != null ? collaborationId
                    : plans.isEmpty() ? null : plans.get(0).id;
            definitions.appendChild(writeDiagram(planeElement));

            for (String fragment : meta.rootFragments()) {
                if (ROOT_TRAILING.contains(ElementPreserver.fragmentName(fragment))) {
                    appendFragment(definitions, fragment);
                }
            }
            return doc;
        }

        /**
         * Drops edges whose endpoints are missing or whose classification no longer fits the
         * endpoints, and derives incoming/outgoing from the remaining sequence flows.
         */
        private void partitionEdges() {
            for (FlowElement node : graph.nodes()) {
                if (node.isParticipant()) {
                    participants.add(node);
                }
            }
            for (FlowEdge edge : graph.edges()) {
                FlowElement source = graph.node(edge.sourceId());
                FlowElement target = graph.node(edge.targetId());
                if (source == null || target == null) {
                    sink.report(WarningKind.UNRESOLVED_REFERENCE, edge.id(), "Flow " + edge.id() + " references missing element "
                            + (source == null ? edge.sourceId() : edge.targetId()) + ", skipped");
                    continue;
                }
                boolean crossesParticipants = ProcessGraph.requiresMessageFlow(source, target);
                if (edge.messageFlow()) {
                    if (!crossesParticipants || participants.isEmpty()) {
                        sink.report(WarningKind.INTRA_BOUNDARY_MESSAGE_FLOW, edge.id(),
                                "Message flow " + edge.id() + " does not cross participants, skipped");
                        continue;
                    }
                    messageFlows.add(edge);
                } else {
                    if (crossesParticipants) {
                        sink.report(WarningKind.CROSS_BOUNDARY_FLOW, edge.id(),
                                "Sequence flow " + edge.id() + " crosses participants, skipped");
                        continue;
                    }
                    sequenceFlows.add(edge);
                    outgoing.computeIfAbsent(edge.sourceId(), k -> new ArrayList<>()).add(edge.id());
                    incoming.computeIfAbsent(edge.targetId(), k -> new ArrayList<>()).add(edge.id());
                }
            }
        }

        /**
         * One process per participant that has or needs one; nodes outside every participant
         * form the processes they were decoded from, or a single new one.
         */
        private List<ProcessPlan> planProcesses() {
            List<ProcessPlan> plans = new ArrayList<>();
            Map<String, ProcessPlan> byParticipant = new HashMap<>();
            for (FlowElement participant : participants) {
                boolean hasContent = graph.nodes().stream().anyMatch(n -> participant.id().equals(n.participantId()));
                String processId = participant.processMeta() != null ? participant.processMeta().processId()
                        : participant.processRef();
                if (processId == null && !hasContent) {
                    // black box pool
                    continue;
                }
                if (processId == null) {
                    processId = newId("process");
                }
                ProcessPlan plan = new ProcessPlan(processId, participant.processMeta(), participant);
                plans.add(plan);
                byParticipant.put(participant.id(), plan);
            }

            List<ProcessPlan> loosePlans = new ArrayList<>();
            ProcessPlan current = null;
            for (FlowElement node : graph.nodes()) {
                if (node.isParticipant()) {
                    continue;
                }
                ProcessPlan plan = node.participantId() == null ? null : byParticipant.get(node.participantId());
                if (plan == null) {
                    // nodes follow the process record they were decoded after
                    if (node.processMeta() != null || current == null) {
                        ProcessMeta processMeta = node.processMeta();
                        String processId = processMeta != null ? processMeta.processId() : newId("process");
                        current = new ProcessPlan(processId, processMeta, null);
                        loosePlans.add(current);
                    }
                    plan = current;
                }
                if (node.isLane()) {
                    plan.lanes.add(node);
                } else {
                    plan.nodes.add(node);
                }
            }
            plans.addAll(loosePlans);

            Map<String, ProcessPlan> planByNode = new HashMap<>();
            for (ProcessPlan plan : plans) {
                for (FlowElement node : plan.nodes) {
                    planByNode.put(node.id(), plan);
                }
            }
            for (FlowEdge flow : sequenceFlows) {
                ProcessPlan plan = planByNode.get(flow.sourceId());
                if (plan == null) {
                    plan = planByNode.get(flow.targetId());
                }
                if (plan != null) {
                    plan.flows.add(flow);
                } else {
                    sink.report(WarningKind.UNRESOLVED_REFERENCE, flow.id(),
                            "Sequence flow " + flow.id() + " has no process to belong to, skipped");
                }
            }
            if (!participants.isEmpty() && !loosePlans.isEmpty()) {
                log.debug("{} process(es) for nodes outside every participant", loosePlans.size());
            }
            return plans;
        }

        private Element writeCollaboration(String collaborationId, List<ProcessPlan> plans) {
            PreservedContent content = meta.collaboration();
            Element collaboration = bpmn("collaboration");
            collaboration.setAttribute("id", collaborationId);
            ElementPreserver.replayAttributes(collaboration, content.attributes(), Set.of("id"), namespaces);
            for (String text : content.documentation()) {
                collaboration.appendChild(documentation(text));
            }
            appendFragments(collaboration, content.fragments(), true);

            Map<String, String> processByParticipant = new HashMap<>();
            for (ProcessPlan plan : plans) {
                if (plan.participant != null) {
                    processByParticipant.put(plan.participant.id(), plan.id);
                }
            }
            for (FlowElement participant : participants) {
                Element participantEl = bpmn("participant");
                participantEl.setAttribute("id", participant.id());
                setIfNotBlank(participantEl, "name", participant.name());
                String processRef = processByParticipant.get(participant.id());
                if (processRef != null) {
                    participantEl.setAttribute("processRef", processRef);
                }
                ElementPreserver.replayAttributes(participantEl, participant.preserved().attributes(),
                        Set.of("id", "name", "processRef"), namespaces);
                appendDocumentation(participantEl, participant.documentation(), participant.preserved());
                appendFragments(participantEl, participant.preserved().fragments(), true);
                appendFragments(participantEl, participant.preserved().fragments(), false);
                collaboration.appendChild(participantEl);
            }
            for (FlowEdge flow : messageFlows) {
                collaboration.appendChild(writeFlow("messageFlow", flow));
            }

            appendFragments(collaboration, content.fragments(), false);
            return collaboration;
        }

        private Element writeProcess(ProcessPlan plan) {
            PreservedContent content = plan.content();
            Element process = bpmn("process");
            process.setAttribute("id", plan.id);
            ElementPreserver.replayAttributes(process, content.attributes(), Set.of("id"), namespaces);
            if (plan.meta == null) {
                if (plan.participant != null) {
                    setIfNotBlank(process, "name", plan.participant.name());
                }
                process.setAttribute("isExecutable", "false");
            }
            for (String text : content.documentation()) {
                process.appendChild(documentation(text));
            }

            List<String> leading = new ArrayList<>();
            List<String> flowElements = new ArrayList<>();
            List<String> artifacts = new ArrayList<>();
            List<String> trailing = new ArrayList<>();
            for (String fragment : content.fragments()) {
                String name = ElementPreserver.fragmentName(fragment);
                if (PROCESS_LEADING.contains(name)) {
                    leading.add(fragment);
                } else if (ARTIFACTS.contains(name)) {
                    artifacts.add(fragment);
                } else if (PROCESS_TRAILING.contains(name)) {
                    trailing.add(fragment);
                } else {
                    flowElements.add(fragment);
                }
            }
            leading.forEach(fragment -> appendFragment(process, fragment));

            if (!plan.lanes.isEmpty()) {
                Element laneSet = bpmn("laneSet");
                String laneSetId = plan.meta != null && plan.meta.laneSetId() != null
                        ? plan.meta.laneSetId() : newId("laneSet");
                laneSet.setAttribute("id", laneSetId);
                for (FlowElement lane : plan.lanes) {
                    laneSet.appendChild(writeLane(lane, plan));
                }
                process.appendChild(laneSet);
            }

            List<FlowElement> artifactNodes = new ArrayList<>();
            for (FlowElement node : plan.nodes) {
                if (node.kind() == NodeKind.TEXT_ANNOTATION || node.kind() == NodeKind.GROUP) {
                    artifactNodes.add(node);
                } else {
                    process.appendChild(writeNode(node));
                }
            }
            flowElements.forEach(fragment -> appendFragment(process, fragment));
            for (FlowElement node : plan.nodes) {
                if (node.kind() == NodeKind.DATA_OBJECT && node.preserved().attribute("dataObjectRef") == null) {
                    Element dataObject = bpmn("dataObject");
                    dataObject.setAttribute("id", DATA_OBJECT_PREFIX + node.id());
                    process.appendChild(dataObject);
                }
            }
            for (FlowEdge flow : plan.flows) {
                process.appendChild(writeFlow("sequenceFlow", flow));
            }
            for (FlowElement node : artifactNodes) {
                process.appendChild(writeNode(node));
            }
            artifacts.forEach(fragment -> appendFragment(process, fragment));
            trailing.forEach(fragment -> appendFragment(process, fragment));
            return process;
        }

        private Element writeLane(FlowElement lane, ProcessPlan plan) {
            Element laneEl = bpmn("lane");
            laneEl.setAttribute("id", lane.id());
            setIfNotBlank(laneEl, "name", lane.name());
            ElementPreserver.replayAttributes(laneEl, lane.preserved().attributes(), Set.of("id", "name"), namespaces);
            appendDocumentation(laneEl, lane.documentation(), lane.preserved());
            appendFragments(laneEl, lane.preserved().fragments(), true);

            // declared members that still belong here, then members added since
            Set<String> members = new LinkedHashSet<>();
            for (String ref : lane.flowNodeRefs()) {
                FlowElement member = graph.node(ref);
                if (member != null && lane.id().equals(member.laneId())) {
                    members.add(ref);
                }
            }
            for (FlowElement node : plan.nodes) {
                if (lane.id().equals(node.laneId())) {
                    members.add(node.id());
                }
            }
            for (String member : members) {
                Element ref = bpmn("flowNodeRef");
                ref.setTextContent(member);
                laneEl.appendChild(ref);
            }

            appendFragments(laneEl, lane.preserved().fragments(), false);
            return laneEl;
        }

        private Element writeNode(FlowElement node) {
            BpmnElementType type = node.effectiveElementType();
            Element element = bpmn(type.localName());
            element.setAttribute("id", node.id());
            if (node.kind() != NodeKind.TEXT_ANNOTATION) {
                setIfNotBlank(element, "name", node.name());
            }
            ElementPreserver.replayAttributes(element, node.preserved().attributes(), Set.of("id", "name"), namespaces);
            if (node.kind() == NodeKind.DATA_OBJECT && node.preserved().attribute("dataObjectRef") == null) {
                element.setAttribute("dataObjectRef", DATA_OBJECT_PREFIX + node.id());
            }

            appendDocumentation(element, node.documentation(), node.preserved());
            List<String> fragments = eventFragments(node);
            appendFragments(element, fragments, true);

            if (node.kind().isFlowNode()) {
                for (String flowId : incoming.getOrDefault(node.id(), List.of())) {
                    element.appendChild(textElement("incoming", flowId));
                }
                for (String flowId : outgoing.getOrDefault(node.id(), List.of())) {
                    element.appendChild(textElement("outgoing", flowId));
                }
            }
            if (node.kind() == NodeKind.TEXT_ANNOTATION && !node.name().isEmpty()) {
                element.appendChild(textElement("text", node.name()));
            }

            appendFragments(element, fragments, false);
            if (node.kind().isEvent() && node.eventDefinition() != null && !hasEventDefinition(fragments, node.eventDefinition())) {
                Element definition = bpmn(node.eventDefinition().localName());
                definition.setAttribute("id", node.id() + "_def");
                element.appendChild(definition);
            }
            return element;
        }

        private Element writeFlow(String tag, FlowEdge flow) {
            Element element = bpmn(tag);
            element.setAttribute("id", flow.id());
            setIfNotBlank(element, "name", flow.name());
            element.setAttribute("sourceRef", flow.sourceId());
            element.setAttribute("targetRef", flow.targetId());
            ElementPreserver.replayAttributes(element, flow.preserved().attributes(),
                    Set.of("id", "name", "sourceRef", "targetRef"), namespaces);
            appendDocumentation(element, flow.documentation(), flow.preserved());
            appendFragments(element, flow.preserved().fragments(), true);
            appendFragments(element, flow.preserved().fragments(), false);
            return element;
        }

        private Element writeDiagram(String planeElement) {
            Element diagram = doc.createElementNS(BPMNDI_NS, BPMNDI_PREFIX + ":BPMNDiagram");
            diagram.setAttribute("id", meta.diagramId() != null ? meta.diagramId() : DEFAULT_DIAGRAM_ID);
            Element plane = doc.createElementNS(BPMNDI_NS, BPMNDI_PREFIX + ":BPMNPlane");
            plane.setAttribute("id", meta.planeId() != null ? meta.planeId() : DEFAULT_PLANE_ID);
            if (planeElement != null) {
                plane.setAttribute("bpmnElement", planeElement);
            }
            diagram.appendChild(plane);

            // collect before the diagram exists so only model ids count
            Set<String> modelIds = modelIds();

            // containers first so they are drawn beneath their content
            for (FlowElement participant : participants) {
                plane.appendChild(writeShape(participant, participant.position()));
            }
            for (FlowElement node : graph.nodes()) {
                if (node.isLane()) {
                    plane.appendChild(writeShape(node, absolutePosition(node)));
                }
            }
            for (FlowElement node : graph.nodes()) {
                if (!node.isParticipant() && !node.isLane()) {
                    plane.appendChild(writeShape(node, absolutePosition(node)));
                }
            }
            for (FlowEdge flow : sequenceFlows) {
                if (modelIds.contains(flow.id())) {
                    plane.appendChild(writeEdge(flow));
                }
            }
            for (FlowEdge flow : messageFlows) {
                plane.appendChild(writeEdge(flow));
            }
            for (DiagramFragment fragment : meta.diagramFragments()) {
                if (modelIds.contains(fragment.bpmnElement())) {
                    appendFragment(plane, fragment.markup());
                } else {
                    log.debug("Dropping diagram record for {}, the element is gone", fragment.bpmnElement());
                }
            }
            return diagram;
        }

        private Element writeShape(FlowElement node, Point absolute) {
            Bounds bounds = DiagramLayoutDeriver.shapeBounds(node, absolute);
            boundsById.put(node.id(), bounds);

            Element shape = doc.createElementNS(BPMNDI_NS, BPMNDI_PREFIX + ":BPMNShape");
            shape.setAttribute("id", node.shape() != null && node.shape().shapeId() != null
                    ? node.shape().shapeId() : node.id() + "_di");
            shape.setAttribute("bpmnElement", node.id());
            if (node.shape() != null) {
                ElementPreserver.replayAttributes(shape, node.shape().attributes(), Set.of(), namespaces);
            }
            if (node.kind().isContainer()) {
                shape.setAttribute("isHorizontal", "true");
            }
            shape.appendChild(boundsElement(bounds));

            Bounds label = DiagramLayoutDeriver.labelBounds(node, bounds);
            if (label != null) {
                shape.appendChild(labelElement(label));
            }
            ColorStyles.write(shape, node.style(), node.shape() == null ? null : node.shape().extensionElements(), namespaces);
            return shape;
        }

        private Element writeEdge(FlowEdge flow) {
            FlowElement source = graph.node(flow.sourceId());
            FlowElement target = graph.node(flow.targetId());
            Bounds sourceBounds = boundsById.get(source.id());
            Bounds targetBounds = boundsById.get(target.id());
            boolean reused = DiagramLayoutDeriver.reusesWaypoints(flow, source, sourceBounds, target, targetBounds);
            List<Point> waypoints = DiagramLayoutDeriver.waypoints(flow, source, sourceBounds, target, targetBounds);

            Element edge = doc.createElementNS(BPMNDI_NS, BPMNDI_PREFIX + ":BPMNEdge");
            edge.setAttribute("id", flow.diagram() != null && flow.diagram().shapeId() != null
                    ? flow.diagram().shapeId() : flow.id() + "_di");
            edge.setAttribute("bpmnElement", flow.id());
            if (flow.diagram() != null && reused) {
                ElementPreserver.replayAttributes(edge, flow.diagram().attributes(), Set.of(), namespaces);
            }
            for (Point point : waypoints) {
                Element waypoint = doc.createElementNS(DI_NS, DI_PREFIX + ":waypoint");
                waypoint.setAttribute("x", formatNumber(point.x()));
                waypoint.setAttribute("y", formatNumber(point.y()));
                edge.appendChild(waypoint);
            }
            Bounds label = DiagramLayoutDeriver.edgeLabelBounds(flow, waypoints, reused);
            if (label != null) {
                edge.appendChild(labelElement(label));
            }
            return edge;
        }

        private Point absolutePosition(FlowElement node) {
            FlowElement participant = graph.node(node.participantId());
            if (participant == null || !participant.isParticipant()) {
                return node.position();
            }
            return CoordinateNormalizer.toAbsolute(node.position(), participant.position());
        }

        /**
         * Every id in the model part of the document, including ids inside replayed fragments.
         */
        private Set<String> modelIds() {
            Set<String> found = new HashSet<>();
            NodeList all = doc.getElementsByTagName("*");
            for (int i = 0; i < all.getLength(); i++) {
                String id = ((Element) all.item(i)).getAttribute("id");
                if (!id.isEmpty()) {
                    found.add(id);
                }
            }
            return found;
        }

        /**
         * Preserved fragments of a node, without event definitions that no longer match its
         * {@link FlowElement#eventDefinition()}.
         */
        private List<String> eventFragments(FlowElement node) {
            List<String> fragments = node.preserved().fragments();
            if (!node.kind().isEvent() || hasEventDefinition(fragments, node.eventDefinition())) {
                return fragments;
            }
            List<String> kept = new ArrayList<>();
            for (String fragment : fragments) {
                if (EventDefinitionType.fromLocalName(ElementPreserver.fragmentName(fragment)) == null) {
                    kept.add(fragment);
                }
            }
            return kept;
        }

        private boolean hasEventDefinition(List<String> fragments, EventDefinitionType type) {
            if (type == null) {
                return false;
            }
            for (String fragment : fragments) {
                if (type.localName().equals(ElementPreserver.fragmentName(fragment))) {
                    return true;
                }
            }
            return false;
        }

        /**
         * The editable text first, then the documentation entries beyond the first as decoded.
         */
        private void appendDocumentation(Element element, String editable, PreservedContent preserved) {
            if (editable != null && !editable.isEmpty()) {
                element.appendChild(documentation(editable));
            }
            List<String> texts = preserved.documentation();
            for (int i = 1; i < texts.size(); i++) {
                element.appendChild(documentation(texts.get(i)));
            }
        }

        private void appendFragments(Element element, List<String> fragments, boolean leading) {
            for (String fragment : fragments) {
                if (ElementPreserver.isLeading(fragment) == leading) {
                    appendFragment(element, fragment);
                }
            }
        }

        private void appendFragment(Element parent, String fragment) {
            for (Node node : XmlSupport.importFragment(doc, fragment, namespaces)) {
                parent.appendChild(node);
            }
        }

        private Element documentation(String text) {
            return textElement("documentation", text);
        }

        private Element textElement(String tag, String text) {
            Element element = bpmn(tag);
            element.setTextContent(text);
            return element;
        }

        private Element bpmn(String localName) {
            return doc.createElementNS(BPMN_NS, BPMN_PREFIX + ":" + localName);
        }

        private Element boundsElement(Bounds bounds) {
            Element element = doc.createElementNS(DC_NS, DC_PREFIX + ":Bounds");
            element.setAttribute("x", formatNumber(bounds.x()));
            element.setAttribute("y", formatNumber(bounds.y()));
            element.setAttribute("width", formatNumber(bounds.width()));
            element.setAttribute("height", formatNumber(bounds.height()));
            return element;
        }

        private Element labelElement(Bounds bounds) {
            Element label = doc.createElementNS(BPMNDI_NS, BPMNDI_PREFIX + ":BPMNLabel");
            label.appendChild(boundsElement(bounds));
            return label;
        }

        private String newId(String tag) {
            String id = ids.generateId(tag, takenIds);
            takenIds.add(id);
            return id;
        }
    }

    /**
     * Declarations for the encoded root: the standard prefixes, then every prefix the decoded
     * document declared that does not clash with them.
     */
    static Map<String, String> declarations(DocumentMeta meta) {
        Map<String, String> declarations = new LinkedHashMap<>(BpmnNamespaces.STANDARD_DECLARATIONS);
        for (Map.Entry<String, String> ns : meta.namespaces().entrySet()) {
            String existing = declarations.get(ns.getKey());
            if (existing == null) {
                declarations.put(ns.getKey(), ns.getValue());
            } else if (!Objects.equals(existing, ns.getValue())) {
                log.warn("Prefix '{}' is bound to {} in the source but is reserved for {}, declaration dropped",
                        ns.getKey(), ns.getValue(), existing);
            }
        }
        return declarations;
    }

    /**
     * Whole numbers without a fraction, as diagram coordinates are usually written.
     */
    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    private static void setIfAbsent(Element element, String attribute, String value) {
        if (!element.hasAttribute(attribute) && value != null && !value.isEmpty()) {
            element.setAttribute(attribute, value);
        }
    }

    private static void setIfNotBlank(Element element, String attribute, String value) {
        if (value != null && !value.isBlank()) {
            element.setAttribute(attribute, value);
        }
    }
}
