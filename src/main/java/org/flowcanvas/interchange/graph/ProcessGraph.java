package org.flowcanvas.interchange.graph;

import org.flowcanvas.interchange.bpmn.IdAllocator;
import org.flowcanvas.interchange.bpmn.models.DocumentMeta;
import org.flowcanvas.interchange.bpmn.models.FlowEdge;
import org.flowcanvas.interchange.bpmn.models.FlowElement;
import org.flowcanvas.interchange.bpmn.models.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The editor's directed graph: nodes and edges in insertion order plus the document-level
 * preservation record.
 * <p>
 * Node ids are unique. An edge is a message flow exactly when its endpoints belong to different
 * participants; the classification is fixed when the edge is added.
 */
public class ProcessGraph {
    private static final Logger log = LoggerFactory.getLogger(ProcessGraph.class);

    private final Map<String, FlowElement> nodes = new LinkedHashMap<>();
    private final Map<String, FlowEdge> edges = new LinkedHashMap<>();
    private DocumentMeta documentMeta;

    public ProcessGraph() {
        this(DocumentMeta.EMPTY);
    }

    public ProcessGraph(DocumentMeta documentMeta) {
        this.documentMeta = documentMeta == null ? DocumentMeta.EMPTY : documentMeta;
    }

    public List<FlowElement> nodes() {
        return List.copyOf(nodes.values());
    }

    public List<FlowEdge> edges() {
        return List.copyOf(edges.values());
    }

    public DocumentMeta documentMeta() {
        return documentMeta;
    }

    public void setDocumentMeta(DocumentMeta documentMeta) {
        this.documentMeta = documentMeta == null ? DocumentMeta.EMPTY : documentMeta;
    }

    /**
     * @return the node, or null when no node has this id
     */
    public FlowElement node(String id) {
        return id == null ? null : nodes.get(id);
    }

    public FlowEdge edge(String id) {
        return id == null ? null : edges.get(id);
    }

    public boolean containsNode(String id) {
        return id != null && nodes.containsKey(id);
    }

    /**
     * Ids of all nodes and edges.
     */
    public Set<String> ids() {
        Set<String> ids = new HashSet<>(nodes.keySet());
        ids.addAll(edges.keySet());
        return ids;
    }

    public void addNode(FlowElement node) {
        Objects.requireNonNull(node.id(), "node id");
        Objects.requireNonNull(node.kind(), "node kind");
        if (nodes.containsKey(node.id()) || edges.containsKey(node.id())) {
            throw new IllegalArgumentException("Duplicate element id: " + node.id());
        }
        if (node.participantId() != null && !isParticipant(node.participantId())) {
            throw new IllegalArgumentException("Unknown participant " + node.participantId() + " for " + node.id());
        }
        nodes.put(node.id(), node);
    }

    /**
     * Replaces the node with the same id, e.g. after the editor moved or renamed it.
     */
    public void replaceNode(FlowElement node) {
        if (!nodes.containsKey(node.id())) {
            throw new IllegalArgumentException("No node with id " + node.id());
        }
        nodes.put(node.id(), node);
    }

    /**
     * Adds an edge whose classification is already known, as decoded.
     */
    public void addEdge(FlowEdge edge) {
        Objects.requireNonNull(edge.id(), "edge id");
        if (nodes.containsKey(edge.id()) || edges.containsKey(edge.id())) {
            throw new IllegalArgumentException("Duplicate element id: " + edge.id());
        }
        edges.put(edge.id(), edge);
    }

    /**
     * Connects two nodes, choosing message flow when they belong to different participants.
     *
     * @return the new edge
     * @throws IllegalArgumentException if an endpoint is missing or cannot carry a flow
     */
    public FlowEdge connect(String sourceId, String targetId, IdAllocator ids) {
        FlowElement source = requireConnectable(sourceId);
        FlowElement target = requireConnectable(targetId);
        boolean messageFlow = requiresMessageFlow(source, target);
        if (!messageFlow && (source.isParticipant() || target.isParticipant())) {
            throw new IllegalArgumentException("A participant cannot be connected to its own content: "
                    + sourceId + " -> " + targetId);
        }
        FlowEdge edge = FlowEdge.builder()
                .id(ids.generateId(messageFlow ? "messageFlow" : "sequenceFlow", ids()))
                .sourceId(sourceId)
                .targetId(targetId)
                .messageFlow(messageFlow)
                .build();
        if (messageFlow) {
            log.debug("{} -> {} crosses participants, added as message flow {}", sourceId, targetId, edge.id());
        }
        edges.put(edge.id(), edge);
        return edge;
    }

    /**
     * Whether a flow between the two nodes crosses a participant boundary. A participant
     * belongs to itself; nodes outside every participant belong to none.
     */
    public static boolean requiresMessageFlow(FlowElement source, FlowElement target) {
        return !Objects.equals(source.owningParticipantId(), target.owningParticipantId());
    }

    /**
     * Removes a node with every edge attached to it. Removing a participant also removes its
     * lanes and contained nodes; removing a lane leaves its members outside any lane.
     *
     * @return the removed nodes, or an empty list when there was no such node
     */
    public List<FlowElement> removeNode(String id) {
        FlowElement node = nodes.get(id);
        if (node == null) {
            return List.of();
        }
        List<FlowElement> removed = new ArrayList<>();
        removed.add(node);
        if (node.isParticipant()) {
            for (FlowElement candidate : nodes.values()) {
                if (id.equals(candidate.participantId())) {
                    removed.add(candidate);
                }
            }
        } else if (node.isLane()) {
            for (FlowElement member : List.copyOf(nodes.values())) {
                if (id.equals(member.laneId())) {
                    nodes.put(member.id(), member.toBuilder().laneId(null).build());
                }
            }
        }
        if (!node.isParticipant() && node.processMeta() != null) {
            handOverProcessMeta(node);
        }

        Set<String> removedIds = new HashSet<>();
        for (FlowElement element : removed) {
            nodes.remove(element.id());
            removedIds.add(element.id());
        }
        edges.values().removeIf(edge -> removedIds.contains(edge.sourceId()) || removedIds.contains(edge.targetId()));
        log.debug("Removed {} and {} dependent node(s)", id, removed.size() - 1);
        return Collections.unmodifiableList(removed);
    }

    /**
     * Moves the process record of a node outside every participant to the next node of the
     * same process, i.e. the next such node that does not start a process of its own.
     */
    private void handOverProcessMeta(FlowElement node) {
        boolean after = false;
        for (FlowElement candidate : nodes.values()) {
            if (candidate.id().equals(node.id())) {
                after = true;
                continue;
            }
            if (!after || candidate.isParticipant() || candidate.participantId() != null) {
                continue;
            }
            if (candidate.processMeta() == null) {
                nodes.put(candidate.id(), candidate.toBuilder().processMeta(node.processMeta()).build());
                log.debug("Process {} now recorded on {}", node.processMeta().processId(), candidate.id());
                return;
            }
            break;
        }
        log.debug("Process {} has no nodes left", node.processMeta().processId());
    }

    public void removeEdge(String id) {
        edges.remove(id);
    }

    private boolean isParticipant(String id) {
        FlowElement candidate = nodes.get(id);
        return candidate != null && candidate.kind() == NodeKind.PARTICIPANT;
    }

    private FlowElement requireConnectable(String id) {
        FlowElement node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("No node with id " + id);
        }
        if (node.isLane()) {
            throw new IllegalArgumentException("Lanes cannot be connected: " + id);
        }
        return node;
    }
}
