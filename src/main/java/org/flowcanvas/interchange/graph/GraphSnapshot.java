package org.flowcanvas.interchange.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.flowcanvas.interchange.bpmn.models.DocumentMeta;
import org.flowcanvas.interchange.bpmn.models.FlowEdge;
import org.flowcanvas.interchange.bpmn.models.FlowElement;

import java.util.List;

/**
 * Serialized form of a {@link ProcessGraph}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphSnapshot(List<FlowElement> nodes, List<FlowEdge> edges, DocumentMeta document) {
    public GraphSnapshot {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        document = document == null ? DocumentMeta.EMPTY : document;
    }

    public static GraphSnapshot of(ProcessGraph graph) {
        return new GraphSnapshot(graph.nodes(), graph.edges(), graph.documentMeta());
    }

    /**
     * Rebuilds the graph. Participants are added before the nodes they contain.
     */
    public ProcessGraph toGraph() {
        ProcessGraph graph = new ProcessGraph(document);
        for (FlowElement node : nodes) {
            if (node.isParticipant()) {
                graph.addNode(node);
            }
        }
        for (FlowElement node : nodes) {
            if (!node.isParticipant()) {
                graph.addNode(node);
            }
        }
        for (FlowEdge edge : edges) {
            graph.addEdge(edge);
        }
        return graph;
    }
}
