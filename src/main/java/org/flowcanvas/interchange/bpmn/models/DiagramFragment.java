package org.flowcanvas.interchange.bpmn.models;

/**
 * A serialized diagram record ({@code BPMNShape} or {@code BPMNEdge}) describing an element that
 * is not a graph node or edge, for example an element nested inside a sub-process.
 */
public record DiagramFragment(String bpmnElement, String markup) {
}
