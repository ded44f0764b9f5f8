package org.flowcanvas.interchange.bpmn;

public enum WarningKind {
    /** A flow references an element that does not exist; the flow is dropped. */
    UNRESOLVED_REFERENCE,
    /** Second occurrence of an element, shape or edge id; the first occurrence wins. */
    DUPLICATE_IDENTIFIER,
    /** A sequence flow spans two participants. */
    CROSS_BOUNDARY_FLOW,
    /** A message flow connects elements of the same participant; it is dropped. */
    INTRA_BOUNDARY_MESSAGE_FLOW
}
