package org.flowcanvas.interchange.bpmn.models;

/**
 * How a shape's colours were (or will be) written in the diagram section.
 */
public enum ColorScheme {
    /** {@code bioc:fill} / {@code bioc:stroke} attributes on the shape. */
    BIOC_ATTRIBUTES,
    /** {@code color:background-color} / {@code color:border-color} attributes on the shape. */
    COLOR_ATTRIBUTES,
    /** {@code bpmndi:BPMNExtensionElements} with {@code fillColor} / {@code strokeColor} children. */
    DI_EXTENSION
}
