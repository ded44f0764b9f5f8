package org.flowcanvas.interchange.bpmn.models;

public record Size(double width, double height) {
}
