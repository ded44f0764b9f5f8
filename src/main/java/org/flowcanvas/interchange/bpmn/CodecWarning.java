package org.flowcanvas.interchange.bpmn;

/**
 * A recoverable anomaly met while decoding or encoding.
 *
 * @param kind      what went wrong
 * @param elementId id of the element that was skipped or reclassified
 * @param message   human readable description
 */
public record CodecWarning(WarningKind kind, String elementId, String message) {
}
