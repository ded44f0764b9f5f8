package org.flowcanvas.interchange.bpmn;

/**
 * Policy for recoverable anomalies found while decoding.
 */
public enum DecodeMode {
    /** Skip the offending element, log and report a warning, continue. */
    LENIENT,
    /** Abort on the first anomaly with a {@link StrictDecodingException}. */
    STRICT
}
