package org.flowcanvas.interchange.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.flowcanvas.interchange.bpmn.DecodeMode;

/**
 * Codec settings, read from {@code bpmn-codec.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CodecConfig {
    /**
     * "LENIENT" skips anomalies with a warning, "STRICT" rejects the document on the first one.
     */
    public String mode = "LENIENT";

    /**
     * Spaces per indentation level of encoded documents; 0 writes everything on one line.
     */
    public int indentAmount = 2;

    /**
     * Written on {@code definitions} only when the decoded document had none.
     * Example: "http://bpmn.io/schema/bpmn"
     */
    public String targetNamespace = "http://bpmn.io/schema/bpmn";
    public String exporter = "flowcanvas";
    public String exporterVersion = "1.0";

    /**
     * Seed for generated id suffixes; null draws a fresh seed per session.
     */
    public Long idSeed;

    public DecodeMode decodeMode() {
        if (mode == null || mode.isBlank()) {
            return DecodeMode.LENIENT;
        }
        try {
            return DecodeMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unknown decode mode '" + mode + "', expected LENIENT or STRICT", e);
        }
    }
}
