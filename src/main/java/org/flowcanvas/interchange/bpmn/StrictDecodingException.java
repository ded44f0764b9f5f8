package org.flowcanvas.interchange.bpmn;

/**
 * Raised in {@link DecodeMode#STRICT} for an anomaly that lenient decoding would skip.
 */
public class StrictDecodingException extends BpmnCodecException {
    private final CodecWarning warning;

    public StrictDecodingException(CodecWarning warning) {
        super("Strict decoding rejected the document: " + warning.message());
        this.warning = warning;
    }

    public CodecWarning getWarning() {
        return warning;
    }
}
