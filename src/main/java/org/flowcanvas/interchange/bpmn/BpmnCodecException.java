package org.flowcanvas.interchange.bpmn;

/**
 * Base of the failures the decoder and encoder surface to callers.
 */
public class BpmnCodecException extends RuntimeException {

    public BpmnCodecException(String message) {
        super(message);
    }

    public BpmnCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
