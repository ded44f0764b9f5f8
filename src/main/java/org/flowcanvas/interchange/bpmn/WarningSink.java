package org.flowcanvas.interchange.bpmn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the warnings of one decode or encode run and enforces {@link DecodeMode#STRICT}.
 */
final class WarningSink {
    private static final Logger log = LoggerFactory.getLogger(WarningSink.class);

    private final DecodeMode mode;
    private final List<CodecWarning> warnings = new ArrayList<>();

    WarningSink(DecodeMode mode) {
        this.mode = mode;
    }

    void report(WarningKind kind, String elementId, String message) {
        CodecWarning warning = new CodecWarning(kind, elementId, message);
        if (mode == DecodeMode.STRICT) {
            throw new StrictDecodingException(warning);
        }
        log.warn("{} ({}): {}", kind, elementId, message);
        warnings.add(warning);
    }

    List<CodecWarning> warnings() {
        return warnings;
    }
}
