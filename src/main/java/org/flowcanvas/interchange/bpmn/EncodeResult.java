package org.flowcanvas.interchange.bpmn;

import java.util.List;

public record EncodeResult(String xml, List<CodecWarning> warnings) {
    public EncodeResult {
        warnings = List.copyOf(warnings);
    }
}
