package org.flowcanvas.interchange.bpmn;

import org.flowcanvas.interchange.graph.ProcessGraph;

import java.util.List;

public record DecodeResult(ProcessGraph graph, List<CodecWarning> warnings) {
    public DecodeResult {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
