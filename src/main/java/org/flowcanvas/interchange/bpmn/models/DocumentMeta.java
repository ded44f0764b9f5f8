package org.flowcanvas.interchange.bpmn.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Document-level preservation: what surrounds the processes and the diagram plane.
 *
 * @param definitionsId         id of the {@code definitions} root
 * @param definitionsAttributes remaining root attributes (e.g. {@code targetNamespace}, {@code exporter})
 * @param namespaces            every namespace declaration seen in the document, prefix to URI ("" is the default namespace)
 * @param rootFragments         root children other than collaboration, process and diagram ({@code message}, {@code signal}, ...)
 * @param collaborationId       id of the collaboration, may be null
 * @param collaboration         preserved attributes, documentation and unknown children of the collaboration
 * @param diagramId             id of the {@code BPMNDiagram}
 * @param planeId               id of the {@code BPMNPlane}
 * @param diagramFragments      diagram records that describe no graph element
 */
public record DocumentMeta(
        String definitionsId,
        Map<String, String> definitionsAttributes,
        Map<String, String> namespaces,
        List<String> rootFragments,
        String collaborationId,
        PreservedContent collaboration,
        String diagramId,
        String planeId,
        List<DiagramFragment> diagramFragments
) {
    public static final DocumentMeta EMPTY = new DocumentMeta(
            null, Map.of(), Map.of(), List.of(), null, PreservedContent.EMPTY, null, null, List.of());

    public DocumentMeta {
        definitionsAttributes = definitionsAttributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(definitionsAttributes));
        namespaces = namespaces == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(namespaces));
        rootFragments = rootFragments == null ? List.of() : List.copyOf(rootFragments);
        collaboration = collaboration == null ? PreservedContent.EMPTY : collaboration;
        diagramFragments = diagramFragments == null ? List.of() : List.copyOf(diagramFragments);
    }
}
