package org.flowcanvas.interchange.bpmn.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything captured from a decoded element that the typed fields do not model.
 * <p>
 * Fragments are serialized child elements, kept in document order. They are never
 * interpreted, only replayed by the encoder.
 *
 * @param attributes    every attribute of the element by qualified name (namespace declarations excluded)
 * @param documentation text of every {@code documentation} child, in order
 * @param fragments     serialized form of every child element that is not structurally understood
 */
public record PreservedContent(
        Map<String, String> attributes,
        List<String> documentation,
        List<String> fragments
) {
    public static final PreservedContent EMPTY = new PreservedContent(Map.of(), List.of(), List.of());

    public PreservedContent {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        documentation = documentation == null ? List.of() : List.copyOf(documentation);
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return attributes.isEmpty() && documentation.isEmpty() && fragments.isEmpty();
    }

    public String attribute(String qualifiedName) {
        return attributes.get(qualifiedName);
    }
}
