package org.flowcanvas.interchange.bpmn.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Fill and stroke colours of a shape. Colours are CSS-like strings ("#aabbcc" or "rgb(r, g, b)").
 *
 * @param fill    background colour, may be null
 * @param stroke  border colour, may be null
 * @param schemes every scheme the colours were read from; empty for colours set by the editor
 */
public record ColorStyle(String fill, String stroke, Set<ColorScheme> schemes) {

    public ColorStyle {
        EnumSet<ColorScheme> copy = EnumSet.noneOf(ColorScheme.class);
        if (schemes != null) {
            copy.addAll(schemes);
        }
        schemes = Collections.unmodifiableSet(copy);
    }

    public ColorStyle(String fill, String stroke, ColorScheme scheme) {
        this(fill, stroke, scheme == null ? Set.of() : Set.of(scheme));
    }

    /**
     * The scheme the colours were primarily read from, or null for editor colours.
     */
    @JsonIgnore
    public ColorScheme scheme() {
        return schemes.isEmpty() ? null : schemes.iterator().next();
    }

    public boolean hasColors() {
        return (fill != null && !fill.isEmpty()) || (stroke != null && !stroke.isEmpty());
    }
}
