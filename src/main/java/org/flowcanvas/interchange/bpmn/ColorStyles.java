package org.flowcanvas.interchange.bpmn;

import org.flowcanvas.interchange.bpmn.models.ColorScheme;
import org.flowcanvas.interchange.bpmn.models.ColorStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.BIOC_NS;
import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.BIOC_PREFIX;
import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.BPMNDI_NS;
import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.BPMNDI_PREFIX;
import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.COLOR_NS;
import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.COLOR_PREFIX;

/**
 * Reads and writes shape colours. Two attribute schemes ({@code bioc:fill/stroke} and
 * {@code color:background-color/border-color}) and the structured
 * {@code bpmndi:BPMNExtensionElements} scheme with {@code fillColor}/{@code strokeColor} children.
 */
public final class ColorStyles {
    private static final Logger log = LoggerFactory.getLogger(ColorStyles.class);

    static final String EXTENSION_ELEMENTS = "BPMNExtensionElements";
    static final String FILL_COLOR = "fillColor";
    static final String STROKE_COLOR = "strokeColor";

    private static final Pattern RGB = Pattern.compile("rgb\\(\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*\\)");
    private static final Pattern HEX = Pattern.compile("#([0-9a-fA-F]{3}|[0-9a-fA-F]{6})");

    private ColorStyles() {
    }

    /**
     * Whether a shape attribute belongs to one of the colour attribute schemes.
     */
    static boolean isColorAttribute(Node attribute) {
        String ns = attribute.getNamespaceURI();
        return BIOC_NS.equals(ns) || COLOR_NS.equals(ns);
    }

    /**
     * Reads every scheme present on the shape. A channel missing from one scheme is taken from the
     * next, in attribute, then structured order.
     *
     * @return the colours of a {@code BPMNShape}, or null when it has none
     */
    public static ColorStyle read(Element shape) {
        Set<ColorScheme> schemes = EnumSet.noneOf(ColorScheme.class);
        String fill = null;
        String stroke = null;

        String biocFill = attribute(shape, BIOC_NS, "fill");
        String biocStroke = attribute(shape, BIOC_NS, "stroke");
        if (biocFill != null || biocStroke != null) {
            schemes.add(ColorScheme.BIOC_ATTRIBUTES);
            fill = biocFill;
            stroke = biocStroke;
        }

        String colorFill = attribute(shape, COLOR_NS, "background-color");
        String colorStroke = attribute(shape, COLOR_NS, "border-color");
        if (colorFill != null || colorStroke != null) {
            schemes.add(ColorScheme.COLOR_ATTRIBUTES);
            fill = fill == null ? colorFill : fill;
            stroke = stroke == null ? colorStroke : stroke;
        }

        Element extension = extensionElements(shape);
        if (extension != null) {
            String extensionFill = channelColor(extension, FILL_COLOR);
            String extensionStroke = channelColor(extension, STROKE_COLOR);
            if (extensionFill != null || extensionStroke != null) {
                schemes.add(ColorScheme.DI_EXTENSION);
                fill = fill == null ? extensionFill : fill;
                stroke = stroke == null ? extensionStroke : stroke;
            }
        }

        if (fill == null && stroke == null) {
            return null;
        }
        return new ColorStyle(fill, stroke, schemes);
    }

    static Element extensionElements(Element shape) {
        for (Element child : XmlSupport.childElements(shape)) {
            if (XmlSupport.isElement(child, BPMNDI_NS, EXTENSION_ELEMENTS)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Writes {@code style} onto an encoded shape in every scheme it was read from, structured scheme for new colours.
     * The preserved extension block, if any, is replayed with its colour children replaced.
     */
    static void write(Element shape, ColorStyle style, String preservedExtension, Map<String, String> namespaces) {
        Document doc = shape.getOwnerDocument();
        Element extension = null;
        if (preservedExtension != null) {
            List<Node> imported = XmlSupport.importFragment(doc, preservedExtension, namespaces);
            for (Node node : imported) {
                if (node instanceof Element) {
                    extension = (Element) node;
                }
            }
        }

        if (style == null || !style.hasColors()) {
            if (extension != null) {
                shape.appendChild(extension);
            }
            return;
        }

        Set<ColorScheme> schemes = style.schemes().isEmpty() ? Set.of(ColorScheme.DI_EXTENSION) : style.schemes();
        if (schemes.contains(ColorScheme.BIOC_ATTRIBUTES)) {
            setIfPresent(shape, BIOC_NS, BIOC_PREFIX + ":fill", style.fill());
            setIfPresent(shape, BIOC_NS, BIOC_PREFIX + ":stroke", style.stroke());
        }
        if (schemes.contains(ColorScheme.COLOR_ATTRIBUTES)) {
            setIfPresent(shape, COLOR_NS, COLOR_PREFIX + ":background-color", style.fill());
            setIfPresent(shape, COLOR_NS, COLOR_PREFIX + ":border-color", style.stroke());
        }
        if (schemes.contains(ColorScheme.DI_EXTENSION)) {
            if (extension == null) {
                extension = doc.createElementNS(BPMNDI_NS, BPMNDI_PREFIX + ":" + EXTENSION_ELEMENTS);
            }
            // a colour without rgb notation stays an attribute
            if (!replaceChannel(extension, FILL_COLOR, style.fill())) {
                setIfPresent(shape, BIOC_NS, BIOC_PREFIX + ":fill", style.fill());
            }
            if (!replaceChannel(extension, STROKE_COLOR, style.stroke())) {
                setIfPresent(shape, BIOC_NS, BIOC_PREFIX + ":stroke", style.stroke());
            }
        }
        if (extension != null && extension.hasChildNodes()) {
            shape.appendChild(extension);
        }
    }

    /**
     * Parses "#rgb", "#rrggbb" or "rgb(r, g, b)".
     *
     * @return red, green and blue, or null when the colour is in another notation
     */
    public static int[] parseColor(String color) {
        if (color == null) {
            return null;
        }
        String trimmed = color.trim();
        Matcher hex = HEX.matcher(trimmed);
        if (hex.matches()) {
            String digits = hex.group(1);
            if (digits.length() == 3) {
                digits = "" + digits.charAt(0) + digits.charAt(0) + digits.charAt(1) + digits.charAt(1)
                        + digits.charAt(2) + digits.charAt(2);
            }
            return new int[]{
                    Integer.parseInt(digits.substring(0, 2), 16),
                    Integer.parseInt(digits.substring(2, 4), 16),
                    Integer.parseInt(digits.substring(4, 6), 16)};
        }
        Matcher rgb = RGB.matcher(trimmed);
        if (rgb.matches()) {
            return new int[]{
                    Math.min(255, Integer.parseInt(rgb.group(1))),
                    Math.min(255, Integer.parseInt(rgb.group(2))),
                    Math.min(255, Integer.parseInt(rgb.group(3)))};
        }
        return null;
    }

    private static boolean replaceChannel(Element extension, String channel, String color) {
        for (Element child : XmlSupport.childElements(extension)) {
            if (channel.equals(XmlSupport.localName(child))) {
                extension.removeChild(child);
            }
        }
        if (color == null || color.isEmpty()) {
            return true;
        }
        int[] rgb = parseColor(color);
        if (rgb == null) {
            log.warn("Colour '{}' cannot be written as {}", color, channel);
            return false;
        }
        Element element = extension.getOwnerDocument().createElementNS(BPMNDI_NS, BPMNDI_PREFIX + ":" + channel);
        element.setAttribute("red", String.valueOf(rgb[0]));
        element.setAttribute("green", String.valueOf(rgb[1]));
        element.setAttribute("blue", String.valueOf(rgb[2]));
        extension.appendChild(element);
        return true;
    }

    private static String channelColor(Element extension, String channel) {
        for (Element child : XmlSupport.childElements(extension)) {
            if (channel.equals(XmlSupport.localName(child))) {
                return String.format("rgb(%s, %s, %s)",
                        orZero(child.getAttribute("red")),
                        orZero(child.getAttribute("green")),
                        orZero(child.getAttribute("blue")));
            }
        }
        return null;
    }

    private static String orZero(String value) {
        return value == null || value.isEmpty() ? "0" : value;
    }

    private static String attribute(Element element, String namespace, String localName) {
        String value = element.getAttributeNS(namespace, localName);
        return value == null || value.isEmpty() ? null : value;
    }

    private static void setIfPresent(Element element, String namespace, String qualifiedName, String value) {
        if (value != null && !value.isEmpty()) {
            element.setAttributeNS(namespace, qualifiedName, value);
        }
    }
}
