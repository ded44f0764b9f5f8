package org.flowcanvas.interchange.bpmn;

import org.flowcanvas.interchange.bpmn.models.PreservedContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

import javax.xml.XMLConstants;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.flowcanvas.interchange.bpmn.BpmnNamespaces.BPMN_NS;

/**
 * Captures what the graph does not model so the encoder can replay it, and replays it.
 * <p>
 * Attributes are kept by qualified name, documentation as text, and every other child element
 * that is not structurally understood as an opaque serialized fragment in document order.
 */
public final class ElementPreserver {
    private static final Logger log = LoggerFactory.getLogger(ElementPreserver.class);

    /**
     * Children the decoder reads structurally and the encoder regenerates.
     */
    public static final Set<String> STRUCTURAL_CHILDREN = Set.of(
            "incoming", "outgoing", "documentation", "laneSet", "flowNodeRef");

    /**
     * Fragments schema order places before any structurally generated child.
     */
    public static final Set<String> LEADING_FRAGMENTS = Set.of(
            "extensionElements", "auditing", "monitoring", "categoryValueRef");

    private static final Pattern FRAGMENT_NAME = Pattern.compile("^\\s*<(?:[\\w.\\-]+:)?([\\w.\\-]+)");

    private ElementPreserver() {
    }

    public static PreservedContent capture(Element element) {
        return capture(element, Set.of());
    }

    /**
     * @param alsoStructural element-specific children to leave out besides {@link #STRUCTURAL_CHILDREN}
     */
    public static PreservedContent capture(Element element, Set<String> alsoStructural) {
        List<String> documentation = new ArrayList<>();
        List<String> fragments = new ArrayList<>();
        for (Element child : XmlSupport.childElements(element)) {
            String name = XmlSupport.localName(child);
            if (XmlSupport.isElement(child, BPMN_NS, "documentation")) {
                documentation.add(child.getTextContent());
            } else if (!isStructural(child, name, alsoStructural)) {
                fragments.add(XmlSupport.serializeNode(child));
            }
        }
        return new PreservedContent(attributes(element), documentation, fragments);
    }

    private static boolean isStructural(Element child, String name, Set<String> alsoStructural) {
        if (!XmlSupport.isElement(child, BPMN_NS, name)) {
            return false;
        }
        return STRUCTURAL_CHILDREN.contains(name) || alsoStructural.contains(name);
    }

    /**
     * Every attribute by qualified name, in document order; namespace declarations excluded.
     */
    public static Map<String, String> attributes(Element element) {
        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap map = element.getAttributes();
        for (int i = 0; i < map.getLength(); i++) {
            Node attribute = map.item(i);
            if (!isNamespaceDeclaration(attribute)) {
                attributes.put(attribute.getNodeName(), attribute.getNodeValue());
            }
        }
        return attributes;
    }

    static boolean isNamespaceDeclaration(Node attribute) {
        return XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attribute.getNamespaceURI())
                || "xmlns".equals(attribute.getNodeName())
                || attribute.getNodeName().startsWith("xmlns:");
    }

    /**
     * Collects the namespace declarations of {@code element} and its descendants into
     * {@code declarations}; the first declaration of a prefix wins.
     */
    public static void collectNamespaces(Element element, Map<String, String> declarations) {
        NamedNodeMap map = element.getAttributes();
        for (int i = 0; i < map.getLength(); i++) {
            Node attribute = map.item(i);
            if (isNamespaceDeclaration(attribute)) {
                String nodeName = attribute.getNodeName();
                String prefix = "xmlns".equals(nodeName) ? "" : nodeName.substring("xmlns:".length());
                declarations.putIfAbsent(prefix, attribute.getNodeValue());
            }
        }
        for (Element child : XmlSupport.childElements(element)) {
            collectNamespaces(child, declarations);
        }
    }

    /**
     * Local name of the root element of a serialized fragment, or "" when it cannot be read.
     */
    public static String fragmentName(String fragment) {
        Matcher matcher = FRAGMENT_NAME.matcher(fragment);
        return matcher.find() ? matcher.group(1) : "";
    }

    public static boolean isLeading(String fragment) {
        return LEADING_FRAGMENTS.contains(fragmentName(fragment));
    }

    /**
     * Writes preserved attributes, skipping the ones in {@code skip} (those are written from typed fields).
     * Prefixed attributes are bound to the namespace their prefix is declared with.
     */
    public static void replayAttributes(Element target, Map<String, String> attributes, Set<String> skip,
                                        Map<String, String> namespaces) {
        for (Map.Entry<String, String> attribute : attributes.entrySet()) {
            String qualifiedName = attribute.getKey();
            if (skip.contains(qualifiedName)) {
                continue;
            }
            int colon = qualifiedName.indexOf(':');
            if (colon < 0) {
                target.setAttribute(qualifiedName, attribute.getValue());
                continue;
            }
            String prefix = qualifiedName.substring(0, colon);
            String uri = "xml".equals(prefix) ? XMLConstants.XML_NS_URI : namespaces.get(prefix);
            if (uri == null) {
                log.warn("Dropping attribute {} of {}: prefix '{}' is not declared",
                        qualifiedName, target.getAttribute("id"), prefix);
                continue;
            }
            target.setAttributeNS(uri, qualifiedName, attribute.getValue());
        }
    }
}
