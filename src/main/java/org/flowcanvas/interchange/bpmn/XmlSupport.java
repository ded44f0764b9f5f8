package org.flowcanvas.interchange.bpmn;

import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * DOM plumbing shared by the decoder, the encoder and the preservation layer.
 */
final class XmlSupport {
    private static final String FRAGMENT_WRAPPER = "preserved";

    private static final ErrorHandler RETHROWING_HANDLER = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
            // parser warnings never make a document malformed
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    };

    private XmlSupport() {
    }

    static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(RETHROWING_HANDLER);
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    /**
     * Parses a complete document.
     *
     * @throws MalformedDocumentException if the text is not well-formed
     */
    static Document parseDocument(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new MalformedDocumentException("document is empty", -1, -1, null);
        }
        try {
            return newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
        } catch (SAXParseException e) {
            throw new MalformedDocumentException(e.getMessage(), e.getLineNumber(), e.getColumnNumber(), e);
        } catch (SAXException | IOException e) {
            throw new MalformedDocumentException(e.getMessage(), -1, -1, e);
        }
    }

    static Document newDocument() {
        return newDocumentBuilder().newDocument();
    }

    /**
     * Serializes a node without XML declaration or indentation.
     */
    static String serializeNode(Node node) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(node), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new BpmnCodecException("Failed to serialize element <" + node.getNodeName() + ">", e);
        }
    }

    /**
     * Writes a whole document with an XML declaration and indentation.
     */
    static String serializeDocument(Document doc, int indentAmount) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, indentAmount > 0 ? "yes" : "no");
            if (indentAmount > 0) {
                transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", String.valueOf(indentAmount));
            }
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");
            doc.setXmlStandalone(true);

            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(writer));

            // Remove extra blank lines (consecutive newlines)
            String xml = writer.toString().replaceAll("(\r?\n)\\s*\r?\n", "$1");
            return rootOnOwnLine(xml);
        } catch (TransformerException e) {
            throw new BpmnCodecException("Failed to write BPMN document", e);
        }
    }

    /**
     * Starts the root element on the line after the XML declaration.
     */
    static String rootOnOwnLine(String xml) {
        int declarationEnd = xml.startsWith("<?xml") ? xml.indexOf("?>") : -1;
        if (declarationEnd < 0) {
            return xml;
        }
        String declaration = xml.substring(0, declarationEnd + 2);
        String rest = xml.substring(declarationEnd + 2).stripLeading();
        return declaration + "\n" + rest;
    }

    /**
     * Parses preserved markup and imports its top-level nodes into {@code target}.
     * Prefixes the markup uses without declaring them resolve against {@code namespaces}.
     * Whitespace-only text is dropped.
     */
    static List<Node> importFragment(Document target, String markup, Map<String, String> namespaces) {
        StringBuilder wrapper = new StringBuilder("<").append(FRAGMENT_WRAPPER);
        for (Map.Entry<String, String> ns : namespaces.entrySet()) {
            String attrName = ns.getKey().isEmpty() ? "xmlns" : "xmlns:" + ns.getKey();
            wrapper.append(' ').append(attrName).append("=\"").append(escape(ns.getValue())).append('"');
        }
        wrapper.append('>').append(markup).append("</").append(FRAGMENT_WRAPPER).append('>');

        Document parsed;
        try {
            parsed = newDocumentBuilder().parse(new InputSource(new StringReader(wrapper.toString())));
        } catch (SAXException | IOException e) {
            throw new BpmnCodecException("Preserved content is not well-formed: " + abbreviate(markup), e);
        }
        Element root = parsed.getDocumentElement();
        removeWhitespaceText(root);
        for (Element child : childElements(root)) {
            removeInheritedDeclarations(child, namespaces);
        }

        List<Node> imported = new ArrayList<>();
        NodeList children = root.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            imported.add(target.importNode(children.item(i), true));
        }
        return imported;
    }

    static List<Element> childElements(Node parent) {
        List<Element> elements = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i) instanceof Element) {
                elements.add((Element) children.item(i));
            }
        }
        return elements;
    }

    /**
     * Local name of a node, tolerating parsers that leave it unset.
     */
    static String localName(Node node) {
        String localName = node.getLocalName();
        if (localName != null) {
            return localName;
        }
        String nodeName = node.getNodeName();
        int colon = nodeName.indexOf(':');
        return colon >= 0 ? nodeName.substring(colon + 1) : nodeName;
    }

    /**
     * Whether {@code node} is the element {@code localName} in namespace {@code namespace}.
     * Elements without a namespace are accepted too.
     */
    static boolean isElement(Node node, String namespace, String localName) {
        if (!(node instanceof Element) || !localName.equals(localName(node))) {
            return false;
        }
        String ns = node.getNamespaceURI();
        return ns == null || ns.equals(namespace);
    }

    /**
     * Escapes the five XML metacharacters.
     */
    static String escape(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&apos;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

    private static void removeWhitespaceText(Node node) {
        NodeList children = node.getChildNodes();
        for (int i = children.getLength() - 1; i >= 0; i--) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.TEXT_NODE && child.getTextContent().trim().isEmpty()) {
                node.removeChild(child);
            } else if (child.getNodeType() == Node.ELEMENT_NODE) {
                removeWhitespaceText(child);
            }
        }
    }

    /**
     * Drops declarations the target document root already makes, so replayed fragments do not
     * repeat them.
     */
    private static void removeInheritedDeclarations(Element element, Map<String, String> inherited) {
        NamedNodeMap attributes = element.getAttributes();
        for (int i = attributes.getLength() - 1; i >= 0; i--) {
            Node attribute = attributes.item(i);
            if (!XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attribute.getNamespaceURI())) {
                continue;
            }
            String prefix = "xmlns".equals(attribute.getNodeName()) ? "" : localName(attribute);
            if (attribute.getNodeValue().equals(inherited.get(prefix))) {
                element.removeAttributeNode((Attr) attribute);
            }
        }
        for (Element child : childElements(element)) {
            removeInheritedDeclarations(child, inherited);
        }
    }

    private static String abbreviate(String markup) {
        return markup.length() <= 80 ? markup : markup.substring(0, 77) + "...";
    }
}
