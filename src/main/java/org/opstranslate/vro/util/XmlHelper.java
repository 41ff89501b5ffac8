package org.opstranslate.vro.util;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Namespace-agnostic DOM access for vRO documents. Workflow exports carry the
 * {@code http://vmware.com/vco/workflow} namespace, actions usually none, so elements are
 * matched by local name only.
 */
public class XmlHelper {

    public static Document parseDocument(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new RuntimeException("Failed to parse XML file: " + file + " (file not found)");
        }
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setExpandEntityReferences(false);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            Document doc = builder.parse(file.toFile());
            doc.getDocumentElement().normalize();
            return doc;
        } catch (Exception e) {
            throw new RuntimeException("Failed to parse XML file: " + file, e);
        }
    }

    public static String localName(Node node) {
        String local = node.getLocalName();
        return local != null ? local : node.getNodeName();
    }

    /**
     * Direct element children of {@code parent} with the given local name, in document order.
     */
    public static List<Element> childElements(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(child))) {
                result.add((Element) child);
            }
        }
        return result;
    }

    /**
     * All descendant elements with the given local name, in document order.
     */
    public static List<Element> descendants(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getElementsByTagNameNS("*", name);
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        if (result.isEmpty()) {
            // documents parsed without namespace information
            nodes = parent.getElementsByTagName(name);
            for (int i = 0; i < nodes.getLength(); i++) {
                result.add((Element) nodes.item(i));
            }
        }
        return result;
    }

    public static Element firstChild(Element parent, String name) {
        List<Element> children = childElements(parent, name);
        return children.isEmpty() ? null : children.get(0);
    }

    /**
     * Text content of the first direct child with the given name, or null when the child is absent.
     */
    public static String childText(Element parent, String name) {
        Element child = firstChild(parent, name);
        return child == null ? null : child.getTextContent();
    }

    public static String attributeOrNull(Element element, String name) {
        if (!element.hasAttribute(name)) {
            return null;
        }
        return element.getAttribute(name);
    }
}
