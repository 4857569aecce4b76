package uk.gegc.questionextractor.shared.util;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Namespace-aware helpers over W3C DOM elements. All lists are returned in document order.
 */
public final class DomUtils {

    private DomUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static boolean is(Node node, String namespace, String localName) {
        return node instanceof Element
                && namespace.equals(node.getNamespaceURI())
                && localName.equals(node.getLocalName());
    }

    public static List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element) {
                result.add(element);
            }
        }
        return result;
    }

    public static List<Element> childElements(Element parent, String namespace, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (is(child, namespace, localName)) {
                result.add((Element) child);
            }
        }
        return result;
    }

    public static Optional<Element> firstChild(Element parent, String namespace, String localName) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (is(child, namespace, localName)) {
                return Optional.of((Element) child);
            }
        }
        return Optional.empty();
    }

    public static List<Element> descendants(Element root, String namespace, String localName) {
        NodeList nodes = root.getElementsByTagNameNS(namespace, localName);
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    /**
     * Like {@link #descendants}, but leaves out elements under an {@code mc:Fallback} below
     * {@code root}. Word repeats the content of {@code mc:Choice} there for older readers.
     */
    public static List<Element> primaryDescendants(Element root, String namespace, String localName) {
        List<Element> result = new ArrayList<>();
        for (Element element : descendants(root, namespace, localName)) {
            if (!insideFallback(element, root)) {
                result.add(element);
            }
        }
        return result;
    }

    public static boolean isFallback(Node node) {
        return is(node, OoxmlNamespaces.MARKUP_COMPATIBILITY, "Fallback");
    }

    private static boolean insideFallback(Element element, Element root) {
        for (Node node = element.getParentNode(); node != null && node != root; node = node.getParentNode()) {
            if (isFallback(node)) {
                return true;
            }
        }
        return false;
    }

    public static boolean hasDescendant(Element root, String namespace, String localName) {
        return root.getElementsByTagNameNS(namespace, localName).getLength() > 0;
    }

    /**
     * Returns the attribute value, or {@code null} when the attribute is absent.
     */
    public static String attribute(Element element, String namespace, String localName) {
        return element.hasAttributeNS(namespace, localName)
                ? element.getAttributeNS(namespace, localName)
                : null;
    }

    /**
     * Concatenates the text of every descendant element with the given name.
     */
    public static String joinedText(Element root, String namespace, String localName) {
        StringBuilder text = new StringBuilder();
        for (Element element : descendants(root, namespace, localName)) {
            text.append(element.getTextContent());
        }
        return text.toString();
    }
}
