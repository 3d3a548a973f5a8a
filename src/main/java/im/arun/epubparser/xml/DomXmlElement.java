package im.arun.epubparser.xml;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link XmlElement} backed by a W3C DOM element.
 */
class DomXmlElement implements XmlElement {

    private final Element element;

    DomXmlElement(Element element) {
        this.element = element;
    }

    @Override
    public String getName() {
        return localName(element);
    }

    @Override
    public Optional<String> attribute(String name) {
        if (element.hasAttribute(name)) {
            return Optional.of(element.getAttribute(name));
        }
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            if (name.equals(localName(attr))) {
                return Optional.of(attr.getValue());
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<XmlElement> child(String name) {
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element && name.equals(localName(node))) {
                return Optional.of(new DomXmlElement((Element) node));
            }
        }
        return Optional.empty();
    }

    @Override
    public List<XmlElement> children(String name) {
        List<XmlElement> result = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element && name.equals(localName(node))) {
                result.add(new DomXmlElement((Element) node));
            }
        }
        return result;
    }

    @Override
    public List<XmlElement> children(String name, String attributeName, String attributeValue) {
        List<XmlElement> result = new ArrayList<>();
        for (XmlElement child : children(name)) {
            if (child.attribute(attributeName).filter(attributeValue::equals).isPresent()) {
                result.add(child);
            }
        }
        return result;
    }

    @Override
    public Optional<String> text() {
        String content = element.getTextContent();
        if (content == null) {
            return Optional.empty();
        }
        String trimmed = content.trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }

    @Override
    public String toString() {
        return "<" + element.getTagName() + ">";
    }

    private static String localName(Node node) {
        String local = node.getLocalName();
        if (local != null) {
            return local;
        }
        String qualified = node.getNodeName();
        int colon = qualified.indexOf(':');
        return colon >= 0 ? qualified.substring(colon + 1) : qualified;
    }
}
