package im.arun.epubparser.xml;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of an element in a parsed XML document.
 * Tag names are matched on their local part, so {@code dc:title} is found as {@code title}.
 */
public interface XmlElement {

    String getName();

    Optional<String> attribute(String name);

    /**
     * First direct child with the given tag name.
     */
    Optional<XmlElement> child(String name);

    /**
     * All direct children with the given tag name, in document order.
     */
    List<XmlElement> children(String name);

    /**
     * Direct children with the given tag name whose attribute equals {@code attributeValue}.
     */
    List<XmlElement> children(String name, String attributeName, String attributeValue);

    /**
     * Trimmed text content, empty when the element holds no text.
     */
    Optional<String> text();
}
