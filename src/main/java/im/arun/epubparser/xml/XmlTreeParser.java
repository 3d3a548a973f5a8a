package im.arun.epubparser.xml;

import java.nio.file.Path;

/**
 * Turns XML bytes into a navigable {@link XmlElement} tree.
 * Implementations raise {@link im.arun.epubparser.exception.PackageParseException}
 * when the input cannot be read or is not well-formed.
 */
public interface XmlTreeParser {

    XmlElement parse(byte[] xml);

    XmlElement parse(Path file);
}
