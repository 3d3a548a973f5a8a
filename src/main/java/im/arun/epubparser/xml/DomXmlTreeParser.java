package im.arun.epubparser.xml;

import im.arun.epubparser.exception.PackageParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link XmlTreeParser} on top of the JDK DOM parser.
 */
public class DomXmlTreeParser implements XmlTreeParser {
    private static final Logger logger = LoggerFactory.getLogger(DomXmlTreeParser.class);

    @Override
    public XmlElement parse(byte[] xml) {
        return parse(xml, "<bytes>");
    }

    @Override
    public XmlElement parse(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new PackageParseException("Failed to read XML document " + file, e);
        }
        return parse(bytes, file.toString());
    }

    private XmlElement parse(byte[] xml, String source) {
        try {
            DocumentBuilder builder = SecureXmlUtils.createSecureDocumentBuilder(true);
            Document document = builder.parse(new ByteArrayInputStream(xml));
            logger.debug("Parsed XML document {} ({} bytes)", source, xml.length);
            return new DomXmlElement(document.getDocumentElement());
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new PackageParseException("Failed to parse XML document " + source + ": " + e.getMessage(), e);
        }
    }
}
