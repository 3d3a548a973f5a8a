package im.arun.epubparser.container;

import im.arun.epubparser.exception.ContainerException;
import im.arun.epubparser.exception.PackageParseException;
import im.arun.epubparser.xml.XmlElement;
import im.arun.epubparser.xml.XmlTreeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Finds the package document of an extracted EPUB through {@code META-INF/container.xml}.
 */
public class ContainerLocator {
    private static final Logger logger = LoggerFactory.getLogger(ContainerLocator.class);

    public static final String CONTAINER_PATH = "META-INF/container.xml";

    private final XmlTreeParser xmlParser;

    public ContainerLocator(XmlTreeParser xmlParser) {
        this.xmlParser = xmlParser;
    }

    /**
     * Returns the absolute path of the package document declared by the first rootfile.
     *
     * @param directory root of the extracted archive
     * @throws ContainerException if the container file is missing, malformed or lacks a full-path
     */
    public Path locatePackageDocument(Path directory) {
        Path containerFile = directory.resolve(CONTAINER_PATH);
        if (!Files.isRegularFile(containerFile)) {
            throw new ContainerException("Container file not found: " + containerFile);
        }

        XmlElement container;
        try {
            container = xmlParser.parse(containerFile);
        } catch (PackageParseException e) {
            throw new ContainerException("Container file is not valid XML: " + containerFile, e);
        }

        XmlElement rootfile = container.child("rootfiles")
                .flatMap(rootfiles -> rootfiles.child("rootfile"))
                .orElseThrow(() -> new ContainerException("Container file declares no rootfile: " + containerFile));

        String fullPath = rootfile.attribute("full-path")
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new ContainerException("Rootfile has no full-path attribute: " + containerFile));

        Path packageDocument = directory.resolve(fullPath).toAbsolutePath().normalize();
        logger.debug("Package document located at {}", packageDocument);
        return packageDocument;
    }
}
