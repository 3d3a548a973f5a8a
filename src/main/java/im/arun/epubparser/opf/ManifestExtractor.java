package im.arun.epubparser.opf;

import im.arun.epubparser.exception.ManifestException;
import im.arun.epubparser.model.Manifest;
import im.arun.epubparser.model.ManifestItem;
import im.arun.epubparser.model.MediaType;
import im.arun.epubparser.xml.XmlElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the package {@code manifest} element to a {@link Manifest}.
 * Items sharing an id overwrite each other in document order.
 */
public class ManifestExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ManifestExtractor.class);

    public Manifest extract(XmlElement manifest) {
        if (manifest == null) {
            throw new ManifestException("Package document has no manifest");
        }
        List<XmlElement> elements = manifest.children("item");
        if (elements.isEmpty()) {
            throw new ManifestException("Manifest has no item elements");
        }

        Map<String, ManifestItem> items = new LinkedHashMap<>();
        for (int i = 0; i < elements.size(); i++) {
            XmlElement element = elements.get(i);
            int position = i + 1;
            String id = element.attribute("id")
                    .orElseThrow(() -> new ManifestException("Manifest item #" + position + " has no id attribute"));
            String path = element.attribute("href")
                    .orElseThrow(() -> new ManifestException("Manifest item '" + id + "' has no href attribute"));
            String mediaType = element.attribute("media-type").orElse(null);

            ManifestItem item = ManifestItem.builder()
                    .id(id)
                    .path(path)
                    .mediaType(MediaType.fromValue(mediaType))
                    .property(element.attribute("properties").orElse(null))
                    .build();
            if (items.put(id, item) != null) {
                logger.warn("Duplicate manifest id '{}', keeping the later item ({})", id, path);
            }
        }

        return new Manifest(manifest.attribute("id").orElse(null), items);
    }
}
