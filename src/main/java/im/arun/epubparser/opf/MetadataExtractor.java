package im.arun.epubparser.opf;

import im.arun.epubparser.model.Creator;
import im.arun.epubparser.model.Metadata;
import im.arun.epubparser.xml.XmlElement;

import java.util.Optional;

/**
 * Maps the package {@code metadata} element to {@link Metadata}.
 * Missing elements leave the corresponding field empty; extraction never fails.
 */
public class MetadataExtractor {

    public Metadata extract(XmlElement metadata) {
        if (metadata == null) {
            return Metadata.builder().build();
        }
        return Metadata.builder()
                .contributor(creator(metadata, "contributor"))
                .coverage(text(metadata, "coverage"))
                .creator(creator(metadata, "creator"))
                .date(text(metadata, "date"))
                .description(text(metadata, "description"))
                .format(text(metadata, "format"))
                .identifier(text(metadata, "identifier"))
                .language(text(metadata, "language"))
                .publisher(text(metadata, "publisher"))
                .relation(text(metadata, "relation"))
                .rights(text(metadata, "rights"))
                .source(text(metadata, "source"))
                .subject(text(metadata, "subject"))
                .title(text(metadata, "title"))
                .type(text(metadata, "type"))
                .coverId(coverId(metadata))
                .build();
    }

    private String text(XmlElement metadata, String name) {
        return metadata.child(name).flatMap(XmlElement::text).orElse(null);
    }

    private Creator creator(XmlElement metadata, String name) {
        Optional<XmlElement> element = metadata.child(name);
        return Creator.builder()
                .name(element.flatMap(XmlElement::text).orElse(null))
                .role(element.flatMap(e -> e.attribute("role")).orElse(null))
                .fileAs(element.flatMap(e -> e.attribute("file-as")).orElse(null))
                .build();
    }

    // First <meta name="cover"> wins
    private String coverId(XmlElement metadata) {
        return metadata.children("meta", "name", "cover").stream()
                .findFirst()
                .flatMap(meta -> meta.attribute("content"))
                .orElse(null);
    }
}
