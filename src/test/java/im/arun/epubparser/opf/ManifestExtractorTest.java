package im.arun.epubparser.opf;

import im.arun.epubparser.exception.ManifestException;
import im.arun.epubparser.exception.TocReferenceNotFoundException;
import im.arun.epubparser.model.Manifest;
import im.arun.epubparser.model.MediaType;
import im.arun.epubparser.xml.DomXmlTreeParser;
import im.arun.epubparser.xml.XmlElement;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManifestExtractorTest {

    private final ManifestExtractor extractor = new ManifestExtractor();

    private static XmlElement xml(String xml) {
        return new DomXmlTreeParser().parse(xml.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void registersEveryItemById() {
        Manifest manifest = extractor.extract(xml("""
                <manifest id="m1">
                    <item id="ncx" href="toc.ncx" media-type="application/x-dtbncx+xml"/>
                    <item id="ch1" href="text/ch1.xhtml" media-type="application/xhtml+xml"/>
                    <item id="nav" href="nav.xhtml" media-type="application/xhtml+xml" properties="nav"/>
                </manifest>
                """));

        assertThat(manifest.getId()).isEqualTo("m1");
        assertThat(manifest.getItems()).hasSize(3).containsKeys("ncx", "ch1", "nav");
        assertThat(manifest.getItems().get("ncx").getMediaType()).isEqualTo(MediaType.NCX);
        assertThat(manifest.getItems().get("ch1").getPath()).isEqualTo("text/ch1.xhtml");
        assertThat(manifest.getItems().get("ch1").getProperty()).isNull();
        assertThat(manifest.getItems().get("nav").getProperty()).isEqualTo("nav");
    }

    @Test
    void unknownOrMissingMediaTypeFallsBackToUnknown() {
        Manifest manifest = extractor.extract(xml("""
                <manifest>
                    <item id="a" href="a.bin" media-type="application/x-made-up"/>
                    <item id="b" href="b.bin"/>
                </manifest>
                """));

        assertThat(manifest.getItems().get("a").getMediaType()).isEqualTo(MediaType.UNKNOWN);
        assertThat(manifest.getItems().get("b").getMediaType()).isEqualTo(MediaType.UNKNOWN);
    }

    @Test
    void duplicateIdKeepsLaterItem() {
        Manifest manifest = extractor.extract(xml("""
                <manifest>
                    <item id="dup" href="first.xhtml" media-type="application/xhtml+xml"/>
                    <item id="other" href="other.xhtml" media-type="application/xhtml+xml"/>
                    <item id="dup" href="second.xhtml" media-type="application/xhtml+xml"/>
                </manifest>
                """));

        assertThat(manifest.getItems()).hasSize(2);
        assertThat(manifest.getItems().get("dup").getPath()).isEqualTo("second.xhtml");
    }

    @Test
    void itemWithoutHrefFailsNamingTheItem() {
        assertThatThrownBy(() -> extractor.extract(xml("""
                <manifest>
                    <item id="ok" href="ok.xhtml" media-type="application/xhtml+xml"/>
                    <item id="broken" media-type="application/xhtml+xml"/>
                </manifest>
                """)))
                .isInstanceOf(ManifestException.class)
                .hasMessageContaining("broken")
                .hasMessageContaining("href");
    }

    @Test
    void itemWithoutIdFails() {
        assertThatThrownBy(() -> extractor.extract(xml("""
                <manifest>
                    <item href="ok.xhtml" media-type="application/xhtml+xml"/>
                </manifest>
                """)))
                .isInstanceOf(ManifestException.class)
                .hasMessageContaining("#1")
                .hasMessageContaining("id");
    }

    @Test
    void emptyManifestFails() {
        assertThatThrownBy(() -> extractor.extract(xml("<manifest/>")))
                .isInstanceOf(ManifestException.class)
                .hasMessageContaining("no item");
    }

    @Test
    void missingManifestFails() {
        assertThatThrownBy(() -> extractor.extract(null))
                .isInstanceOf(ManifestException.class);
    }

    @Test
    void pathLookupFailsForUnknownId() {
        Manifest manifest = extractor.extract(xml("""
                <manifest><item id="ncx" href="toc.ncx" media-type="application/x-dtbncx+xml"/></manifest>
                """));

        assertThat(manifest.pathForItemWithId("ncx")).isEqualTo("toc.ncx");
        assertThat(manifest.findItemWithId("missing")).isEmpty();
        assertThatThrownBy(() -> manifest.pathForItemWithId("missing"))
                .isInstanceOf(TocReferenceNotFoundException.class)
                .hasMessageContaining("missing");
    }
}
