package im.arun.epubparser.toc;

import im.arun.epubparser.EpubTestFiles;
import im.arun.epubparser.exception.TableOfContentsException;
import im.arun.epubparser.model.TableOfContents;
import im.arun.epubparser.xml.DomXmlTreeParser;
import im.arun.epubparser.xml.XmlElement;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TocExtractorTest {

    private final TocExtractor extractor = new TocExtractor();

    private static XmlElement xml(String xml) {
        return new DomXmlTreeParser().parse(xml.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void buildsNestedTree() {
        TableOfContents root = extractor.extract(xml(EpubTestFiles.BOOK_NCX));

        assertThat(root.getLabel()).isEqualTo("A Tale of Two Cities");
        assertThat(root.getId()).isEqualTo(TableOfContents.ROOT_ID);
        assertThat(root.getItem()).isEqualTo("urn:isbn:9780000000001");
        assertThat(root.getSubTable()).extracting(TableOfContents::getLabel)
                .containsExactly("Book the First", "Book the Second");

        TableOfContents first = root.getSubTable().get(0);
        assertThat(first.getId()).isEqualTo("book1");
        assertThat(first.getItem()).isEqualTo("text/ch1.xhtml");
        assertThat(first.getSubTable()).singleElement().satisfies(child -> {
            assertThat(child.getLabel()).isEqualTo("The Period");
            assertThat(child.getItem()).isEqualTo("text/ch1.xhtml#period");
            assertThat(child.getSubTable()).isEmpty();
        });
        assertThat(root.getSubTable().get(1).getSubTable()).isEmpty();
    }

    @Test
    void flattenAndDepthFollowTheTree() {
        TableOfContents root = extractor.extract(xml(EpubTestFiles.BOOK_NCX));

        assertThat(root.flatten()).extracting(TableOfContents::getId)
                .containsExactly("0", "book1", "book1-ch1", "book2");
        assertThat(root.depth()).isEqualTo(3);
    }

    @Test
    void rootIdIsAlwaysZero() {
        TableOfContents root = extractor.extract(xml(EpubTestFiles.MINIMAL_NCX));

        assertThat(root.getId()).isEqualTo("0");
        assertThat(root.getItem()).isNull();
        assertThat(root.getSubTable()).singleElement()
                .extracting(TableOfContents::getLabel).isEqualTo("Ch1");
    }

    @Test
    void missingNavMapYieldsLeafRoot() {
        TableOfContents root = extractor.extract(xml("<ncx><docTitle><text>Only Title</text></docTitle></ncx>"));

        assertThat(root.getSubTable()).isEmpty();
    }

    @Test
    void missingTitleFails() {
        assertThatThrownBy(() -> extractor.extract(xml("<ncx><navMap/></ncx>")))
                .isInstanceOf(TableOfContentsException.class)
                .hasMessageContaining("docTitle");
    }

    @Test
    void navPointWithoutLabelFailsNamingThePoint() {
        assertThatThrownBy(() -> extractor.extract(xml("""
                <ncx>
                    <docTitle><text>T</text></docTitle>
                    <navMap>
                        <navPoint id="np7"><content src="a.html"/></navPoint>
                    </navMap>
                </ncx>
                """)))
                .isInstanceOf(TableOfContentsException.class)
                .hasMessageContaining("np7")
                .hasMessageContaining("navLabel");
    }

    @Test
    void navPointWithoutIdFails() {
        assertThatThrownBy(() -> extractor.extract(xml("""
                <ncx>
                    <docTitle><text>T</text></docTitle>
                    <navMap>
                        <navPoint><navLabel><text>Ch</text></navLabel><content src="a.html"/></navPoint>
                    </navMap>
                </ncx>
                """)))
                .isInstanceOf(TableOfContentsException.class)
                .hasMessageContaining("id");
    }

    @Test
    void nestedNavPointWithoutContentFails() {
        assertThatThrownBy(() -> extractor.extract(xml("""
                <ncx>
                    <docTitle><text>T</text></docTitle>
                    <navMap>
                        <navPoint id="outer">
                            <navLabel><text>Outer</text></navLabel>
                            <content src="a.html"/>
                            <navPoint id="inner"><navLabel><text>Inner</text></navLabel></navPoint>
                        </navPoint>
                    </navMap>
                </ncx>
                """)))
                .isInstanceOf(TableOfContentsException.class)
                .hasMessageContaining("inner")
                .hasMessageContaining("content");
    }

    @Test
    void deeplyNestedNavPointsKeepTheirStructure() {
        TableOfContents root = extractor.extract(xml(EpubTestFiles.nestedNcx(20_000)));

        assertThat(root.depth()).isEqualTo(20_001);
        assertThat(root.flatten()).hasSize(20_001);
        TableOfContents deepest = root.flatten().get(20_000);
        assertThat(deepest.getId()).isEqualTo("np20000");
        assertThat(deepest.getLabel()).isEqualTo("Level 20000");
        assertThat(deepest.getSubTable()).isEmpty();
    }
}
