package im.arun.epubparser.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EpubDocumentTest {

    private static final Path CONTENT = Paths.get("/books/sample/OEBPS").toAbsolutePath();

    private static EpubDocument document(Metadata metadata) {
        Manifest manifest = new Manifest(null, Map.of(
                "ncx", ManifestItem.builder().id("ncx").path("toc.ncx").mediaType(MediaType.NCX).build(),
                "img1", ManifestItem.builder().id("img1").path("images/cover.png").mediaType(MediaType.PNG).build()));
        return EpubDocument.builder()
                .directory(CONTENT.getParent())
                .contentDirectory(CONTENT)
                .metadata(metadata)
                .manifest(manifest)
                .spine(Spine.builder()
                        .toc("ncx")
                        .pageProgressionDirection(PageProgressionDirection.LTR)
                        .item(SpineItem.builder().idref("ncx").linear(true).build())
                        .build())
                .tableOfContents(TableOfContents.builder().label("Sample").id(TableOfContents.ROOT_ID).build())
                .build();
    }

    @Test
    void convenienceAccessorsReadMetadata() {
        EpubDocument document = document(Metadata.builder()
                .title("Sample")
                .publisher("Press")
                .creator(Creator.builder().name("Author Name").build())
                .coverId("img1")
                .build());

        assertThat(document.getTitle()).isEqualTo("Sample");
        assertThat(document.getAuthor()).isEqualTo("Author Name");
        assertThat(document.getPublisher()).isEqualTo("Press");
        assertThat(document.getCover()).isEqualTo(CONTENT.resolve("images/cover.png"));
    }

    @Test
    void coverIsAbsentWithoutResolvableCoverId() {
        assertThat(document(Metadata.builder().build()).getCover()).isNull();
        assertThat(document(Metadata.builder().coverId("nope").build()).getCover()).isNull();
        assertThat(document(Metadata.builder().build()).getAuthor()).isNull();
    }

    @Test
    void serialisesWithSnakeCaseAndWithoutConvenienceFields() throws Exception {
        EpubDocument document = document(Metadata.builder().title("Sample").coverId("img1").build());

        JsonNode json = new ObjectMapper().valueToTree(document);

        assertThat(json.has("content_directory")).isTrue();
        assertThat(json.has("title")).isFalse();
        assertThat(json.has("cover")).isFalse();
        assertThat(json.at("/metadata/cover_id").asText()).isEqualTo("img1");
        assertThat(json.at("/metadata/publisher").isMissingNode()).isTrue();
        assertThat(json.at("/manifest/items/ncx/media_type").asText()).isEqualTo("application/x-dtbncx+xml");
        assertThat(json.at("/spine/page_progression_direction").asText()).isEqualTo("ltr");
        assertThat(json.at("/table_of_contents/id").asText()).isEqualTo("0");
    }

    @Test
    void modelCollectionsAreImmutable() {
        EpubDocument document = document(Metadata.builder().build());

        assertThatThrownBy(() -> document.getManifest().getItems().remove("ncx"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> document.getSpine().getItems().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> document.getTableOfContents().getSubTable().add(null))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
