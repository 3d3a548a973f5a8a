package im.arun.epubparser.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * A fully parsed EPUB package. Built once at the end of a successful parse and
 * never modified afterwards.
 */
@Value
@Builder
public class EpubDocument {

    @NonNull
    @JsonProperty("directory")
    Path directory;

    @NonNull
    @JsonProperty("content_directory")
    Path contentDirectory;

    @NonNull
    @JsonProperty("metadata")
    Metadata metadata;

    @NonNull
    @JsonProperty("manifest")
    Manifest manifest;

    @NonNull
    @JsonProperty("spine")
    Spine spine;

    @NonNull
    @JsonProperty("table_of_contents")
    TableOfContents tableOfContents;

    @JsonIgnore
    public String getTitle() {
        return metadata.getTitle();
    }

    @JsonIgnore
    public String getAuthor() {
        Creator creator = metadata.getCreator();
        return creator != null ? creator.getName() : null;
    }

    @JsonIgnore
    public String getPublisher() {
        return metadata.getPublisher();
    }

    /**
     * Absolute path of the cover image, or {@code null} when the metadata names no cover
     * or the named item is not in the manifest.
     */
    @JsonIgnore
    public Path getCover() {
        String coverId = metadata.getCoverId();
        if (coverId == null) {
            return null;
        }
        return manifest.findItemWithId(coverId)
                .map(item -> contentDirectory.resolve(item.getPath()).normalize())
                .orElse(null);
    }
}
