package im.arun.epubparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.epubparser.exception.TocReferenceNotFoundException;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Id-indexed registry of every resource in the publication.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Manifest {

    @JsonProperty("id")
    String id;

    @JsonProperty("items")
    Map<String, ManifestItem> items;

    public Manifest(String id, Map<String, ManifestItem> items) {
        this.id = id;
        this.items = Collections.unmodifiableMap(new LinkedHashMap<>(items));
    }

    public Optional<ManifestItem> findItemWithId(String itemId) {
        return Optional.ofNullable(items.get(itemId));
    }

    /**
     * Returns the content-relative path of the item with the given id.
     *
     * @throws TocReferenceNotFoundException if no item is registered under {@code itemId}
     */
    public String pathForItemWithId(String itemId) {
        return findItemWithId(itemId)
                .map(ManifestItem::getPath)
                .orElseThrow(() -> new TocReferenceNotFoundException(itemId));
    }
}
