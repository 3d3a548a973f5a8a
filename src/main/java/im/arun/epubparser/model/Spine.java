package im.arun.epubparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Linear reading order of the publication. Items keep the order of the
 * {@code itemref} elements in the package document.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Spine {

    @JsonProperty("id")
    String id;

    @JsonProperty("toc")
    String toc;

    @NonNull
    @JsonProperty("page_progression_direction")
    PageProgressionDirection pageProgressionDirection;

    @Singular
    @JsonProperty("items")
    List<SpineItem> items;
}
