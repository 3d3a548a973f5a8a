package im.arun.epubparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single resource registered in the manifest. The path is relative to the
 * content directory.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ManifestItem {

    @NonNull
    @JsonProperty("id")
    String id;

    @NonNull
    @JsonProperty("path")
    String path;

    @NonNull
    @JsonProperty("media_type")
    MediaType mediaType;

    @JsonProperty("property")
    String property;
}
