package im.arun.epubparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * A creator or contributor of the publication. Every field may be absent.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Creator {

    @JsonProperty("name")
    String name;

    @JsonProperty("role")
    String role;

    @JsonProperty("file_as")
    String fileAs;
}
