package im.arun.epubparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SpineItem {

    @JsonProperty("id")
    String id;

    @NonNull
    @JsonProperty("idref")
    String idref;

    @JsonProperty("linear")
    boolean linear;
}
