package im.arun.epubparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Dublin Core properties of the publication plus the manifest id of its cover image.
 * Every field is optional and {@code null} when the package does not declare it.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Metadata {

    @JsonProperty("contributor")
    Creator contributor;

    @JsonProperty("coverage")
    String coverage;

    @JsonProperty("creator")
    Creator creator;

    @JsonProperty("date")
    String date;

    @JsonProperty("description")
    String description;

    @JsonProperty("format")
    String format;

    @JsonProperty("identifier")
    String identifier;

    @JsonProperty("language")
    String language;

    @JsonProperty("publisher")
    String publisher;

    @JsonProperty("relation")
    String relation;

    @JsonProperty("rights")
    String rights;

    @JsonProperty("source")
    String source;

    @JsonProperty("subject")
    String subject;

    @JsonProperty("title")
    String title;

    @JsonProperty("type")
    String type;

    @JsonProperty("cover_id")
    String coverId;
}
