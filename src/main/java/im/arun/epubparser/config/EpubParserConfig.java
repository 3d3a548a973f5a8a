package im.arun.epubparser.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class EpubParserConfig {
    /** Root for extracted archives; {@code null} extracts next to the archive. */
    private String extractionDirectory;
    private List<String> archiveExtensions = new ArrayList<>(List.of("epub", "zip"));
    private String entryEncoding = "UTF-8";
    private boolean prettyPrint = true;
}
