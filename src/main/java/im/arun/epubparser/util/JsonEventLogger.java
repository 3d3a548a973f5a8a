package im.arun.epubparser.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.epubparser.model.Manifest;
import im.arun.epubparser.model.Metadata;
import im.arun.epubparser.model.Spine;
import im.arun.epubparser.model.TableOfContents;
import im.arun.epubparser.service.EpubParserListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser listener that accumulates lifecycle events and rewrites them as a JSON array
 * after every event.
 */
public class JsonEventLogger implements EpubParserListener {
    private static final Logger systemLogger = LoggerFactory.getLogger(JsonEventLogger.class);
    private final Path logPath;
    private final List<Map<String, Object>> logData = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public JsonEventLogger(Path logPath) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.logPath = logPath;

        Path parent = logPath.toAbsolutePath().getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            systemLogger.error("Failed to create log directory {}", parent, e);
        }
    }

    @Override
    public void parsingStarted(Path archive) {
        log("parsing_started", Map.of("archive", archive.toString()));
    }

    @Override
    public void archiveExtracted(Path directory) {
        log("archive_extracted", Map.of("directory", directory.toString()));
    }

    @Override
    public void metadataParsed(Metadata metadata) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("title", metadata.getTitle());
        details.put("identifier", metadata.getIdentifier());
        log("metadata_parsed", details);
    }

    @Override
    public void manifestParsed(Manifest manifest) {
        log("manifest_parsed", Map.of("items", manifest.getItems().size()));
    }

    @Override
    public void spineParsed(Spine spine) {
        log("spine_parsed", Map.of(
                "items", spine.getItems().size(),
                "page_progression_direction", spine.getPageProgressionDirection().getValue()));
    }

    @Override
    public void tableOfContentsParsed(TableOfContents tableOfContents) {
        log("table_of_contents_parsed", Map.of(
                "entries", tableOfContents.flatten().size() - 1,
                "depth", tableOfContents.depth() - 1));
    }

    @Override
    public void parsingFinished(Path archive) {
        log("parsing_finished", Map.of("archive", archive.toString()));
    }

    @Override
    public void parsingFailed(Path archive, Exception error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("level", "ERROR");
        details.put("archive", archive.toString());
        details.put("error", error.getClass().getSimpleName());
        details.put("message", error.getMessage());
        log("parsing_failed", details);
    }

    private void log(String event, Map<String, Object> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("event", event);
        entry.put("timestamp", LocalDateTime.now().toString());
        entry.putAll(details);
        logData.add(entry);

        writeToFile();
    }

    private void writeToFile() {
        try {
            objectMapper.writeValue(logPath.toFile(), logData);
        } catch (IOException e) {
            systemLogger.error("Failed to write log file: {}", logPath, e);
        }
    }

    public List<Map<String, Object>> getEntries() {
        return Collections.unmodifiableList(logData);
    }

    public Path getLogPath() {
        return logPath;
    }
}
