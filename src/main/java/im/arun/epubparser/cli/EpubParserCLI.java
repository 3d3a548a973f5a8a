package im.arun.epubparser.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.epubparser.config.ConfigLoader;
import im.arun.epubparser.config.EpubParserConfig;
import im.arun.epubparser.exception.EpubParseException;
import im.arun.epubparser.model.EpubDocument;
import im.arun.epubparser.model.TableOfContents;
import im.arun.epubparser.service.EpubParserService;
import im.arun.epubparser.util.JsonEventLogger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.lang.ref.Reference;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for EpubParser using Picocli.
 */
@Command(
    name = "epubparser",
    description = "Parse an EPUB archive into metadata, manifest, spine and table of contents",
    mixinStandardHelpOptions = true,
    version = "EpubParser 1.0"
)
public class EpubParserCLI implements Callable<Integer> {

    @Option(names = {"--epub-path"}, description = "Path to EPUB file", required = true)
    private String epubPath;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--extraction-dir"}, description = "Directory to extract the archive into")
    private String extractionDir;

    @Option(names = {"--output"}, description = "Output JSON file path")
    private String outputPath;

    @Option(names = {"--event-log"}, description = "Write parse events as JSON to this file")
    private String eventLogPath;

    @Option(names = {"--summary"}, description = "Print a short summary instead of JSON")
    private boolean summary;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path epubFilePath = Paths.get(epubPath);
        if (!Files.exists(epubFilePath)) {
            err.println("Error: EPUB file not found: " + epubPath);
            err.flush();
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        if (extractionDir != null) {
            overrides.put("extractionDirectory", extractionDir);
        }
        EpubParserConfig config = new ConfigLoader(configPath).load(overrides);

        EpubParserService service = new EpubParserService(config);
        JsonEventLogger eventLogger = eventLogPath != null ? new JsonEventLogger(Paths.get(eventLogPath)) : null;
        service.setListener(eventLogger);

        EpubDocument document;
        try {
            document = service.parse(epubFilePath);
        } catch (EpubParseException e) {
            err.println("Error parsing document: " + e.getMessage());
            return 1;
        } finally {
            // the service only holds the logger weakly
            Reference.reachabilityFence(eventLogger);
            if (eventLogger != null) {
                err.println("Event log written to: " + eventLogger.getLogPath());
            }
            err.flush();
        }

        if (summary) {
            printSummary(document, out);
            out.flush();
            return 0;
        }

        ObjectMapper mapper = new ObjectMapper();
        if (config.isPrettyPrint()) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
        String jsonOutput = mapper.writeValueAsString(document);

        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), jsonOutput);
            out.println("Output written to: " + outputPath);
        } else {
            out.println(jsonOutput);
        }
        out.flush();
        return 0;
    }

    private void printSummary(EpubDocument document, PrintWriter out) {
        out.println("Title:     " + valueOrDash(document.getTitle()));
        out.println("Author:    " + valueOrDash(document.getAuthor()));
        out.println("Publisher: " + valueOrDash(document.getPublisher()));
        out.println("Cover:     " + valueOrDash(document.getCover()));
        out.println("Manifest:  " + document.getManifest().getItems().size() + " items");
        out.println("Spine:     " + document.getSpine().getItems().size() + " items, "
                + document.getSpine().getPageProgressionDirection().getValue());
        out.println("Contents:");
        for (TableOfContents entry : document.getTableOfContents().getSubTable()) {
            printEntry(entry, 1, out);
        }
    }

    private void printEntry(TableOfContents entry, int level, PrintWriter out) {
        out.println("  ".repeat(level) + entry.getLabel() + " (" + entry.getItem() + ")");
        for (TableOfContents child : entry.getSubTable()) {
            printEntry(child, level + 1, out);
        }
    }

    private static String valueOrDash(Object value) {
        return value != null ? value.toString() : "-";
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new EpubParserCLI()).execute(args);
        System.exit(exitCode);
    }
}
