package im.arun.epubparser.service;

import im.arun.epubparser.archive.ArchiveExtractor;
import im.arun.epubparser.archive.ZipArchiveExtractor;
import im.arun.epubparser.config.EpubParserConfig;
import im.arun.epubparser.container.ContainerLocator;
import im.arun.epubparser.exception.ArchiveExtractionException;
import im.arun.epubparser.exception.TocReferenceNotFoundException;
import im.arun.epubparser.model.EpubDocument;
import im.arun.epubparser.model.Manifest;
import im.arun.epubparser.model.Metadata;
import im.arun.epubparser.model.Spine;
import im.arun.epubparser.model.TableOfContents;
import im.arun.epubparser.opf.ManifestExtractor;
import im.arun.epubparser.opf.MetadataExtractor;
import im.arun.epubparser.opf.SpineExtractor;
import im.arun.epubparser.toc.TocExtractor;
import im.arun.epubparser.xml.DomXmlTreeParser;
import im.arun.epubparser.xml.XmlElement;
import im.arun.epubparser.xml.XmlTreeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.ref.WeakReference;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Parses an EPUB archive into an {@link EpubDocument}.
 * <p>
 * The pipeline runs synchronously on the calling thread: extract the archive, locate
 * the package document, read metadata, manifest and spine, then resolve the NCX through
 * {@code spine.toc} and build the table of contents. Any failure aborts the parse; the
 * listener hears about it before the exception reaches the caller.
 * <p>
 * The listener is only weakly referenced. Keep a strong reference for as long as
 * events are wanted.
 */
public class EpubParserService {
    private static final Logger logger = LoggerFactory.getLogger(EpubParserService.class);

    private final ArchiveExtractor archiveExtractor;
    private final XmlTreeParser xmlParser;
    private final ContainerLocator containerLocator;
    private final MetadataExtractor metadataExtractor;
    private final ManifestExtractor manifestExtractor;
    private final SpineExtractor spineExtractor;
    private final TocExtractor tocExtractor;

    private WeakReference<EpubParserListener> listener = new WeakReference<>(null);

    public EpubParserService() {
        this(new EpubParserConfig());
    }

    public EpubParserService(EpubParserConfig config) {
        this(new ZipArchiveExtractor(config), new DomXmlTreeParser());
    }

    public EpubParserService(ArchiveExtractor archiveExtractor, XmlTreeParser xmlParser) {
        this.archiveExtractor = archiveExtractor;
        this.xmlParser = xmlParser;
        this.containerLocator = new ContainerLocator(xmlParser);
        this.metadataExtractor = new MetadataExtractor();
        this.manifestExtractor = new ManifestExtractor();
        this.spineExtractor = new SpineExtractor();
        this.tocExtractor = new TocExtractor();
    }

    public void setListener(EpubParserListener listener) {
        this.listener = new WeakReference<>(listener);
    }

    /**
     * Parses the archive at {@code archive}.
     *
     * @throws im.arun.epubparser.exception.EpubParseException describing the first stage that failed
     */
    public EpubDocument parse(Path archive) {
        try {
            logger.info("Parsing EPUB {}", archive);
            notifyListener(l -> l.parsingStarted(archive));

            Path directory = extractArchive(archive);
            notifyListener(l -> l.archiveExtracted(directory));

            Path packageDocument = containerLocator.locatePackageDocument(directory);
            Path contentDirectory = packageDocument.getParent();
            XmlElement content = xmlParser.parse(packageDocument);

            Metadata metadata = metadataExtractor.extract(content.child("metadata").orElse(null));
            notifyListener(l -> l.metadataParsed(metadata));

            Manifest manifest = manifestExtractor.extract(content.child("manifest").orElse(null));
            logger.debug("Manifest has {} items", manifest.getItems().size());
            notifyListener(l -> l.manifestParsed(manifest));

            Spine spine = spineExtractor.extract(content.child("spine").orElse(null));
            logger.debug("Spine has {} items", spine.getItems().size());
            notifyListener(l -> l.spineParsed(spine));

            Path tocPath = resolveTocPath(contentDirectory, manifest, spine);
            TableOfContents tableOfContents = tocExtractor.extract(xmlParser.parse(tocPath));
            notifyListener(l -> l.tableOfContentsParsed(tableOfContents));

            EpubDocument document = EpubDocument.builder()
                    .directory(directory)
                    .contentDirectory(contentDirectory)
                    .metadata(metadata)
                    .manifest(manifest)
                    .spine(spine)
                    .tableOfContents(tableOfContents)
                    .build();

            logger.info("Parsed EPUB {}: {} manifest items, {} spine items, {} toc entries",
                    archive.getFileName(), manifest.getItems().size(), spine.getItems().size(),
                    tableOfContents.flatten().size() - 1);
            notifyListener(l -> l.parsingFinished(archive));
            return document;
        } catch (RuntimeException e) {
            logger.error("Failed to parse EPUB {}: {}", archive, e.getMessage());
            notifyListener(l -> l.parsingFailed(archive, e));
            throw e;
        }
    }

    private Path extractArchive(Path archive) {
        try {
            return archiveExtractor.extract(archive);
        } catch (IOException | RuntimeException e) {
            throw new ArchiveExtractionException(archive, e);
        }
    }

    private Path resolveTocPath(Path contentDirectory, Manifest manifest, Spine spine) {
        String tocId = spine.getToc();
        if (tocId == null) {
            throw new TocReferenceNotFoundException(null);
        }
        return contentDirectory.resolve(manifest.pathForItemWithId(tocId)).normalize();
    }

    private void notifyListener(Consumer<EpubParserListener> event) {
        EpubParserListener current = listener.get();
        if (current != null) {
            event.accept(current);
        }
    }
}
