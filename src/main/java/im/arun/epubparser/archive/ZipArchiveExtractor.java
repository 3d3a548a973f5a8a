package im.arun.epubparser.archive;

import im.arun.epubparser.config.EpubParserConfig;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;

/**
 * Extracts zip based archives (including {@code .epub}) with Commons Compress.
 * <p>
 * The target directory is named after the archive without its extension and lives in
 * the configured extraction directory, or next to the archive. Existing files are
 * overwritten; concurrent extraction of the same archive is not coordinated.
 */
public class ZipArchiveExtractor implements ArchiveExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ZipArchiveExtractor.class);

    private static final byte[] ZIP_MAGIC = {0x50, 0x4B, 0x03, 0x04};

    private final Path extractionDirectory;
    private final List<String> archiveExtensions;
    private final Charset entryEncoding;

    public ZipArchiveExtractor() {
        this(new EpubParserConfig());
    }

    public ZipArchiveExtractor(EpubParserConfig config) {
        this.extractionDirectory = config.getExtractionDirectory() != null
                ? Paths.get(config.getExtractionDirectory()).toAbsolutePath()
                : null;
        this.archiveExtensions = config.getArchiveExtensions().stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .toList();
        this.entryEncoding = Charset.forName(config.getEntryEncoding());
    }

    @Override
    public Path extract(Path archive) throws IOException {
        Path source = archive.toAbsolutePath();
        if (!Files.isRegularFile(source)) {
            throw new NoSuchFileException(source.toString());
        }
        if (!hasArchiveExtension(source) && !hasZipSignature(source)) {
            throw new IOException("Unsupported archive format: " + source.getFileName());
        }

        Path target = targetDirectory(source);
        int count = 0;
        try (ZipFile zipFile = ZipFile.builder()
                .setPath(source)
                .setCharset(entryEncoding)
                .setUseUnicodeExtraFields(true)
                .get()) {
            Files.createDirectories(target);
            Enumeration<ZipArchiveEntry> entries = zipFile.getEntries();
            while (entries.hasMoreElements()) {
                ZipArchiveEntry entry = entries.nextElement();
                Path destination = target.resolve(entry.getName()).normalize();
                if (!destination.startsWith(target)) {
                    throw new IOException("Archive entry escapes target directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(destination);
                    continue;
                }
                Files.createDirectories(destination.getParent());
                try (InputStream in = zipFile.getInputStream(entry)) {
                    Files.copy(in, destination, StandardCopyOption.REPLACE_EXISTING);
                }
                count++;
            }
        }

        logger.debug("Extracted {} entries from {} to {}", count, source.getFileName(), target);
        return target;
    }

    Path targetDirectory(Path archive) {
        String fileName = archive.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String name = dot > 0 ? fileName.substring(0, dot) : fileName + "-extracted";
        Path root = extractionDirectory != null ? extractionDirectory : archive.getParent();
        return root.resolve(name).normalize();
    }

    private boolean hasArchiveExtension(Path archive) {
        String fileName = archive.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 && archiveExtensions.contains(fileName.substring(dot + 1));
    }

    private boolean hasZipSignature(Path archive) {
        try (InputStream is = new BufferedInputStream(Files.newInputStream(archive))) {
            byte[] buffer = is.readNBytes(ZIP_MAGIC.length);
            if (buffer.length < ZIP_MAGIC.length) {
                return false;
            }
            for (int i = 0; i < ZIP_MAGIC.length; i++) {
                if (buffer[i] != ZIP_MAGIC[i]) {
                    return false;
                }
            }
            return true;
        } catch (IOException e) {
            logger.warn("Failed to read signature of {}: {}", archive, e.getMessage());
            return false;
        }
    }
}
