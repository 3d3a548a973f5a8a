package im.arun.epubparser.archive;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Materialises an archive on disk and returns the directory holding its entries.
 */
public interface ArchiveExtractor {

    Path extract(Path archive) throws IOException;
}
