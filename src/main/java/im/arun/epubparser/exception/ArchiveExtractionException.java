package im.arun.epubparser.exception;

import java.nio.file.Path;

/**
 * Raised when the EPUB archive is missing, corrupt or not a zip container.
 */
public class ArchiveExtractionException extends EpubParseException {

    public ArchiveExtractionException(Path archive, Throwable cause) {
        super("Failed to extract archive " + archive + ": "
                + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()), cause);
    }
}
