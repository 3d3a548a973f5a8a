package im.arun.epubparser.exception;

/**
 * Raised when the manifest has no items or an item lacks its {@code id} or {@code href}.
 */
public class ManifestException extends EpubParseException {

    public ManifestException(String message) {
        super(message);
    }
}
