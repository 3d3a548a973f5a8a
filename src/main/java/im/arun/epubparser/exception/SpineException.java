package im.arun.epubparser.exception;

/**
 * Raised when the spine is missing or an {@code itemref} lacks its {@code idref}.
 */
public class SpineException extends EpubParseException {

    public SpineException(String message) {
        super(message);
    }
}
