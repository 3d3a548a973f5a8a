package im.arun.epubparser.exception;

/**
 * Base type for every failure raised while parsing an EPUB package.
 * A parse call that throws one of these never returns a partial document.
 */
public abstract class EpubParseException extends RuntimeException {

    protected EpubParseException(String message) {
        super(message);
    }

    protected EpubParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
