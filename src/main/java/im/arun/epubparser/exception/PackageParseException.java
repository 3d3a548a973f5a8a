package im.arun.epubparser.exception;

/**
 * Raised when an XML document inside the package cannot be read or parsed.
 */
public class PackageParseException extends EpubParseException {

    public PackageParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
