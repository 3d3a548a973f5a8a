package im.arun.epubparser.exception;

/**
 * Raised when {@code META-INF/container.xml} is missing, malformed or does not
 * declare the package document path.
 */
public class ContainerException extends EpubParseException {

    public ContainerException(String message) {
        super(message);
    }

    public ContainerException(String message, Throwable cause) {
        super(message, cause);
    }
}
