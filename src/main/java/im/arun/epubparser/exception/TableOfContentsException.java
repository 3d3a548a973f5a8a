package im.arun.epubparser.exception;

/**
 * Raised when the NCX document has no title, or a navigation point lacks its label,
 * id or content source.
 */
public class TableOfContentsException extends EpubParseException {

    public TableOfContentsException(String message) {
        super(message);
    }
}
