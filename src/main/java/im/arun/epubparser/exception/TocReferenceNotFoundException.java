package im.arun.epubparser.exception;

/**
 * Raised when the spine declares no {@code toc} reference, or the reference does not
 * match any manifest item.
 */
public class TocReferenceNotFoundException extends EpubParseException {

    private final String itemId;

    public TocReferenceNotFoundException(String itemId) {
        super(itemId == null
                ? "Spine does not declare a toc reference"
                : "No manifest item with id '" + itemId + "'");
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
