package im.arun.epubparser.toc;

import im.arun.epubparser.exception.TableOfContentsException;
import im.arun.epubparser.model.TableOfContents;
import im.arun.epubparser.xml.XmlElement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Builds the table of contents tree from an NCX navigation document.
 * <p>
 * The root node takes the {@code docTitle} text as its label and the {@code dtb:uid}
 * head meta as its item. Each {@code navPoint} becomes a child node; nesting follows
 * the source document, so the result is a finite tree without back references.
 */
public class TocExtractor {

    static final String UID_META_NAME = "dtb:uid";

    /**
     * @param ncx root element of the navigation document
     * @throws TableOfContentsException if the title is missing or a navigation point is incomplete
     */
    public TableOfContents extract(XmlElement ncx) {
        String label = ncx.child("docTitle")
                .flatMap(title -> title.child("text"))
                .flatMap(XmlElement::text)
                .orElseThrow(() -> new TableOfContentsException("Navigation document has no docTitle/text"));

        String item = ncx.child("head")
                .flatMap(head -> head.children("meta", "name", UID_META_NAME).stream().findFirst())
                .flatMap(meta -> meta.attribute("content"))
                .orElse(null);

        List<TableOfContents> subTable = ncx.child("navMap")
                .map(this::navPoints)
                .orElseGet(List::of);

        return TableOfContents.builder()
                .label(label)
                .id(TableOfContents.ROOT_ID)
                .item(item)
                .subTable(subTable)
                .build();
    }

    private List<TableOfContents> navPoints(XmlElement navMap) {
        // explicit stack, nesting depth is controlled by the document
        Deque<NavPointFrame> stack = new ArrayDeque<>();
        NavPointFrame root = new NavPointFrame(null, null, null, navMap.children("navPoint"));
        stack.push(root);
        while (!stack.isEmpty()) {
            NavPointFrame frame = stack.peek();
            if (frame.pending.hasNext()) {
                stack.push(open(frame.pending.next()));
                continue;
            }
            stack.pop();
            if (frame != root) {
                stack.peek().entries.add(frame.toEntry());
            }
        }
        return root.entries;
    }

    private NavPointFrame open(XmlElement point) {
        String id = point.attribute("id")
                .orElseThrow(() -> new TableOfContentsException("Navigation point has no id attribute"));
        String label = point.child("navLabel")
                .flatMap(navLabel -> navLabel.child("text"))
                .flatMap(XmlElement::text)
                .orElseThrow(() -> new TableOfContentsException("Navigation point '" + id + "' has no navLabel/text"));
        String source = point.child("content")
                .flatMap(content -> content.attribute("src"))
                .orElseThrow(() -> new TableOfContentsException("Navigation point '" + id + "' has no content src"));
        return new NavPointFrame(id, label, source, point.children("navPoint"));
    }

    private static final class NavPointFrame {
        private final String id;
        private final String label;
        private final String source;
        private final Iterator<XmlElement> pending;
        private final List<TableOfContents> entries = new ArrayList<>();

        private NavPointFrame(String id, String label, String source, List<XmlElement> children) {
            this.id = id;
            this.label = label;
            this.source = source;
            this.pending = children.iterator();
        }

        private TableOfContents toEntry() {
            return TableOfContents.builder()
                    .label(label)
                    .id(id)
                    .item(source)
                    .subTable(entries)
                    .build();
        }
    }
}
