package im.arun.epubparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * A node of the table of contents. The root carries the document title and the
 * id {@value #ROOT_ID}; every other node maps one NCX navigation point.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TableOfContents {

    public static final String ROOT_ID = "0";

    @NonNull
    @JsonProperty("label")
    String label;

    @NonNull
    @JsonProperty("id")
    String id;

    @JsonProperty("item")
    String item;

    @Singular("subEntry")
    @JsonProperty("sub_table")
    List<TableOfContents> subTable;

    /**
     * Returns this node followed by all its descendants in pre-order.
     */
    public List<TableOfContents> flatten() {
        List<TableOfContents> nodes = new ArrayList<>();
        Deque<TableOfContents> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            TableOfContents node = pending.pop();
            nodes.add(node);
            for (int i = node.getSubTable().size() - 1; i >= 0; i--) {
                pending.push(node.getSubTable().get(i));
            }
        }
        return nodes;
    }

    /**
     * Number of levels below and including this node; a leaf has depth 1.
     */
    public int depth() {
        int depth = 0;
        List<TableOfContents> level = List.of(this);
        while (!level.isEmpty()) {
            depth++;
            List<TableOfContents> next = new ArrayList<>();
            for (TableOfContents node : level) {
                next.addAll(node.getSubTable());
            }
            level = next;
        }
        return depth;
    }
}
