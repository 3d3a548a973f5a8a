package im.arun.epubparser.opf;

import im.arun.epubparser.exception.SpineException;
import im.arun.epubparser.model.PageProgressionDirection;
import im.arun.epubparser.model.Spine;
import im.arun.epubparser.model.SpineItem;
import im.arun.epubparser.xml.XmlElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Maps the package {@code spine} element to a {@link Spine}, keeping itemref order.
 */
public class SpineExtractor {
    private static final Logger logger = LoggerFactory.getLogger(SpineExtractor.class);

    public Spine extract(XmlElement spine) {
        if (spine == null) {
            throw new SpineException("Package document has no spine");
        }

        Spine.SpineBuilder builder = Spine.builder()
                .id(spine.attribute("id").orElse(null))
                .toc(spine.attribute("toc").orElse(null));

        String direction = spine.attribute("page-progression-direction").orElse(null);
        PageProgressionDirection progression = PageProgressionDirection.fromAttribute(direction);
        if (progression == PageProgressionDirection.UNSPECIFIED) {
            logger.warn("Unrecognised page-progression-direction '{}'", direction);
        }
        builder.pageProgressionDirection(progression);

        List<XmlElement> itemrefs = spine.children("itemref");
        for (int i = 0; i < itemrefs.size(); i++) {
            XmlElement itemref = itemrefs.get(i);
            int position = i + 1;
            String idref = itemref.attribute("idref")
                    .orElseThrow(() -> new SpineException("Spine itemref #" + position + " has no idref attribute"));
            builder.item(SpineItem.builder()
                    .id(itemref.attribute("id").orElse(null))
                    .idref(idref)
                    .linear(isLinear(itemref))
                    .build());
        }

        return builder.build();
    }

    // Only an absent attribute or the exact value "yes" counts as linear
    private boolean isLinear(XmlElement itemref) {
        return itemref.attribute("linear").map("yes"::equals).orElse(true);
    }
}
