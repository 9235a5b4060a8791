package org.netpreserve.sitemirror.blockid;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects the block anchors rendered into a page.
 */
public class BlockIdExtractor {
    public static final String ATTRIBUTE = "data-block-id";

    /**
     * @return raw ID to the canonical ID exactly as rendered, in document order
     */
    public Map<String, String> extract(String html) {
        return extract(Jsoup.parse(html));
    }

    public Map<String, String> extract(Document document) {
        var blockIds = new LinkedHashMap<String, String>();
        for (Element element : document.select("[" + ATTRIBUTE + "]")) {
            String canonical = element.attr(ATTRIBUTE).strip();
            String raw = BlockIds.normalize(canonical);
            if (raw != null) {
                blockIds.putIfAbsent(raw, canonical);
            }
        }
        return blockIds;
    }
}
