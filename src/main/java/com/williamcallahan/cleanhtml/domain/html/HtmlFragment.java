package com.williamcallahan.cleanhtml.domain.html;

import java.util.List;

/**
 * Body-level content of a document, independent of any document shell.
 *
 * @param nodes top-level nodes in document order
 */
public record HtmlFragment(List<HtmlNode> nodes) {

    public HtmlFragment {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    /**
     * Returns a fragment with no content.
     *
     * @return empty fragment
     */
    public static HtmlFragment empty() {
        return new HtmlFragment(List.of());
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
