package com.williamcallahan.cleanhtml.service.html;

import com.williamcallahan.cleanhtml.domain.html.BlockTags;
import com.williamcallahan.cleanhtml.domain.html.HtmlElement;
import com.williamcallahan.cleanhtml.domain.html.HtmlFragment;
import com.williamcallahan.cleanhtml.domain.html.HtmlNode;
import com.williamcallahan.cleanhtml.domain.html.HtmlText;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses markup with jsoup and converts the result into an immutable {@link HtmlFragment}.
 *
 * <p>Comments, doctypes and processing instructions are dropped during conversion.
 */
public final class FragmentParser {

    private static final String PARAGRAPH_TAG = "p";

    private FragmentParser() {}

    /**
     * Parses a full, possibly malformed, HTML document and returns its body content.
     *
     * <p>Loose inline content sitting directly in the body (text, {@code b}, {@code a}...)
     * is gathered into a paragraph, the way a permissive parser implies one.
     *
     * @param html document markup
     * @return body content as a fragment
     */
    public static HtmlFragment parseDocument(String html) {
        Document document = Jsoup.parse(html == null ? "" : html);
        return wrapLooseInlineContent(new HtmlFragment(convertChildren(document.body())));
    }

    /**
     * Parses markup that is already well formed, such as sanitizing filter output.
     *
     * <p>The XML parser adds no implied structure: no {@code tbody}, no implied paragraphs.
     *
     * @param markup well-formed fragment markup
     * @return fragment holding the top-level nodes as written
     */
    public static HtmlFragment parseWellFormed(String markup) {
        Document document = Jsoup.parse(markup == null ? "" : markup, "", Parser.xmlParser());
        return new HtmlFragment(convertChildren(document));
    }

    private static List<HtmlNode> convertChildren(Node parent) {
        List<HtmlNode> converted = new ArrayList<>(parent.childNodeSize());
        for (Node child : parent.childNodes()) {
            if (child instanceof Element element) {
                converted.add(convertElement(element));
            } else if (child instanceof TextNode textNode) {
                converted.add(new HtmlText(textNode.getWholeText()));
            } else if (child instanceof DataNode dataNode) {
                converted.add(new HtmlText(dataNode.getWholeData()));
            }
        }
        return converted;
    }

    private static HtmlElement convertElement(Element element) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (Attribute attribute : element.attributes()) {
            attributes.put(attribute.getKey(), attribute.getValue());
        }
        return new HtmlElement(element.normalName(), attributes, convertChildren(element));
    }

    /**
     * Gathers each run of top-level inline nodes into a paragraph. Runs holding only
     * whitespace are dropped.
     *
     * @param fragment parsed content
     * @return fragment whose top-level nodes are all block elements
     */
    public static HtmlFragment wrapLooseInlineContent(HtmlFragment fragment) {
        List<HtmlNode> wrapped = new ArrayList<>(fragment.nodes().size());
        List<HtmlNode> inlineRun = new ArrayList<>();
        for (HtmlNode node : fragment.nodes()) {
            if (node instanceof HtmlElement element && BlockTags.isBlock(element.tagName())) {
                flushInlineRun(inlineRun, wrapped);
                wrapped.add(node);
            } else {
                inlineRun.add(node);
            }
        }
        flushInlineRun(inlineRun, wrapped);
        return new HtmlFragment(wrapped);
    }

    private static void flushInlineRun(List<HtmlNode> inlineRun, List<HtmlNode> target) {
        boolean hasContent = inlineRun.stream().anyMatch(node -> !node.isBlankText());
        if (hasContent) {
            target.add(new HtmlElement(PARAGRAPH_TAG, Map.of(), trimRunEdges(inlineRun)));
        }
        inlineRun.clear();
    }

    private static List<HtmlNode> trimRunEdges(List<HtmlNode> inlineRun) {
        List<HtmlNode> trimmed = new ArrayList<>(inlineRun);
        while (!trimmed.isEmpty() && trimmed.get(0).isBlankText()) {
            trimmed.remove(0);
        }
        while (!trimmed.isEmpty() && trimmed.get(trimmed.size() - 1).isBlankText()) {
            trimmed.remove(trimmed.size() - 1);
        }
        if (!trimmed.isEmpty() && trimmed.get(0) instanceof HtmlText first) {
            trimmed.set(0, new HtmlText(first.content().stripLeading()));
        }
        int lastIndex = trimmed.size() - 1;
        if (lastIndex >= 0 && trimmed.get(lastIndex) instanceof HtmlText last) {
            trimmed.set(lastIndex, new HtmlText(last.content().stripTrailing()));
        }
        return trimmed;
    }
}
