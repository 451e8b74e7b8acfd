package com.williamcallahan.cleanhtml.service.html;

import com.williamcallahan.cleanhtml.domain.html.HtmlElement;
import com.williamcallahan.cleanhtml.domain.html.HtmlFragment;
import com.williamcallahan.cleanhtml.domain.html.HtmlNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Structural fixes for markup produced by word processors and rich-text editors.
 *
 * <p>Every transform takes a fragment and returns a new one; renamed or unwrapped nodes keep
 * their attribute values and child order.
 */
public class DomNormalizer {

    /** Default upper bound on the text length of a bold line promoted to a heading. */
    public static final int DEFAULT_HEADING_MAX_LENGTH = 60;

    private static final String TOP_HEADING = "h1";
    private static final String SECTION_HEADING = "h2";
    private static final String PARAGRAPH = "p";
    private static final String LIST_ITEM = "li";
    private static final String SPAN = "span";
    private static final String[] BOLD_TAGS = {"b", "strong"};
    private static final Set<String> PRESENTATIONAL_SPAN_ATTRIBUTES = Set.of("style", "class", "lang", "dir");

    private final int headingMaxLength;

    public DomNormalizer() {
        this(DEFAULT_HEADING_MAX_LENGTH);
    }

    /**
     * Creates a normalizer.
     *
     * @param headingMaxLength longest bold-only paragraph text still turned into a heading
     */
    public DomNormalizer(int headingMaxLength) {
        if (headingMaxLength <= 0) {
            throw new IllegalArgumentException("Heading max length must be positive");
        }
        this.headingMaxLength = headingMaxLength;
    }

    /**
     * Runs every transform in order.
     *
     * @param fragment parsed content
     * @param unwrapListItemParagraphs whether paragraphs directly inside list items are unwrapped;
     *                                 only the first pass over raw input does this
     * @return normalized fragment
     */
    public HtmlFragment normalize(HtmlFragment fragment, boolean unwrapListItemParagraphs) {
        HtmlFragment normalized = demoteTopHeadings(fragment);
        normalized = promoteBoldParagraphs(normalized);
        normalized = unwrapBoldInHeadings(normalized);
        normalized = stripPresentationSpans(normalized);
        if (unwrapListItemParagraphs) {
            normalized = unwrapListItemParagraphs(normalized);
        }
        return normalized;
    }

    /**
     * Renames every {@code h1} to {@code h2}; fragments never carry a page title.
     */
    public HtmlFragment demoteTopHeadings(HtmlFragment fragment) {
        return rewrite(fragment, element -> element.isNamed(TOP_HEADING)
                ? List.of(element.renamed(SECTION_HEADING))
                : List.of(element));
    }

    /**
     * Turns a top-level paragraph holding nothing but a short bold run into an {@code h2}.
     */
    public HtmlFragment promoteBoldParagraphs(HtmlFragment fragment) {
        List<HtmlNode> promoted = new ArrayList<>(fragment.nodes().size());
        for (HtmlNode node : fragment.nodes()) {
            if (node instanceof HtmlElement paragraph && paragraph.isNamed(PARAGRAPH)) {
                HtmlElement boldRun = soleBoldChild(paragraph);
                if (boldRun != null && isHeadingLength(boldRun)) {
                    promoted.add(new HtmlElement(SECTION_HEADING, paragraph.attributes(), boldRun.children()));
                    continue;
                }
            }
            promoted.add(node);
        }
        return new HtmlFragment(promoted);
    }

    /**
     * Unwraps a {@code b} or {@code strong} that is the only content of an {@code h2}.
     */
    public HtmlFragment unwrapBoldInHeadings(HtmlFragment fragment) {
        return rewrite(fragment, element -> {
            if (!element.isNamed(SECTION_HEADING) || soleBoldChild(element) == null) {
                return List.of(element);
            }
            return List.of(element.withChildren(flatten(element.children(), DomNormalizer::isBold)));
        });
    }

    /**
     * Replaces spans that only carry styling with their children.
     */
    public HtmlFragment stripPresentationSpans(HtmlFragment fragment) {
        return rewrite(fragment, element -> element.isNamed(SPAN) && isPresentational(element)
                ? element.children()
                : List.of(element));
    }

    /**
     * Replaces paragraphs sitting directly inside list items with their children.
     */
    public HtmlFragment unwrapListItemParagraphs(HtmlFragment fragment) {
        return rewrite(fragment, element -> element.isNamed(LIST_ITEM)
                ? List.of(element.withChildren(flatten(element.children(),
                        child -> child instanceof HtmlElement candidate && candidate.isNamed(PARAGRAPH))))
                : List.of(element));
    }

    /**
     * Drops every element with one of the given names, content included.
     *
     * @param fragment content to filter
     * @param tagNames lowercase tag names to remove
     * @return fragment without those elements
     */
    public HtmlFragment removeElements(HtmlFragment fragment, Set<String> tagNames) {
        return rewrite(fragment, element -> tagNames.contains(element.tagName())
                ? List.of()
                : List.of(element));
    }

    private boolean isHeadingLength(HtmlElement boldRun) {
        String text = boldRun.textContent().strip();
        return !text.isEmpty() && text.length() <= headingMaxLength;
    }

    private static HtmlElement soleBoldChild(HtmlElement parent) {
        List<HtmlNode> significant = parent.significantChildren();
        if (significant.size() == 1 && isBold(significant.get(0))) {
            return (HtmlElement) significant.get(0);
        }
        return null;
    }

    private static boolean isBold(HtmlNode node) {
        return node instanceof HtmlElement element && element.isNamed(BOLD_TAGS);
    }

    private static boolean isPresentational(HtmlElement span) {
        return PRESENTATIONAL_SPAN_ATTRIBUTES.containsAll(span.attributes().keySet());
    }

    private static List<HtmlNode> flatten(List<HtmlNode> children, Predicate<HtmlNode> unwrap) {
        List<HtmlNode> flattened = new ArrayList<>(children.size());
        for (HtmlNode child : children) {
            if (unwrap.test(child)) {
                flattened.addAll(((HtmlElement) child).children());
            } else {
                flattened.add(child);
            }
        }
        return flattened;
    }

    /**
     * Applies a rule bottom-up: children are rewritten before their parent sees them. The rule
     * returns the nodes that replace an element, so it can keep, rename, unwrap or drop it.
     */
    private static HtmlFragment rewrite(HtmlFragment fragment, Function<HtmlElement, List<HtmlNode>> rule) {
        return new HtmlFragment(rewriteAll(fragment.nodes(), rule));
    }

    private static List<HtmlNode> rewriteAll(List<HtmlNode> nodes, Function<HtmlElement, List<HtmlNode>> rule) {
        List<HtmlNode> rewritten = new ArrayList<>(nodes.size());
        for (HtmlNode node : nodes) {
            if (node instanceof HtmlElement element) {
                HtmlElement withRewrittenChildren = element.withChildren(rewriteAll(element.children(), rule));
                rewritten.addAll(rule.apply(withRewrittenChildren));
            } else {
                rewritten.add(node);
            }
        }
        return rewritten;
    }
}
