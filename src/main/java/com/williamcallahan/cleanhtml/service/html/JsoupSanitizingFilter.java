package com.williamcallahan.cleanhtml.service.html;

import com.williamcallahan.cleanhtml.domain.cleaning.AllowedTags;
import com.williamcallahan.cleanhtml.domain.cleaning.TagRule;
import com.williamcallahan.cleanhtml.support.AsciiTextNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.safety.Cleaner;
import org.jsoup.safety.Safelist;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@link SanitizingFilter} backed by jsoup's {@link Cleaner}.
 *
 * <p>Disallowed elements are unwrapped (their text survives), disallowed attributes are
 * dropped and {@code href}/{@code src} values must use a web or mail protocol. Relative
 * links are resolved against a base URI only to check their protocol and are written back
 * unchanged.
 */
public class JsoupSanitizingFilter implements SanitizingFilter {

    private static final Logger logger = LoggerFactory.getLogger(JsoupSanitizingFilter.class);

    /** Base used to resolve relative links when checking their protocol. */
    public static final String DEFAULT_RELATIVE_LINK_BASE = "https://localhost/";

    private static final String[] LINK_PROTOCOLS = {"http", "https", "mailto", "ftp", "tel"};
    private static final String[] IMAGE_PROTOCOLS = {"http", "https"};

    private final String relativeLinkBase;

    public JsoupSanitizingFilter() {
        this(DEFAULT_RELATIVE_LINK_BASE);
    }

    /**
     * Creates a filter.
     *
     * @param relativeLinkBase absolute URI relative links are resolved against for protocol checks
     */
    public JsoupSanitizingFilter(String relativeLinkBase) {
        this.relativeLinkBase = Objects.requireNonNull(relativeLinkBase, "Relative link base cannot be null");
    }

    @Override
    public String filter(String fragmentText, AllowedTags allowedTags) {
        Document dirty = Jsoup.parseBodyFragment(fragmentText == null ? "" : fragmentText, relativeLinkBase);
        Document clean = new Cleaner(toSafelist(allowedTags)).clean(dirty);
        int removed = removeEmptyElements(clean.body());
        if (removed > 0) {
            logger.debug("Removed {} empty elements after filtering", removed);
        }
        clean.outputSettings()
                .syntax(Document.OutputSettings.Syntax.xml)
                .escapeMode(Entities.EscapeMode.xhtml)
                .charset(StandardCharsets.UTF_8)
                .prettyPrint(false);
        return clean.body().html();
    }

    static Safelist toSafelist(AllowedTags allowedTags) {
        Safelist safelist = new Safelist();
        for (TagRule rule : allowedTags.rules()) {
            safelist.addTags(rule.tagName());
            if (!rule.attributes().isEmpty()) {
                safelist.addAttributes(rule.tagName(), rule.attributes().toArray(new String[0]));
            }
        }
        allowedTags.rule("a")
                .filter(rule -> rule.attributes().contains("href"))
                .ifPresent(rule -> safelist.addProtocols("a", "href", LINK_PROTOCOLS));
        allowedTags.rule("img")
                .filter(rule -> rule.attributes().contains("src"))
                .ifPresent(rule -> safelist.addProtocols("img", "src", IMAGE_PROTOCOLS));
        return safelist.preserveRelativeLinks(true);
    }

    /**
     * Removes elements without meaningful content, children before parents, so a wrapper
     * whose only child was empty goes too. Void elements such as {@code br}, {@code hr}
     * and {@code img} count as content.
     */
    private static int removeEmptyElements(Element body) {
        Elements all = body.getAllElements();
        int removed = 0;
        for (int index = all.size() - 1; index >= 0; index--) {
            Element element = all.get(index);
            if (element == body || element.parent() == null) {
                continue;
            }
            if (isEmpty(element)) {
                element.remove();
                removed++;
            }
        }
        return removed;
    }

    private static boolean isEmpty(Element element) {
        if (element.tag().isEmpty()) {
            return false;
        }
        for (Element descendant : element.getAllElements()) {
            if (descendant.tag().isEmpty()) {
                return false;
            }
        }
        return AsciiTextNormalizer.isBlankIncludingNbsp(element.wholeText());
    }
}
