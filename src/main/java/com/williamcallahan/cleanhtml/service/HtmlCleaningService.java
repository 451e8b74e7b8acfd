package com.williamcallahan.cleanhtml.service;

import com.williamcallahan.cleanhtml.domain.cleaning.CleaningOptions;
import com.williamcallahan.cleanhtml.domain.cleaning.InvalidCleaningOptionException;
import com.williamcallahan.cleanhtml.domain.html.HtmlFragment;
import com.williamcallahan.cleanhtml.service.html.DomNormalizer;
import com.williamcallahan.cleanhtml.service.html.FragmentParser;
import com.williamcallahan.cleanhtml.service.html.FragmentSerializer;
import com.williamcallahan.cleanhtml.service.html.HtmlPreprocessor;
import com.williamcallahan.cleanhtml.service.html.JsoupSanitizingFilter;
import com.williamcallahan.cleanhtml.service.html.ParagraphReconstructor;
import com.williamcallahan.cleanhtml.service.html.QuoteNormalizer;
import com.williamcallahan.cleanhtml.service.html.SanitizingFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Cleans pasted HTML into a minimal, allowlisted fragment.
 *
 * <p>The pipeline runs the structural normalizer twice: once on the raw parse and again on the
 * sanitizing filter's output, so that tags unwrapped by the filter cannot leave editor
 * artifacts behind. Each call works on its own trees; the only shared state is the current
 * {@link CleaningOptions}, which is swapped as a whole.
 */
public class HtmlCleaningService {

    private static final Logger logger = LoggerFactory.getLogger(HtmlCleaningService.class);
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    private static final Set<String> SCRIPT_TAGS = Set.of("script");
    private static final String PARAGRAPH_TAG = "p";

    private final SanitizingFilter sanitizingFilter;
    private final DomNormalizer domNormalizer;
    private volatile CleaningOptions options;

    public HtmlCleaningService() {
        this(new JsoupSanitizingFilter(), new DomNormalizer(), CleaningOptions.defaults());
    }

    /**
     * Creates a service.
     *
     * @param sanitizingFilter allowlist enforcer run between the normalizer passes
     * @param domNormalizer structural transforms
     * @param initialOptions options in effect until {@link #setOptions(Map)} is called
     */
    public HtmlCleaningService(SanitizingFilter sanitizingFilter, DomNormalizer domNormalizer,
                               CleaningOptions initialOptions) {
        this.sanitizingFilter = Objects.requireNonNull(sanitizingFilter, "Sanitizing filter cannot be null");
        this.domNormalizer = Objects.requireNonNull(domNormalizer, "DOM normalizer cannot be null");
        this.options = Objects.requireNonNull(initialOptions, "Initial options cannot be null");
    }

    /**
     * Cleans a chunk of HTML.
     *
     * @param html raw markup, possibly malformed; null is treated as empty
     * @return well-formed fragment restricted to the allowed tags of the current options
     */
    public String clean(String html) {
        String input = html == null ? "" : html;
        CleaningOptions snapshot = options;
        PIPELINE_LOG.debug("CLEAN - Starting, input length: {}", input.length());

        String preprocessed = HtmlPreprocessor.preprocess(input);
        HtmlFragment parsed = FragmentParser.parseDocument(preprocessed);
        parsed = domNormalizer.removeElements(parsed, SCRIPT_TAGS);
        String normalized = FragmentSerializer.serialize(domNormalizer.normalize(parsed, true));
        PIPELINE_LOG.debug("CLEAN - First normalization pass produced {} chars", normalized.length());

        String filtered = sanitizingFilter.filter(normalized, snapshot.allowedTags());
        PIPELINE_LOG.debug("CLEAN - Filter kept {} chars using [{}]",
                filtered.length(), snapshot.allowedTags().describe());

        HtmlFragment refiltered = FragmentParser.parseWellFormed(filtered);
        if (snapshot.allowedTags().allows(PARAGRAPH_TAG)) {
            // text freed from unwrapped containers is wrapped as parseDocument would wrap it
            refiltered = FragmentParser.wrapLooseInlineContent(refiltered);
        }
        String cleaned = finalizeOutput(FragmentSerializer.serialize(domNormalizer.normalize(refiltered, false)));
        PIPELINE_LOG.debug("CLEAN - Completed, output length: {}", cleaned.length());
        return cleaned;
    }

    /**
     * Wraps loosely formatted text in paragraphs and converts single newlines to line breaks.
     *
     * @param text text or HTML to reconstruct
     * @return paragraph markup
     */
    public String reconstruct(String text) {
        return ParagraphReconstructor.reconstruct(text);
    }

    /**
     * Wraps loosely formatted text in paragraphs.
     *
     * @param text text or HTML to reconstruct
     * @param insertLineBreaks whether single newlines become {@code <br />}
     * @return paragraph markup
     */
    public String reconstruct(String text, boolean insertLineBreaks) {
        return ParagraphReconstructor.reconstruct(text, insertLineBreaks);
    }

    /**
     * Replaces typographic quotes with ASCII quotes.
     *
     * @param text text to normalize
     * @return normalized text
     */
    public String normalizeQuotes(String text) {
        return QuoteNormalizer.normalizeQuotes(text);
    }

    /**
     * Updates some or all cleaning options. Either every entry applies or none does.
     *
     * @param overrides option values keyed by option name
     * @throws InvalidCleaningOptionException when a key is unknown or a value is null
     */
    public synchronized void setOptions(Map<String, Boolean> overrides) {
        CleaningOptions updated = options.withOverrides(overrides);
        options = updated;
        logger.info("Cleaning options updated: {}", updated.asMap());
    }

    /**
     * Returns the current option values.
     *
     * @return unmodifiable snapshot keyed by option name
     */
    public Map<String, Boolean> getOptions() {
        return options.asMap();
    }

    public CleaningOptions getCleaningOptions() {
        return options;
    }

    private static String finalizeOutput(String serialized) {
        if (serialized.endsWith("\n")) {
            return serialized.substring(0, serialized.length() - 1);
        }
        return serialized;
    }
}
