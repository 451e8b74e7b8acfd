package com.williamcallahan.cleanhtml.config;

import com.williamcallahan.cleanhtml.domain.cleaning.CleaningOptions;
import com.williamcallahan.cleanhtml.service.html.DomNormalizer;
import com.williamcallahan.cleanhtml.service.html.JsoupSanitizingFilter;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Settings under {@code clean-html.*}.
 */
@ConfigurationProperties(prefix = "clean-html")
public class CleanHtmlProperties {

    private static final String HEADING_LENGTH_KEY = "clean-html.heading-max-length";
    private static final String LINK_BASE_KEY = "clean-html.filter.relative-link-base";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String ABSOLUTE_URI_FMT = "%s must be an absolute URI.";

    private int headingMaxLength = DomNormalizer.DEFAULT_HEADING_MAX_LENGTH;
    private Options options = new Options();
    private Filter filter = new Filter();

    /**
     * Validates settings once they are bound.
     */
    @PostConstruct
    public void validateConfiguration() {
        if (headingMaxLength < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, HEADING_LENGTH_KEY));
        }
        filter.validateConfiguration();
    }

    public int getHeadingMaxLength() {
        return headingMaxLength;
    }

    public void setHeadingMaxLength(int headingMaxLength) {
        this.headingMaxLength = headingMaxLength;
    }

    public Options getOptions() {
        return options;
    }

    public void setOptions(Options options) {
        this.options = options;
    }

    public Filter getFilter() {
        return filter;
    }

    public void setFilter(Filter filter) {
        this.filter = filter;
    }

    /**
     * Cleaning switches in effect at startup.
     */
    public static class Options {
        private boolean images;
        private boolean italics;
        private boolean links;
        private boolean table;
        private boolean strip;

        public CleaningOptions toCleaningOptions() {
            return new CleaningOptions(images, italics, links, table, strip);
        }

        public boolean isImages() {
            return images;
        }

        public void setImages(boolean images) {
            this.images = images;
        }

        public boolean isItalics() {
            return italics;
        }

        public void setItalics(boolean italics) {
            this.italics = italics;
        }

        public boolean isLinks() {
            return links;
        }

        public void setLinks(boolean links) {
            this.links = links;
        }

        public boolean isTable() {
            return table;
        }

        public void setTable(boolean table) {
            this.table = table;
        }

        public boolean isStrip() {
            return strip;
        }

        public void setStrip(boolean strip) {
            this.strip = strip;
        }
    }

    /**
     * Sanitizing filter settings.
     */
    public static class Filter {
        private String relativeLinkBase = JsoupSanitizingFilter.DEFAULT_RELATIVE_LINK_BASE;

        void validateConfiguration() {
            if (relativeLinkBase == null || relativeLinkBase.isBlank()) {
                throw new IllegalArgumentException(String.format(Locale.ROOT, ABSOLUTE_URI_FMT, LINK_BASE_KEY));
            }
            try {
                if (!new URI(relativeLinkBase).isAbsolute()) {
                    throw new IllegalArgumentException(String.format(Locale.ROOT, ABSOLUTE_URI_FMT, LINK_BASE_KEY));
                }
            } catch (URISyntaxException syntaxException) {
                throw new IllegalArgumentException(
                        String.format(Locale.ROOT, ABSOLUTE_URI_FMT, LINK_BASE_KEY), syntaxException);
            }
        }

        public String getRelativeLinkBase() {
            return relativeLinkBase;
        }

        public void setRelativeLinkBase(String relativeLinkBase) {
            this.relativeLinkBase = relativeLinkBase;
        }
    }
}
