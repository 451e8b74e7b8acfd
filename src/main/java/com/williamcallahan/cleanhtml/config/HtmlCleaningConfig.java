package com.williamcallahan.cleanhtml.config;

import com.williamcallahan.cleanhtml.service.HtmlCleaningService;
import com.williamcallahan.cleanhtml.service.html.DomNormalizer;
import com.williamcallahan.cleanhtml.service.html.JsoupSanitizingFilter;
import com.williamcallahan.cleanhtml.service.html.SanitizingFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the cleaning pipeline from {@link CleanHtmlProperties}.
 */
@Configuration
@EnableConfigurationProperties(CleanHtmlProperties.class)
public class HtmlCleaningConfig {

    private static final Logger logger = LoggerFactory.getLogger(HtmlCleaningConfig.class);

    @Bean
    public SanitizingFilter sanitizingFilter(CleanHtmlProperties properties) {
        return new JsoupSanitizingFilter(properties.getFilter().getRelativeLinkBase());
    }

    @Bean
    public DomNormalizer domNormalizer(CleanHtmlProperties properties) {
        return new DomNormalizer(properties.getHeadingMaxLength());
    }

    @Bean
    public HtmlCleaningService htmlCleaningService(SanitizingFilter sanitizingFilter,
                                                   DomNormalizer domNormalizer,
                                                   CleanHtmlProperties properties) {
        HtmlCleaningService service = new HtmlCleaningService(
                sanitizingFilter, domNormalizer, properties.getOptions().toCleaningOptions());
        logger.info("HTML cleaning service ready with options {}", service.getOptions());
        return service;
    }
}
