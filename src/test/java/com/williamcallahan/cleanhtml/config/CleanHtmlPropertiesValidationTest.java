package com.williamcallahan.cleanhtml.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/**
 * Verifies startup validation of the cleaning settings.
 */
class CleanHtmlPropertiesValidationTest {

    @Test
    void acceptsDefaults() {
        assertDoesNotThrow(new CleanHtmlProperties()::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveHeadingLength() {
        CleanHtmlProperties properties = new CleanHtmlProperties();
        properties.setHeadingMaxLength(0);

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsRelativeLinkBaseThatIsNotAbsolute() {
        CleanHtmlProperties properties = new CleanHtmlProperties();
        properties.getFilter().setRelativeLinkBase("docs/");

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }
}
