package com.williamcallahan.cleanhtml.service.html;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class QuoteNormalizerTest {

    @Test
    void mapsTypographicQuotesToAscii() {
        String input = "“Smart” «angled» „low‟ ‘single’ ‹a› ‚b‛";

        assertEquals("\"Smart\" \"angled\" \"low\" 'single' 'a' 'b'", QuoteNormalizer.normalizeQuotes(input));
    }

    @Test
    void leavesOtherTextUntouched() {
        assertEquals("café \"plain\" 'ascii'", QuoteNormalizer.normalizeQuotes("café \"plain\" 'ascii'"));
        assertEquals("", QuoteNormalizer.normalizeQuotes(null));
    }
}
