package com.williamcallahan.cleanhtml.service.html;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Verifies preformatted blocks are swapped for placeholders and restored exactly once.
 */
class PreformattedBlockExtractorTest {

    @Test
    void replacesCompleteBlocksWithNumberedPlaceholders() {
        PreformattedBlockExtractor extractor = new PreformattedBlockExtractor();

        String extracted = extractor.extract("a<pre>one</pre>b<PRE class=\"x\">two</PRE>c");

        assertEquals("a<pre autop-pre-tag-0></pre>b<pre autop-pre-tag-1></pre>c", extracted);
        assertEquals(2, extractor.placeholderCount());
        assertEquals("a<pre>one</pre>b<PRE class=\"x\">two</PRE>c", extractor.restore(extracted));
    }

    @Test
    void leavesTextWithoutPreformattedBlocksAlone() {
        PreformattedBlockExtractor extractor = new PreformattedBlockExtractor();

        assertEquals("<preview>text</preview>", extractor.extract("<preview>text</preview>"));
        assertEquals(0, extractor.placeholderCount());
    }

    @Test
    void keepsStrayClosingTagAsText() {
        PreformattedBlockExtractor extractor = new PreformattedBlockExtractor();

        String extracted = extractor.extract("a</pre><pre>b</pre>");

        assertEquals("a</pre><pre autop-pre-tag-0></pre>", extracted);
        assertEquals("a</pre><pre>b</pre>", extractor.restore(extracted));
    }

    @Test
    void rejectsMissingPlaceholder() {
        PreformattedBlockExtractor extractor = new PreformattedBlockExtractor();
        extractor.extract("<pre>x</pre>");

        assertThrows(PlaceholderRestorationException.class, () -> extractor.restore("<p>no placeholder</p>"));
    }

    @Test
    void rejectsDuplicatedPlaceholder() {
        PreformattedBlockExtractor extractor = new PreformattedBlockExtractor();
        String extracted = extractor.extract("<pre>x</pre>");

        assertThrows(PlaceholderRestorationException.class, () -> extractor.restore(extracted + extracted));
    }

    @Test
    void restoresBlocksInOnePassWhenBlockTextLooksLikeAPlaceholder() {
        PreformattedBlockExtractor extractor = new PreformattedBlockExtractor();

        String extracted = extractor.extract("<pre>x<pre autop-pre-tag-1></pre> and <pre>y</pre>");

        assertEquals("<pre autop-pre-tag-0></pre> and <pre autop-pre-tag-1></pre>", extracted);
        assertEquals("<pre>x<pre autop-pre-tag-1></pre> and <pre>y</pre>", extractor.restore(extracted));
    }
}
