package com.williamcallahan.cleanhtml.web;

import com.williamcallahan.cleanhtml.domain.cleaning.HtmlCleanRequest;
import com.williamcallahan.cleanhtml.domain.cleaning.HtmlCleanResponse;
import com.williamcallahan.cleanhtml.domain.cleaning.InvalidCleaningOptionException;
import com.williamcallahan.cleanhtml.service.HtmlCleaningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST endpoints for HTML cleaning.
 */
@RestController
@RequestMapping("/api/html")
public class HtmlCleanController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(HtmlCleanController.class);

    private final HtmlCleaningService htmlCleaningService;

    public HtmlCleanController(HtmlCleaningService htmlCleaningService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.htmlCleaningService = htmlCleaningService;
    }

    /**
     * Cleans pasted HTML with the current options.
     *
     * @param request body of the form <pre>{@code {"content": "<p>...</p>"}}</pre>
     * @return <pre>{@code {"html": "..."}}</pre>
     */
    @PostMapping(value = "/clean",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> clean(@RequestBody HtmlCleanRequest request) {
        try {
            logger.debug("Cleaning HTML of length: {}", request.content().length());
            return ResponseEntity.ok(new HtmlCleanResponse(htmlCleaningService.clean(request.content())));
        } catch (RuntimeException e) {
            logger.error("Error cleaning HTML", e);
            return handleServiceException(e, "clean HTML");
        }
    }

    /**
     * Wraps loosely formatted text in paragraphs.
     *
     * @param request body of the form <pre>{@code {"content": "...", "lineBreaks": true}}</pre>
     * @return <pre>{@code {"html": "<p>...</p>\n"}}</pre>
     */
    @PostMapping(value = "/autop",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> reconstructParagraphs(@RequestBody HtmlCleanRequest request) {
        try {
            String html = htmlCleaningService.reconstruct(request.content(), request.lineBreaks());
            return ResponseEntity.ok(new HtmlCleanResponse(html));
        } catch (RuntimeException e) {
            logger.error("Error reconstructing paragraphs", e);
            return handleServiceException(e, "reconstruct paragraphs");
        }
    }

    /**
     * Replaces typographic quotes with ASCII quotes.
     *
     * @param request body of the form <pre>{@code {"content": "..."}}</pre>
     * @return <pre>{@code {"html": "..."}}</pre>
     */
    @PostMapping(value = "/quotes",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<HtmlCleanResponse> normalizeQuotes(@RequestBody HtmlCleanRequest request) {
        return ResponseEntity.ok(new HtmlCleanResponse(htmlCleaningService.normalizeQuotes(request.content())));
    }

    @GetMapping(value = "/options", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Boolean>> getOptions() {
        return ResponseEntity.ok(htmlCleaningService.getOptions());
    }

    /**
     * Updates some or all cleaning options. A single unknown key or null value rejects the
     * whole update.
     *
     * @param overrides option values keyed by option name
     * @return the options now in effect, or 400 naming the offending key
     */
    @PutMapping(value = "/options",
                consumes = MediaType.APPLICATION_JSON_VALUE,
                produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> updateOptions(@RequestBody Map<String, Boolean> overrides) {
        try {
            htmlCleaningService.setOptions(overrides);
            return ResponseEntity.ok(htmlCleaningService.getOptions());
        } catch (InvalidCleaningOptionException invalidOption) {
            logger.warn("Rejected option update for key {}", invalidOption.getOptionKey());
            return handleValidationException(invalidOption);
        }
    }
}
