package com.williamcallahan.cleanhtml.web;

import com.williamcallahan.cleanhtml.config.HtmlCleaningConfig;
import com.williamcallahan.cleanhtml.service.HtmlCleaningService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Verifies the HTML cleaning endpoints and their error payloads.
 */
@WebMvcTest(controllers = HtmlCleanController.class)
@Import({HtmlCleaningConfig.class, ExceptionResponseBuilder.class})
class HtmlCleanControllerTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    HtmlCleaningService htmlCleaningService;

    @AfterEach
    void resetOptions() {
        htmlCleaningService.setOptions(Map.of(
                "images", false, "italics", false, "links", false, "strip", false, "table", false));
    }

    @Test
    void clean_returns_normalized_html() throws Exception {
        mvc.perform(post("/api/html/clean")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"<p><strong>Section Title</strong></p>\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.html").value("<h2>Section Title</h2>"));
    }

    @Test
    void autop_honours_line_break_flag() throws Exception {
        mvc.perform(post("/api/html/autop")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"Line one\\nLine two\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.html").value("<p>Line one<br />\nLine two</p>\n"));

        mvc.perform(post("/api/html/autop")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"Line one\\n\\nLine two\", \"lineBreaks\": false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.html").value("<p>Line one</p>\n<p>Line two</p>\n"));
    }

    @Test
    void quotes_are_normalized() throws Exception {
        mvc.perform(post("/api/html/quotes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"\\u201cHi\\u201d \\u2018there\\u2019\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.html").value("\"Hi\" 'there'"));
    }

    @Test
    void options_can_be_read_and_updated() throws Exception {
        mvc.perform(get("/api/html/options"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.links").value(false));

        mvc.perform(put("/api/html/options")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"links\": true}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.links").value(true))
            .andExpect(jsonPath("$.images").value(false));
    }

    @Test
    void unknown_option_is_rejected_without_changes() throws Exception {
        mvc.perform(put("/api/html/options")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"links\": true, \"bogus\": true}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.message", containsString("bogus does not exist as a settable option.")));

        mvc.perform(get("/api/html/options"))
            .andExpect(jsonPath("$.links").value(false));
    }
}
