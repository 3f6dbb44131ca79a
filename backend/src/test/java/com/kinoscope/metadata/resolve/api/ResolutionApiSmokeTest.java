package com.kinoscope.metadata.resolve.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Runs the real resolver against an unreachable IMDb host: every fetch fails as a value, never as a 5xx.
 */
@SpringBootTest
@ActiveProfiles("test")
class ResolutionApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void unreachableSearchYieldsEmptyResolution() throws Exception {
        mockMvc.perform(post("/api/resolve")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"seed\":{\"title\":\"Krysař\",\"year\":\"1985\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.imdbId").value(nullValue()));
    }

    @Test
    void unreachableTitlePageKeepsIdWithoutRating() throws Exception {
        mockMvc.perform(post("/api/ratings/tt0088349/refresh"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.imdbId").value("tt0088349"))
            .andExpect(jsonPath("$.rating").value(nullValue()));
    }

    @Test
    void enrichWithoutAnyMatchStillReturnsSeedFields() throws Exception {
        mockMvc.perform(post("/api/enrich")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"seed\":{\"id\":7,\"title\":\"Kolja\",\"year\":\"1996\",\"origin\":\"Česko\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sourceId").value(7))
            .andExpect(jsonPath("$.title").value("Kolja"))
            .andExpect(jsonPath("$.originCountryCodes[0]").value("CZ"));
    }
}
