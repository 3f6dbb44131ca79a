package com.kinoscope.metadata.resolve.api;

import com.kinoscope.metadata.resolve.imdb.ImdbResolver;
import com.kinoscope.metadata.resolve.imdb.ResolutionAbortedException;
import com.kinoscope.metadata.resolve.model.MergedMovie;
import com.kinoscope.metadata.resolve.model.ResolutionResult;
import com.kinoscope.metadata.resolve.model.SeedRecord;
import com.kinoscope.metadata.resolve.service.EnrichmentRequest;
import com.kinoscope.metadata.resolve.service.MovieEnrichmentService;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ResolutionControllerTest {
    private static final String KRYSAR_REQUEST = """
        {
          "seed": {
            "id": 1,
            "title": "Krysař",
            "year": "1985",
            "directors": ["Jiří Barta"],
            "localizedTitles": {"USA": "The Pied Piper"}
          },
          "sourceHtml": "<html><body><a href=\\"https://www.imdb.com/title/tt0088349/\\">IMDb</a></body></html>"
        }
        """;

    @Autowired
    private WebApplicationContext context;

    @MockBean
    private ImdbResolver imdbResolver;

    @MockBean
    private MovieEnrichmentService enrichmentService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void resolvePassesSeedAndParsedSourceDocument() throws Exception {
        when(imdbResolver.resolveExternalId(
            argThat((Document doc) -> doc != null && !doc.select("a[href*=tt0088349]").isEmpty()),
            argThat((SeedRecord seed) -> "Krysař".equals(seed.title())
                && "The Pied Piper".equals(seed.localizedTitle("usa")))
        )).thenReturn(new ResolutionResult("tt0088349", 7.4, 2100));

        mockMvc.perform(post("/api/resolve").contentType(MediaType.APPLICATION_JSON).content(KRYSAR_REQUEST))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.imdbId").value("tt0088349"))
            .andExpect(jsonPath("$.rating").value(7.4))
            .andExpect(jsonPath("$.ratingCount").value(2100));
    }

    @Test
    void resolveWithoutSeedIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/resolve").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(imdbResolver);
    }

    @Test
    void resolveIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/resolve"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void refreshRejectsMalformedId() throws Exception {
        mockMvc.perform(post("/api/ratings/nm0000001/refresh"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(imdbResolver);
    }

    @Test
    void refreshReturnsRating() throws Exception {
        when(imdbResolver.fetchRating("tt0118849")).thenReturn(new ResolutionResult("tt0118849", 7.9, 41000));

        mockMvc.perform(post("/api/ratings/tt0118849/refresh"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.imdbId").value("tt0118849"))
            .andExpect(jsonPath("$.rating").value(7.9));
    }

    @Test
    void abortedResolutionMapsToServiceUnavailable() throws Exception {
        when(imdbResolver.fetchRating("tt0118849")).thenThrow(new ResolutionAbortedException("resolution_deadline_exceeded"));

        mockMvc.perform(post("/api/ratings/tt0118849/refresh"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("resolution_aborted"))
            .andExpect(jsonPath("$.message").value("resolution_deadline_exceeded"));
    }

    @Test
    void enrichReturnsMergedRecord() throws Exception {
        MergedMovie merged = new MergedMovie(
            1, 10863, "The Pied Piper", "tt0088349", "Krysař", null, "1985", null, null, null, null, null,
            List.of("CS"), List.of(), List.of("Jiří Barta"), List.of(), null, null, null,
            7.4, 2100, null, null, null, null, null, null, null, List.of(), Map.of("USA", "The Pied Piper"), null
        );
        when(enrichmentService.enrich(any(EnrichmentRequest.class))).thenReturn(merged);

        mockMvc.perform(post("/api/enrich").contentType(MediaType.APPLICATION_JSON).content(KRYSAR_REQUEST))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.imdbId").value("tt0088349"))
            .andExpect(jsonPath("$.tmdbId").value(10863))
            .andExpect(jsonPath("$.originCountryCodes[0]").value("CS"))
            .andExpect(jsonPath("$.localizedTitles.USA").value("The Pied Piper"));
    }
}
