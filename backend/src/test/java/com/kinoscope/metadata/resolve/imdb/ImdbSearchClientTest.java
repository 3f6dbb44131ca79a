package com.kinoscope.metadata.resolve.imdb;

import com.kinoscope.metadata.config.ResolverProperties;
import com.kinoscope.metadata.resolve.model.SearchCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ImdbSearchClientTest {
    private ImdbSearchClient client;

    @BeforeEach
    void setUp() {
        ResolverProperties properties = new ResolverProperties();
        properties.getImdb().setBaseUrl("https://www.imdb.com/");
        client = new ImdbSearchClient(properties, new ImdbSearchResultParser());
    }

    @Test
    void plainSearchUrlEncodesQuery() {
        assertThat(client.searchUrl(" Krysař & Co ", null))
            .isEqualTo("https://www.imdb.com/find/?q=Krysa%C5%99+%26+Co");
        assertThat(client.searchUrl("Kolja", "  ")).isEqualTo("https://www.imdb.com/find/?q=Kolja");
    }

    @Test
    void typedSearchUrlAddsEncodedTitleType() {
        assertThat(client.searchUrl("Kolja", "TV Movie"))
            .isEqualTo("https://www.imdb.com/find/?q=Kolja&s=tt&ttype=TV+Movie");
        assertThat(client.searchUrl("Kolja", "ft"))
            .isEqualTo("https://www.imdb.com/find/?q=Kolja&s=tt&ttype=ft");
    }

    @Test
    void typedSearchFetchesTypedUrlAndParsesResults() {
        String html = ImdbPages.modernSearch("Titles", List.of(new ImdbPages.Card("tt0118849", "Kolja", "1996", null)));
        FakePageFetcher fetcher = new FakePageFetcher().page(client.searchUrl("Kolja", "ft"), html);

        List<SearchCandidate> typed = client.search(fetcher, "Kolja", "ft");
        List<SearchCandidate> untyped = client.search(fetcher, "Kolja", null);

        assertThat(typed).extracting(SearchCandidate::id).containsExactly("tt0118849");
        assertThat(untyped).isEmpty();
    }

    @Test
    void failedSearchYieldsEmptyList() {
        FakePageFetcher fetcher = new FakePageFetcher();

        assertThat(client.search(fetcher, "Krysař", null)).isEmpty();
        assertThat(client.search(fetcher, "Krysař", "ft")).isEmpty();
        assertThat(fetcher.requested()).containsExactly(
            "https://www.imdb.com/find/?q=Krysa%C5%99",
            "https://www.imdb.com/find/?q=Krysa%C5%99&s=tt&ttype=ft"
        );
    }

    @Test
    void blankQueryIsNotFetched() {
        FakePageFetcher fetcher = new FakePageFetcher();
        assertThat(client.search(fetcher, "  ", "ft")).isEmpty();
        assertThat(fetcher.requested()).isEmpty();
    }
}
