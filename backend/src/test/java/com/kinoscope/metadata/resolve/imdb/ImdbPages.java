package com.kinoscope.metadata.resolve.imdb;

import java.util.List;

/**
 * Minimal IMDb find and title pages for tests.
 */
final class ImdbPages {
    private ImdbPages() {
    }

    record Card(String id, String title, String year, String typeLabel) {
    }

    static String modernSearch(String heading, List<Card> cards) {
        StringBuilder items = new StringBuilder();
        for (Card card : cards) {
            items.append("<li class=\"ipc-metadata-list-summary-item find-title-result\">")
                .append("<a class=\"ipc-metadata-list-summary-item__t\" href=\"/title/").append(card.id())
                .append("/?ref_=fn_al_tt_1\" aria-label=\"View title page for ").append(card.title()).append("\">")
                .append(card.title()).append("</a>")
                .append("<ul class=\"ipc-inline-list\">");
            if (card.year() != null) {
                items.append("<li><span class=\"ipc-metadata-list-summary-item__li cli-title-metadata-item\">")
                    .append(card.year()).append("</span></li>");
            }
            items.append("</ul>");
            if (card.typeLabel() != null) {
                items.append("<span class=\"ipc-metadata-list-summary-item__tl\">").append(card.typeLabel()).append("</span>");
            }
            items.append("</li>");
        }
        return """
            <html><body>
            <section data-testid="find-results-section-title">
              <div><h3 class="ipc-title__text">%s</h3></div>
              <ul class="ipc-metadata-list">%s</ul>
            </section>
            </body></html>
            """.formatted(heading, items);
    }

    static String moviePage(String title, String type, String datePublished, List<String> directors, Double rating, Integer count) {
        StringBuilder directorJson = new StringBuilder();
        for (String director : directors) {
            if (directorJson.length() > 0) {
                directorJson.append(',');
            }
            directorJson.append("{\"@type\":\"Person\",\"name\":\"").append(director).append("\"}");
        }
        String ratingJson = rating == null
            ? ""
            : ",\"aggregateRating\":{\"@type\":\"AggregateRating\",\"ratingValue\":" + rating + ",\"ratingCount\":" + count + "}";
        String dateJson = datePublished == null ? "" : ",\"datePublished\":\"" + datePublished + "\"";
        return """
            <html><head><title>%s - IMDb</title>
            <script type="application/ld+json">{"@context":"https://schema.org","@type":"%s","name":"%s"%s,"director":[%s]%s}</script>
            </head><body></body></html>
            """.formatted(title, type, title, dateJson, directorJson, ratingJson);
    }
}
