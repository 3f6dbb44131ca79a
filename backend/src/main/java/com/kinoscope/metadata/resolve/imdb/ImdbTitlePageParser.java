package com.kinoscope.metadata.resolve.imdb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kinoscope.metadata.resolve.model.TitleMetadata;
import com.kinoscope.metadata.resolve.util.TitleTypes;
import com.kinoscope.metadata.resolve.util.YearMatcher;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts year, directors, rating and type from an IMDb title page. JSON-LD is preferred; the page
 * {@code <title>} is the fallback when no structured node carries a year.
 */
@Component
public class ImdbTitlePageParser {
    private static final Logger log = LoggerFactory.getLogger(ImdbTitlePageParser.class);

    private final ObjectMapper objectMapper;

    public ImdbTitlePageParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TitleMetadata parse(String html) {
        if (html == null || html.isBlank()) {
            return null;
        }
        Document document = Jsoup.parse(html);

        Rating seenRating = null;
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                JsonNode root = objectMapper.readTree(payload);
                TitleMetadata structured = fromStructured(root);
                if (structured != null) {
                    return structured;
                }
                Rating rating = ratingOnly(root);
                if (rating != null) {
                    seenRating = rating;
                }
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block: {}", e.getOriginalMessage());
            }
        }

        return fromPageTitle(document.title(), seenRating);
    }

    private TitleMetadata fromPageTitle(String pageTitle, Rating rating) {
        String year = YearMatcher.extractParenthesizedYear(pageTitle);
        String typeHint = TitleTypes.fromPageTitle(pageTitle);
        if (year == null && typeHint == null) {
            return null;
        }
        log.debug("Title page fallback: title='{}' year={} type={}", pageTitle, year, typeHint);
        return new TitleMetadata(
            year,
            List.of(),
            rating == null ? null : rating.value(),
            rating == null ? null : rating.count(),
            typeHint
        );
    }

    private TitleMetadata fromStructured(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                TitleMetadata metadata = fromStructured(child);
                if (metadata != null) {
                    return metadata;
                }
            }
            return null;
        }
        if (!node.isObject()) {
            return null;
        }
        JsonNode graph = node.get("@graph");
        if (graph != null && graph.isArray()) {
            for (JsonNode child : graph) {
                TitleMetadata metadata = fromStructured(child);
                if (metadata != null) {
                    return metadata;
                }
            }
        }

        String type = typeOf(node.get("@type"));
        if (type == null) {
            return null;
        }
        String year = extractYear(node);
        if (year == null) {
            return null;
        }
        Rating rating = extractRating(node);
        return new TitleMetadata(
            year,
            extractDirectors(node.get("director")),
            rating == null ? null : rating.value(),
            rating == null ? null : rating.count(),
            type
        );
    }

    private Rating ratingOnly(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                Rating rating = ratingOnly(child);
                if (rating != null) {
                    return rating;
                }
            }
            return null;
        }
        if (!node.isObject()) {
            return null;
        }
        JsonNode graph = node.get("@graph");
        if (graph != null && graph.isArray()) {
            for (JsonNode child : graph) {
                Rating rating = ratingOnly(child);
                if (rating != null) {
                    return rating;
                }
            }
        }
        return extractRating(node);
    }

    private String typeOf(JsonNode typeNode) {
        if (typeNode == null || typeNode.isNull()) {
            return null;
        }
        if (typeNode.isTextual()) {
            return typeNode.asText().isBlank() ? null : typeNode.asText().trim();
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && !child.asText().isBlank()) {
                    return child.asText().trim();
                }
            }
        }
        return null;
    }

    private String extractYear(JsonNode node) {
        String year = YearMatcher.extractYear(text(node, "datePublished"));
        if (year != null) {
            return year;
        }
        year = YearMatcher.extractYear(text(node, "releaseDate"));
        if (year != null) {
            return year;
        }
        JsonNode events = node.get("releasedEvent");
        if (events != null && events.isArray()) {
            for (JsonNode event : events) {
                year = YearMatcher.extractYear(text(event, "startDate"));
                if (year != null) {
                    return year;
                }
            }
        }
        return null;
    }

    private List<String> extractDirectors(JsonNode directorNode) {
        List<String> directors = new ArrayList<>();
        if (directorNode == null || directorNode.isNull()) {
            return directors;
        }
        if (directorNode.isArray()) {
            for (JsonNode item : directorNode) {
                addDirectorName(item, directors);
            }
        } else {
            addDirectorName(directorNode, directors);
        }
        return directors;
    }

    private void addDirectorName(JsonNode item, List<String> out) {
        String name = null;
        if (item.isTextual()) {
            name = item.asText();
        } else if (item.isObject()) {
            name = text(item, "name");
        }
        if (name != null && !name.isBlank()) {
            out.add(name.trim());
        }
    }

    private Rating extractRating(JsonNode node) {
        JsonNode aggregate = node.get("aggregateRating");
        if (aggregate == null || !aggregate.isObject()) {
            return null;
        }
        Double value = parseDouble(aggregate.get("ratingValue"));
        if (value == null) {
            return null;
        }
        return new Rating(value, parseInteger(aggregate.get("ratingCount")));
    }

    private Double parseDouble(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private Integer parseInteger(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim().replace(",", ""));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isTextual()) {
            return null;
        }
        return value.asText();
    }

    private record Rating(Double value, Integer count) {
    }
}
