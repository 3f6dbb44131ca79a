package com.kinoscope.metadata.resolve.imdb;

import com.kinoscope.metadata.resolve.model.SearchCandidate;
import com.kinoscope.metadata.resolve.util.TitleTypes;
import com.kinoscope.metadata.resolve.util.YearMatcher;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads title results from an IMDb find page. Both the legacy table layout and the current card
 * layout are scanned; legacy rows win when the same id appears in both.
 */
@Component
public class ImdbSearchResultParser {
    static final Pattern TITLE_ID = Pattern.compile("tt\\d+");
    private static final String ARIA_PREFIX = "View title page for ";

    public List<SearchCandidate> parse(String html) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        return parse(Jsoup.parse(html));
    }

    public List<SearchCandidate> parse(Document document) {
        List<SearchCandidate> out = new ArrayList<>();
        Set<String> seen = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (SearchCandidate candidate : legacyResults(document)) {
            if (seen.add(candidate.id())) {
                out.add(candidate);
            }
        }
        for (SearchCandidate candidate : modernResults(document)) {
            if (seen.add(candidate.id())) {
                out.add(candidate);
            }
        }
        return out;
    }

    private List<SearchCandidate> legacyResults(Document document) {
        List<SearchCandidate> results = new ArrayList<>();
        for (Element row : document.select("table[class*=findList] tr")) {
            Element textCell = row.selectFirst("td[class=result_text]");
            Element link = textCell == null ? null : textCell.selectFirst("a");
            if (link == null) {
                continue;
            }
            String id = titleId(link.attr("href"));
            if (id == null) {
                continue;
            }
            String rawText = textCell.text();
            results.add(new SearchCandidate(
                id,
                link.text().trim(),
                YearMatcher.extractParenthesizedYear(rawText),
                rawText,
                TitleTypes.fromSearchText(rawText)
            ));
        }
        return results;
    }

    private List<SearchCandidate> modernResults(Document document) {
        Element section = findSection(document, "Movies");
        if (section == null) {
            section = findSection(document, "Titles");
        }
        if (section == null) {
            return List.of();
        }

        List<SearchCandidate> results = new ArrayList<>();
        for (Element item : section.select("li[class*=ipc-metadata-list-summary-item]")) {
            Element link = item.selectFirst("a[href*=/title/tt]");
            if (link == null) {
                continue;
            }
            String id = titleId(link.attr("href"));
            if (id == null) {
                continue;
            }

            String title = titleFromAriaLabel(link.attr("aria-label"));
            if (title.isEmpty()) {
                title = link.text().trim();
            }

            String year = null;
            StringBuilder raw = new StringBuilder();
            for (Element span : item.select("span[class*=cli-title-metadata-item]")) {
                String text = span.text();
                if (text.isBlank()) {
                    continue;
                }
                if (raw.length() > 0) {
                    raw.append(' ');
                }
                raw.append(text);
                if (year == null) {
                    year = YearMatcher.extractYear(text);
                }
            }
            String rawText = raw.toString();

            String titleType = null;
            Element typeLabel = item.selectFirst("span[class*=ipc-metadata-list-summary-item__tl]");
            if (typeLabel == null) {
                typeLabel = item.selectFirst("label[class*=ipc-metadata-list-summary-item__tl]");
            }
            if (typeLabel != null && !typeLabel.text().isBlank()) {
                titleType = typeLabel.text().trim();
            }
            if (titleType == null) {
                titleType = TitleTypes.fromSearchText(rawText);
            }

            results.add(new SearchCandidate(id, title, year, rawText, titleType));
        }
        return results;
    }

    private Element findSection(Document document, String heading) {
        for (Element section : document.select("section[data-testid=find-results-section-title]")) {
            for (Element h3 : section.select("h3")) {
                if (heading.equals(h3.text().trim())) {
                    return section;
                }
            }
        }
        return null;
    }

    private String titleFromAriaLabel(String ariaLabel) {
        if (ariaLabel == null || ariaLabel.isBlank()) {
            return "";
        }
        String value = ariaLabel.trim();
        if (value.toLowerCase(Locale.ROOT).startsWith(ARIA_PREFIX.toLowerCase(Locale.ROOT))) {
            value = value.substring(ARIA_PREFIX.length());
        }
        return value.trim();
    }

    static String titleId(String href) {
        if (href == null) {
            return null;
        }
        Matcher matcher = TITLE_ID.matcher(href);
        return matcher.find() ? matcher.group() : null;
    }
}
