package com.kinoscope.metadata.resolve.util;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * IMDb title kinds. Search results show display labels ("TV Series"), title pages use
 * schema.org style types ("TVSeries"); both reduce to the same canonical key.
 */
public final class TitleTypes {
    public static final String TV_SERIES = "TVSeries";
    public static final String TV_MINI_SERIES = "TVMiniSeries";
    public static final String TV_MOVIE = "TVMovie";
    public static final String TV_EPISODE = "TVEpisode";
    public static final String TV_SPECIAL = "TVSpecial";
    public static final String TV_SHORT = "TVShort";
    public static final String PODCAST_SERIES = "PodcastSeries";
    public static final String PODCAST_EPISODE = "PodcastEpisode";
    public static final String VIDEO_GAME = "VideoGame";
    public static final String VIDEO = "Video";
    public static final String SHORT = "Short";
    public static final String MUSIC_VIDEO = "MusicVideoObject";

    private static final Set<String> REJECTED = Set.of(
        "podcastseries",
        "podcastepisode",
        "tvseries",
        "tvepisode",
        "videogame",
        "musicvideoobject"
    );

    private static final Pattern SEARCH_LABEL = Pattern.compile(
        "\\b(TV Series|TV Mini Series|TV Movie|TV Episode|TV Special|TV Short|Podcast Series|Podcast Episode"
            + "|Video Game|Video|Short|Music Video)\\b",
        Pattern.CASE_INSENSITIVE
    );

    // Longer labels first so "(Video Game" is not read as "(Video".
    private static final List<PageTitleHint> PAGE_TITLE_HINTS = List.of(
        new PageTitleHint("(Podcast Series", PODCAST_SERIES),
        new PageTitleHint("(Podcast Episode", PODCAST_EPISODE),
        new PageTitleHint("(TV Series", TV_SERIES),
        new PageTitleHint("(TV Episode", TV_EPISODE),
        new PageTitleHint("(TV Mini Series", TV_MINI_SERIES),
        new PageTitleHint("(TV Movie", TV_MOVIE),
        new PageTitleHint("(TV Special", TV_SPECIAL),
        new PageTitleHint("(TV Short", TV_SHORT),
        new PageTitleHint("(Video Game", VIDEO_GAME),
        new PageTitleHint("(Music Video", MUSIC_VIDEO),
        new PageTitleHint("(Video", VIDEO),
        new PageTitleHint("(Short", SHORT)
    );

    private TitleTypes() {
    }

    public static String canonicalKey(String label) {
        if (label == null) {
            return "";
        }
        String key = label.replaceAll("[^A-Za-z]", "").toLowerCase(Locale.ROOT);
        return "musicvideo".equals(key) ? "musicvideoobject" : key;
    }

    public static boolean isRejected(String label) {
        return REJECTED.contains(canonicalKey(label));
    }

    /**
     * Blank and unknown labels are acceptable; only the known non-film kinds are not.
     */
    public static boolean isAcceptable(String label) {
        if (label == null || label.isBlank()) {
            return true;
        }
        return !isRejected(label);
    }

    /**
     * Display label found in free search-result text, e.g. "TV Series" in "2019 TV Series Cast".
     */
    public static String fromSearchText(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return null;
        }
        Matcher matcher = SEARCH_LABEL.matcher(rawText);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * Canonical type hinted by a title page heading such as "Kremlin Wizard (Podcast Series 2024– ) - IMDb".
     */
    public static String fromPageTitle(String pageTitle) {
        if (pageTitle == null || pageTitle.isBlank()) {
            return null;
        }
        for (PageTitleHint hint : PAGE_TITLE_HINTS) {
            if (containsMarker(pageTitle, hint.marker())) {
                return hint.type();
            }
        }
        return null;
    }

    // Compares in place: lower-casing the whole title can change its length and shift offsets.
    private static boolean containsMarker(String text, String marker) {
        int last = text.length() - marker.length();
        for (int i = 0; i <= last; i++) {
            if (text.regionMatches(true, i, marker, 0, marker.length())
                && endsAtWordBoundary(text, i + marker.length())) {
                return true;
            }
        }
        return false;
    }

    private static boolean endsAtWordBoundary(String text, int end) {
        return end >= text.length() || !Character.isLetterOrDigit(text.charAt(end));
    }

    private record PageTitleHint(String marker, String type) {
    }
}
