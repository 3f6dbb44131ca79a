package com.kinoscope.metadata.resolve.util;

import java.util.List;

/**
 * Rewrites Czech transcriptions of Japanese and Korean names into the English romanizations
 * used by international catalogs (modified Hepburn, Revised Romanization).
 * Rule tables are ordered longest pattern first; the first rule matching at a position wins.
 */
public final class RomanizationConverter {
    private static final List<Rule> JAPANESE_RULES = List.of(
        new Rule("šú", "shū"),
        new Rule("šó", "shō"),
        new Rule("čó", "chō"),
        new Rule("čú", "chū"),
        new Rule("džú", "jū"),
        new Rule("džó", "jō"),
        new Rule("cú", "tsū"),
        new Rule("rjú", "ryū"),
        new Rule("rjó", "ryō"),
        new Rule("kjú", "kyū"),
        new Rule("kjó", "kyō"),
        new Rule("gjú", "gyū"),
        new Rule("gjó", "gyō"),
        new Rule("njú", "nyū"),
        new Rule("njó", "nyō"),
        new Rule("mjú", "myū"),
        new Rule("mjó", "myō"),
        new Rule("hjú", "hyū"),
        new Rule("hjó", "hyō"),
        new Rule("bjú", "byū"),
        new Rule("bjó", "byō"),
        new Rule("pjú", "pyū"),
        new Rule("pjó", "pyō"),
        new Rule("dži", "ji"),
        new Rule("džu", "ju"),
        new Rule("dže", "je"),
        new Rule("džo", "jo"),
        new Rule("dža", "ja"),
        new Rule("ša", "sha"),
        new Rule("ši", "shi"),
        new Rule("šu", "shu"),
        new Rule("še", "she"),
        new Rule("šo", "sho"),
        new Rule("ča", "cha"),
        new Rule("či", "chi"),
        new Rule("ču", "chu"),
        new Rule("če", "che"),
        new Rule("čo", "cho"),
        new Rule("cu", "tsu"),
        new Rule("ca", "tsa"),
        new Rule("ce", "tse"),
        new Rule("co", "tso"),
        new Rule("ci", "tsi"),
        new Rule("rja", "rya"),
        new Rule("rji", "ryi"),
        new Rule("rju", "ryu"),
        new Rule("rje", "rye"),
        new Rule("rjo", "ryo"),
        new Rule("kja", "kya"),
        new Rule("kji", "kyi"),
        new Rule("kju", "kyu"),
        new Rule("kje", "kye"),
        new Rule("kjo", "kyo"),
        new Rule("gja", "gya"),
        new Rule("gji", "gyi"),
        new Rule("gju", "gyu"),
        new Rule("gje", "gye"),
        new Rule("gjo", "gyo"),
        new Rule("nja", "nya"),
        new Rule("nji", "nyi"),
        new Rule("nju", "nyu"),
        new Rule("nje", "nye"),
        new Rule("njo", "nyo"),
        new Rule("mja", "mya"),
        new Rule("mji", "myi"),
        new Rule("mju", "myu"),
        new Rule("mje", "mye"),
        new Rule("mjo", "myo"),
        new Rule("hja", "hya"),
        new Rule("hji", "hyi"),
        new Rule("hju", "hyu"),
        new Rule("hje", "hye"),
        new Rule("hjo", "hyo"),
        new Rule("bja", "bya"),
        new Rule("bji", "byi"),
        new Rule("bju", "byu"),
        new Rule("bje", "bye"),
        new Rule("bjo", "byo"),
        new Rule("pja", "pya"),
        new Rule("pji", "pyi"),
        new Rule("pju", "pyu"),
        new Rule("pje", "pye"),
        new Rule("pjo", "pyo"),
        new Rule("jú", "yū"),
        new Rule("jó", "yō"),
        new Rule("ja", "ya"),
        new Rule("ji", "yi"),
        new Rule("ju", "yu"),
        new Rule("je", "ye"),
        new Rule("jo", "yo"),
        new Rule("ó", "ō"),
        new Rule("ú", "ū")
    );

    private static final List<Rule> KOREAN_RULES = List.of(
        new Rule("šin", "sin"),
        new Rule("šim", "sim"),
        new Rule("ča", "ja"),
        new Rule("čo", "jo"),
        new Rule("ču", "ju"),
        new Rule("če", "je"),
        new Rule("či", "ji"),
        new Rule("š", "s"),
        new Rule("č", "j"),
        new Rule("ů", "u")
    );

    private RomanizationConverter() {
    }

    /**
     * Input is expected in lower case; output keeps it.
     */
    public static String japaneseToHepburn(String czechName) {
        return applyRules(czechName, JAPANESE_RULES);
    }

    public static String koreanToRevised(String czechName) {
        return applyRules(czechName, KOREAN_RULES);
    }

    /**
     * Applies both tables and keeps the output that moved furthest from the input, Japanese on ties.
     * Pure ASCII input is returned as is: short clusters such as "co" also occur in Western names.
     */
    public static String transliterateToEnglish(String czechName) {
        if (czechName == null || czechName.isBlank()) {
            return czechName;
        }
        if (isPlainAscii(czechName)) {
            return czechName;
        }

        String japanese = japaneseToHepburn(czechName);
        String korean = koreanToRevised(czechName);
        int japaneseDistance = levenshteinDistance(czechName, japanese);
        int koreanDistance = levenshteinDistance(czechName, korean);

        if (japaneseDistance == 0 && koreanDistance == 0) {
            return czechName;
        }
        return japaneseDistance >= koreanDistance ? japanese : korean;
    }

    static int levenshteinDistance(String s, String t) {
        if (s.equals(t)) {
            return 0;
        }
        int n = s.length();
        int m = t.length();
        if (n == 0) {
            return m;
        }
        if (m == 0) {
            return n;
        }

        int[] previous = new int[m + 1];
        int[] current = new int[m + 1];
        for (int j = 0; j <= m; j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= n; i++) {
            current[0] = i;
            for (int j = 1; j <= m; j++) {
                int cost = s.charAt(i - 1) == t.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[m];
    }

    private static String applyRules(String input, List<Rule> rules) {
        if (input == null || input.isBlank()) {
            return input;
        }
        StringBuilder result = new StringBuilder(input.length() + 8);
        int i = 0;
        while (i < input.length()) {
            Rule matched = null;
            for (Rule rule : rules) {
                if (input.startsWith(rule.czech(), i)) {
                    matched = rule;
                    break;
                }
            }
            if (matched == null) {
                result.append(input.charAt(i));
                i++;
            } else {
                result.append(matched.english());
                i += matched.czech().length();
            }
        }
        return result.toString();
    }

    private static boolean isPlainAscii(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) > 127) {
                return false;
            }
        }
        return true;
    }

    private record Rule(String czech, String english) {
    }
}
