package com.bko.team.agent;

import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public enum TaskKind {
    DESIGN,
    IMPLEMENTATION,
    MIXED;

    /**
     * Reads a classification answer. The digits 1, 2 and 3 win in that order, then whole-word
     * keywords, design keywords first. Anything else is MIXED.
     */
    public static TaskKind classify(@Nullable String answer, List<String> designKeywords, List<String> implementationKeywords) {
        if (answer == null) {
            return MIXED;
        }
        String text = answer.trim();
        if (text.contains("1")) {
            return DESIGN;
        }
        if (text.contains("2")) {
            return IMPLEMENTATION;
        }
        if (text.contains("3")) {
            return MIXED;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (containsWord(lower, designKeywords)) {
            return DESIGN;
        }
        if (containsWord(lower, implementationKeywords)) {
            return IMPLEMENTATION;
        }
        return MIXED;
    }

    private static boolean containsWord(String text, List<String> keywords) {
        for (String keyword : keywords) {
            Pattern word = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(keyword.toLowerCase(Locale.ROOT)) + "(?![\\p{L}\\p{N}])");
            if (word.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
