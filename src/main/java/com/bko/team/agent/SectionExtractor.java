package com.bko.team.agent;

import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort splitting of model answers laid out as two headed sections. Never throws;
 * a section that cannot be found comes back empty.
 */
public final class SectionExtractor {

    private static final Pattern BULLET = Pattern.compile("(?m)^\\s*[-*]\\s+(.+)$");

    private SectionExtractor() {
    }

    public record Sections(String first, String second) {
    }

    /**
     * Splits on the second heading first, so a first heading that is a substring of the second
     * one ("FUNCTIONAL REQUIREMENTS" inside "NON-FUNCTIONAL REQUIREMENTS") is only looked for
     * in the text before it.
     */
    public static Sections split(@Nullable String text, List<String> firstMarkers, List<String> secondMarkers) {
        if (text == null || text.isBlank()) {
            return new Sections("", "");
        }
        String head = text;
        String second = "";
        Match secondMatch = find(text, secondMarkers);
        if (secondMatch != null) {
            head = text.substring(0, secondMatch.start());
            second = clean(text.substring(secondMatch.end()));
        }
        String first = "";
        Match firstMatch = find(head, firstMarkers);
        if (firstMatch != null) {
            first = clean(head.substring(firstMatch.end()));
        }
        return new Sections(first, second);
    }

    /**
     * Lines starting with {@code -} or {@code *} followed by whitespace, bullet stripped.
     */
    public static List<String> bullets(@Nullable String section) {
        List<String> items = new ArrayList<>();
        if (section == null) {
            return items;
        }
        Matcher matcher = BULLET.matcher(section);
        while (matcher.find()) {
            String item = matcher.group(1).trim();
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return items;
    }

    /**
     * Text before the first colon, or the fallback when there is no colon.
     */
    public static String nameBeforeColon(@Nullable String text, String fallback) {
        if (text == null) {
            return fallback;
        }
        int colon = text.indexOf(':');
        if (colon < 0) {
            return fallback;
        }
        String name = text.substring(0, colon).trim();
        return name.isEmpty() ? fallback : name;
    }

    private static @Nullable Match find(String text, List<String> markers) {
        Match best = null;
        for (String marker : markers) {
            int index = text.indexOf(marker);
            if (index >= 0 && (best == null || index < best.start())) {
                best = new Match(index, index + marker.length());
            }
        }
        return best;
    }

    private static String clean(String section) {
        String value = section.strip();
        while (value.startsWith(":")) {
            value = value.substring(1).strip();
        }
        return value;
    }

    private record Match(int start, int end) {
    }
}
