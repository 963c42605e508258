package com.tabletop.workstation.game;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Catalog reference helpers. The catalog itself lives outside this service; a reference is the
 * normalized card name ({@code "Lightning Bolt"} is {@code lightning_bolt}).
 */
public final class CardRefs {

    private CardRefs() {
    }

    public static String normalize(String cardName) {
        String normalized = cardName.toLowerCase(Locale.ROOT).replaceAll("[',]", "");
        normalized = normalized.replaceAll("[^a-z0-9]", "_");
        normalized = normalized.replaceAll("_+", "_");
        return stripUnderscores(normalized);
    }

    /**
     * Best-effort display name for a reference; a trailing set code such as {@code _A25} is dropped.
     */
    public static String displayName(String cardRef) {
        String[] parts = cardRef.split("_");
        int length = parts.length;
        if (length > 1) {
            String last = parts[length - 1];
            if (last.equals("UNK") || (last.length() == 3 && last.equals(last.toUpperCase(Locale.ROOT))
                    && !last.equals(last.toLowerCase(Locale.ROOT)))) {
                length--;
            }
        }
        return Arrays.stream(parts, 0, length)
                .filter(part -> !part.isEmpty())
                .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1))
                .collect(Collectors.joining(" "));
    }

    private static String stripUnderscores(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '_') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '_') {
            end--;
        }
        return value.substring(start, end);
    }
}
