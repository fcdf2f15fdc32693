package com.largomodo.shelfcatalog.core;

import com.largomodo.shelfcatalog.core.domain.Book;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Title comparisons available for shelf sorting.
 * <p>
 * Neither ordering breaks ties: books with equal keys compare as 0 and keep their
 * relative order under a stable sort.
 * <p>
 * Comparison walks Unicode code points rather than UTF-16 units, so titles with
 * supplementary characters (emoji, historic scripts) sort after every BMP character
 * instead of landing between U+D7FF and U+E000.
 */
public enum TitleOrdering {
    CODEPOINT((left, right) -> compareCodePoints(left.title(), right.title())),
    CASE_INSENSITIVE((left, right) -> compareCodePoints(fold(left.title()), fold(right.title())));

    private final Comparator<Book> comparator;

    TitleOrdering(Comparator<Book> comparator) {
        this.comparator = comparator;
    }

    public Comparator<Book> comparator() {
        return comparator;
    }

    public static TitleOrdering fromCliArgument(String arg) {
        String supported = Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "));
        if (arg == null) {
            throw new IllegalArgumentException("Title ordering argument cannot be null. Supported: " + supported);
        }
        try {
            return valueOf(arg.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid title ordering: " + arg + ". Supported: " + supported);
        }
    }

    /**
     * Lexicographic comparison by Unicode code point. A proper prefix sorts first.
     */
    static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int cpA = a.codePointAt(i);
            int cpB = b.codePointAt(j);
            if (cpA != cpB) {
                return Integer.compare(cpA, cpB);
            }
            i += Character.charCount(cpA);
            j += Character.charCount(cpB);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    // Upper then lower approximates full case folding (e.g. "ß" and "SS" fold together)
    private static String fold(String title) {
        return title.toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
    }
}
