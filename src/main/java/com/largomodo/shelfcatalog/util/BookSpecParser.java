package com.largomodo.shelfcatalog.util;

import com.largomodo.shelfcatalog.core.domain.Book;

import java.util.regex.Pattern;

/**
 * Parses compact book descriptions of the form {@code ID|TITLE|AUTHOR|CATEGORY[|ISBN]}.
 * <p>
 * Fields are trimmed. A blank ISBN is treated as absent. Commas and colons are
 * ordinary title characters here.
 */
public class BookSpecParser {

    public static final String FORMAT = "ID|TITLE|AUTHOR|CATEGORY[|ISBN]";

    private static final Pattern SEPARATOR = Pattern.compile("\\|");
    private static final String[] REQUIRED_FIELDS = {"id", "title", "author", "category"};

    private BookSpecParser() {
        // Static utility class - prevent instantiation
    }

    /**
     * @param spec book description, must not be null
     * @return the parsed book
     * @throws IllegalArgumentException if the field count is wrong or a required field is blank
     */
    public static Book parse(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("Book description must not be null, expected " + FORMAT);
        }

        // Limit -1 keeps trailing empty fields so "a|b|c|d|" counts as five
        String[] fields = SEPARATOR.split(spec, -1);
        if (fields.length < 4 || fields.length > 5) {
            throw new IllegalArgumentException(
                    "Invalid book '" + spec + "': expected " + FORMAT + ", got " + fields.length + " field(s)");
        }

        for (int i = 0; i < REQUIRED_FIELDS.length; i++) {
            fields[i] = fields[i].trim();
            if (fields[i].isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid book '" + spec + "': " + REQUIRED_FIELDS[i] + " must not be blank");
            }
        }

        String isbn = fields.length == 5 && !fields[4].isBlank() ? fields[4].trim() : null;
        return new Book(fields[0], fields[1], fields[2], fields[3], isbn);
    }
}
