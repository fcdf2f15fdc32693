package com.largomodo.shelfcatalog.core.domain;

import java.util.Objects;

/**
 * Immutable book value handed to shelves and to the catalog.
 * <p>
 * Identity is the {@code id}: two books with the same id are equal even if their
 * other attributes differ. Shelves never deduplicate, so equality only matters to
 * callers comparing books.
 * </p>
 *
 * @param id       opaque identifier, unique per book instance
 * @param title    title used for shelf ordering
 * @param author   author shown in dumps
 * @param category grouping key matched against shelf names
 * @param isbn     ISBN, or {@code null} when unknown
 */
public record Book(String id, String title, String author, String category, String isbn) {

    /**
     * Compact constructor that rejects missing required attributes.
     *
     * @throws IllegalArgumentException if id, title, author or category is null
     */
    public Book {
        requireField(id, "id");
        requireField(title, "title");
        requireField(author, "author");
        requireField(category, "category");
    }

    public Book(String id, String title, String author, String category) {
        this(id, title, author, category, null);
    }

    private static void requireField(String value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("Book " + field + " must not be null");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return id.equals(((Book) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
