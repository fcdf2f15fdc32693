package com.largomodo.shelfcatalog.core.domain;

import com.largomodo.shelfcatalog.core.TitleOrdering;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Named container holding an ordered sequence of books.
 * <p>
 * Book order is insertion order until one of the sort methods reorders it. The shelf
 * holds references only: a book placed here stays the same value and may sit on
 * other shelves or in other piles at the same time.
 * <p>
 * Not thread-safe. Callers sharing a shelf across threads must lock externally.
 */
public class Shelf {

    private final String name;
    private final List<Book> books = new ArrayList<>();

    public Shelf(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Shelf name must not be null");
        }
        this.name = name;
    }

    public Shelf(String name, Iterable<Book> books) {
        this(name);
        addBooks(books);
    }

    public String getName() {
        return name;
    }

    /**
     * @return read-only view of the books in shelf order
     */
    public List<Book> getBooks() {
        return Collections.unmodifiableList(books);
    }

    public int size() {
        return books.size();
    }

    /**
     * Appends books after the ones already on the shelf, in iteration order.
     * <p>
     * No deduplication and no check of category against the shelf name.
     *
     * @param newBooks books to append, must not be null or contain null
     * @throws IllegalArgumentException if newBooks is null or holds a null book
     */
    public void addBooks(Iterable<Book> newBooks) {
        if (newBooks == null) {
            throw new IllegalArgumentException("Books to add must not be null");
        }
        // Validate everything first so a bad element leaves the shelf untouched
        List<Book> staged = new ArrayList<>();
        for (Book book : newBooks) {
            if (book == null) {
                throw new IllegalArgumentException("Cannot add null book to shelf '" + name + "'");
            }
            staged.add(book);
        }
        books.addAll(staged);
    }

    /**
     * Sorts books by title using case-sensitive code point order.
     *
     * @see #sortBooksByTitle(TitleOrdering)
     */
    public void sortBooksByTitle() {
        sortBooksByTitle(TitleOrdering.CODEPOINT);
    }

    /**
     * Sorts books in place by title using the given ordering.
     * <p>
     * {@link List#sort} is a stable merge sort, so books with equal titles keep
     * their relative order.
     *
     * @param ordering title comparison to apply, must not be null
     */
    public void sortBooksByTitle(TitleOrdering ordering) {
        if (ordering == null) {
            throw new IllegalArgumentException("Title ordering must not be null");
        }
        books.sort(ordering.comparator());
    }

    /**
     * @return distinct categories of the books currently on the shelf (unmodifiable, empty for an empty shelf)
     */
    public Set<String> categories() {
        Set<String> categories = new LinkedHashSet<>();
        for (Book book : books) {
            categories.add(book.category());
        }
        return Collections.unmodifiableSet(categories);
    }

    @Override
    public String toString() {
        return "Shelf{name='" + name + "', books=" + books.size() + "}";
    }
}
