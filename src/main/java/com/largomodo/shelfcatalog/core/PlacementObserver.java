package com.largomodo.shelfcatalog.core;

import com.largomodo.shelfcatalog.core.domain.Book;
import com.largomodo.shelfcatalog.core.domain.Shelf;

/**
 * Observer for book placement during {@link Catalog#organizeBooksByCategory(Iterable, PlacementObserver)}.
 * <p>
 * All methods have default no-op implementations, allowing consumers to override only
 * the events they care about. Callbacks fire in pile order, after placement has
 * been decided and before any shelf is modified.
 * </p>
 * <pre>{@code
 * catalog.organizeBooksByCategory(pile, new PlacementObserver() {
 *     @Override
 *     public void onUnplaced(Book book) {
 *         System.out.println("No shelf for " + book.title());
 *     }
 * });
 * }</pre>
 */
public interface PlacementObserver {

    /**
     * Called for a book that will be appended to {@code shelf}.
     *
     * @param book  the placed book
     * @param shelf the first shelf whose name matches the book's category
     */
    default void onPlaced(Book book, Shelf shelf) {}

    /**
     * Called for a book whose category matches no shelf name. The book is dropped.
     *
     * @param book the book left off every shelf
     */
    default void onUnplaced(Book book) {}
}
