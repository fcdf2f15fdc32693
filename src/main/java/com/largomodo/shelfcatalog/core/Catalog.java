package com.largomodo.shelfcatalog.core;

import com.largomodo.shelfcatalog.core.domain.Book;
import com.largomodo.shelfcatalog.core.domain.Room;
import com.largomodo.shelfcatalog.core.domain.Shelf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Organizing and reporting operations over a single {@link Room}.
 * <p>
 * The catalog borrows the room it is constructed with and keeps no state of its own:
 * every operation reads or mutates the room's shelves directly. Shelves are never
 * created here; building the room is the caller's job.
 * <p>
 * Not thread-safe. A room and its catalog assume exclusive, sequential access.
 */
public class Catalog {

    private static final Logger log = LoggerFactory.getLogger(Catalog.class);

    private static final PlacementObserver NO_OP_OBSERVER = new PlacementObserver() {
    };

    private final Room room;
    private final TitleOrdering titleOrdering;

    public Catalog(Room room) {
        this(room, TitleOrdering.CODEPOINT);
    }

    /**
     * @param room          the room to operate on, must not be null
     * @param titleOrdering ordering used by {@link #sortBooksOnAllShelves()}, must not be null
     * @throws IllegalArgumentException if either argument is null
     */
    public Catalog(Room room, TitleOrdering titleOrdering) {
        if (room == null) {
            throw new IllegalArgumentException("Catalog requires a room");
        }
        if (titleOrdering == null) {
            throw new IllegalArgumentException("Title ordering must not be null");
        }
        this.room = room;
        this.titleOrdering = titleOrdering;
    }

    public Room getRoom() {
        return room;
    }

    public TitleOrdering getTitleOrdering() {
        return titleOrdering;
    }

    /**
     * Distributes a pile of loose books onto the room's existing shelves.
     *
     * @see #organizeBooksByCategory(Iterable, PlacementObserver)
     */
    public void organizeBooksByCategory(Iterable<Book> pile) {
        organizeBooksByCategory(pile, NO_OP_OBSERVER);
    }

    /**
     * Distributes a pile of loose books onto the room's existing shelves.
     * <p>
     * Each book goes to the first shelf (in room order) whose name equals the book's
     * category exactly. It is appended after the books already there; books bound for
     * the same shelf keep their pile order. A book with no matching shelf is dropped,
     * which is reported to the observer and not treated as an error.
     * <p>
     * The pile is read once and never modified. Nothing is remembered between calls,
     * so organizing overlapping piles appends the same books again.
     *
     * @param pile     books to place, must not be null or contain null
     * @param observer receives a callback per book, must not be null
     * @throws IllegalArgumentException if pile or observer is null, or pile holds a null book
     */
    public void organizeBooksByCategory(Iterable<Book> pile, PlacementObserver observer) {
        if (pile == null) {
            throw new IllegalArgumentException("Pile must not be null");
        }
        if (observer == null) {
            throw new IllegalArgumentException("Placement observer must not be null");
        }

        // Decide every placement before touching a shelf: the pile may be a view of one
        // of the room's shelves, and a bad element must not leave the room half-updated
        Map<String, Optional<Shelf>> shelfByCategory = new HashMap<>();
        Map<Shelf, List<Book>> placements = new LinkedHashMap<>();
        List<Placement> decisions = new ArrayList<>();

        for (Book book : pile) {
            if (book == null) {
                throw new IllegalArgumentException("Pile must not contain null books");
            }
            Optional<Shelf> target = shelfByCategory.computeIfAbsent(book.category(), room::findShelf);
            target.ifPresent(shelf -> placements.computeIfAbsent(shelf, key -> new ArrayList<>()).add(book));
            decisions.add(new Placement(book, target.orElse(null)));
        }

        for (Placement decision : decisions) {
            if (decision.shelf() != null) {
                observer.onPlaced(decision.book(), decision.shelf());
            } else {
                log.debug("No shelf named '{}' for book {} ({}), leaving it unplaced",
                        decision.book().category(), decision.book().id(), decision.book().title());
                observer.onUnplaced(decision.book());
            }
        }

        for (Map.Entry<Shelf, List<Book>> entry : placements.entrySet()) {
            entry.getKey().addBooks(entry.getValue());
            log.debug("Placed {} book(s) on shelf '{}'", entry.getValue().size(), entry.getKey().getName());
        }
    }

    /**
     * Sorts every shelf by title in room order, using this catalog's ordering.
     * Each shelf sorts independently and stably.
     */
    public void sortBooksOnAllShelves() {
        for (Shelf shelf : room.getShelves()) {
            shelf.sortBooksByTitle(titleOrdering);
        }
        log.debug("Sorted {} shelves by title ({})", room.getShelves().size(), titleOrdering);
    }

    /**
     * Renders the room as text. Pure read: the same room state always yields the same string.
     * <pre>
     * Room: owner
     *   Shelf: name
     *     - title by author [category]
     * </pre>
     * Lines are separated by {@code \n} regardless of platform, with no trailing newline.
     */
    public String dump() {
        StringBuilder out = new StringBuilder();
        out.append("Room: ").append(room.getOwner());
        for (Shelf shelf : room.getShelves()) {
            out.append('\n').append("  Shelf: ").append(shelf.getName());
            for (Book book : shelf.getBooks()) {
                out.append('\n')
                        .append("    - ").append(book.title())
                        .append(" by ").append(book.author())
                        .append(" [").append(book.category()).append(']');
            }
        }
        return out.toString();
    }

    /**
     * Checks that no category is spread over differently named shelves.
     * <p>
     * Shelves sharing a name count as one location. Organizing alone never breaks this,
     * since a category only ever resolves to the first matching shelf; it catches rooms
     * whose shelves were filled directly.
     *
     * @throws CategoryPlacementException naming the category and the first two shelves holding it
     */
    public void verifyCategoryPlacement() {
        Map<String, String> seen = new HashMap<>();
        for (Shelf shelf : room.getShelves()) {
            for (String category : shelf.categories()) {
                String previous = seen.putIfAbsent(category, shelf.getName());
                if (previous != null && !previous.equals(shelf.getName())) {
                    throw new CategoryPlacementException(category, previous, shelf.getName());
                }
            }
        }
    }

    /**
     * Flattens the room into one row per shelved book, in room then shelf order.
     */
    public List<CatalogRow> rows() {
        List<CatalogRow> rows = new ArrayList<>();
        for (Shelf shelf : room.getShelves()) {
            for (Book book : shelf.getBooks()) {
                rows.add(new CatalogRow(book.id(), book.title(), book.author(),
                        book.category(), book.isbn(), shelf.getName()));
            }
        }
        return Collections.unmodifiableList(rows);
    }

    /**
     * Counts books per shelf name and category.
     *
     * @return shelf name (room order, same-named shelves merged) to category (sorted) to book count
     */
    public Map<String, Map<String, Long>> categoryCounts() {
        Map<String, Map<String, Long>> counts = new LinkedHashMap<>();
        for (Shelf shelf : room.getShelves()) {
            Map<String, Long> perCategory = counts.computeIfAbsent(shelf.getName(), name -> new TreeMap<>());
            for (Book book : shelf.getBooks()) {
                perCategory.merge(book.category(), 1L, Long::sum);
            }
        }
        return counts;
    }

    /**
     * Outcome for one pile entry; shelf is null when no shelf matched.
     */
    private record Placement(Book book, Shelf shelf) {
    }
}
