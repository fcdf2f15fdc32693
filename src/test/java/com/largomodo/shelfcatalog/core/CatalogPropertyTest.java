package com.largomodo.shelfcatalog.core;

import com.largomodo.shelfcatalog.core.domain.Book;
import com.largomodo.shelfcatalog.core.domain.Room;
import com.largomodo.shelfcatalog.core.domain.Shelf;
import net.jqwik.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property-based tests for Catalog.
 * <p>
 * Tests verify:
 * - Dump is idempotent for any room state
 * - Sorting is ordered and stable (equal titles keep pile order)
 * - Organizing places exactly the books whose category names a shelf, nothing else
 */
class CatalogPropertyTest {

    private static final List<String> SHELF_NAMES = List.of("Fiction", "History", "SciFi");

    @Provide
    Arbitrary<List<Book>> piles() {
        // Small alphabets force repeated titles and some categories without a shelf
        Arbitrary<String> titles = Arbitraries.strings().withChars("abAB").ofMinLength(0).ofMaxLength(3);
        Arbitrary<String> categories = Arbitraries.of("Fiction", "History", "SciFi", "fiction", "Poetry");
        return Combinators.combine(titles, categories)
                .as((title, category) -> new Object[]{title, category})
                .list().ofMaxSize(25)
                .map(CatalogPropertyTest::numbered);
    }

    private static List<Book> numbered(List<Object[]> drafts) {
        List<Book> books = new ArrayList<>();
        for (int i = 0; i < drafts.size(); i++) {
            Object[] draft = drafts.get(i);
            books.add(new Book("b" + i, (String) draft[0], "Author " + i, (String) draft[1]));
        }
        return books;
    }

    private static Room freshRoom() {
        Room room = new Room("Owner");
        SHELF_NAMES.forEach(name -> room.addShelf(new Shelf(name)));
        return room;
    }

    private static int indexOf(Book book) {
        return Integer.parseInt(book.id().substring(1));
    }

    @Property
    void dumpIsIdempotent(@ForAll("piles") List<Book> pile) {
        Catalog catalog = new Catalog(freshRoom());
        catalog.organizeBooksByCategory(pile);
        catalog.sortBooksOnAllShelves();

        assertEquals(catalog.dump(), catalog.dump());
    }

    @Property
    void sortIsOrderedAndStable(@ForAll("piles") List<Book> pile) {
        Shelf shelf = new Shelf("Mixed", pile);

        shelf.sortBooksByTitle();

        List<Book> sorted = shelf.getBooks();
        for (int i = 1; i < sorted.size(); i++) {
            Book previous = sorted.get(i - 1);
            Book current = sorted.get(i);
            int cmp = TitleOrdering.compareCodePoints(previous.title(), current.title());
            assertTrue(cmp <= 0, "Titles out of order: " + previous.title() + " > " + current.title());
            if (cmp == 0) {
                assertTrue(indexOf(previous) < indexOf(current),
                        "Equal titles must keep original order: " + previous.id() + " after " + current.id());
            }
        }
    }

    @Property
    void organizePlacesOnlyMatchingBooksInPileOrder(@ForAll("piles") List<Book> pile) {
        Room room = freshRoom();

        new Catalog(room).organizeBooksByCategory(pile);

        for (Shelf shelf : room.getShelves()) {
            List<String> expected = pile.stream()
                    .filter(book -> book.category().equals(shelf.getName()))
                    .map(Book::id)
                    .collect(Collectors.toList());
            List<String> actual = shelf.getBooks().stream().map(Book::id).collect(Collectors.toList());
            assertEquals(expected, actual, "Shelf " + shelf.getName());
        }
    }
}
