package com.largomodo.shelfcatalog;

import com.largomodo.shelfcatalog.core.domain.Book;
import com.largomodo.shelfcatalog.core.domain.Room;
import com.largomodo.shelfcatalog.core.domain.Shelf;

import java.util.List;

/**
 * Built-in room and pile loaded by {@code --demo}.
 * <p>
 * The sample has no "Mystery" shelf, so one book is left unplaced.
 */
final class SampleLibrary {

    static final String OWNER = "Bob";

    private SampleLibrary() {
    }

    static Room room() {
        return new Room(OWNER, List.of(
                new Shelf("Classic"),
                new Shelf("Dystopian"),
                new Shelf("Programming"),
                new Shelf("Sci-Fi")
        ));
    }

    static List<Book> pile() {
        return List.of(
                new Book("b001", "A Tale of Two Cities", "Charles Dickens", "Classic"),
                new Book("b002", "Brave New World", "Aldous Huxley", "Dystopian"),
                new Book("b003", "The Pragmatic Programmer", "Andrew Hunt", "Programming", "9780201616224"),
                new Book("b004", "Clean Code", "Robert C. Martin", "Programming", "9780132350884"),
                new Book("b005", "Do Androids Dream of Electric Sheep?", "Philip K. Dick", "Sci-Fi"),
                new Book("b006", "I, Robot", "Isaac Asimov", "Sci-Fi"),
                new Book("b007", "The Name of the Rose", "Umberto Eco", "Mystery")
        );
    }
}
