package com.largomodo.shelfcatalog;

import com.largomodo.shelfcatalog.core.Catalog;
import com.largomodo.shelfcatalog.core.PlacementObserver;
import com.largomodo.shelfcatalog.core.TitleOrdering;
import com.largomodo.shelfcatalog.core.domain.Book;
import com.largomodo.shelfcatalog.core.domain.Room;
import com.largomodo.shelfcatalog.core.domain.Shelf;
import com.largomodo.shelfcatalog.util.BookSpecParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * CLI entry point for organizing a room of shelves.
 * <p>
 * Builds a room from {@code --shelf} options (or the sample room with {@code --demo}),
 * places the {@code --book} pile by category, sorts every shelf by title and prints
 * the room dump on stdout. Log output goes to stderr so the dump can be piped.
 */
@Command(
        name = "shelfcatalog",
        mixinStandardHelpOptions = true,
        resourceBundle = "shelfcatalog.shelfcatalog",
        version = "${bundle:application.version}",
        header = "Organizes a room of shelves by category and title.",
        description = {
                "Places a pile of books onto the shelf whose name equals each book's category," +
                        " sorts every shelf by title and prints the room.",
                "",
                "Books whose category matches no shelf are left unplaced and reported as warnings.",
                "Shelves are never created automatically: declare one per category with --shelf."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:Execution error (e.g. category placement verification failed)",
                "2:Invalid command line arguments"
        }
)
public class ShelfCatalog implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ShelfCatalog.class);

    @Option(names = {"-r", "--owner"}, paramLabel = "NAME",
            description = "Owner of the room. Required unless --demo is given.")
    String owner;

    @Option(names = {"-s", "--shelf"}, paramLabel = "NAME",
            description = {
                    "Adds an empty shelf to the room. Repeatable; shelves keep the given order.",
                    "Books are placed on the first shelf whose name equals their category (case-sensitive)."
            })
    List<String> shelfNames = new ArrayList<>();

    @Option(names = {"-b", "--book"}, paramLabel = BookSpecParser.FORMAT, converter = BookConverter.class,
            description = "Adds a book to the pile to organize. Repeatable.")
    List<Book> books = new ArrayList<>();

    @Option(names = "--title-order", defaultValue = "CODEPOINT",
            description = {
                    "Title comparison used when sorting shelves.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    TitleOrdering titleOrdering;

    @Option(names = "--no-sort", description = "Keep placement order instead of sorting shelves by title")
    boolean noSort;

    @Option(names = "--verify", description = "Fail if any category ends up on more than one shelf")
    boolean verify;

    @Option(names = "--summary", description = "Print book counts per shelf and category after the dump")
    boolean summary;

    @Option(names = "--demo", description = "Start from the built-in sample room and pile")
    boolean demo;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line configured the way {@link #main} runs it.
     */
    static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new ShelfCatalog());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        cmd.registerConverter(TitleOrdering.class, TitleOrdering::fromCliArgument);
        return cmd;
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        Room room = buildRoom();
        List<Book> pile = new ArrayList<>();
        if (demo) {
            pile.addAll(SampleLibrary.pile());
        }
        pile.addAll(books);

        try {
            MDC.put("room", room.getOwner());
            run(new Catalog(room, titleOrdering), pile);
        } finally {
            MDC.clear();
        }
        return 0;
    }

    private Room buildRoom() {
        Room room;
        if (demo) {
            room = owner != null ? new Room(owner, SampleLibrary.room().getShelves()) : SampleLibrary.room();
        } else {
            if (owner == null || owner.isBlank()) {
                throw new ParameterException(spec.commandLine(),
                        "Missing required option: '--owner=NAME' (or use --demo)");
            }
            room = new Room(owner);
        }

        for (String name : shelfNames) {
            room.addShelf(new Shelf(name));
        }

        if (room.getShelves().isEmpty()) {
            log.warn("Room of {} has no shelves: every book will be left unplaced", room.getOwner());
        }
        return room;
    }

    private void run(Catalog catalog, List<Book> pile) {
        final AtomicInteger placedCount = new AtomicInteger(0);
        final AtomicInteger unplacedCount = new AtomicInteger(0);

        catalog.organizeBooksByCategory(pile, new PlacementObserver() {
            @Override
            public void onPlaced(Book book, Shelf shelf) {
                placedCount.incrementAndGet();
            }

            @Override
            public void onUnplaced(Book book) {
                unplacedCount.incrementAndGet();
                log.warn("Unplaced: '{}' ({}) - no shelf named '{}'", book.title(), book.id(), book.category());
            }
        });
        log.info("Organized pile: {} placed, {} unplaced", placedCount.get(), unplacedCount.get());

        if (!noSort) {
            catalog.sortBooksOnAllShelves();
        }

        if (verify) {
            catalog.verifyCategoryPlacement();
            log.info("Category placement verified: each category is on a single shelf");
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println(catalog.dump());

        if (summary) {
            out.println();
            out.println("Books per shelf and category:");
            for (Map.Entry<String, Map<String, Long>> shelf : catalog.categoryCounts().entrySet()) {
                String counts = shelf.getValue().isEmpty()
                        ? "-"
                        : shelf.getValue().entrySet().stream()
                        .map(entry -> entry.getKey() + "=" + entry.getValue())
                        .collect(Collectors.joining(", "));
                out.println("  " + shelf.getKey() + ": " + counts);
            }
        }
        out.flush();
    }
}
