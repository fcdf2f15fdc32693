package com.largomodo.shelfcatalog;

import com.largomodo.shelfcatalog.core.TitleOrdering;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for ShelfCatalog CLI argument parsing and end-to-end runs.
 * <p>
 * Runs go through {@link ShelfCatalog#commandLine()} with stdout and stderr captured.
 */
class ShelfCatalogTest {

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int execute(String... args) {
        CommandLine cmd = ShelfCatalog.commandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void testParseRepeatableOptions() {
        CommandLine cmd = ShelfCatalog.commandLine();
        ShelfCatalog app = cmd.getCommand();

        cmd.parseArgs("--owner", "Alice", "-s", "Fiction", "-s", "History",
                "-b", "f1|Emma|Jane Austen|Fiction", "--title-order", "case-insensitive");

        assertEquals("Alice", app.owner);
        assertEquals(2, app.shelfNames.size());
        assertEquals(1, app.books.size());
        assertEquals("Emma", app.books.get(0).title());
        assertEquals(TitleOrdering.CASE_INSENSITIVE, app.titleOrdering);
    }

    @Test
    void testDefaultTitleOrdering() {
        CommandLine cmd = ShelfCatalog.commandLine();
        ShelfCatalog app = cmd.getCommand();

        cmd.parseArgs("--owner", "Alice");

        assertEquals(TitleOrdering.CODEPOINT, app.titleOrdering);
        assertFalse(app.noSort);
    }

    @Test
    void testOrganizeSortAndDump() {
        int exitCode = execute("--owner", "Alice", "-s", "Fiction", "-s", "History",
                "-b", "f1|Zorba the Greek|Nikos Kazantzakis|Fiction",
                "-b", "h1|SPQR|Mary Beard|History",
                "-b", "f2|Emma|Jane Austen|Fiction",
                "-b", "p1|Odes|John Keats|Poetry");

        assertEquals(0, exitCode, "stderr: " + err);
        String expected = String.join("\n",
                "Room: Alice",
                "  Shelf: Fiction",
                "    - Emma by Jane Austen [Fiction]",
                "    - Zorba the Greek by Nikos Kazantzakis [Fiction]",
                "  Shelf: History",
                "    - SPQR by Mary Beard [History]");
        assertEquals(expected, out.toString().strip());
    }

    @Test
    void testNoSortKeepsPileOrder() {
        int exitCode = execute("--owner", "Alice", "-s", "Fiction", "--no-sort",
                "-b", "f1|Zorba the Greek|Nikos Kazantzakis|Fiction",
                "-b", "f2|Emma|Jane Austen|Fiction");

        assertEquals(0, exitCode);
        String dump = out.toString();
        assertTrue(dump.indexOf("Zorba") < dump.indexOf("Emma"), "Pile order expected: " + dump);
    }

    @Test
    void testDemoWithSummary() {
        int exitCode = execute("--demo", "--verify", "--summary");

        assertEquals(0, exitCode, "stderr: " + err);
        String output = out.toString();
        assertTrue(output.startsWith("Room: " + SampleLibrary.OWNER));
        assertTrue(output.contains("    - Clean Code by Robert C. Martin [Programming]\n"
                + "    - The Pragmatic Programmer by Andrew Hunt [Programming]"));
        assertFalse(output.contains("The Name of the Rose"), "Mystery book has no shelf");
        assertTrue(output.contains("  Programming: Programming=2"));
        assertTrue(output.contains("  Sci-Fi: Sci-Fi=2"));
    }

    @Test
    void testDemoOwnerOverride() {
        int exitCode = execute("--demo", "--owner", "Carol", "-s", "Mystery");

        assertEquals(0, exitCode);
        assertTrue(out.toString().startsWith("Room: Carol"));
        assertTrue(out.toString().contains("  Shelf: Mystery\n    - The Name of the Rose by Umberto Eco [Mystery]"));
    }

    @Test
    void testMissingOwnerIsUsageError() {
        int exitCode = execute("-s", "Fiction");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("--owner"), "stderr: " + err);
    }

    @Test
    void testMalformedBookIsUsageError() {
        int exitCode = execute("--owner", "Alice", "-b", "f1|Emma");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("got 2 field(s)"), "stderr: " + err);
    }

    @Test
    void testInvalidTitleOrderIsUsageError() {
        int exitCode = execute("--owner", "Alice", "--title-order", "locale");

        assertEquals(2, exitCode);
    }

    @Test
    void testVersionFromResourceBundle() {
        int exitCode = execute("--version");

        assertEquals(0, exitCode);
        assertEquals("1.0.0", out.toString().strip());
    }
}
