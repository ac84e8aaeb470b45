package com.vmsimulator;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Console mode of the entry point.
 */
public class MainTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return Main.runConsole(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void testSinglePolicy() {
        assertEquals(0, run("3", "1,2,3,4,1,2,5,1,2,3,4,5", "lru"));
        String report = out.toString(StandardCharsets.UTF_8);
        assertTrue(report.contains("Total Page Faults: 10"));
        assertTrue(report.contains("Step 12: Accessing Page 5 (Page Fault)"));
    }

    @Test
    void testBothPoliciesByDefault() {
        assertEquals(0, run("3", "1 2 3 4 1 2 5 1 2 3 4 5"));
        String summary = out.toString(StandardCharsets.UTF_8);
        assertTrue(summary.contains("faults=10"));
        assertTrue(summary.contains("faults=7"));
    }

    @Test
    void testInvalidArguments() {
        assertEquals(1, run("0", "1,2,3"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("frameCount must be > 0"));

        err.reset();
        assertEquals(1, run("3", "1,a"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("'a'"));

        err.reset();
        assertEquals(1, run("3", "1,2", "FIFO"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Unknown replacement policy"));

        err.reset();
        assertEquals(1, run("3"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains(Main.USAGE));
        assertEquals("", out.toString(StandardCharsets.UTF_8));
    }
}
