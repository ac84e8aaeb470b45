package com.vmsimulator.process;

import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Locality-biased sequence generation with a fixed seed.
 */
public class PageSequenceGeneratorTest {

    @Test
    void testSameSeedSameSequence() {
        ProcessInfo process = new ProcessInfo(42, "java", 320.0);
        List<Integer> a = new PageSequenceGenerator(new Random(7)).generate(process);
        List<Integer> b = new PageSequenceGenerator(new Random(7)).generate(process);

        assertEquals(a, b);
        assertEquals(PageSequenceGenerator.SEQUENCE_LENGTH, a.size());
    }

    @Test
    void testSmallProcessUsesHotPagesOnly() {
        // 10 MB -> 4 pages, all hot; new pages may only appear after index 20
        ProcessInfo process = new ProcessInfo(1, "small", 10.0);
        for (long seed = 0; seed < 20; seed++) {
            List<Integer> seq = new PageSequenceGenerator(new Random(seed)).generate(process);
            for (int i = 0; i < seq.size(); i++) {
                int page = seq.get(i);
                if (i <= 20) {
                    assertTrue(page >= 1 && page <= 4, "seed=" + seed + " i=" + i + " page=" + page);
                } else {
                    assertTrue(page >= 1);
                }
            }
        }
    }

    @Test
    void testPagesStayInRangeBeforeTail() {
        ProcessInfo process = new ProcessInfo(2, "big", 800.0);
        for (long seed = 0; seed < 20; seed++) {
            List<Integer> seq = new PageSequenceGenerator(new Random(seed)).generate(process);
            for (int i = 0; i <= 20; i++) {
                int page = seq.get(i);
                assertTrue(page >= 1 && page <= 10, "seed=" + seed + " page=" + page);
            }
        }
    }

    @Test
    void testSizing() {
        assertEquals(4, PageSequenceGenerator.pageCountFor(10));
        assertEquals(6, PageSequenceGenerator.pageCountFor(300));
        assertEquals(10, PageSequenceGenerator.pageCountFor(4000));

        assertEquals(0.4, PageSequenceGenerator.localityFactorFor(0), 1e-9);
        assertEquals(0.5, PageSequenceGenerator.localityFactorFor(100), 1e-9);
        assertEquals(0.8, PageSequenceGenerator.localityFactorFor(1000), 1e-9);
    }
}
