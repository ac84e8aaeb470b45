package com.vmsimulator.memory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Invariants that hold for every policy over a batch of seeded random inputs.
 */
public class PageReplacementPropertiesTest {

    private final List<List<Integer>> sequences = new ArrayList<>();

    @BeforeEach
    void setUp() {
        Random random = new Random(1550);
        sequences.add(List.of());
        sequences.add(List.of(1, 2, 3, 4, 1, 2, 5, 1, 2, 3, 4, 5));
        sequences.add(List.of(1, 2, 3, 4, 1, 2, 1, 2, 1, 3, 4, 5, 4, 5, 4, 5));
        sequences.add(List.of(0, 0, 0));
        for (int i = 0; i < 60; i++) {
            int length = random.nextInt(40);
            int pages = 1 + random.nextInt(10);
            List<Integer> seq = new ArrayList<>();
            for (int j = 0; j < length; j++) {
                seq.add(random.nextInt(pages));
            }
            sequences.add(seq);
        }
    }

    @Test
    void testDeterminism() {
        for (ReplacementPolicy policy : ReplacementPolicy.values()) {
            for (int frames = 1; frames <= 5; frames++) {
                for (List<Integer> seq : sequences) {
                    assertEquals(policy.create(frames).simulate(seq), policy.create(frames).simulate(seq));
                }
            }
        }
    }

    @Test
    void testHistoryAndFaultBounds() {
        for (ReplacementPolicy policy : ReplacementPolicy.values()) {
            for (int frames = 1; frames <= 5; frames++) {
                for (List<Integer> seq : sequences) {
                    SimulationResult result = policy.create(frames).simulate(seq);
                    List<StepRecord> history = result.getHistory();

                    assertEquals(seq.size(), history.size());
                    assertTrue(result.getFaultCount() <= seq.size());

                    int counted = 0;
                    Set<Integer> seen = new HashSet<>();
                    for (StepRecord step : history) {
                        if (step.isFault())
                            counted++;
                        if (seen.add(step.getPageAccessed())) {
                            assertTrue(step.isFault(), "first reference must fault: " + step);
                        }
                    }
                    assertEquals(counted, result.getFaultCount());
                }
            }
        }
    }

    @Test
    void testOccupancyAndNoDuplicates() {
        for (ReplacementPolicy policy : ReplacementPolicy.values()) {
            for (int frames = 1; frames <= 5; frames++) {
                for (List<Integer> seq : sequences) {
                    SimulationResult result = policy.create(frames).simulate(seq);
                    for (StepRecord step : result.getHistory()) {
                        assertValidState(step.getFrameStateBefore(), frames);
                        assertValidState(step.frameStateAfter(), frames);
                        assertEquals(!contains(step.getFrameStateBefore(), step.getPageAccessed()), step.isFault());
                    }
                    assertValidState(result.getFinalFrameState(), frames);
                }
            }
        }
    }

    @Test
    void testOptimalNeverWorseThanLru() {
        for (int frames = 1; frames <= 6; frames++) {
            for (List<Integer> seq : sequences) {
                int lru = new LRU(frames).simulate(seq).getFaultCount();
                int optimal = new Optimal(frames).simulate(seq).getFaultCount();
                assertTrue(optimal <= lru, "frames=" + frames + " seq=" + seq);
            }
        }
    }

    @Test
    void testEnoughFramesFaultsOncePerDistinctPage() {
        for (ReplacementPolicy policy : ReplacementPolicy.values()) {
            for (List<Integer> seq : sequences) {
                int distinct = new HashSet<>(seq).size();
                int frames = Math.max(1, distinct);
                assertEquals(distinct, policy.create(frames).simulate(seq).getFaultCount());
                assertEquals(distinct, policy.create(frames + 3).simulate(seq).getFaultCount());
            }
        }
    }

    @Test
    void testLruHistoryReplays() {
        for (int frames = 1; frames <= 5; frames++) {
            for (List<Integer> seq : sequences) {
                SimulationResult result = new LRU(frames).simulate(seq);
                List<StepRecord> history = result.getHistory();
                Map<Integer, Integer> lastUse = new HashMap<>();
                for (int i = 0; i < history.size(); i++) {
                    StepRecord step = history.get(i);
                    int[] expected = step.getFrameStateBefore();
                    if (step.isFault()) {
                        int slot = firstEmpty(expected);
                        if (slot < 0) {
                            slot = 0;
                            for (int f = 1; f < expected.length; f++) {
                                if (lastUse.get(expected[f]) < lastUse.get(expected[slot]))
                                    slot = f;
                            }
                        }
                        expected[slot] = step.getPageAccessed();
                    }
                    lastUse.put(step.getPageAccessed(), i);
                    assertReplays(result, i, expected);
                }
            }
        }
    }

    @Test
    void testOptimalHistoryReplays() {
        for (int frames = 1; frames <= 5; frames++) {
            for (List<Integer> seq : sequences) {
                SimulationResult result = new Optimal(frames).simulate(seq);
                List<StepRecord> history = result.getHistory();
                for (int i = 0; i < history.size(); i++) {
                    StepRecord step = history.get(i);
                    int[] expected = step.getFrameStateBefore();
                    if (step.isFault()) {
                        int slot = firstEmpty(expected);
                        if (slot < 0) {
                            slot = 0;
                            for (int f = 1; f < expected.length; f++) {
                                if (nextUse(seq, expected[f], i) > nextUse(seq, expected[slot], i))
                                    slot = f;
                            }
                        }
                        expected[slot] = step.getPageAccessed();
                    }
                    assertReplays(result, i, expected);
                }
            }
        }
    }

    private static void assertReplays(SimulationResult result, int i, int[] expectedAfter) {
        List<StepRecord> history = result.getHistory();
        assertArrayEquals(expectedAfter, history.get(i).frameStateAfter());
        if (i + 1 < history.size()) {
            assertArrayEquals(expectedAfter, history.get(i + 1).getFrameStateBefore());
        } else {
            assertArrayEquals(expectedAfter, result.getFinalFrameState());
        }
    }

    private static void assertValidState(int[] state, int frames) {
        assertEquals(frames, state.length);
        Set<Integer> residents = new HashSet<>();
        for (int page : state) {
            if (page != FrameTable.EMPTY) {
                assertTrue(residents.add(page), "duplicate resident in " + Arrays.toString(state));
            }
        }
        assertTrue(residents.size() <= frames);
    }

    private static boolean contains(int[] state, int page) {
        for (int p : state) {
            if (p == page)
                return true;
        }
        return false;
    }

    private static int firstEmpty(int[] state) {
        for (int i = 0; i < state.length; i++) {
            if (state[i] == FrameTable.EMPTY)
                return i;
        }
        return -1;
    }

    private static int nextUse(List<Integer> seq, int page, int step) {
        for (int j = step + 1; j < seq.size(); j++) {
            if (seq.get(j) == page)
                return j;
        }
        return Integer.MAX_VALUE;
    }
}
