package com.vmsimulator.process;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * PageSequenceGenerator
 *
 * Genera secuencias de referencias con localidad a partir del tamaño en
 * memoria de un proceso:
 * - número de páginas: memoria/50 MB, acotado a [4, 10].
 * - páginas "calientes": 1..min(5, páginas); el resto son "frías".
 * - factor de localidad: 0.4 + memoria/1000, acotado a [0.2, 0.8].
 *
 * Toda la aleatoriedad proviene del Random inyectado, así que con una semilla
 * fija la secuencia es reproducible.
 */
public class PageSequenceGenerator {
    public static final int SEQUENCE_LENGTH = 30;
    static final int MIN_PAGES = 4;
    static final int MAX_PAGES = 10;
    static final int MAX_HOT_PAGES = 5;

    private final Random random;

    public PageSequenceGenerator(Random random) {
        this.random = random;
    }

    /**
     * Genera una secuencia para el proceso dado.
     *
     * @param process proceso observado
     * @return secuencia de SEQUENCE_LENGTH páginas (>= 1)
     */
    public List<Integer> generate(ProcessInfo process) {
        double memoryMb = process.getMemoryMb();
        int numPages = pageCountFor(memoryMb);
        int hotCount = Math.min(MAX_HOT_PAGES, numPages);
        int coldCount = numPages - hotCount;
        double locality = localityFactorFor(memoryMb);

        List<Integer> sequence = new ArrayList<>(SEQUENCE_LENGTH);
        Set<Integer> distinct = new HashSet<>();
        for (int i = 0; i < SEQUENCE_LENGTH; i++) {
            int page;
            if (random.nextDouble() < locality) {
                page = 1 + random.nextInt(hotCount);
            } else if (i > 20 && random.nextDouble() < 0.3) {
                // página nueva: fuerza un fault al final de la traza
                page = numPages + 1 + distinct.size();
            } else if (coldCount > 0) {
                page = hotCount + 1 + random.nextInt(coldCount);
            } else {
                page = 1 + random.nextInt(numPages);
            }
            sequence.add(page);
            distinct.add(page);
        }
        return sequence;
    }

    static int pageCountFor(double memoryMb) {
        return Math.min(MAX_PAGES, Math.max(MIN_PAGES, (int) (memoryMb / 50)));
    }

    static double localityFactorFor(double memoryMb) {
        return Math.min(0.8, Math.max(0.2, 0.4 + memoryMb / 1000));
    }
}
