package com.vmsimulator.process;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Secuencias de ejemplo ofrecidas en la interfaz.
 */
public enum ExampleSequence {
    BASIC("Basic Sequence"),
    LOCALITY("With Locality of Reference"),
    RANDOM("Random Sequence");

    static final int RANDOM_LENGTH = 20;
    static final int RANDOM_MAX_PAGE = 9;

    private final String displayName;

    ExampleSequence(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Devuelve las páginas del ejemplo.
     *
     * @param random fuente para RANDOM; ignorada en los ejemplos fijos
     * @return nueva lista mutable
     */
    public List<Integer> pages(Random random) {
        switch (this) {
            case BASIC:
                return new ArrayList<>(List.of(1, 2, 3, 4, 1, 2, 5, 1, 2, 3, 4, 5));
            case LOCALITY:
                return new ArrayList<>(List.of(1, 2, 3, 4, 1, 2, 1, 2, 1, 3, 4, 5, 4, 5, 4, 5));
            default:
                List<Integer> pages = new ArrayList<>(RANDOM_LENGTH);
                for (int i = 0; i < RANDOM_LENGTH; i++) {
                    pages.add(1 + random.nextInt(RANDOM_MAX_PAGE));
                }
                return pages;
        }
    }

    @Override
    public String toString() {
        return displayName;
    }
}
