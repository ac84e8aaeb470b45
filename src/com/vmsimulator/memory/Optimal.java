package com.vmsimulator.memory;

import java.util.List;

/**
 * Optimal (Belady) - expulsa la página cuyo próximo uso está más lejos en el
 * futuro, o que no vuelve a usarse.
 *
 * Empates: se recorren los frames en orden ascendente y solo se cambia de
 * candidato ante una distancia estrictamente mayor, así que gana el frame de
 * menor índice.
 */
public class Optimal extends PageReplacementAlgorithm {
    /** Distancia de una página que no vuelve a referenciarse. */
    static final int NEVER = Integer.MAX_VALUE;

    /**
     * Construye una instancia de Optimal.
     *
     * @param frameCount número de frames físicos
     */
    public Optimal(int frameCount) {
        super(frameCount);
    }

    @Override
    protected void reset() {
        // Sin estado propio: la decisión depende solo de la secuencia
    }

    @Override
    protected void pageAccessed(int page, int step) {
        // No-op
    }

    @Override
    protected void pageEvicted(int page) {
        // No-op
    }

    /**
     * Selecciona el frame cuya página se usará más tarde.
     *
     * @param referenceSequence secuencia completa
     * @param step              índice de la referencia que produjo el fault
     * @return frame víctima
     */
    @Override
    protected int selectFrameToReplace(List<Integer> referenceSequence, int step) {
        int victim = 0;
        int farthest = -1;
        for (int f = 0; f < frameTable.size(); f++) {
            int next = nextUse(referenceSequence, frameTable.pageAt(f), step);
            if (next > farthest) {
                farthest = next;
                victim = f;
            }
        }
        return victim;
    }

    /**
     * Índice de la siguiente referencia a la página posterior a step.
     *
     * @param referenceSequence secuencia completa
     * @param page              página residente
     * @param step              índice actual
     * @return menor j > step con S[j] == page, o NEVER
     */
    static int nextUse(List<Integer> referenceSequence, int page, int step) {
        for (int j = step + 1; j < referenceSequence.size(); j++) {
            if (referenceSequence.get(j) == page) {
                return j;
            }
        }
        return NEVER;
    }

    @Override
    public String getName() {
        return "Optimal (Belady)";
    }
}
