package com.vmsimulator.memory;

import java.util.Arrays;

/**
 * Registro inmutable de un paso de la simulación.
 *
 * Contiene:
 * - pageAccessed: página referenciada en este paso.
 * - frameStateBefore: copia de los frames antes de aplicar el paso.
 * - fault: true si la página no estaba residente.
 * - frameIndex: slot donde se cargó la página, o -1 en un hit.
 * - evictedPage: página expulsada, o FrameTable.EMPTY si no hubo expulsión.
 */
public final class StepRecord {
    private final int pageAccessed;
    private final int[] frameStateBefore;
    private final boolean fault;
    private final int frameIndex;
    private final int evictedPage;

    public StepRecord(int pageAccessed, int[] frameStateBefore, boolean fault, int frameIndex, int evictedPage) {
        this.pageAccessed = pageAccessed;
        this.frameStateBefore = frameStateBefore.clone();
        this.fault = fault;
        this.frameIndex = frameIndex;
        this.evictedPage = evictedPage;
    }

    public int getPageAccessed() {
        return pageAccessed;
    }

    /**
     * Estado de los frames contra el que se decidió hit/fault.
     *
     * @return copia del estado previo
     */
    public int[] getFrameStateBefore() {
        return frameStateBefore.clone();
    }

    /**
     * Estado resultante tras aplicar el paso.
     *
     * @return copia del estado posterior
     */
    public int[] frameStateAfter() {
        int[] after = frameStateBefore.clone();
        if (fault && frameIndex >= 0) {
            after[frameIndex] = pageAccessed;
        }
        return after;
    }

    public boolean isFault() {
        return fault;
    }

    public int getFrameIndex() {
        return frameIndex;
    }

    public int getEvictedPage() {
        return evictedPage;
    }

    public boolean isReplacement() {
        return evictedPage != FrameTable.EMPTY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StepRecord))
            return false;
        StepRecord other = (StepRecord) o;
        return pageAccessed == other.pageAccessed
                && fault == other.fault
                && frameIndex == other.frameIndex
                && evictedPage == other.evictedPage
                && Arrays.equals(frameStateBefore, other.frameStateBefore);
    }

    @Override
    public int hashCode() {
        int h = Arrays.hashCode(frameStateBefore);
        h = 31 * h + pageAccessed;
        h = 31 * h + (fault ? 1 : 0);
        h = 31 * h + frameIndex;
        h = 31 * h + evictedPage;
        return h;
    }

    @Override
    public String toString() {
        return String.format("[p=%d %s before=%s%s]", pageAccessed, fault ? "FAULT" : "HIT",
                Arrays.toString(frameStateBefore),
                isReplacement() ? " evict=" + evictedPage : "");
    }
}
