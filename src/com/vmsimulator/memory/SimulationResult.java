package com.vmsimulator.memory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * SimulationResult
 *
 * Resultado inmutable de una ejecución: número de page faults, estado final de
 * los frames e historial ordenado de pasos. Las tasas se derivan del
 * historial y nunca dividen por cero.
 */
public final class SimulationResult {
    private final String algorithmName;
    private final int faultCount;
    private final int[] finalFrameState;
    private final List<StepRecord> history;

    public SimulationResult(String algorithmName, int faultCount, int[] finalFrameState, List<StepRecord> history) {
        this.algorithmName = algorithmName;
        this.faultCount = faultCount;
        this.finalFrameState = finalFrameState.clone();
        this.history = Collections.unmodifiableList(new ArrayList<>(history));
    }

    public String getAlgorithmName() {
        return algorithmName;
    }

    public int getFaultCount() {
        return faultCount;
    }

    public int[] getFinalFrameState() {
        return finalFrameState.clone();
    }

    public int getFrameCount() {
        return finalFrameState.length;
    }

    public List<StepRecord> getHistory() {
        return history;
    }

    /**
     * Secuencia de referencias reconstruida desde el historial.
     *
     * @return páginas accedidas en orden
     */
    public List<Integer> getReferenceSequence() {
        List<Integer> sequence = new ArrayList<>(history.size());
        for (StepRecord step : history) {
            sequence.add(step.getPageAccessed());
        }
        return sequence;
    }

    public int getHitCount() {
        return history.size() - faultCount;
    }

    /**
     * Número de faults que expulsaron una página residente.
     *
     * @return reemplazos realizados
     */
    public int getReplacementCount() {
        int count = 0;
        for (StepRecord step : history) {
            if (step.isReplacement())
                count++;
        }
        return count;
    }

    /**
     * Fracción de referencias que produjeron fault.
     *
     * @return faultCount / referencias, o 0 si no hubo referencias
     */
    public double getFaultRate() {
        if (history.isEmpty()) {
            return 0;
        }
        return (double) faultCount / history.size();
    }

    /**
     * Fracción de referencias resueltas sin fault.
     *
     * @return hits / referencias, o 0 si no hubo referencias
     */
    public double getHitRate() {
        if (history.isEmpty()) {
            return 0;
        }
        return (double) getHitCount() / history.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SimulationResult))
            return false;
        SimulationResult other = (SimulationResult) o;
        return faultCount == other.faultCount
                && algorithmName.equals(other.algorithmName)
                && Arrays.equals(finalFrameState, other.finalFrameState)
                && history.equals(other.history);
    }

    @Override
    public int hashCode() {
        int h = algorithmName.hashCode();
        h = 31 * h + faultCount;
        h = 31 * h + Arrays.hashCode(finalFrameState);
        h = 31 * h + history.hashCode();
        return h;
    }

    @Override
    public String toString() {
        return String.format("%s: faults=%d final=%s steps=%d", algorithmName, faultCount,
                Arrays.toString(finalFrameState), history.size());
    }
}
