package com.vmsimulator.simulator;

import com.vmsimulator.memory.FrameTable;
import com.vmsimulator.memory.ReplacementPolicy;
import com.vmsimulator.memory.SimulationResult;
import com.vmsimulator.memory.StepRecord;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * SimulationReport
 *
 * Formatea resultados como texto plano para consola y para el área de log de
 * la ventana principal.
 */
public final class SimulationReport {

    private SimulationReport() {
    }

    /**
     * Informe completo de una ejecución: resumen y un paso por línea.
     *
     * @param result resultado a formatear
     * @return texto multilínea
     */
    public static String format(SimulationResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Algorithm: ").append(result.getAlgorithmName()).append('\n');
        sb.append("Frames: ").append(result.getFrameCount()).append('\n');
        sb.append("Total Page Faults: ").append(result.getFaultCount()).append('\n');
        sb.append("Page Fault Rate: ").append(percent(result.getFaultRate())).append('\n');
        sb.append("Final Memory State: ").append(formatFrames(result.getFinalFrameState())).append('\n');
        sb.append("Access Sequence: ").append(formatSequence(result.getReferenceSequence())).append('\n');

        List<StepRecord> history = result.getHistory();
        for (int i = 0; i < history.size(); i++) {
            StepRecord step = history.get(i);
            sb.append(String.format("Step %d: Accessing Page %d %s\n", i + 1, step.getPageAccessed(),
                    step.isFault() ? "(Page Fault)" : "(Hit)"));
        }
        return sb.toString();
    }

    /**
     * Resumen comparativo de varias políticas sobre la misma entrada.
     *
     * @param results resultados por política
     * @return una línea por política
     */
    public static String compare(Map<ReplacementPolicy, SimulationResult> results) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<ReplacementPolicy, SimulationResult> e : results.entrySet()) {
            SimulationResult r = e.getValue();
            sb.append(String.format("%-8s faults=%d rate=%s final=%s\n", e.getKey().getDisplayName(),
                    r.getFaultCount(), percent(r.getFaultRate()), formatFrames(r.getFinalFrameState())));
        }
        return sb.toString();
    }

    /**
     * @param frames contenido de los frames
     * @return p. ej. "[1, 2, -]"
     */
    public static String formatFrames(int[] frames) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < frames.length; i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(frames[i] == FrameTable.EMPTY ? "-" : String.valueOf(frames[i]));
        }
        return sb.append(']').toString();
    }

    public static String formatSequence(List<Integer> sequence) {
        return sequence.stream().map(String::valueOf).collect(Collectors.joining(" -> "));
    }

    /**
     * @param rate fracción entre 0 y 1
     * @return porcentaje con dos decimales, p. ej. "83.33%"
     */
    public static String percent(double rate) {
        return String.format(Locale.ROOT, "%.2f%%", rate * 100);
    }
}
