package com.vmsimulator.memory;

import com.vmsimulator.simulator.EventLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Base para algoritmos de reemplazo de páginas.
 *
 * Implementa el recorrido común sobre la secuencia de referencias (snapshot,
 * detección de fault, uso de frames libres, registro del historial) y delega
 * en las subclases los hooks de acceso, expulsión y selección de víctima.
 *
 * Cada llamada a {@link #simulate(List)} reinicia la tabla de frames y el
 * estado propio del algoritmo, por lo que una instancia puede reutilizarse
 * entre secuencias independientes.
 */
public abstract class PageReplacementAlgorithm {
    protected final FrameTable frameTable;
    private EventLogger eventLogger;

    /**
     * @param frameCount número de frames físicos
     * @throws IllegalArgumentException si frameCount <= 0
     */
    protected PageReplacementAlgorithm(int frameCount) {
        this.frameTable = new FrameTable(frameCount);
    }

    /**
     * Inyecta el EventLogger para trazar la ejecución.
     *
     * @param logger instancia de EventLogger (puede ser null)
     */
    public void setEventLogger(EventLogger logger) {
        this.eventLogger = logger;
    }

    public int getFrameCount() {
        return frameTable.size();
    }

    /**
     * Ejecuta la simulación completa sobre la secuencia.
     *
     * @param referenceSequence páginas referenciadas en orden (no negativas)
     * @return resultado con faults, estado final e historial
     * @throws IllegalArgumentException si la secuencia es null o contiene
     *                                  páginas null o negativas
     */
    public final SimulationResult simulate(List<Integer> referenceSequence) {
        validate(referenceSequence);

        frameTable.clear();
        reset();

        List<StepRecord> history = new ArrayList<>(referenceSequence.size());
        int faults = 0;
        log(String.format("%s started: frames=%d refs=%d", getName(), frameTable.size(), referenceSequence.size()));

        for (int step = 0; step < referenceSequence.size(); step++) {
            int page = referenceSequence.get(step);
            int[] before = frameTable.snapshot();
            boolean fault = !frameTable.isResident(page);
            int slot = -1;
            int evicted = FrameTable.EMPTY;

            if (fault) {
                faults++;
                OptionalInt free = frameTable.firstEmptySlot();
                if (free.isPresent()) {
                    slot = free.getAsInt();
                } else {
                    slot = selectFrameToReplace(referenceSequence, step);
                    evicted = frameTable.pageAt(slot);
                    pageEvicted(evicted);
                }
                frameTable.assign(slot, page);
                if (evicted == FrameTable.EMPTY) {
                    log(String.format("[step=%d] fault page=%d -> frame=%d", step, page, slot));
                } else {
                    log(String.format("[step=%d] fault page=%d -> frame=%d (evicted %d)", step, page, slot, evicted));
                }
            }

            pageAccessed(page, step);
            history.add(new StepRecord(page, before, fault, slot, evicted));
        }

        log(String.format("%s finished: faults=%d final=%s", getName(), faults, frameTable));
        return new SimulationResult(getName(), faults, frameTable.snapshot(), history);
    }

    /**
     * Rechaza la entrada completa antes de mutar cualquier estado.
     */
    private static void validate(List<Integer> referenceSequence) {
        if (referenceSequence == null)
            throw new IllegalArgumentException("referenceSequence must not be null");
        for (int i = 0; i < referenceSequence.size(); i++) {
            Integer page = referenceSequence.get(i);
            if (page == null)
                throw new IllegalArgumentException("null page reference at position " + i);
            if (page < 0)
                throw new IllegalArgumentException("negative page reference " + page + " at position " + i);
        }
    }

    private void log(String message) {
        if (eventLogger != null) {
            eventLogger.log(message);
        }
    }

    /**
     * Limpia el estado propio del algoritmo al inicio de cada simulación.
     */
    protected abstract void reset();

    /**
     * Notifica que la página ha sido referenciada (hit o fault), después de
     * haberse resuelto el fault.
     *
     * @param page página referenciada
     * @param step índice de la referencia en la secuencia
     */
    protected abstract void pageAccessed(int page, int step);

    /**
     * Notifica que la página ha sido expulsada de su frame.
     *
     * @param page página expulsada
     */
    protected abstract void pageEvicted(int page);

    /**
     * Selecciona el frame a reemplazar. Solo se invoca con la tabla llena.
     *
     * @param referenceSequence secuencia completa
     * @param step              índice de la referencia que produjo el fault
     * @return índice del frame víctima
     */
    protected abstract int selectFrameToReplace(List<Integer> referenceSequence, int step);

    /**
     * Nombre descriptivo del algoritmo.
     *
     * @return nombre del algoritmo
     */
    public abstract String getName();
}
