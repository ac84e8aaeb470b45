package com.vmsimulator.memory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * LRU (Least Recently Used) - Algoritmo de reemplazo basado en recencia.
 *
 * Mantiene un LinkedHashMap en orden de acceso: cada referencia elimina y
 * vuelve a insertar la página al final, de modo que la primera entrada es
 * siempre la página usada hace más tiempo.
 */
public class LRU extends PageReplacementAlgorithm {
    private final LinkedHashMap<Integer, Boolean> accessOrder;

    /**
     * Construye una instancia de LRU.
     *
     * @param frameCount número de frames físicos
     */
    public LRU(int frameCount) {
        super(frameCount);
        this.accessOrder = new LinkedHashMap<>();
    }

    @Override
    protected void reset() {
        accessOrder.clear();
    }

    /**
     * Mueve la página a la posición más reciente, sea hit o fault.
     *
     * @param page página referenciada
     * @param step índice de la referencia
     */
    @Override
    protected void pageAccessed(int page, int step) {
        accessOrder.remove(page);
        accessOrder.put(page, Boolean.TRUE);
    }

    @Override
    protected void pageEvicted(int page) {
        accessOrder.remove(page);
    }

    /**
     * Selecciona el frame de la página menos recientemente usada.
     *
     * @param referenceSequence secuencia completa (no usada)
     * @param step              índice de la referencia actual
     * @return frame de la página más antigua en el orden de acceso
     */
    @Override
    protected int selectFrameToReplace(List<Integer> referenceSequence, int step) {
        Iterator<Integer> it = accessOrder.keySet().iterator();
        if (!it.hasNext())
            throw new IllegalStateException("LRU tracker empty with a full frame table");
        int lruPage = it.next();
        return frameTable.slotOf(lruPage)
                .orElseThrow(() -> new IllegalStateException("LRU page " + lruPage + " is not resident"));
    }

    @Override
    public String getName() {
        return "LRU (Least Recently Used)";
    }
}
