package com.vmsimulator.memory;

import java.util.Arrays;
import java.util.OptionalInt;

/**
 * FrameTable
 *
 * Conjunto fijo de frames físicos. Cada slot contiene un número de página o
 * {@link #EMPTY}. Solo responde "qué está dónde"; la decisión de qué expulsar
 * pertenece al algoritmo de reemplazo que es dueño de la tabla.
 */
public class FrameTable {
    /** Centinela de slot libre. */
    public static final int EMPTY = -1;

    private final int[] frames;

    /**
     * Construye una tabla con todos los slots vacíos.
     *
     * @param frameCount número de frames físicos
     * @throws IllegalArgumentException si frameCount <= 0
     */
    public FrameTable(int frameCount) {
        if (frameCount <= 0)
            throw new IllegalArgumentException("frameCount must be > 0");
        this.frames = new int[frameCount];
        Arrays.fill(this.frames, EMPTY);
    }

    /**
     * Indica si la página ocupa algún frame.
     *
     * @param page número de página
     * @return true si está residente
     */
    public boolean isResident(int page) {
        return slotOf(page).isPresent();
    }

    /**
     * Devuelve el slot libre de menor índice.
     *
     * @return índice del slot o vacío si la tabla está llena
     */
    public OptionalInt firstEmptySlot() {
        for (int i = 0; i < frames.length; i++) {
            if (frames[i] == EMPTY) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Devuelve el slot que contiene la página.
     *
     * @param page número de página
     * @return índice del slot o vacío si no está residente
     */
    public OptionalInt slotOf(int page) {
        if (page < 0) {
            return OptionalInt.empty();
        }
        for (int i = 0; i < frames.length; i++) {
            if (frames[i] == page) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Sobrescribe el contenido de un slot.
     *
     * @param index índice del slot
     * @param page  página a colocar (o EMPTY)
     * @throws IndexOutOfBoundsException si index está fuera de [0, size)
     */
    public void assign(int index, int page) {
        if (index < 0 || index >= frames.length)
            throw new IndexOutOfBoundsException("frame index " + index + " out of [0, " + frames.length + ")");
        frames[index] = page;
    }

    /**
     * Página contenida en un slot.
     *
     * @param index índice del slot
     * @return página o EMPTY
     */
    public int pageAt(int index) {
        if (index < 0 || index >= frames.length)
            throw new IndexOutOfBoundsException("frame index " + index + " out of [0, " + frames.length + ")");
        return frames[index];
    }

    /**
     * Copia del contenido actual; no comparte el arreglo interno.
     *
     * @return copia de los frames
     */
    public int[] snapshot() {
        return frames.clone();
    }

    /**
     * Vacía todos los slots.
     */
    public void clear() {
        Arrays.fill(frames, EMPTY);
    }

    public int size() {
        return frames.length;
    }

    /**
     * Número de slots ocupados.
     *
     * @return frames no vacíos
     */
    public int occupiedCount() {
        int count = 0;
        for (int f : frames) {
            if (f != EMPTY)
                count++;
        }
        return count;
    }

    @Override
    public String toString() {
        return Arrays.toString(frames);
    }
}
