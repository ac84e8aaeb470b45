package com.vmsimulator.memory;

/**
 * Políticas de reemplazo disponibles.
 */
public enum ReplacementPolicy {
    LRU("LRU"),
    OPTIMAL("Optimal");

    private final String displayName;

    ReplacementPolicy(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Crea una instancia nueva del algoritmo.
     *
     * @param frameCount número de frames físicos
     * @return algoritmo listo para simular
     */
    public PageReplacementAlgorithm create(int frameCount) {
        return switch (this) {
            case LRU -> new LRU(frameCount);
            case OPTIMAL -> new Optimal(frameCount);
        };
    }

    /**
     * Resuelve una política por nombre, sin distinguir mayúsculas.
     *
     * @param name "LRU", "OPTIMAL" o el nombre visible
     * @return política correspondiente
     * @throws IllegalArgumentException si el nombre no corresponde a ninguna
     */
    public static ReplacementPolicy fromName(String name) {
        if (name != null) {
            String n = name.trim();
            for (ReplacementPolicy p : values()) {
                if (p.name().equalsIgnoreCase(n) || p.displayName.equalsIgnoreCase(n)) {
                    return p;
                }
            }
        }
        throw new IllegalArgumentException("Unknown replacement policy: " + name);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
