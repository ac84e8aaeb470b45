package com.vmsimulator.simulator;

import com.vmsimulator.memory.ReplacementPolicy;

/**
 * Configuración inmutable de una ejecución: número de frames y política.
 */
public final class SimulationConfig {
    public static final int DEFAULT_FRAMES = 4;

    private final int frameCount;
    private final ReplacementPolicy policy;

    /**
     * @param frameCount número de frames físicos
     * @param policy     política de reemplazo
     * @throws IllegalArgumentException si frameCount <= 0 o policy es null
     */
    public SimulationConfig(int frameCount, ReplacementPolicy policy) {
        if (frameCount <= 0)
            throw new IllegalArgumentException("frameCount must be > 0");
        if (policy == null)
            throw new IllegalArgumentException("policy must not be null");
        this.frameCount = frameCount;
        this.policy = policy;
    }

    public int getFrameCount() {
        return frameCount;
    }

    public ReplacementPolicy getPolicy() {
        return policy;
    }

    /**
     * Copia con otra política y el mismo número de frames.
     *
     * @param other política a usar
     * @return nueva configuración
     */
    public SimulationConfig withPolicy(ReplacementPolicy other) {
        return new SimulationConfig(frameCount, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SimulationConfig))
            return false;
        SimulationConfig other = (SimulationConfig) o;
        return frameCount == other.frameCount && policy == other.policy;
    }

    @Override
    public int hashCode() {
        return 31 * frameCount + policy.hashCode();
    }

    @Override
    public String toString() {
        return policy.getDisplayName() + " frames=" + frameCount;
    }
}
