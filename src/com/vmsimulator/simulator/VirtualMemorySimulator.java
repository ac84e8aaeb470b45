package com.vmsimulator.simulator;

import com.vmsimulator.memory.PageReplacementAlgorithm;
import com.vmsimulator.memory.ReplacementPolicy;
import com.vmsimulator.memory.SimulationResult;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * VirtualMemorySimulator
 *
 * Punto de entrada de las capas de presentación. Cada llamada crea un
 * algoritmo nuevo a partir de la configuración, de modo que no se conserva
 * estado entre simulaciones; lo único compartido es el EventLogger.
 */
public class VirtualMemorySimulator {
    private final EventLogger eventLogger;

    /**
     * Construye un simulador con su propio EventLogger.
     */
    public VirtualMemorySimulator() {
        this(new EventLogger());
    }

    /**
     * @param eventLogger logger donde se trazan las ejecuciones
     */
    public VirtualMemorySimulator(EventLogger eventLogger) {
        this.eventLogger = eventLogger;
    }

    public EventLogger getEventLogger() {
        return eventLogger;
    }

    /**
     * Ejecuta una simulación.
     *
     * @param config            frames y política
     * @param referenceSequence páginas referenciadas
     * @return resultado de la ejecución
     * @throws IllegalArgumentException si la secuencia contiene páginas
     *                                  inválidas
     */
    public SimulationResult simulate(SimulationConfig config, List<Integer> referenceSequence) {
        PageReplacementAlgorithm algorithm = config.getPolicy().create(config.getFrameCount());
        algorithm.setEventLogger(eventLogger);
        return algorithm.simulate(referenceSequence);
    }

    /**
     * Ejecuta todas las políticas sobre la misma entrada.
     *
     * @param frameCount        número de frames
     * @param referenceSequence páginas referenciadas
     * @return resultados por política, en orden de declaración
     */
    public Map<ReplacementPolicy, SimulationResult> compare(int frameCount, List<Integer> referenceSequence) {
        Map<ReplacementPolicy, SimulationResult> results = new EnumMap<>(ReplacementPolicy.class);
        for (ReplacementPolicy policy : ReplacementPolicy.values()) {
            results.put(policy, simulate(new SimulationConfig(frameCount, policy), referenceSequence));
        }
        return results;
    }
}
