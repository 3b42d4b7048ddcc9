package kineticrain.physics.simulator;

/**
 * Observador del bucle temporal. Se invoca cada {@code progressInterval} pasos; no tiene
 * efecto sobre la numérica.
 */
@FunctionalInterface
public interface SimulationProgressListener {
    void onProgress(SimulationProgress progress);
}
