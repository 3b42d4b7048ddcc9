package kineticrain.physics.simulator;

import kineticrain.domain.state.ShallowWaterState;

/**
 * Instantánea de progreso entregada a los observadores.
 *
 * @param step                 Pasos completados.
 * @param currentTimeInSeconds Tiempo simulado tras el paso [s].
 * @param deltaTime            Paso de tiempo aplicado [s].
 * @param maxWaveSpeed         Cota s_max usada para elegir el paso [m/s].
 * @param state                Estado tras el paso.
 */
public record SimulationProgress(
        long step,
        double currentTimeInSeconds,
        double deltaTime,
        double maxWaveSpeed,
        ShallowWaterState state
) {
}
