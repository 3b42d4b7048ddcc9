package kineticrain.physics.impl;

import kineticrain.physics.i.IFluxSolver;
import kineticrain.physics.kinetic.InterfaceFlux;
import kineticrain.physics.kinetic.KineticVelocityGrid;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.Callable;

/**
 * Tarea que calcula los flujos de un rango contiguo de interfaces [fromInterface, toInterface).
 * Está diseñada para ejecutarse en un pool de hilos: cada interfaz depende solo de sus dos
 * celdas vecinas, así que los rangos son independientes entre sí.
 * <p>
 * Los arrays de estado se reciben ya extendidos con las dos celdas fantasma, de modo que la
 * interfaz i separa las posiciones i e i+1.
 */
@Getter
@RequiredArgsConstructor
public class InterfaceFluxTask implements Callable<InterfaceFluxTask> {

    // --- Entradas para la tarea ---
    private final IFluxSolver fluxSolver;
    private final KineticVelocityGrid kineticGrid;
    private final double[] paddedDepth;
    private final double[] paddedVelocity;
    private final int fromInterface;
    private final int toInterface;

    // --- Resultados de la tarea ---
    private double[] massFlux;
    private double[] momentumFlux;

    @Override
    public InterfaceFluxTask call() {
        int count = toInterface - fromInterface;
        this.massFlux = new double[count];
        this.momentumFlux = new double[count];

        for (int j = 0; j < count; j++) {
            int i = fromInterface + j;
            InterfaceFlux flux = fluxSolver.computeFlux(
                    paddedDepth[i], paddedVelocity[i],
                    paddedDepth[i + 1], paddedVelocity[i + 1],
                    kineticGrid);
            massFlux[j] = flux.mass();
            momentumFlux[j] = flux.momentum();
        }
        return this;
    }
}
