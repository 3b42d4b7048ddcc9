package kineticrain.physics.i;

import kineticrain.physics.kinetic.InterfaceFlux;
import kineticrain.physics.kinetic.KineticVelocityGrid;

public interface IFluxSolver extends ISolverComponent {
    /**
     * Calcula el flujo numérico en una interfaz a partir de los estados vecinos.
     *
     * @param leftDepth     Profundidad de la celda izquierda [m].
     * @param leftVelocity  Velocidad de la celda izquierda [m/s].
     * @param rightDepth    Profundidad de la celda derecha [m].
     * @param rightVelocity Velocidad de la celda derecha [m/s].
     * @param kineticGrid   Malla de velocidades cinéticas usada para la cuadratura.
     * @return Flujos de masa y de cantidad de movimiento.
     */
    InterfaceFlux computeFlux(double leftDepth, double leftVelocity,
                              double rightDepth, double rightVelocity,
                              KineticVelocityGrid kineticGrid);
}
