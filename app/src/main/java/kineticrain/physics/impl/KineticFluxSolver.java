package kineticrain.physics.impl;

import kineticrain.physics.i.IFluxSolver;
import kineticrain.physics.kinetic.InterfaceFlux;
import kineticrain.physics.kinetic.KineticVelocityGrid;
import kineticrain.physics.kinetic.MaxwellianMapper;

import java.util.Objects;

/**
 * Solver de flujo cinético (kinetic flux splitting) con upwind en la variable ξ.
 * <p>
 * La distribución upwind toma la Maxwelliana izquierda donde ξ ≥ 0 y la derecha donde ξ &lt; 0:
 * las velocidades cinéticas positivas transportan información de izquierda a derecha.
 * Los flujos son los momentos de esa distribución, integrados por cuadratura (suma · dξ):
 * <pre>
 *     F_masa = Σ ξ   · M_up(ξ) · dξ
 *     F_mov  = Σ ξ²  · M_up(ξ) · dξ
 * </pre>
 * Si el rango de la malla no domina las velocidades características de la interfaz, la
 * precisión se degrada sin lanzar ningún error.
 */
public class KineticFluxSolver implements IFluxSolver {

    private final MaxwellianMapper maxwellian;

    public KineticFluxSolver(MaxwellianMapper maxwellian) {
        this.maxwellian = Objects.requireNonNull(maxwellian, "El mapper de Maxwellianas no puede ser nulo.");
    }

    @Override
    public String getName() {
        return "Kinetic_Upwind";
    }

    @Override
    public String getDescription() {
        return "Flux splitting cinético: upwind en ξ y cuadratura de momentos sobre malla uniforme.";
    }

    @Override
    public InterfaceFlux computeFlux(double leftDepth, double leftVelocity,
                                     double rightDepth, double rightVelocity,
                                     KineticVelocityGrid kineticGrid) {
        int size = kineticGrid.size();

        // Solo se evalúa la Maxwelliana que el upwind selecciona en cada nodo.
        double massSum = 0.0;
        double momentumSum = 0.0;
        for (int k = 0; k < size; k++) {
            double v = kineticGrid.node(k);
            double m = (v >= 0.0)
                    ? maxwellian.density(leftDepth, leftVelocity, v)
                    : maxwellian.density(rightDepth, rightVelocity, v);
            massSum += v * m;
            momentumSum += v * v * m;
        }

        double dxi = kineticGrid.spacing();
        return new InterfaceFlux(massSum * dxi, momentumSum * dxi);
    }
}
