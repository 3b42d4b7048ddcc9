package kineticrain.physics.impl;

import kineticrain.domain.grid.Topography;
import kineticrain.domain.recharge.RechargeField;
import kineticrain.domain.state.ShallowWaterState;
import kineticrain.physics.i.IFluxSolver;
import kineticrain.physics.i.ISolverComponent;
import kineticrain.physics.kinetic.InterfaceFlux;
import kineticrain.physics.kinetic.KineticVelocityGrid;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Motor de avance temporal: un paso explícito (Euler hacia delante) de volúmenes finitos.
 * <pre>
 *     h'  = h  - (dt/dx)(F_{i+1/2} - F_{i-1/2}) + dt·S
 *     hu' = hu - (dt/dx)(G_{i+1/2} - G_{i-1/2}) + dt·S·u - dt·g·h·∂Z/∂x
 * </pre>
 * con S = R - I. Las paredes son reflectivas: el estado se extiende con dos celdas fantasma
 * (profundidad espejada, velocidad negada) y una sola rutina de interfaz cubre las N+1 caras.
 * <p>
 * Tras la actualización, h' se acota a ≥ 0 y toda celda con h' &lt; h_eps recibe hu' = 0 exacto.
 * El método nunca falla con entradas válidas: las celdas casi secas se degradan, no lanzan.
 */
@Slf4j
public class KineticTimeStepper implements ISolverComponent {

    private final IFluxSolver fluxSolver;
    private final KineticVelocityGrid kineticGrid;
    private final double gravity;
    private final double dryDepthThreshold;

    // Pool opcional para repartir las interfaces (null = secuencial).
    private final ExecutorService threadPool;
    private final int parallelism;

    public KineticTimeStepper(IFluxSolver fluxSolver, KineticVelocityGrid kineticGrid,
                              double gravity, double dryDepthThreshold) {
        this(fluxSolver, kineticGrid, gravity, dryDepthThreshold, null, 1);
    }

    public KineticTimeStepper(IFluxSolver fluxSolver, KineticVelocityGrid kineticGrid,
                              double gravity, double dryDepthThreshold,
                              ExecutorService threadPool, int parallelism) {
        this.fluxSolver = Objects.requireNonNull(fluxSolver, "El solver de flujo no puede ser nulo.");
        this.kineticGrid = Objects.requireNonNull(kineticGrid, "La malla cinética no puede ser nula.");
        this.gravity = gravity;
        this.dryDepthThreshold = dryDepthThreshold;
        this.threadPool = threadPool;
        this.parallelism = (threadPool == null) ? 1 : Math.max(parallelism, 1);
    }

    @Override
    public String getName() {
        return "KineticFVM_ForwardEuler";
    }

    @Override
    public String getDescription() {
        return String.format("FVM explícito de 1er orden, flujos %s, paredes reflectivas, %d hilo(s).",
                fluxSolver.getName(), parallelism);
    }

    /**
     * Avanza el estado un paso de tiempo.
     *
     * @param state    Estado actual (h, hu). No se modifica.
     * @param bed      Cota del lecho.
     * @param recharge Lluvia e infiltración de este paso.
     * @param dx       Tamaño de celda [m].
     * @param dt       Paso de tiempo [s], ya acotado por el criterio CFL.
     * @return Un estado nuevo.
     */
    public ShallowWaterState step(ShallowWaterState state, Topography bed, RechargeField recharge,
                                  double dx, double dt) {
        final int n = state.cellCount();
        if (bed.cellCount() != n || recharge.cellCount() != n) {
            throw new IllegalArgumentException("Lecho y recarga deben tener " + n + " celdas.");
        }
        double[] h = state.depth();
        double[] hu = state.discharge();

        // 1. Velocidad derivada (protegida frente a celdas secas)
        double[] u = state.velocity(dryDepthThreshold);

        // 2. Recarga S = R - I
        double[] source = recharge.netSource();

        // 3-4. Flujos en las N+1 interfaces sobre el estado extendido con celdas fantasma
        double[] paddedDepth = new double[n + 2];
        double[] paddedVelocity = new double[n + 2];
        padWithReflectiveGhostCells(h, u, paddedDepth, paddedVelocity);

        double[] massFlux = new double[n + 1];
        double[] momentumFlux = new double[n + 1];
        computeInterfaceFluxes(paddedDepth, paddedVelocity, massFlux, momentumFlux);

        // 5. Gradiente del lecho
        double[] bedGradient = bedSlopeGradient(bed.bedElevation(), dx);

        // 6. Actualización conservativa + fuentes
        double ratio = dt / dx;
        double[] newDepth = new double[n];
        double[] newDischarge = new double[n];
        for (int i = 0; i < n; i++) {
            newDepth[i] = h[i] - ratio * (massFlux[i + 1] - massFlux[i]) + dt * source[i];
            newDischarge[i] = hu[i] - ratio * (momentumFlux[i + 1] - momentumFlux[i])
                    + dt * source[i] * u[i]
                    - dt * gravity * h[i] * bedGradient[i];

            // 7. Tratamiento de celda seca
            if (newDepth[i] < 0.0) {
                newDepth[i] = 0.0;
            }
            if (newDepth[i] < dryDepthThreshold) {
                newDischarge[i] = 0.0;
            }
        }

        return new ShallowWaterState(newDepth, newDischarge);
    }

    /**
     * Extiende el estado con una celda fantasma a cada lado: misma profundidad que la celda
     * vecina y velocidad negada. Así el flujo neto a través de las paredes es nulo.
     */
    static void padWithReflectiveGhostCells(double[] depth, double[] velocity,
                                            double[] paddedDepth, double[] paddedVelocity) {
        int n = depth.length;
        System.arraycopy(depth, 0, paddedDepth, 1, n);
        System.arraycopy(velocity, 0, paddedVelocity, 1, n);

        paddedDepth[0] = depth[0];
        paddedVelocity[0] = -velocity[0];
        paddedDepth[n + 1] = depth[n - 1];
        paddedVelocity[n + 1] = -velocity[n - 1];
    }

    /**
     * ∂Z/∂x: diferencias centrales en el interior y laterales en las dos celdas de borde.
     * Con una sola celda el gradiente es cero.
     */
    static double[] bedSlopeGradient(double[] z, double dx) {
        int n = z.length;
        double[] gradient = new double[n];
        if (n < 2) {
            return gradient;
        }
        for (int i = 1; i < n - 1; i++) {
            gradient[i] = (z[i + 1] - z[i - 1]) / (2.0 * dx);
        }
        gradient[0] = (z[1] - z[0]) / dx;
        gradient[n - 1] = (z[n - 1] - z[n - 2]) / dx;
        return gradient;
    }

    private void computeInterfaceFluxes(double[] paddedDepth, double[] paddedVelocity,
                                        double[] massFlux, double[] momentumFlux) {
        int interfaceCount = massFlux.length;

        if (threadPool == null || parallelism == 1 || interfaceCount < 2 * parallelism) {
            for (int i = 0; i < interfaceCount; i++) {
                InterfaceFlux flux = fluxSolver.computeFlux(
                        paddedDepth[i], paddedVelocity[i],
                        paddedDepth[i + 1], paddedVelocity[i + 1],
                        kineticGrid);
                massFlux[i] = flux.mass();
                momentumFlux[i] = flux.momentum();
            }
            return;
        }

        // Reparto en rangos contiguos, uno por hilo
        int chunk = (interfaceCount + parallelism - 1) / parallelism;
        List<InterfaceFluxTask> tasks = new ArrayList<>(parallelism);
        for (int from = 0; from < interfaceCount; from += chunk) {
            int to = Math.min(from + chunk, interfaceCount);
            tasks.add(new InterfaceFluxTask(fluxSolver, kineticGrid, paddedDepth, paddedVelocity, from, to));
        }

        List<Future<InterfaceFluxTask>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Cálculo de flujos interrumpido.", e);
        }

        for (Future<InterfaceFluxTask> future : futures) {
            InterfaceFluxTask task;
            try {
                task = future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Cálculo de flujos interrumpido.", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Error calculando flujos de interfaz.", e.getCause());
            }
            int from = task.getFromInterface();
            System.arraycopy(task.getMassFlux(), 0, massFlux, from, task.getMassFlux().length);
            System.arraycopy(task.getMomentumFlux(), 0, momentumFlux, from, task.getMomentumFlux().length);
        }
        log.trace("Flujos calculados en {} tareas.", tasks.size());
    }
}
