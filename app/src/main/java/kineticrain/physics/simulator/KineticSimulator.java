package kineticrain.physics.simulator;

import kineticrain.config.KineticSolverConfig;
import kineticrain.config.ScenarioConfig;
import kineticrain.config.SimulationConfigurationException;
import kineticrain.domain.grid.UniformGrid;
import kineticrain.domain.recharge.RechargeField;
import kineticrain.domain.simulation.Scenario;
import kineticrain.domain.simulation.SimulationResult;
import kineticrain.domain.state.ShallowWaterState;
import kineticrain.factory.ScenarioFactory;
import kineticrain.physics.impl.KineticFluxSolver;
import kineticrain.physics.impl.KineticTimeStepper;
import kineticrain.physics.kinetic.KineticVelocityGrid;
import kineticrain.physics.kinetic.MaxwellianMapper;
import kineticrain.physics.solver.WaveSpeedEstimator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Orquesta la simulación de aguas someras con recarga.
 * <p>
 * Responsabilidades:
 * 1. Validar la configuración antes de dar ningún paso.
 * 2. Construir la malla cinética una sola vez a partir de la profundidad máxima inicial.
 * 3. Gestionar el bucle de tiempo: dt = cfl · dx / (s_max + ε), recortado para no pasar de T.
 * 4. Notificar el progreso a un observador y devolver el estado final.
 */
@Slf4j
public class KineticSimulator implements AutoCloseable {

    private static final double SPEED_EPSILON = 1e-12;

    private final KineticSolverConfig solverConfig;
    @Getter
    private final Scenario scenario;
    @Getter
    private final KineticVelocityGrid kineticGrid;
    private final KineticTimeStepper stepper;
    private final SimulationProgressListener progressListener;
    private final ExecutorService threadPool;

    @Getter
    private ShallowWaterState currentState;
    @Getter
    private double currentTimeInSeconds;
    @Getter
    private long stepCount;

    @Getter
    private boolean coverageWarningIssued;

    public KineticSimulator(ScenarioConfig scenarioConfig, KineticSolverConfig solverConfig) {
        this(ScenarioFactory.createDamBreak(scenarioConfig), solverConfig, new LoggingProgressListener());
    }

    public KineticSimulator(Scenario scenario, KineticSolverConfig solverConfig) {
        this(scenario, solverConfig, new LoggingProgressListener());
    }

    public KineticSimulator(Scenario scenario, KineticSolverConfig solverConfig,
                            SimulationProgressListener progressListener) {
        this.scenario = Objects.requireNonNull(scenario, "El escenario no puede ser nulo.");
        this.solverConfig = Objects.requireNonNull(solverConfig, "La configuración del solver no puede ser nula.");
        this.progressListener = Objects.requireNonNull(progressListener, "El observador de progreso no puede ser nulo.");
        solverConfig.validate();
        validateScenario(scenario);

        double g = solverConfig.gravity();
        double hEps = solverConfig.dryDepthThreshold();

        double initialMaxDepth = scenario.initialState().maxDepth();
        if (initialMaxDepth <= hEps) {
            log.warn("Estado inicial seco (h_max={}). La malla cinética se dimensiona con h_eps.", initialMaxDepth);
        }
        this.kineticGrid = KineticVelocityGrid.create(
                Math.max(initialMaxDepth, hEps),
                solverConfig.kineticGridFactor(),
                solverConfig.kineticGridResolution(),
                g);

        KineticFluxSolver fluxSolver = new KineticFluxSolver(new MaxwellianMapper(g, hEps));
        int processorCount = solverConfig.cpuProcessorCount();
        if (processorCount > 1) {
            this.threadPool = Executors.newFixedThreadPool(processorCount);
            this.stepper = new KineticTimeStepper(fluxSolver, kineticGrid, g, hEps, threadPool, processorCount);
        } else {
            this.threadPool = null;
            this.stepper = new KineticTimeStepper(fluxSolver, kineticGrid, g, hEps);
        }

        this.currentState = scenario.initialState();
        this.currentTimeInSeconds = 0.0;
        this.stepCount = 0;

        log.info("KineticSimulator inicializado. N={}, dx={}, T={}, ξ_max={}, Nξ={}, solver={}",
                scenario.grid().cellCount(), scenario.grid().spacing(), scenario.finalTime(),
                kineticGrid.maxSpeed(), kineticGrid.size(), stepper.getDescription());
    }

    private static void validateScenario(Scenario scenario) {
        if (!(scenario.finalTime() >= 0) || !Double.isFinite(scenario.finalTime())) {
            throw new SimulationConfigurationException("El tiempo final debe ser >= 0 y finito: " + scenario.finalTime());
        }
        for (double h : scenario.initialState().depth()) {
            if (!(h >= 0) || !Double.isFinite(h)) {
                throw new SimulationConfigurationException("Profundidad inicial inválida: " + h);
            }
        }
    }

    /**
     * Ejecuta una iteración del bucle temporal.
     *
     * @return El paso de tiempo aplicado [s].
     * @throws IllegalStateException            si la simulación ya alcanzó T.
     * @throws SimulationConfigurationException si se alcanza el techo de pasos antes de T.
     */
    public double advanceTimeStep() {
        UniformGrid grid = scenario.grid();
        double finalTime = scenario.finalTime();
        if (currentTimeInSeconds >= finalTime) {
            throw new IllegalStateException("La simulación ya alcanzó el tiempo final T=" + finalTime);
        }
        if (stepCount >= solverConfig.maxSteps()) {
            throw new SimulationConfigurationException(String.format(
                    "Se alcanzó el techo de %d pasos en t=%.6g sin llegar a T=%.6g. Configuración degenerada.",
                    solverConfig.maxSteps(), currentTimeInSeconds, finalTime));
        }

        double sMax = currentMaxWaveSpeed();
        if (!coverageWarningIssued && !kineticGrid.covers(sMax)) {
            coverageWarningIssued = true;
            log.warn("La malla cinética (ξ_max={}) ya no domina la velocidad de onda (s_max={}) en t={}. "
                    + "La precisión de los flujos se degrada; aumente kineticGridFactor.",
                    kineticGrid.maxSpeed(), sMax, currentTimeInSeconds);
        }

        double dt = solverConfig.cfl() * grid.spacing() / (sMax + SPEED_EPSILON);
        boolean reachesEnd = currentTimeInSeconds + dt >= finalTime;
        if (reachesEnd) {
            dt = finalTime - currentTimeInSeconds;
        }

        RechargeField recharge = scenario.rechargeModel().rechargeAt(currentTimeInSeconds);
        currentState = stepper.step(currentState, scenario.topography(), recharge, grid.spacing(), dt);

        currentTimeInSeconds = reachesEnd ? finalTime : currentTimeInSeconds + dt;
        stepCount++;

        if (stepCount % solverConfig.progressInterval() == 0) {
            progressListener.onProgress(new SimulationProgress(stepCount, currentTimeInSeconds, dt, sMax, currentState));
        }
        log.debug("Paso {}: dt={}, s_max={}", stepCount, dt, sMax);
        return dt;
    }

    /**
     * Integra hasta el tiempo final del escenario.
     *
     * @return Coordenadas, lecho, profundidad y velocidad finales.
     * @throws SimulationConfigurationException si se alcanza el techo de pasos antes de T.
     */
    public SimulationResult run() {
        long startTime = System.currentTimeMillis();
        double finalTime = scenario.finalTime();

        while (currentTimeInSeconds < finalTime) {
            advanceTimeStep();
        }

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("Simulación completada: t={}, pasos={}, {} ms", currentTimeInSeconds, stepCount, elapsed);
        return buildResult(elapsed);
    }

    private double currentMaxWaveSpeed() {
        double hEps = solverConfig.dryDepthThreshold();
        return WaveSpeedEstimator.maxWaveSpeed(
                currentState.depth(), currentState.velocity(hEps), solverConfig.gravity(), hEps);
    }

    private SimulationResult buildResult(long elapsedMillis) {
        double hEps = solverConfig.dryDepthThreshold();
        double[] h = currentState.depth();
        double[] reportedDepth = new double[h.length];
        for (int i = 0; i < h.length; i++) {
            reportedDepth[i] = Math.max(h[i], hEps);
        }
        return SimulationResult.builder()
                .coordinates(scenario.grid().coordinates())
                .bedElevation(scenario.topography().bedElevation())
                .depth(reportedDepth)
                .velocity(currentState.velocity(hEps))
                .finalTime(currentTimeInSeconds)
                .stepCount(stepCount)
                .simulationTimeMillis(elapsedMillis)
                .build();
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
            log.info("KineticSimulator cerrado.");
        }
    }
}
