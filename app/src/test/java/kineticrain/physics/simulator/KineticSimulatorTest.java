package kineticrain.physics.simulator;

import kineticrain.config.KineticSolverConfig;
import kineticrain.config.ScenarioConfig;
import kineticrain.config.SimulationConfigurationException;
import kineticrain.domain.recharge.RechargeField;
import kineticrain.domain.recharge.RechargeModel;
import kineticrain.domain.simulation.Scenario;
import kineticrain.domain.simulation.SimulationResult;
import kineticrain.factory.ScenarioFactory;
import kineticrain.physics.solver.WaveSpeedEstimator;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import kineticrain.domain.state.ShallowWaterState;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.DoubleSummaryStatistics;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@Slf4j
class KineticSimulatorTest {

    private static final double G = KineticSolverConfig.STANDARD_GRAVITY;
    private static final double H_EPS = 1e-8;

    @Test
    @DisplayName("Rotura de presa de referencia: h en [1, 2] y |u| acotada por s_max inicial")
    void run_damBreak_shouldStayWithinPhysicalBounds() {
        ScenarioConfig scenarioConfig = ScenarioConfig.getDamBreakScenario();
        KineticSolverConfig solverConfig = KineticSolverConfig.getDefault();

        Scenario scenario = ScenarioFactory.createDamBreak(scenarioConfig);
        double initialSpeedBound = WaveSpeedEstimator.maxWaveSpeed(
                scenario.initialState().depth(), scenario.initialState().velocity(H_EPS), G, H_EPS);

        SimulationResult result;
        try (KineticSimulator simulator = new KineticSimulator(scenario, solverConfig)) {
            result = simulator.run();
        }

        DoubleSummaryStatistics depth = Arrays.stream(result.depth()).summaryStatistics();
        DoubleSummaryStatistics velocity = Arrays.stream(result.velocity()).summaryStatistics();
        log.info("Rotura de presa: pasos={}, h=[{}, {}], u=[{}, {}]", result.stepCount(),
                depth.getMin(), depth.getMax(), velocity.getMin(), velocity.getMax());

        assertEquals(0.5, result.finalTime(), 0.0);
        assertEquals(200, result.cellCount());
        assertTrue(depth.getMin() >= 1.0 - 1e-3, "Profundidad mínima fuera de rango: " + depth.getMin());
        assertTrue(depth.getMax() <= 2.0 + 1e-3, "Profundidad máxima fuera de rango: " + depth.getMax());
        assertTrue(Math.max(Math.abs(velocity.getMin()), Math.abs(velocity.getMax())) <= initialSpeedBound);

        // La onda avanza hacia aguas abajo: el agua se mueve a la derecha en el centro
        assertTrue(result.velocity()[100] > 0.1, "La velocidad en la presa debería ser positiva.");
        assertTrue(result.depth()[0] > 1.99, "Las ondas no deberían haber llegado a la pared izquierda.");
        assertEquals(1.0, result.depth()[199], 1e-6, "Las ondas no deberían haber llegado a la pared derecha.");
    }

    @Test
    @DisplayName("Sin recarga y con lecho plano, Σh·dx se conserva durante toda la simulación")
    void run_noRecharge_shouldConserveMass() {
        ScenarioConfig scenarioConfig = ScenarioConfig.getDamBreakScenario()
                .withCellCount(80)
                .withFinalTime(2.0); // suficiente para que las ondas se reflejen en las paredes
        KineticSolverConfig solverConfig = KineticSolverConfig.getDefault().withKineticGridResolution(256);

        Scenario scenario = ScenarioFactory.createDamBreak(scenarioConfig);
        double dx = scenario.grid().spacing();
        double initialVolume = scenario.initialState().totalVolume(dx);

        SimulationProgressListener listener = progress ->
                assertEquals(initialVolume, progress.state().totalVolume(dx), 1e-10,
                        "Masa no conservada en el paso " + progress.step());

        try (KineticSimulator simulator = new KineticSimulator(scenario, solverConfig.withProgressInterval(1), listener)) {
            simulator.run();
            assertEquals(initialVolume, simulator.getCurrentState().totalVolume(dx), 1e-10);
        }
    }

    @Test
    @DisplayName("Solo recarga: el centro crece a la tasa de lluvia r")
    void run_rainfallOnly_shouldRaiseCenterAtRainfallRate() {
        double h0 = 1.0;
        double rain = 0.01;
        double finalTime = 0.2;
        ScenarioConfig scenarioConfig = ScenarioConfig.getDamBreakScenario()
                .withCellCount(100)
                .withUpstreamDepth(h0)
                .withDownstreamDepth(h0)
                .withRainfallRate(rain)
                .withFinalTime(finalTime);
        KineticSolverConfig solverConfig = KineticSolverConfig.getDefault().withKineticGridResolution(256);

        SimulationResult result;
        try (KineticSimulator simulator = new KineticSimulator(scenarioConfig, solverConfig)) {
            result = simulator.run();
        }

        double growthRate = (result.depth()[50] - h0) / finalTime;
        log.info("Tasa de crecimiento en el centro: {} (lluvia {})", growthRate, rain);
        assertEquals(rain, growthRate, rain * 1e-3);
        assertEquals(0.0, result.velocity()[50], 1e-12);
    }

    @Test
    @DisplayName("La infiltración resta de la lluvia en el término fuente")
    void run_rainfallMinusInfiltration_shouldUseNetSource() {
        ScenarioConfig scenarioConfig = ScenarioConfig.getDamBreakScenario()
                .withCellCount(40)
                .withUpstreamDepth(1.0)
                .withDownstreamDepth(1.0)
                .withRainfallRate(0.03)
                .withInfiltrationRate(0.01)
                .withFinalTime(0.1);
        KineticSolverConfig solverConfig = KineticSolverConfig.getDefault().withKineticGridResolution(128);

        try (KineticSimulator simulator = new KineticSimulator(scenarioConfig, solverConfig)) {
            SimulationResult result = simulator.run();
            assertEquals(1.0 + 0.02 * 0.1, result.depth()[20], 1e-6);
        }
    }

    @Test
    @DisplayName("Pared reflectiva: la velocidad junto a la pared cambia de signo y no se pierde masa")
    void run_flowTowardsWall_shouldReflect() {
        ScenarioConfig scenarioConfig = ScenarioConfig.getDamBreakScenario()
                .withCellCount(100)
                .withUpstreamDepth(1.0)
                .withDownstreamDepth(1.0)
                .withInitialVelocity(-0.5)
                .withFinalTime(4.5);
        KineticSolverConfig solverConfig = KineticSolverConfig.getDefault()
                .withKineticGridResolution(256)
                .withProgressInterval(1);

        Scenario scenario = ScenarioFactory.createDamBreak(scenarioConfig);
        double dx = scenario.grid().spacing();
        double initialVolume = scenario.initialState().totalVolume(dx);
        assertTrue(scenario.initialState().velocity(H_EPS)[0] < 0.0);

        double[] maxWallVelocity = {Double.NEGATIVE_INFINITY};
        SimulationProgressListener listener = progress ->
                maxWallVelocity[0] = Math.max(maxWallVelocity[0], progress.state().velocity(H_EPS)[0]);

        try (KineticSimulator simulator = new KineticSimulator(scenario, solverConfig, listener)) {
            simulator.run();
            log.info("Velocidad máxima observada junto a la pared izquierda: {}", maxWallVelocity[0]);

            assertTrue(maxWallVelocity[0] > 1e-3, "La velocidad junto a la pared nunca cambió de signo.");
            assertEquals(initialVolume, simulator.getCurrentState().totalVolume(dx), 1e-10);
        }
    }

    @Test
    @DisplayName("Determinismo: dos ejecuciones idénticas producen resultados idénticos bit a bit")
    void run_twice_shouldBeDeterministic() {
        ScenarioConfig scenarioConfig = ScenarioConfig.getDamBreakScenario().withCellCount(60).withRainfallRate(0.05);
        KineticSolverConfig solverConfig = KineticSolverConfig.getDefault().withKineticGridResolution(200);

        SimulationResult first;
        SimulationResult second;
        SimulationResult parallel;
        try (KineticSimulator simulator = new KineticSimulator(scenarioConfig, solverConfig)) {
            first = simulator.run();
        }
        try (KineticSimulator simulator = new KineticSimulator(scenarioConfig, solverConfig)) {
            second = simulator.run();
        }
        try (KineticSimulator simulator = new KineticSimulator(scenarioConfig, solverConfig.withCpuProcessorCount(3))) {
            parallel = simulator.run();
        }

        assertEquals(first.stepCount(), second.stepCount());
        assertArrayEquals(first.depth(), second.depth(), 0.0);
        assertArrayEquals(first.velocity(), second.velocity(), 0.0);
        assertArrayEquals(first.depth(), parallel.depth(), 0.0);
        assertArrayEquals(first.velocity(), parallel.velocity(), 0.0);
    }

    @Test
    @DisplayName("El observador se invoca cada progressInterval pasos")
    void run_shouldNotifyProgressAtConfiguredInterval() {
        SimulationProgressListener listener = mock(SimulationProgressListener.class);
        ScenarioConfig scenarioConfig = ScenarioConfig.getDamBreakScenario().withCellCount(50).withFinalTime(0.2);
        KineticSolverConfig solverConfig = KineticSolverConfig.getDefault()
                .withKineticGridResolution(128)
                .withProgressInterval(5);

        try (KineticSimulator simulator = new KineticSimulator(
                ScenarioFactory.createDamBreak(scenarioConfig), solverConfig, listener)) {
            SimulationResult result = simulator.run();

            ArgumentCaptor<SimulationProgress> captor = ArgumentCaptor.forClass(SimulationProgress.class);
            verify(listener, times((int) (result.stepCount() / 5))).onProgress(captor.capture());

            List<SimulationProgress> notifications = captor.getAllValues();
            for (int k = 0; k < notifications.size(); k++) {
                SimulationProgress progress = notifications.get(k);
                assertEquals(5L * (k + 1), progress.step());
                assertTrue(progress.deltaTime() <= 0.5 * scenarioConfig.domainLength() / 50 / progress.maxWaveSpeed() + 1e-15);
            }
        }
    }

    @Test
    @DisplayName("El paso final se recorta para terminar exactamente en T")
    void advanceTimeStep_shouldNotOvershootFinalTime() {
        ScenarioConfig scenarioConfig = ScenarioConfig.getDamBreakScenario().withCellCount(20).withFinalTime(0.013);
        KineticSolverConfig solverConfig = KineticSolverConfig.getDefault().withKineticGridResolution(64);

        try (KineticSimulator simulator = new KineticSimulator(scenarioConfig, solverConfig)) {
            while (simulator.getCurrentTimeInSeconds() < 0.013) {
                simulator.advanceTimeStep();
            }
            assertEquals(0.013, simulator.getCurrentTimeInSeconds(), 0.0);
            assertThrows(IllegalStateException.class, simulator::advanceTimeStep);
        }
    }

    @Test
    @DisplayName("Con T = 0 se devuelven los campos iniciales sin dar ningún paso")
    void run_zeroFinalTime_shouldReturnInitialFields() {
        ScenarioConfig scenarioConfig = ScenarioConfig.getDamBreakScenario().withCellCount(10).withFinalTime(0.0);

        try (KineticSimulator simulator = new KineticSimulator(scenarioConfig, KineticSolverConfig.getDefault())) {
            SimulationResult result = simulator.run();

            assertEquals(0L, result.stepCount());
            assertArrayEquals(new double[]{2, 2, 2, 2, 2, 1, 1, 1, 1, 1}, result.depth(), 0.0);
        }
    }

    @Test
    @DisplayName("Configuraciones inválidas se rechazan antes de dar ningún paso")
    void constructor_invalidConfiguration_shouldThrow() {
        ScenarioConfig scenario = ScenarioConfig.getDamBreakScenario();
        KineticSolverConfig solver = KineticSolverConfig.getDefault();

        assertThrows(SimulationConfigurationException.class,
                () -> new KineticSimulator(scenario.withCellCount(0), solver));
        assertThrows(SimulationConfigurationException.class,
                () -> new KineticSimulator(scenario.withDomainLength(-1.0), solver));
        assertThrows(SimulationConfigurationException.class,
                () -> new KineticSimulator(scenario, solver.withCfl(0.0)));
        assertThrows(SimulationConfigurationException.class,
                () -> new KineticSimulator(scenario, solver.withCfl(1.2)));
    }

    @Test
    @DisplayName("Superar el techo de pasos es un error fatal de configuración")
    void run_stepCeilingExceeded_shouldThrow() {
        ScenarioConfig scenarioConfig = ScenarioConfig.getDamBreakScenario().withCellCount(20);
        KineticSolverConfig solverConfig = KineticSolverConfig.getDefault()
                .withKineticGridResolution(64)
                .withMaxSteps(3);

        try (KineticSimulator simulator = new KineticSimulator(scenarioConfig, solverConfig)) {
            assertThrows(SimulationConfigurationException.class, simulator::run);
            assertEquals(3L, simulator.getStepCount());
        }
    }

    @Test
    @DisplayName("La malla cinética se dimensiona con la profundidad máxima inicial")
    void constructor_shouldSizeKineticGridFromInitialMaxDepth() {
        KineticSolverConfig solverConfig = KineticSolverConfig.getDefault().withKineticGridResolution(101);

        try (KineticSimulator simulator = new KineticSimulator(ScenarioConfig.getDamBreakScenario(), solverConfig)) {
            assertEquals(4.0 * Math.sqrt(2.0 * G * 2.0), simulator.getKineticGrid().maxSpeed(), 1e-12);
            assertEquals(101, simulator.getKineticGrid().size());
        }
    }

    @Test
    @DisplayName("La gravedad es un parámetro: otro valor cambia la dinámica")
    void run_customGravity_shouldChangeDynamics() {
        ScenarioConfig scenarioConfig = ScenarioConfig.getDamBreakScenario().withCellCount(40).withFinalTime(0.2);
        KineticSolverConfig earth = KineticSolverConfig.getDefault().withKineticGridResolution(128);

        SimulationResult onEarth;
        SimulationResult onMoon;
        try (KineticSimulator simulator = new KineticSimulator(scenarioConfig, earth)) {
            onEarth = simulator.run();
        }
        try (KineticSimulator simulator = new KineticSimulator(scenarioConfig, earth.withGravity(1.62))) {
            onMoon = simulator.run();
        }

        assertTrue(onEarth.velocity()[20] > onMoon.velocity()[20],
                "Con menos gravedad la rotura de presa debe ser más lenta.");
    }

    @Test
    @DisplayName("El modelo de recarga se evalúa una vez por paso con el tiempo simulado actual")
    void run_timeDependentRecharge_shouldBeEvaluatedOncePerStep() {
        ScenarioConfig scenarioConfig = ScenarioConfig.getDamBreakScenario()
                .withCellCount(30)
                .withUpstreamDepth(1.0)
                .withDownstreamDepth(1.0)
                .withFinalTime(0.2);
        Scenario base = ScenarioFactory.createDamBreak(scenarioConfig);

        List<Double> evaluationTimes = new ArrayList<>();
        RechargeModel burst = t -> {
            evaluationTimes.add(t);
            return RechargeField.uniform(30, t < 0.1 ? 0.02 : 0.0, 0.0);
        };
        Scenario scenario = base.withRechargeModel(burst);

        try (KineticSimulator simulator = new KineticSimulator(
                scenario, KineticSolverConfig.getDefault().withKineticGridResolution(128))) {
            SimulationResult result = simulator.run();

            assertEquals(result.stepCount(), evaluationTimes.size());
            assertEquals(0.0, evaluationTimes.get(0), 0.0);
            for (int k = 1; k < evaluationTimes.size(); k++) {
                assertTrue(evaluationTimes.get(k) > evaluationTimes.get(k - 1));
                assertTrue(evaluationTimes.get(k) < 0.2);
            }
            // Solo llueve en los pasos que empiezan antes de t = 0.1 (dt ≈ 0.04 con esta malla)
            double growth = result.depth()[15] - 1.0;
            assertTrue(growth >= 0.02 * 0.1 - 1e-12 && growth < 0.02 * 0.15, "Crecimiento inesperado: " + growth);
        }
    }

    @Test
    @DisplayName("Un observador que escribe en el estado recibido no altera la simulación")
    void run_listenerWritingIntoState_shouldNotAffectNumerics() {
        ScenarioConfig scenarioConfig = ScenarioConfig.getDamBreakScenario()
                .withCellCount(40)
                .withUpstreamDepth(1.0)
                .withDownstreamDepth(1.0)
                .withFinalTime(0.3);
        KineticSolverConfig solverConfig = KineticSolverConfig.getDefault()
                .withKineticGridResolution(128)
                .withProgressInterval(1);

        Scenario scenario = ScenarioFactory.createDamBreak(scenarioConfig);
        double dx = scenario.grid().spacing();
        double initialVolume = scenario.initialState().totalVolume(dx);

        SimulationProgressListener tamperingListener = progress -> {
            progress.state().depth()[0] = 5.0;
            progress.state().discharge()[1] = -3.0;
        };

        try (KineticSimulator simulator = new KineticSimulator(scenario, solverConfig, tamperingListener)) {
            SimulationResult result = simulator.run();

            assertEquals(initialVolume, simulator.getCurrentState().totalVolume(dx), 1e-12);
            for (double h : result.depth()) {
                assertEquals(1.0, h, 1e-12, "El lago en reposo no debería moverse.");
            }
        }
    }

    @Test
    @DisplayName("Modificar el estado expuesto no cambia el estado inicial del escenario")
    void getCurrentState_mutation_shouldNotLeakIntoScenario() {
        Scenario scenario = ScenarioFactory.createDamBreak(ScenarioConfig.getDamBreakScenario().withCellCount(10));

        try (KineticSimulator simulator = new KineticSimulator(scenario, KineticSolverConfig.getDefault())) {
            ShallowWaterState exposed = simulator.getCurrentState();
            exposed.depth()[3] = 9.0;

            assertEquals(2.0, scenario.initialState().depth()[3], 0.0);
            assertEquals(2.0, simulator.getCurrentState().depth()[3], 0.0);
        }
    }

    @Test
    @DisplayName("El techo de pasos también se aplica al avanzar paso a paso")
    void advanceTimeStep_stepCeilingExceeded_shouldThrow() {
        KineticSolverConfig solverConfig = KineticSolverConfig.getDefault()
                .withKineticGridResolution(64)
                .withMaxSteps(2);

        try (KineticSimulator simulator = new KineticSimulator(
                ScenarioConfig.getDamBreakScenario().withCellCount(20), solverConfig)) {
            simulator.advanceTimeStep();
            simulator.advanceTimeStep();

            assertThrows(SimulationConfigurationException.class, simulator::advanceTimeStep);
            assertEquals(2L, simulator.getStepCount());
        }
    }

    @Test
    @DisplayName("Una malla cinética estrecha genera un único aviso de cobertura por ejecución")
    void run_narrowKineticGrid_shouldWarnOnlyOnce() {
        Logger simulatorLogger = (Logger) LoggerFactory.getLogger(KineticSimulator.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        simulatorLogger.addAppender(appender);

        ScenarioConfig scenarioConfig = ScenarioConfig.getDamBreakScenario().withCellCount(40).withFinalTime(0.1);
        // ξ_max = 0.5 · sqrt(2 g · 2) queda por debajo de s_max desde el primer paso
        KineticSolverConfig narrow = KineticSolverConfig.getDefault()
                .withKineticGridFactor(0.5)
                .withKineticGridResolution(64);

        try (KineticSimulator simulator = new KineticSimulator(scenarioConfig, narrow)) {
            simulator.run();

            assertTrue(simulator.getStepCount() > 1);
            assertTrue(simulator.isCoverageWarningIssued());
            long coverageWarnings = appender.list.stream()
                    .filter(event -> event.getLevel() == Level.WARN)
                    .filter(event -> event.getFormattedMessage().contains("ya no domina"))
                    .count();
            assertEquals(1L, coverageWarnings);
        } finally {
            simulatorLogger.detachAppender(appender);
        }

        try (KineticSimulator simulator = new KineticSimulator(
                scenarioConfig, KineticSolverConfig.getDefault().withKineticGridResolution(64))) {
            simulator.run();
            assertFalse(simulator.isCoverageWarningIssued());
        }
    }
}
