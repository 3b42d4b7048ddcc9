package kineticrain.factory;

import kineticrain.config.ScenarioConfig;
import kineticrain.domain.grid.Topography;
import kineticrain.domain.grid.UniformGrid;
import kineticrain.domain.recharge.UniformRechargeModel;
import kineticrain.domain.simulation.Scenario;
import kineticrain.domain.state.ShallowWaterState;
import lombok.extern.slf4j.Slf4j;

/**
 * Fábrica responsable de construir el escenario inicial de la simulación.
 * <ol>
 * <li>Malla uniforme de centros de celda sobre [0, L].</li>
 * <li>Condición inicial de rotura de presa: profundidad aguas arriba para x &lt; damPosition,
 * aguas abajo en el resto, velocidad inicial uniforme.</li>
 * <li>Lecho lineal (plano por defecto).</li>
 * <li>Lluvia e infiltración uniformes y constantes.</li>
 * </ol>
 */
@Slf4j
public final class ScenarioFactory {

    private ScenarioFactory() {
    }

    /**
     * @param config Parámetros del escenario. Se validan antes de construir nada.
     * @return El escenario listo para el simulador.
     * @throws kineticrain.config.SimulationConfigurationException si la configuración es inválida.
     */
    public static Scenario createDamBreak(ScenarioConfig config) {
        config.validate();

        final int n = config.cellCount();
        UniformGrid grid = UniformGrid.over(config.domainLength(), n);
        double[] x = grid.coordinates();

        double[] depth = new double[n];
        double[] velocity = new double[n];
        for (int i = 0; i < n; i++) {
            depth[i] = (x[i] < config.damPosition()) ? config.upstreamDepth() : config.downstreamDepth();
            velocity[i] = config.initialVelocity();
        }

        Topography topography = (config.bedSlope() == 0.0)
                ? Topography.flat(n)
                : Topography.linear(grid, config.bedSlope());

        log.debug("Escenario de rotura de presa: N={}, dx={}, presa en x={}", n, grid.spacing(), config.damPosition());

        return Scenario.builder()
                .grid(grid)
                .topography(topography)
                .initialState(ShallowWaterState.fromDepthAndVelocity(depth, velocity))
                .rechargeModel(new UniformRechargeModel(n, config.rainfallRate(), config.infiltrationRate()))
                .finalTime(config.finalTime())
                .build();
    }
}
