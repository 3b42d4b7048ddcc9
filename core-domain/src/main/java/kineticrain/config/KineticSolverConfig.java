package kineticrain.config;

import lombok.Builder;
import lombok.With;

/**
 * Parámetros numéricos del solver cinético.
 * <p>
 * La gravedad es un parámetro explícito: nada en el núcleo numérico lee una constante global,
 * de modo que el solver puede usarse con otros sistemas de unidades.
 *
 * @param gravity               Aceleración de la gravedad (g) [m/s²].
 * @param dryDepthThreshold     Umbral de celda seca (h_eps) [m].
 * @param cfl                   Número de Courant, en (0, 1].
 * @param kineticGridFactor     Factor de dimensionado de la malla cinética:
 *                              ξ_max = factor · sqrt(2 g max(h_inicial)).
 * @param kineticGridResolution Número de puntos de la malla cinética (resolución de cuadratura).
 * @param progressInterval      Cada cuántos pasos se notifica el progreso. Sin efecto numérico.
 * @param maxSteps              Techo duro de pasos de tiempo.
 * @param cpuProcessorCount     Hilos para evaluar los flujos de interfaz. 1 = secuencial.
 */
@Builder
@With
public record KineticSolverConfig(
        double gravity,
        double dryDepthThreshold,
        double cfl,
        double kineticGridFactor,
        int kineticGridResolution,
        int progressInterval,
        long maxSteps,
        int cpuProcessorCount
) {

    public static final double STANDARD_GRAVITY = 9.81;

    public static KineticSolverConfig getDefault() {
        return KineticSolverConfig.builder()
                .gravity(STANDARD_GRAVITY)
                .dryDepthThreshold(1e-8)
                .cfl(0.5)
                .kineticGridFactor(4.0)
                .kineticGridResolution(1024)
                .progressInterval(20)
                .maxSteps(5_000_000L)
                .cpuProcessorCount(1)
                .build();
    }

    /**
     * Valida la configuración de forma anticipada.
     *
     * @throws SimulationConfigurationException si algún parámetro está fuera de rango.
     */
    public void validate() {
        if (!(gravity > 0) || !Double.isFinite(gravity)) {
            throw new SimulationConfigurationException("La gravedad debe ser positiva y finita: " + gravity);
        }
        if (!(dryDepthThreshold > 0)) {
            throw new SimulationConfigurationException("El umbral de celda seca debe ser > 0: " + dryDepthThreshold);
        }
        if (!(cfl > 0) || cfl > 1.0) {
            throw new SimulationConfigurationException("El número CFL debe estar en (0, 1]: " + cfl);
        }
        if (!(kineticGridFactor > 0) || !Double.isFinite(kineticGridFactor)) {
            throw new SimulationConfigurationException("El factor de la malla cinética debe ser > 0: " + kineticGridFactor);
        }
        if (kineticGridResolution < 2) {
            throw new SimulationConfigurationException("La malla cinética necesita al menos 2 puntos: " + kineticGridResolution);
        }
        if (progressInterval <= 0) {
            throw new SimulationConfigurationException("El intervalo de progreso debe ser > 0: " + progressInterval);
        }
        if (maxSteps <= 0) {
            throw new SimulationConfigurationException("El techo de pasos debe ser > 0: " + maxSteps);
        }
        if (cpuProcessorCount <= 0) {
            throw new SimulationConfigurationException("El número de hilos debe ser > 0: " + cpuProcessorCount);
        }
    }
}
