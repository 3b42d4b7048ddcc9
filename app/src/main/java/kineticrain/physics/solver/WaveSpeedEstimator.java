package kineticrain.physics.solver;

/**
 * Estimador de la velocidad máxima de propagación para el criterio CFL:
 * <pre>
 *     s_max = max_i ( |u_i| + sqrt(2 g max(h_i, h_eps)) )
 * </pre>
 * sqrt(2 g h) es el semiancho del soporte de la Maxwelliana, no la celeridad sqrt(g h).
 */
public final class WaveSpeedEstimator {

    /**
     * Prohibido construir esta clase utilidad
     */
    private WaveSpeedEstimator() {
    }

    /**
     * @param depth             Profundidad por celda [m].
     * @param velocity          Velocidad por celda [m/s].
     * @param gravity           Gravedad [m/s²].
     * @param dryDepthThreshold Umbral de celda seca (h_eps).
     * @return La cota s_max sobre todo el campo [m/s].
     */
    public static double maxWaveSpeed(double[] depth, double[] velocity, double gravity, double dryDepthThreshold) {
        if (depth.length != velocity.length) {
            throw new IllegalArgumentException("Profundidad y velocidad deben tener la misma longitud.");
        }
        double max = 0.0;
        for (int i = 0; i < depth.length; i++) {
            double c = Math.sqrt(2.0 * gravity * Math.max(depth[i], dryDepthThreshold));
            max = Math.max(max, Math.abs(velocity[i]) + c);
        }
        return max;
    }
}
