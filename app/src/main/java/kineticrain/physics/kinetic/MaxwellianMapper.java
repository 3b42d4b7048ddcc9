package kineticrain.physics.kinetic;

/**
 * Transforma el estado macroscópico de una celda (h, u) en la pseudo-distribución
 * M(ξ) = sqrt(h) · χ((ξ - u) / sqrt(h)) sobre la malla cinética.
 * <p>
 * Celdas casi secas (h ≤ h_eps) producen M = 0 para no dividir por sqrt(h) ≈ 0.
 * Esta clase es Thread safe.
 */
public final class MaxwellianMapper {

    private final double gravity;
    private final double dryDepthThreshold;

    public MaxwellianMapper(double gravity, double dryDepthThreshold) {
        this.gravity = gravity;
        this.dryDepthThreshold = dryDepthThreshold;
    }

    /**
     * @return Un array nuevo M(ξ_k) con la longitud de la malla cinética.
     */
    public double[] map(double depth, double velocity, KineticVelocityGrid kineticGrid) {
        double[] xi = kineticGrid.nodes();
        double[] out = new double[xi.length];
        if (isDry(depth)) {
            return out;
        }
        double sqrtH = Math.sqrt(depth);
        for (int k = 0; k < xi.length; k++) {
            out[k] = sqrtH * KineticWeightKernel.weight((xi[k] - velocity) / sqrtH, gravity);
        }
        return out;
    }

    /**
     * Valor puntual de la Maxwelliana en una sola velocidad cinética.
     */
    public double density(double depth, double velocity, double xi) {
        if (isDry(depth)) {
            return 0.0;
        }
        double sqrtH = Math.sqrt(depth);
        return sqrtH * KineticWeightKernel.weight((xi - velocity) / sqrtH, gravity);
    }

    public boolean isDry(double depth) {
        return depth <= dryDepthThreshold;
    }
}
