package kineticrain.physics.kinetic;

/**
 * Función peso χ que define la Maxwelliana cinética:
 * <pre>
 *     χ(ω) = (1 / (π g)) · sqrt( max(0, 2g - ω²) )
 * </pre>
 * Es no negativa, simétrica y de soporte compacto |ω| ≤ sqrt(2g). Con esta elección los
 * momentos de la Maxwelliana reproducen los flujos de aguas someras; cualquier kernel
 * alternativo debe conservar esas tres propiedades.
 */
public final class KineticWeightKernel {

    /**
     * Prohibido construir esta clase utilidad
     */
    private KineticWeightKernel() {
    }

    public static double weight(double omega, double gravity) {
        double inside = 2.0 * gravity - omega * omega;
        if (inside <= 0.0) {
            return 0.0;
        }
        return Math.sqrt(inside) / (Math.PI * gravity);
    }

    /**
     * Evalúa χ elemento a elemento.
     *
     * @return Un array nuevo con la misma longitud que {@code omega}.
     */
    public static double[] weight(double[] omega, double gravity) {
        double[] out = new double[omega.length];
        for (int k = 0; k < omega.length; k++) {
            out[k] = weight(omega[k], gravity);
        }
        return out;
    }

    /**
     * Semiancho del soporte, sqrt(2g).
     */
    public static double supportRadius(double gravity) {
        return Math.sqrt(2.0 * gravity);
    }
}
