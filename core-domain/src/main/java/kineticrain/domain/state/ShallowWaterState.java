package kineticrain.domain.state;

import lombok.Builder;
import lombok.With;

import java.util.Arrays;
import java.util.Objects;

/**
 * Representa una "instantánea" inmutable de las variables conservadas en un instante 't'.
 * <p>
 * Como es un objeto de valor, dos instancias se consideran iguales si sus arrays
 * son iguales elemento a elemento. Los accesores devuelven copias.
 *
 * @param depth     Profundidad del agua (h) en cada celda [m].
 * @param discharge Caudal unitario (hu) en cada celda [m²/s].
 */
@Builder
@With
public record ShallowWaterState(double[] depth, double[] discharge) {

    /**
     * Valida nulidad y dimensiones y crea copias defensivas de los arrays.
     */
    public ShallowWaterState {
        Objects.requireNonNull(depth, "El array de profundidad no puede ser nulo.");
        Objects.requireNonNull(discharge, "El array de caudal no puede ser nulo.");
        if (depth.length != discharge.length) {
            throw new IllegalArgumentException("Profundidad y caudal deben tener la misma longitud.");
        }
        depth = depth.clone();
        discharge = discharge.clone();
    }

    /**
     * @return Una copia del array de profundidades; el estado no se puede modificar desde fuera.
     */
    @Override
    public double[] depth() {
        return depth.clone();
    }

    /**
     * @return Una copia del array de caudales.
     */
    @Override
    public double[] discharge() {
        return discharge.clone();
    }

    public static ShallowWaterState fromDepthAndVelocity(double[] depth, double[] velocity) {
        if (depth.length != velocity.length) {
            throw new IllegalArgumentException("Profundidad y velocidad deben tener la misma longitud.");
        }
        double[] hu = new double[depth.length];
        for (int i = 0; i < hu.length; i++) {
            hu[i] = depth[i] * velocity[i];
        }
        return new ShallowWaterState(depth, hu);
    }

    public int cellCount() {
        return depth.length;
    }

    /**
     * Velocidad derivada u = hu / max(h, h_eps). Las celdas secas no dividen por cero.
     *
     * @param dryDepthThreshold Umbral de celda seca (h_eps).
     * @return Un array nuevo con la velocidad de cada celda [m/s].
     */
    public double[] velocity(double dryDepthThreshold) {
        double[] u = new double[depth.length];
        for (int i = 0; i < u.length; i++) {
            u[i] = discharge[i] / Math.max(depth[i], dryDepthThreshold);
        }
        return u;
    }

    /**
     * Volumen total de agua por unidad de anchura, Σ h · dx.
     */
    public double totalVolume(double dx) {
        double sum = 0.0;
        for (double h : depth) {
            sum += h;
        }
        return sum * dx;
    }

    public double maxDepth() {
        double max = 0.0;
        for (double h : depth) {
            max = Math.max(max, h);
        }
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ShallowWaterState that = (ShallowWaterState) o;
        return Arrays.equals(depth, that.depth) && Arrays.equals(discharge, that.discharge);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(depth) + Arrays.hashCode(discharge);
    }
}
