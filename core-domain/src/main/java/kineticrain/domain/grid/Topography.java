package kineticrain.domain.grid;

import java.util.Arrays;
import java.util.Objects;

/**
 * Cota del lecho (Z) en los centros de celda. Estática durante toda la simulación.
 */
public record Topography(double[] bedElevation) {

    public Topography {
        Objects.requireNonNull(bedElevation, "El array de cotas del lecho no puede ser nulo.");
        bedElevation = bedElevation.clone();
    }

    @Override
    public double[] bedElevation() {
        return bedElevation.clone();
    }

    public static Topography flat(int cellCount) {
        return new Topography(new double[cellCount]);
    }

    /**
     * Lecho lineal Z(x) = slope · (L - x), descendente hacia x = L cuando slope &gt; 0.
     */
    public static Topography linear(UniformGrid grid, double slope) {
        double length = grid.getDomainLength();
        double[] x = grid.coordinates();
        double[] z = new double[grid.cellCount()];
        for (int i = 0; i < z.length; i++) {
            z[i] = slope * (length - x[i]);
        }
        return new Topography(z);
    }

    public int cellCount() {
        return bedElevation.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bedElevation, ((Topography) o).bedElevation);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bedElevation);
    }
}
