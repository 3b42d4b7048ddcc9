package kineticrain.domain.grid;

import java.util.Objects;

/**
 * Malla uniforme de volúmenes finitos sobre el dominio [0, L].
 * <p>
 * Las coordenadas son los centros de celda, x_i = (i + 1/2) · dx, y no cambian durante la simulación.
 *
 * @param cellCount   Número de celdas (N).
 * @param spacing     Tamaño de celda (dx) [m].
 * @param coordinates Centros de celda [m].
 */
public record UniformGrid(int cellCount, double spacing, double[] coordinates) {

    public UniformGrid {
        Objects.requireNonNull(coordinates, "El array de coordenadas no puede ser nulo.");
        if (cellCount <= 0 || coordinates.length != cellCount) {
            throw new IllegalArgumentException("La malla necesita " + cellCount + " coordenadas, recibidas " + coordinates.length);
        }
        if (!(spacing > 0)) {
            throw new IllegalArgumentException("El espaciado debe ser positivo: " + spacing);
        }
        coordinates = coordinates.clone();
    }

    @Override
    public double[] coordinates() {
        return coordinates.clone();
    }

    public static UniformGrid over(double domainLength, int cellCount) {
        double dx = domainLength / cellCount;
        double[] x = new double[cellCount];
        for (int i = 0; i < cellCount; i++) {
            x[i] = (i + 0.5) * dx;
        }
        return new UniformGrid(cellCount, dx, x);
    }

    public double getDomainLength() {
        return cellCount * spacing;
    }
}
