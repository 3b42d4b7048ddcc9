package kineticrain.physics.kinetic;

import java.util.Arrays;
import java.util.Objects;

/**
 * Malla auxiliar de velocidades cinéticas ξ, uniforme y simétrica sobre [-ξ_max, ξ_max].
 * <p>
 * No forma parte del estado físico: es andamiaje de cuadratura. Se construye una sola vez
 * a partir de la profundidad máxima inicial y no se adapta si la profundidad crece después.
 *
 * @param nodes   Velocidades cinéticas ξ_k, ordenadas y simétricas respecto a cero.
 * @param spacing Espaciado dξ.
 */
public record KineticVelocityGrid(double[] nodes, double spacing) {

    public KineticVelocityGrid {
        Objects.requireNonNull(nodes, "Los nodos de la malla cinética no pueden ser nulos.");
        if (nodes.length < 2) {
            throw new IllegalArgumentException("La malla cinética necesita al menos 2 nodos.");
        }
        if (!(spacing > 0)) {
            throw new IllegalArgumentException("El espaciado de la malla cinética debe ser positivo: " + spacing);
        }
        nodes = nodes.clone();
    }

    /**
     * Construye la malla con ξ_max = factor · sqrt(2 g h_max) y {@code resolution} puntos.
     * Los nodos se generan por pares (ξ, -ξ) para que la simetría sea exacta en coma flotante.
     *
     * @param maxDepth   Profundidad de referencia (máximo inicial) [m]. Debe ser positiva.
     * @param factor     Factor de dimensionado (&gt; 0).
     * @param resolution Número de nodos (≥ 2).
     * @param gravity    Gravedad [m/s²].
     */
    public static KineticVelocityGrid create(double maxDepth, double factor, int resolution, double gravity) {
        if (!(maxDepth > 0)) {
            throw new IllegalArgumentException("La profundidad de referencia debe ser positiva: " + maxDepth);
        }
        double xiMax = factor * Math.sqrt(2.0 * gravity * maxDepth);
        double dxi = 2.0 * xiMax / (resolution - 1);

        double[] xi = new double[resolution];
        int half = resolution / 2;
        for (int k = 0; k < half; k++) {
            double value = -xiMax + k * dxi;
            xi[k] = value;
            xi[resolution - 1 - k] = -value;
        }
        // Con un número impar de nodos, el central es exactamente cero.
        return new KineticVelocityGrid(xi, dxi);
    }

    @Override
    public double[] nodes() {
        return nodes.clone();
    }

    /**
     * Acceso directo a un nodo, sin copiar el array (bucle de cuadratura).
     */
    public double node(int k) {
        return nodes[k];
    }

    public int size() {
        return nodes.length;
    }

    public double maxSpeed() {
        return nodes[nodes.length - 1];
    }

    /**
     * Indica si el rango de la malla domina una velocidad de onda dada.
     */
    public boolean covers(double waveSpeed) {
        return waveSpeed <= maxSpeed();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KineticVelocityGrid that = (KineticVelocityGrid) o;
        return Double.compare(spacing, that.spacing) == 0 && Arrays.equals(nodes, that.nodes);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(nodes) + Double.hashCode(spacing);
    }
}
