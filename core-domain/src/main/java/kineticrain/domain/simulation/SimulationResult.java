package kineticrain.domain.simulation;

import lombok.Builder;

import java.util.Arrays;
import java.util.Objects;

/**
 * Resultado final de una simulación: los cuatro campos que consume el colaborador de
 * visualización más metadatos del recorrido temporal.
 *
 * @param coordinates          Centros de celda [m].
 * @param bedElevation         Cota del lecho (Z) [m].
 * @param depth                Profundidad final, acotada inferiormente por h_eps [m].
 * @param velocity             Velocidad final [m/s].
 * @param finalTime            Tiempo simulado alcanzado [s].
 * @param stepCount            Número de pasos de tiempo ejecutados.
 * @param simulationTimeMillis Tiempo de cómputo (métrica de rendimiento) [ms].
 */
@Builder
public record SimulationResult(
        double[] coordinates,
        double[] bedElevation,
        double[] depth,
        double[] velocity,
        double finalTime,
        long stepCount,
        long simulationTimeMillis
) {

    public SimulationResult {
        Objects.requireNonNull(coordinates, "coordinates no puede ser nulo.");
        Objects.requireNonNull(bedElevation, "bedElevation no puede ser nulo.");
        Objects.requireNonNull(depth, "depth no puede ser nulo.");
        Objects.requireNonNull(velocity, "velocity no puede ser nulo.");
        int n = coordinates.length;
        if (bedElevation.length != n || depth.length != n || velocity.length != n) {
            throw new IllegalArgumentException("Todos los campos del resultado deben tener la misma longitud.");
        }
        coordinates = coordinates.clone();
        bedElevation = bedElevation.clone();
        depth = depth.clone();
        velocity = velocity.clone();
    }

    @Override
    public double[] coordinates() {
        return coordinates.clone();
    }

    @Override
    public double[] bedElevation() {
        return bedElevation.clone();
    }

    @Override
    public double[] depth() {
        return depth.clone();
    }

    @Override
    public double[] velocity() {
        return velocity.clone();
    }

    public int cellCount() {
        return coordinates.length;
    }

    /**
     * Superficie libre η = h + Z.
     */
    public double[] freeSurface() {
        double[] eta = new double[depth.length];
        for (int i = 0; i < eta.length; i++) {
            eta[i] = depth[i] + bedElevation[i];
        }
        return eta;
    }

    /**
     * Caudal unitario q = h · u.
     */
    public double[] discharge() {
        double[] q = new double[depth.length];
        for (int i = 0; i < q.length; i++) {
            q[i] = depth[i] * velocity[i];
        }
        return q;
    }

    public double totalVolume(double dx) {
        double sum = 0.0;
        for (double h : depth) {
            sum += h;
        }
        return sum * dx;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SimulationResult that = (SimulationResult) o;
        return Double.compare(finalTime, that.finalTime) == 0
                && stepCount == that.stepCount
                && simulationTimeMillis == that.simulationTimeMillis
                && Arrays.equals(coordinates, that.coordinates)
                && Arrays.equals(bedElevation, that.bedElevation)
                && Arrays.equals(depth, that.depth)
                && Arrays.equals(velocity, that.velocity);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(finalTime, stepCount, simulationTimeMillis);
        result = 31 * result + Arrays.hashCode(coordinates);
        result = 31 * result + Arrays.hashCode(bedElevation);
        result = 31 * result + Arrays.hashCode(depth);
        result = 31 * result + Arrays.hashCode(velocity);
        return result;
    }
}
