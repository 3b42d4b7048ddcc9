package kineticrain.config;

import lombok.Builder;
import lombok.With;

/**
 * Un objeto de valor inmutable con los parámetros físicos de un escenario de rotura de presa
 * con recarga.
 * <p>
 * La infiltración es siempre un valor presente: un escenario sin infiltración usa 0.
 *
 * @param cellCount        Número de celdas (N).
 * @param domainLength     Longitud del dominio (L) [m]. El dominio es [0, L].
 * @param finalTime        Tiempo final de simulación (T) [s].
 * @param rainfallRate     Tasa de lluvia uniforme (R) [m/s]. 0 recupera la rotura de presa clásica.
 * @param infiltrationRate Tasa de infiltración uniforme (I) [m/s].
 * @param upstreamDepth    Profundidad inicial aguas arriba de la presa [m].
 * @param downstreamDepth  Profundidad inicial aguas abajo de la presa [m].
 * @param damPosition      Posición de la presa [m]; las celdas con x &lt; damPosition toman upstreamDepth.
 * @param initialVelocity  Velocidad inicial uniforme [m/s].
 * @param bedSlope         Pendiente del lecho; Z(x) = bedSlope · (L - x). 0 = lecho plano.
 */
@Builder
@With
public record ScenarioConfig(
        int cellCount,
        double domainLength,
        double finalTime,
        double rainfallRate,
        double infiltrationRate,
        double upstreamDepth,
        double downstreamDepth,
        double damPosition,
        double initialVelocity,
        double bedSlope
) {

    public static ScenarioConfig getDamBreakScenario() {
        return ScenarioConfig.builder()
                .cellCount(200)
                .domainLength(10.0)
                .finalTime(0.5)
                .rainfallRate(0.0)
                .infiltrationRate(0.0)
                .upstreamDepth(2.0)
                .downstreamDepth(1.0)
                .damPosition(5.0)
                .initialVelocity(0.0)
                .bedSlope(0.0)
                .build();
    }

    /**
     * @throws SimulationConfigurationException si algún parámetro está fuera de rango.
     */
    public void validate() {
        if (cellCount <= 0) {
            throw new SimulationConfigurationException("El número de celdas debe ser > 0: " + cellCount);
        }
        if (!(domainLength > 0) || !Double.isFinite(domainLength)) {
            throw new SimulationConfigurationException("La longitud del dominio debe ser > 0: " + domainLength);
        }
        if (!(finalTime >= 0) || !Double.isFinite(finalTime)) {
            throw new SimulationConfigurationException("El tiempo final debe ser >= 0 y finito: " + finalTime);
        }
        requireFinite("rainfallRate", rainfallRate);
        requireFinite("infiltrationRate", infiltrationRate);
        requireFinite("initialVelocity", initialVelocity);
        requireFinite("bedSlope", bedSlope);
        if (!(upstreamDepth >= 0) || !(downstreamDepth >= 0)) {
            throw new SimulationConfigurationException(
                    "Las profundidades iniciales no pueden ser negativas: " + upstreamDepth + ", " + downstreamDepth);
        }
        if (!(damPosition >= 0) || damPosition > domainLength) {
            throw new SimulationConfigurationException("La presa debe estar dentro de [0, L]: " + damPosition);
        }
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new SimulationConfigurationException("El parámetro " + name + " debe ser finito: " + value);
        }
    }
}
