package kineticrain.config;

/**
 * Error fatal de configuración.
 * <p>
 * Se lanza antes de iniciar la integración temporal cuando algún parámetro del escenario
 * o del solver es inválido, y también cuando la simulación supera el techo de pasos
 * configurado (un dt patológicamente pequeño es, en la práctica, una configuración degenerada).
 */
public class SimulationConfigurationException extends IllegalArgumentException {

    public SimulationConfigurationException(String message) {
        super(message);
    }
}
