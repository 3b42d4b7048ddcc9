package kineticrain.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import kineticrain.domain.simulation.SimulationResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Exporta e importa {@link SimulationResult} en JSON para que el colaborador de
 * visualización (fuera de este proyecto) pueda consumir los campos finales.
 */
@Slf4j
public class SimulationResultJsonHandler {

    // Es costoso de crear y thread-safe: se reutiliza.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Escribe el resultado en la ruta indicada, sobrescribiendo el archivo si existe.
     *
     * @throws IOException Si ocurre un error durante la escritura.
     */
    public void write(SimulationResult result, Path path) throws IOException {
        log.info("Exportando resultado ({} celdas, t={}) a {}", result.cellCount(), result.finalTime(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), result);
            log.debug("Exportación JSON completada.");
        } catch (IOException e) {
            log.error("Error fatal al escribir el resultado en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * @throws IOException Si el archivo no existe o su formato es inválido.
     */
    public SimulationResult read(Path path) throws IOException {
        log.info("Importando resultado desde {}", path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(path.toFile(), SimulationResult.class);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el resultado desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }
}
