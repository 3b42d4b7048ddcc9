package kineticrain.physics.simulator;

import lombok.extern.slf4j.Slf4j;

/**
 * Observador por defecto: registra el avance en el log.
 */
@Slf4j
public class LoggingProgressListener implements SimulationProgressListener {

    @Override
    public void onProgress(SimulationProgress progress) {
        if (log.isInfoEnabled()) {
            log.info("t = {}, step = {}", String.format("%.3f", progress.currentTimeInSeconds()), progress.step());
        }
    }
}
