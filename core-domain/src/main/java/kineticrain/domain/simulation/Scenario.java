package kineticrain.domain.simulation;

import kineticrain.domain.grid.Topography;
import kineticrain.domain.grid.UniformGrid;
import kineticrain.domain.recharge.RechargeModel;
import kineticrain.domain.state.ShallowWaterState;
import lombok.Builder;
import lombok.With;

import java.util.Objects;

/**
 * Todo lo que el simulador necesita para arrancar: malla, lecho, estado inicial,
 * modelo de recarga y tiempo final.
 */
@Builder
@With
public record Scenario(
        UniformGrid grid,
        Topography topography,
        ShallowWaterState initialState,
        RechargeModel rechargeModel,
        double finalTime
) {

    public Scenario {
        Objects.requireNonNull(grid, "La malla no puede ser nula.");
        Objects.requireNonNull(topography, "La topografía no puede ser nula.");
        Objects.requireNonNull(initialState, "El estado inicial no puede ser nulo.");
        Objects.requireNonNull(rechargeModel, "El modelo de recarga no puede ser nulo.");
        int n = grid.cellCount();
        if (topography.cellCount() != n || initialState.cellCount() != n) {
            throw new IllegalArgumentException("Topografía y estado inicial deben tener " + n + " celdas.");
        }
    }
}
