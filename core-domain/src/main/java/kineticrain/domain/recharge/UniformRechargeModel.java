package kineticrain.domain.recharge;

import java.util.Objects;

/**
 * Recarga constante en el tiempo.
 */
public final class UniformRechargeModel implements RechargeModel {

    private final RechargeField field;

    public UniformRechargeModel(RechargeField field) {
        this.field = Objects.requireNonNull(field, "El campo de recarga no puede ser nulo.");
    }

    public UniformRechargeModel(int cellCount, double rainfallRate, double infiltrationRate) {
        this(RechargeField.uniform(cellCount, rainfallRate, infiltrationRate));
    }

    @Override
    public RechargeField rechargeAt(double currentTimeInSeconds) {
        return field;
    }
}
