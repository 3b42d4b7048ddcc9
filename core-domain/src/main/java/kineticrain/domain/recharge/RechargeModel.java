package kineticrain.domain.recharge;

/**
 * Modelo de evolución temporal de la recarga. Se evalúa una vez por paso de tiempo.
 */
@FunctionalInterface
public interface RechargeModel {
    RechargeField rechargeAt(double currentTimeInSeconds);
}
