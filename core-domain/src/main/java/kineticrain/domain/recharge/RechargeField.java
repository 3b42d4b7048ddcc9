package kineticrain.domain.recharge;

import java.util.Arrays;
import java.util.Objects;

/**
 * Campos de recarga por celda: lluvia (R) e infiltración (I).
 * <p>
 * Ambos arrays están siempre presentes; la ausencia de infiltración se representa con ceros,
 * nunca con un valor nulo.
 *
 * @param rainfall     Tasa de lluvia por celda [m/s].
 * @param infiltration Tasa de infiltración por celda [m/s].
 */
public record RechargeField(double[] rainfall, double[] infiltration) {

    public RechargeField {
        Objects.requireNonNull(rainfall, "El array de lluvia no puede ser nulo.");
        Objects.requireNonNull(infiltration, "El array de infiltración no puede ser nulo.");
        if (rainfall.length != infiltration.length) {
            throw new IllegalArgumentException("Lluvia e infiltración deben tener la misma longitud.");
        }
        rainfall = rainfall.clone();
        infiltration = infiltration.clone();
    }

    @Override
    public double[] rainfall() {
        return rainfall.clone();
    }

    @Override
    public double[] infiltration() {
        return infiltration.clone();
    }

    public static RechargeField uniform(int cellCount, double rainfallRate, double infiltrationRate) {
        double[] r = new double[cellCount];
        double[] i = new double[cellCount];
        Arrays.fill(r, rainfallRate);
        Arrays.fill(i, infiltrationRate);
        return new RechargeField(r, i);
    }

    public static RechargeField rainfallOnly(double[] rainfall) {
        return new RechargeField(rainfall, new double[rainfall.length]);
    }

    public int cellCount() {
        return rainfall.length;
    }

    /**
     * Término fuente neto S = R - I.
     */
    public double[] netSource() {
        double[] s = new double[rainfall.length];
        for (int k = 0; k < s.length; k++) {
            s[k] = rainfall[k] - infiltration[k];
        }
        return s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RechargeField that = (RechargeField) o;
        return Arrays.equals(rainfall, that.rainfall) && Arrays.equals(infiltration, that.infiltration);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(rainfall) + Arrays.hashCode(infiltration);
    }
}
