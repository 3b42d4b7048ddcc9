package kineticrain.physics.kinetic;

/**
 * Par de flujos numéricos en una interfaz.
 *
 * @param mass     Flujo de masa (aproxima h·u).
 * @param momentum Flujo de cantidad de movimiento (aproxima h·u² + ½·g·h²).
 */
public record InterfaceFlux(double mass, double momentum) {
}
