package kineticrain.physics.i;

/**
 * Contrato base para cualquier componente numérico del sistema.
 * Permite tratar a todos los solvers de forma polimórfica para tareas
 * de logging e identificación.
 */
public interface ISolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "Kinetic_Upwind").
     */
    String getName();

    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
