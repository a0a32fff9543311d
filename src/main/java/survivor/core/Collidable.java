package survivor.core;

/**
 * Entidade que participa da detecção de colisão. Pertence à camada de simulação; o núcleo de colisão apenas lê posição,
 * colisor e flags durante uma chamada.
 */
public interface Collidable {

    /**
     * Posição X do centro (px).
     */
    double x();

    /**
     * Posição Y do centro (px).
     */
    double y();

    /**
     * Colisor circular resolvido na criação da entidade.
     */
    default Collider collider() {
        return Collider.DEFAULT;
    }

    default boolean isActive() {
        return true;
    }

    default boolean isDead() {
        return false;
    }

    /**
     * Filtro de participação: ativa e não morta.
     *
     * @return true se a entidade deve ser considerada nas colisões deste tick
     */
    default boolean participates() {
        return isActive() && !isDead();
    }

    /**
     * Indica se um par deve ser testado: entidades distintas e ambas participando.
     *
     * @param a primeira entidade
     * @param b segunda entidade
     * @return true se o par é um candidato válido
     */
    static boolean canCollide(Collidable a, Collidable b) {
        return a != b && a.participates() && b.participates();
    }
}
