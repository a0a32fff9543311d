package survivor.collision;

import survivor.core.Collidable;
import survivor.core.Collider;

/**
 * Utilitários de limites de entidades (broadphase).
 */
public final class Bounds {
    private Bounds() {
    }

    /**
     * Calcula a caixa que envolve o colisor de uma entidade, usando o maior raio que o colisor pode assumir.
     *
     * @param entity entidade
     * @return caixa envolvente em world-space
     */
    public static BoundingBox of(Collidable entity) {
        return BoundingBox.centered(entity.x(), entity.y(), entity.collider().extent());
    }

    /**
     * Círculo de uma entidade usando um raio já resolvido.
     *
     * @param entity entidade
     * @param radius raio escolhido pelo chamador
     * @return círculo centrado na entidade
     */
    public static Circle circle(Collidable entity, double radius) {
        return new Circle(entity.x(), entity.y(), radius);
    }

    /**
     * Círculo de uma entidade usando o raio de fallback do seu colisor.
     *
     * @see Collider#fallbackRadius()
     */
    public static Circle circle(Collidable entity) {
        return circle(entity, entity.collider().fallbackRadius());
    }
}
