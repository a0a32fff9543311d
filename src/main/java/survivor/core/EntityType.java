package survivor.core;

/**
 * Categoria de entidade do jogo.
 */
public enum EntityType {
    PLAYER,
    ENEMY,
    PROJECTILE,
    PICKUP
}
