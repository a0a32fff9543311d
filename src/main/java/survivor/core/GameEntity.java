package survivor.core;

import java.util.Objects;
import survivor.math.Vec2;

/**
 * Entidade de jogo com posição, colisor e flags de participação. A simulação (movimento, vida, IA) é quem muta a
 * posição e as flags; o núcleo de colisão só lê.
 */
public final class GameEntity implements Collidable {
    private final EntityType type;
    private final Collider collider;
    private Vec2 position;
    private boolean active = true;
    private boolean dead = false;

    /**
     * Cria uma nova entidade.
     *
     * @param type Categoria da entidade.
     * @param position Posição inicial do centro (px).
     * @param collider Colisor resolvido.
     */
    public GameEntity(EntityType type, Vec2 position, Collider collider) {
        this.type = Objects.requireNonNull(type, "type");
        this.position = Objects.requireNonNull(position, "position");
        this.collider = Objects.requireNonNull(collider, "collider");
    }

    /**
     * Cria uma entidade com raio explícito em (x, y).
     *
     * @param type Categoria
     * @param x Centro X
     * @param y Centro Y
     * @param radius Raio (px)
     * @return Nova entidade
     */
    public static GameEntity withRadius(EntityType type, double x, double y, double radius) {
        return new GameEntity(type, new Vec2(x, y), Collider.ofRadius(radius));
    }

    /**
     * Cria uma entidade cujo tamanho é usado como raio.
     *
     * @param type Categoria
     * @param x Centro X
     * @param y Centro Y
     * @param size Tamanho (px)
     * @return Nova entidade
     */
    public static GameEntity withSize(EntityType type, double x, double y, double size) {
        return new GameEntity(type, new Vec2(x, y), Collider.ofSize(size));
    }

    /**
     * Cria uma entidade sem raio nem tamanho (colisor padrão).
     */
    public static GameEntity unsized(EntityType type, double x, double y) {
        return new GameEntity(type, new Vec2(x, y), Collider.DEFAULT);
    }

    public EntityType type() {
        return type;
    }

    @Override
    public Collider collider() {
        return collider;
    }

    @Override
    public double x() {
        return position.x();
    }

    @Override
    public double y() {
        return position.y();
    }

    /**
     * Retorna a posição atual do centro.
     *
     * @return Posição (Vec2).
     */
    public Vec2 position() {
        return position;
    }

    /**
     * Define a posição do centro.
     *
     * @param p Nova posição.
     */
    public void setPosition(Vec2 p) {
        position = Objects.requireNonNull(p, "position");
    }

    /**
     * Desloca a entidade por (dx, dy).
     */
    public void translate(double dx, double dy) {
        position = position.add(new Vec2(dx, dy));
    }

    @Override
    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    @Override
    public boolean isDead() {
        return dead;
    }

    /**
     * Marca a entidade como morta; ela deixa de participar das colisões a partir do próximo teste.
     */
    public void kill() {
        dead = true;
    }

    /**
     * Revive a entidade (útil para pools que reutilizam instâncias).
     */
    public void revive() {
        dead = false;
    }

    @Override
    public String toString() {
        return type + "@(" + position.x() + ", " + position.y() + ") " + collider;
    }
}
