package survivor.collision;

/**
 * Normal de colisão 2D. Unitária quando há distância entre os centros; vetor nulo quando os centros coincidem.
 *
 * @param x componente X (-1..1)
 * @param y componente Y (-1..1)
 */
public record CollisionNormal(double x, double y) {

    /**
     * Normal nula (centros coincidentes ou sem colisão).
     */
    public static final CollisionNormal ZERO = new CollisionNormal(0.0, 0.0);

    /**
     * Normaliza (dx, dy) pelo comprimento informado. Retorna {@link #ZERO} se {@code length} não for > 0.
     *
     * @param dx delta X
     * @param dy delta Y
     * @param length comprimento de (dx, dy), já calculado pelo chamador
     * @return normal unitária ou ZERO
     */
    static CollisionNormal of(double dx, double dy, double length) {
        if (length > 0) {
            return new CollisionNormal(dx / length, dy / length);
        }
        return ZERO;
    }

    public boolean isZero() {
        return x == 0.0 && y == 0.0;
    }
}
