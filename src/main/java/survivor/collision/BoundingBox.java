package survivor.collision;

/**
 * Caixa alinhada aos eixos (AABB) definida pelo canto superior esquerdo e pelas extensões. Eixo Y cresce para baixo
 * (coordenadas de tela).
 *
 * @param x canto superior esquerdo X (px)
 * @param y canto superior esquerdo Y (px)
 * @param width largura (px), esperada >= 0
 * @param height altura (px), esperada >= 0
 */
public record BoundingBox(double x, double y, double width, double height) {

    /**
     * Cria a caixa quadrada que envolve um círculo de raio {@code halfExtent} centrado em (cx, cy).
     *
     * @param cx centro X
     * @param cy centro Y
     * @param halfExtent meia largura/altura
     * @return nova caixa
     */
    public static BoundingBox centered(double cx, double cy, double halfExtent) {
        return new BoundingBox(cx - halfExtent, cy - halfExtent, 2 * halfExtent, 2 * halfExtent);
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double centerX() {
        return x + width / 2;
    }

    public double centerY() {
        return y + height / 2;
    }
}
