package survivor.collision;

/**
 * Círculo para fins de detecção de colisão.
 *
 * @param x centro X (px)
 * @param y centro Y (px)
 * @param radius raio (px), esperado >= 0
 */
public record Circle(double x, double y, double radius) {
}
