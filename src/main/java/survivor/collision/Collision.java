package survivor.collision;

/**
 * Testes de narrowphase 2D (círculo, AABB e ponto). Funções puras e sem estado, chamadas no caminho quente de cada
 * frame: não alocam além do resultado e não validam entrada (NaN propaga e resulta em "sem colisão").
 */
public final class Collision {
    private Collision() {
    }

    /**
     * Testa colisão Círculo–Círculo. Convenção: normal aponta de c1 → c2.
     * <p>
     * Círculos apenas encostados ({@code distance == r1 + r2}) NÃO colidem.
     *
     * @param c1 primeiro círculo
     * @param c2 segundo círculo
     * @return resultado com distância centro-centro, normal e penetração
     */
    public static CollisionResult testCircleCircle(Circle c1, Circle c2) {
        double dx = c2.x() - c1.x();
        double dy = c2.y() - c1.y();
        double dist = Math.sqrt(dx * dx + dy * dy);
        double r = c1.radius() + c2.radius();

        boolean collided = dist < r;
        double overlap = collided ? r - dist : 0.0;

        return new CollisionResult(collided, dist, CollisionNormal.of(dx, dy, dist), overlap);
    }

    /**
     * Testa colisão AABB–AABB (inequações estritas nos quatro lados).
     * <p>
     * A penetração é a do eixo de menor sobreposição, mas a normal vem do vetor entre os centros das caixas, e não do
     * eixo escolhido: para caixas não quadradas as duas informações podem divergir. Quem precisa empurrar ao longo de
     * um eixo deve combinar {@code overlap} com {@link #minimumPenetrationAxis(BoundingBox, BoundingBox)}. A distância
     * não é calculada (sempre 0).
     *
     * @param b1 primeira caixa
     * @param b2 segunda caixa
     * @return resultado; {@link CollisionResult#NONE} se não há sobreposição
     */
    public static CollisionResult testBoxBox(BoundingBox b1, BoundingBox b2) {
        if (!overlaps(b1, b2)) {
            return CollisionResult.NONE;
        }

        double overlapX = overlapX(b1, b2);
        double overlapY = overlapY(b1, b2);
        double overlap = Math.min(overlapX, overlapY);

        double dx = b2.centerX() - b1.centerX();
        double dy = b2.centerY() - b1.centerY();
        double centerDist = Math.sqrt(dx * dx + dy * dy);

        return new CollisionResult(true, 0.0, CollisionNormal.of(dx, dy, centerDist), overlap);
    }

    /**
     * Eixo de menor penetração entre duas caixas. Em empate escolhe X.
     *
     * @param b1 primeira caixa
     * @param b2 segunda caixa
     * @return X, Y ou NONE se não há sobreposição
     */
    public static Axis minimumPenetrationAxis(BoundingBox b1, BoundingBox b2) {
        if (!overlaps(b1, b2)) {
            return Axis.NONE;
        }
        return overlapX(b1, b2) <= overlapY(b1, b2) ? Axis.X : Axis.Y;
    }

    /**
     * Testa colisão Círculo–AABB usando o ponto da caixa mais próximo do centro do círculo. Convenção: normal aponta do
     * ponto mais próximo → centro do círculo (nula se o centro está dentro da caixa ou sobre a borda).
     *
     * @param circle círculo
     * @param box caixa
     * @return resultado com distância centro–ponto mais próximo
     */
    public static CollisionResult testCircleBox(Circle circle, BoundingBox box) {
        double closestX = Math.max(box.x(), Math.min(circle.x(), box.right()));
        double closestY = Math.max(box.y(), Math.min(circle.y(), box.bottom()));

        double dx = circle.x() - closestX;
        double dy = circle.y() - closestY;
        double dist = Math.sqrt(dx * dx + dy * dy);

        boolean collided = dist < circle.radius();
        double overlap = collided ? circle.radius() - dist : 0.0;

        return new CollisionResult(collided, dist, CollisionNormal.of(dx, dy, dist), overlap);
    }

    /**
     * Ponto dentro do círculo, borda inclusa.
     */
    public static boolean pointInCircle(double px, double py, Circle circle) {
        return distance(px, py, circle.x(), circle.y()) <= circle.radius();
    }

    /**
     * Ponto dentro da caixa, bordas inclusas.
     */
    public static boolean pointInBox(double px, double py, BoundingBox box) {
        return px >= box.x() && px <= box.right() && py >= box.y() && py <= box.bottom();
    }

    /**
     * Distância Euclidiana entre dois pontos.
     */
    public static double distance(double x1, double y1, double x2, double y2) {
        double dx = x2 - x1;
        double dy = y2 - y1;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * Ângulo (rad) da direção que vai de (x1,y1) até (x2,y2), em (-π, π].
     */
    public static double angle(double x1, double y1, double x2, double y2) {
        return Math.atan2(y2 - y1, x2 - x1);
    }

    private static boolean overlaps(BoundingBox b1, BoundingBox b2) {
        return b1.x() < b2.right()
               && b1.right() > b2.x()
               && b1.y() < b2.bottom()
               && b1.bottom() > b2.y();
    }

    private static double overlapX(BoundingBox b1, BoundingBox b2) {
        return Math.min(b1.right(), b2.right()) - Math.max(b1.x(), b2.x());
    }

    private static double overlapY(BoundingBox b1, BoundingBox b2) {
        return Math.min(b1.bottom(), b2.bottom()) - Math.max(b1.y(), b2.y());
    }
}
