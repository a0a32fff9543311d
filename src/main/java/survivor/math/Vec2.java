package survivor.math;

/**
 * Representa um vetor 2D imutável (coordenadas de mundo em pixels) com operações básicas de álgebra vetorial.
 *
 * @param x componente X
 * @param y componente Y
 */
public record Vec2(double x, double y) {

    /**
     * Vetor nulo (0,0).
     */
    public static final Vec2 ZERO = new Vec2(0.0, 0.0);

    /**
     * Soma este vetor com outro.
     *
     * @param o vetor a ser somado
     * @return novo vetor resultado da soma
     */
    public Vec2 add(Vec2 o) {
        return new Vec2(x + o.x, y + o.y);
    }

    /**
     * Subtrai outro vetor deste.
     *
     * @param o vetor a ser subtraído
     * @return novo vetor resultado da subtração
     */
    public Vec2 sub(Vec2 o) {
        return new Vec2(x - o.x, y - o.y);
    }

    /**
     * Multiplica este vetor por um escalar.
     *
     * @param s escalar
     * @return novo vetor escalado
     */
    public Vec2 mul(double s) {
        return new Vec2(x * s, y * s);
    }

    /**
     * Produto escalar entre este vetor e outro.
     *
     * @param o outro vetor
     * @return valor do produto escalar
     */
    public double dot(Vec2 o) {
        return x * o.x + y * o.y;
    }

    /**
     * Retorna o comprimento (norma Euclidiana) deste vetor.
     *
     * @return comprimento do vetor
     */
    public double length() {
        return Math.sqrt(dot(this));
    }

    /**
     * Retorna uma cópia normalizada deste vetor (mesma direção, comprimento 1). Se o vetor for nulo, retorna ele mesmo.
     *
     * @return vetor normalizado
     */
    public Vec2 normalized() {
        double len = length();
        return (len == 0) ? this : this.mul(1.0 / len);
    }
}
