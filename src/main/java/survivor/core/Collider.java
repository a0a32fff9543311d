package survivor.core;

import java.util.Objects;

/**
 * Descreve o colisor circular de uma entidade, resolvido uma única vez na criação da entidade.
 * <p>
 * Uma entidade pode declarar um raio explícito, um "tamanho" (usado como raio), ambos ou nenhum. Valores 0 ou NaN
 * contam como ausentes. Sem nenhum dos dois o colisor é um círculo padrão de raio {@value #DEFAULT_RADIUS}.
 */
public final class Collider {

    /**
     * Raio usado quando a entidade não declara nem raio nem tamanho (px).
     */
    public static final double DEFAULT_RADIUS = 10.0;

    /**
     * Colisor padrão (círculo de raio {@value #DEFAULT_RADIUS}).
     */
    public static final Collider DEFAULT = new Collider(Kind.DEFAULT, Double.NaN, Double.NaN);

    /**
     * Tipo do colisor, conforme os atributos declarados pela entidade.
     */
    public enum Kind {
        /** Apenas raio explícito. */
        RADIUS,
        /** Apenas tamanho, usado como raio. */
        SIZE,
        /** Raio e tamanho declarados. */
        RADIUS_AND_SIZE,
        /** Nenhum dos dois: círculo padrão. */
        DEFAULT
    }

    private final Kind kind;
    private final double radius;
    private final double size;

    private Collider(Kind kind, double radius, double size) {
        this.kind = kind;
        this.radius = radius;
        this.size = size;
    }

    /**
     * Colisor com raio explícito.
     *
     * @param radius raio (px); 0 ou NaN resultam no colisor padrão
     */
    public static Collider ofRadius(double radius) {
        return of(radius, Double.NaN);
    }

    /**
     * Colisor cujo tamanho é usado como raio.
     *
     * @param size tamanho (px); 0 ou NaN resultam no colisor padrão
     */
    public static Collider ofSize(double size) {
        return of(Double.NaN, size);
    }

    /**
     * Resolve o colisor a partir dos atributos opcionais da entidade.
     *
     * @param radius raio explícito ou NaN/0 se ausente
     * @param size tamanho ou NaN/0 se ausente
     * @return colisor resolvido
     */
    public static Collider of(double radius, double size) {
        boolean hasRadius = present(radius);
        boolean hasSize = present(size);
        if (hasRadius && hasSize) {
            return new Collider(Kind.RADIUS_AND_SIZE, radius, size);
        }
        if (hasRadius) {
            return new Collider(Kind.RADIUS, radius, Double.NaN);
        }
        if (hasSize) {
            return new Collider(Kind.SIZE, Double.NaN, size);
        }
        return DEFAULT;
    }

    private static boolean present(double v) {
        return v != 0.0 && !Double.isNaN(v);
    }

    public Kind kind() {
        return kind;
    }

    public boolean hasRadius() {
        return kind == Kind.RADIUS || kind == Kind.RADIUS_AND_SIZE;
    }

    public boolean hasSize() {
        return kind == Kind.SIZE || kind == Kind.RADIUS_AND_SIZE;
    }

    /**
     * Raio explícito (NaN se ausente).
     */
    public double radius() {
        return radius;
    }

    /**
     * Tamanho (NaN se ausente).
     */
    public double size() {
        return size;
    }

    /**
     * Raio usado quando a outra entidade do par não declara o mesmo atributo: tamanho, senão raio, senão
     * {@value #DEFAULT_RADIUS}.
     *
     * @return raio de fallback
     */
    public double fallbackRadius() {
        if (hasSize()) {
            return size;
        }
        if (hasRadius()) {
            return radius;
        }
        return DEFAULT_RADIUS;
    }

    /**
     * Maior raio que este colisor pode assumir em qualquer teste (usado para limites de broadphase).
     *
     * @return raio envolvente
     */
    public double extent() {
        return switch (kind) {
            case RADIUS -> radius;
            case SIZE -> size;
            case RADIUS_AND_SIZE -> Math.max(radius, size);
            case DEFAULT -> DEFAULT_RADIUS;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Collider c)) {
            return false;
        }
        return kind == c.kind && Double.compare(radius, c.radius) == 0 && Double.compare(size, c.size) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, radius, size);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case RADIUS -> "Collider[radius=" + radius + "]";
            case SIZE -> "Collider[size=" + size + "]";
            case RADIUS_AND_SIZE -> "Collider[radius=" + radius + ", size=" + size + "]";
            case DEFAULT -> "Collider[default]";
        };
    }
}
