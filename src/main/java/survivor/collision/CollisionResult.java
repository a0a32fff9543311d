package survivor.collision;

/**
 * Resultado de um teste de narrowphase.
 *
 * @param collided se as formas se interpenetram
 * @param distance distância centro-centro (ou centro-ponto mais próximo, conforme o teste); 0 no teste AABB–AABB
 * @param normal normal de colisão, apontando da primeira forma para a segunda
 * @param overlap magnitude mínima de separação (>= 0); 0 quando não há colisão
 */
public record CollisionResult(boolean collided, double distance, CollisionNormal normal, double overlap) {

    /**
     * Resultado "sem colisão" com distância e normal nulas.
     */
    public static final CollisionResult NONE = new CollisionResult(false, 0.0, CollisionNormal.ZERO, 0.0);
}
