package survivor.core;

/**
 * Estatísticas do último tick de broadphase.
 *
 * @param entities entidades recebidas em {@code update}
 * @param inserted entidades efetivamente indexadas (passaram o filtro e têm posição válida)
 * @param candidatePairs pares candidatos gerados
 * @param occupiedCells células com ao menos uma entidade
 * @param largestBucket maior ocupação de uma célula
 * @param elapsedNanos tempo gasto em {@code update}
 */
public record CollisionStats(int entities, int inserted, int candidatePairs, int occupiedCells, int largestBucket,
                             long elapsedNanos) {

    public static final CollisionStats EMPTY = new CollisionStats(0, 0, 0, 0, 0, 0L);
}
