package survivor.broadphase;

/**
 * Estratégia de inserção de entidades na grade.
 */
public enum InsertionMode {
    /**
     * Cada entidade vai para uma única célula, escolhida pelo seu centro. Pares que atravessam bordas de célula não são
     * gerados.
     */
    POINT,
    /**
     * Cada entidade vai para todas as células que sua caixa envolvente toca. Pares são deduplicados.
     */
    EXTENT
}
