package survivor.collision;

/**
 * Eixo de menor penetração entre duas AABBs.
 */
public enum Axis {
    X,
    Y,
    /** As caixas não se sobrepõem. */
    NONE
}
