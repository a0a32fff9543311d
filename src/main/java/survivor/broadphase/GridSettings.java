package survivor.broadphase;

import java.util.Objects;

/**
 * Parâmetros da grade uniforme. Fixos na construção: mudar o tamanho do mundo exige uma nova grade.
 *
 * @param worldWidth largura do mundo (px)
 * @param worldHeight altura do mundo (px)
 * @param cellSize tamanho da célula (px). Pequeno demais perde pares entre células; grande demais degenera para
 * O(n²) em células lotadas
 * @param insertionMode estratégia de inserção
 */
public record GridSettings(double worldWidth, double worldHeight, double cellSize, InsertionMode insertionMode) {

    /**
     * 800×600 com células de 50 px e inserção por ponto.
     */
    public static final GridSettings DEFAULT = new GridSettings(800, 600, 50, InsertionMode.POINT);

    public GridSettings {
        Objects.requireNonNull(insertionMode, "insertionMode");
    }

    public GridSettings(double worldWidth, double worldHeight, double cellSize) {
        this(worldWidth, worldHeight, cellSize, InsertionMode.POINT);
    }

    public GridSettings withInsertionMode(InsertionMode mode) {
        return new GridSettings(worldWidth, worldHeight, cellSize, mode);
    }
}
