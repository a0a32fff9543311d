package survivor.broadphase;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import survivor.collision.BoundingBox;
import survivor.collision.Bounds;
import survivor.core.Collidable;

/**
 * Broadphase por grade uniforme 2D sobre o mundo jogável. As células ficam num array plano de {@code cols * rows}
 * buckets alocados na construção; a topologia nunca muda depois disso. Cada tick os buckets são esvaziados (não
 * realocados) e repopulados, e só pares que compartilham um bucket viram candidatos.
 * <p>
 * Coordenadas fora do mundo são presas à célula de borda mais próxima em vez de descartadas. Uma entidade com posição
 * NaN não mapeia para célula alguma e é ignorada.
 */
public final class SpatialGrid<T extends Collidable> implements Broadphase<T> {
    private static final Logger log = LoggerFactory.getLogger(SpatialGrid.class);

    /**
     * Menor tamanho de célula aceito (px).
     */
    public static final double MIN_CELL_SIZE = 1e-6;

    /**
     * Número máximo de buckets. Células pequenas demais para o mundo são aumentadas até caber.
     */
    public static final int MAX_CELLS = 1 << 20;

    private final double worldWidth;
    private final double worldHeight;
    private final double cellSize;
    private final int cols;
    private final int rows;
    private final InsertionMode mode;
    private final List<List<Entry<T>>> cells;
    private final BitSet occupied; // células usadas no tick
    private int size;

    /**
     * Entrada de um bucket: a entidade e o intervalo de células que ela ocupa (min == max no modo POINT).
     */
    private static final class Entry<T> {
        final T entity;
        final int minCol;
        final int minRow;
        final int maxCol;
        final int maxRow;

        Entry(T entity, int minCol, int minRow, int maxCol, int maxRow) {
            this.entity = entity;
            this.minCol = minCol;
            this.minRow = minRow;
            this.maxCol = maxCol;
            this.maxRow = maxRow;
        }
    }

    /**
     * Cria uma grade com inserção por ponto.
     *
     * @param worldWidth largura do mundo (px)
     * @param worldHeight altura do mundo (px)
     * @param cellSize tamanho da célula (px)
     */
    public SpatialGrid(double worldWidth, double worldHeight, double cellSize) {
        this(new GridSettings(worldWidth, worldHeight, cellSize));
    }

    /**
     * @param settings dimensões do mundo, tamanho de célula e modo de inserção
     */
    public SpatialGrid(GridSettings settings) {
        Objects.requireNonNull(settings, "settings");
        this.worldWidth = settings.worldWidth();
        this.worldHeight = settings.worldHeight();
        this.cellSize = fitCellSize(worldWidth, worldHeight, Math.max(MIN_CELL_SIZE, settings.cellSize()));
        this.cols = (int) cellsAlong(worldWidth, cellSize);
        this.rows = (int) cellsAlong(worldHeight, cellSize);
        this.mode = settings.insertionMode();
        if (cellSize != settings.cellSize()) {
            log.warn("Tamanho de célula {} ajustado para {} (mundo {}x{}, máximo de {} células)", settings.cellSize(),
                cellSize, worldWidth, worldHeight, MAX_CELLS);
        }

        int n = cols * rows;
        this.cells = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            cells.add(new ArrayList<>());
        }
        this.occupied = new BitSet(n);

        log.debug("SpatialGrid {}x{} (world {}x{}, cell {}, mode {})", cols, rows, worldWidth, worldHeight, cellSize,
            mode);
    }

    @Override
    public void clear() {
        for (int i = occupied.nextSetBit(0); i >= 0; i = occupied.nextSetBit(i + 1)) {
            cells.get(i).clear();
        }
        occupied.clear();
        size = 0;
    }

    /**
     * Coluna da célula que contém {@code x}, presa a [0, cols-1].
     */
    public int column(double x) {
        return clamp((int) Math.floor(x / cellSize), cols);
    }

    /**
     * Linha da célula que contém {@code y}, presa a [0, rows-1].
     */
    public int row(double y) {
        return clamp((int) Math.floor(y / cellSize), rows);
    }

    /**
     * Mapeia uma coordenada de mundo para o índice plano do bucket: {@code row * cols + col}.
     *
     * @param x coordenada X (px)
     * @param y coordenada Y (px)
     * @return índice do bucket, ou -1 se alguma coordenada for NaN
     */
    public int cellIndexFor(double x, double y) {
        if (Double.isNaN(x) || Double.isNaN(y)) {
            return -1;
        }
        return row(y) * cols + column(x);
    }

    @Override
    public boolean insert(T entity) {
        double x = entity.x();
        double y = entity.y();
        if (Double.isNaN(x) || Double.isNaN(y)) {
            log.debug("Ignorando entidade com posição inválida: {}", entity);
            return false;
        }

        int col = column(x);
        int row = row(y);
        if (mode == InsertionMode.POINT) {
            add(new Entry<>(entity, col, row, col, row), row * cols + col);
            size++;
            return true;
        }

        BoundingBox box = Bounds.of(entity);
        int minCol = Double.isNaN(box.x()) ? col : column(box.x());
        int minRow = Double.isNaN(box.y()) ? row : row(box.y());
        int maxCol = Double.isNaN(box.right()) ? col : column(box.right());
        int maxRow = Double.isNaN(box.bottom()) ? row : row(box.bottom());

        Entry<T> e = new Entry<>(entity, minCol, minRow, maxCol, maxRow);
        for (int r = minRow; r <= maxRow; r++) {
            for (int c = minCol; c <= maxCol; c++) {
                add(e, r * cols + c);
            }
        }
        size++;
        return true;
    }

    private void add(Entry<T> e, int index) {
        cells.get(index).add(e);
        occupied.set(index);
    }

    @Override
    public List<CollisionPair<T>> computePairs() {
        List<CollisionPair<T>> out = new ArrayList<>();

        for (int idx = occupied.nextSetBit(0); idx >= 0; idx = occupied.nextSetBit(idx + 1)) {
            List<Entry<T>> bucket = cells.get(idx);
            int n = bucket.size();
            if (n < 2) {
                continue;
            }

            int col = idx % cols;
            int row = idx / cols;
            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    Entry<T> a = bucket.get(i);
                    Entry<T> b = bucket.get(j);
                    if (!Collidable.canCollide(a.entity, b.entity)) {
                        continue;
                    }
                    // par que compartilha várias células só é emitido na primeira delas
                    if (col != Math.max(a.minCol, b.minCol) || row != Math.max(a.minRow, b.minRow)) {
                        continue;
                    }
                    out.add(new CollisionPair<>(a.entity, b.entity));
                }
            }
        }
        return out;
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * Número de entidades no bucket {@code index} neste tick.
     */
    public int bucketSize(int index) {
        return cells.get(index).size();
    }

    /**
     * Número de células com ao menos uma entidade neste tick.
     */
    public int occupiedCells() {
        return occupied.cardinality();
    }

    /**
     * Maior ocupação de célula neste tick.
     */
    public int largestBucket() {
        int max = 0;
        for (int i = occupied.nextSetBit(0); i >= 0; i = occupied.nextSetBit(i + 1)) {
            max = Math.max(max, cells.get(i).size());
        }
        return max;
    }

    public int cols() {
        return cols;
    }

    public int rows() {
        return rows;
    }

    public double cellSize() {
        return cellSize;
    }

    public double worldWidth() {
        return worldWidth;
    }

    public double worldHeight() {
        return worldHeight;
    }

    public InsertionMode insertionMode() {
        return mode;
    }

    /**
     * Dobra o tamanho da célula até que {@code cols * rows <= MAX_CELLS}.
     */
    private static double fitCellSize(double width, double height, double size) {
        double s = size;
        while (cellsAlong(width, s) * cellsAlong(height, s) > MAX_CELLS) {
            s *= 2;
        }
        return s;
    }

    /**
     * Número de células ao longo de um eixo, no mínimo 1 (NaN conta como 1).
     */
    private static double cellsAlong(double extent, double size) {
        double n = Math.ceil(extent / size);
        return n >= 1 ? n : 1;
    }

    private static int clamp(int v, int count) {
        return Math.max(0, Math.min(v, count - 1));
    }
}
