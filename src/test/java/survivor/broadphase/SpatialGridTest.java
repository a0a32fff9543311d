package survivor.broadphase;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import survivor.core.EntityType;
import survivor.core.GameEntity;

class SpatialGridTest {

    private static GameEntity enemy(double x, double y) {
        return GameEntity.withRadius(EntityType.ENEMY, x, y, 5);
    }

    @Test
    void dimensionsAndCellMapping() {
        var grid = new SpatialGrid<GameEntity>(800, 600, 50);

        assertEquals(16, grid.cols());
        assertEquals(12, grid.rows());
        assertEquals(15, grid.column(799));
        assertEquals(11, grid.row(599));
        assertEquals(11 * 16 + 15, grid.cellIndexFor(799, 599));
        assertEquals(0, grid.cellIndexFor(-5, -5));
    }

    @Test
    void outOfWorldCoordinatesArePinnedToEdgeCells() {
        var grid = new SpatialGrid<GameEntity>(800, 600, 50);

        assertEquals(11 * 16 + 15, grid.cellIndexFor(5000, 5000));
        assertEquals(15, grid.cellIndexFor(900, -40));
        assertEquals(11 * 16, grid.cellIndexFor(Double.NEGATIVE_INFINITY, 650));
        assertEquals(-1, grid.cellIndexFor(Double.NaN, 10));
    }

    @Test
    void partialCellsRoundUp() {
        var grid = new SpatialGrid<GameEntity>(810, 601, 50);

        assertEquals(17, grid.cols());
        assertEquals(13, grid.rows());
    }

    @Test
    void sharedPositionYieldsExactlyOnePair() {
        var grid = new SpatialGrid<GameEntity>(800, 600, 50);
        var a = enemy(300, 300);
        var b = enemy(300, 300);
        grid.insert(a);
        grid.insert(b);

        var pairs = grid.computePairs();

        assertEquals(1, pairs.size());
        assertTrue(pairs.get(0).contains(a));
        assertTrue(pairs.get(0).contains(b));
        assertEquals(b, pairs.get(0).other(a));
    }

    @Test
    void sameCellProducesAllUnorderedPairs() {
        var grid = new SpatialGrid<GameEntity>(800, 600, 50);
        grid.insert(enemy(101, 101));
        grid.insert(enemy(120, 130));
        grid.insert(enemy(149, 149));

        assertEquals(3, grid.computePairs().size());
        assertEquals(1, grid.occupiedCells());
        assertEquals(3, grid.largestBucket());
        assertEquals(3, grid.bucketSize(grid.cellIndexFor(125, 125)));
    }

    @Test
    void entitiesInNonAdjacentCellsProduceNoPairs() {
        var grid = new SpatialGrid<GameEntity>(800, 600, 50);
        for (var e : List.of(enemy(25, 25), enemy(125, 25), enemy(25, 125), enemy(225, 225), enemy(775, 575))) {
            grid.insert(e);
        }

        assertTrue(grid.computePairs().isEmpty());
        assertEquals(5, grid.occupiedCells());
        assertEquals(5, grid.size());
    }

    @Test
    void clearIsIdempotent() {
        var grid = new SpatialGrid<GameEntity>(800, 600, 50);
        grid.insert(enemy(10, 10));
        grid.insert(enemy(12, 12));

        grid.clear();
        grid.clear();

        assertTrue(grid.computePairs().isEmpty());
        assertEquals(0, grid.size());
        assertEquals(0, grid.occupiedCells());
        assertEquals(0, grid.bucketSize(0));
    }

    @Test
    void deadAndInactiveEntitiesAreFilteredFromPairs() {
        var grid = new SpatialGrid<GameEntity>(800, 600, 50);
        var alive = enemy(10, 10);
        var dead = enemy(10, 10);
        var inactive = enemy(10, 10);
        dead.kill();
        inactive.setActive(false);
        grid.insert(alive);
        grid.insert(dead);
        grid.insert(inactive);

        assertTrue(grid.computePairs().isEmpty(), "Entidades mortas/inativas não devem gerar pares");
    }

    @Test
    void entityKilledAfterInsertionIsFiltered() {
        var grid = new SpatialGrid<GameEntity>(800, 600, 50);
        var a = enemy(10, 10);
        var b = enemy(10, 10);
        grid.insert(a);
        grid.insert(b);
        b.kill();

        assertTrue(grid.computePairs().isEmpty());
    }

    @Test
    void sameEntityInsertedTwiceDoesNotPairWithItself() {
        var grid = new SpatialGrid<GameEntity>(800, 600, 50);
        var a = enemy(10, 10);
        grid.insert(a);
        grid.insert(a);

        assertTrue(grid.computePairs().isEmpty());
    }

    @Test
    void nanPositionIsNotIndexed() {
        var grid = new SpatialGrid<GameEntity>(800, 600, 50);

        assertFalse(grid.insert(enemy(Double.NaN, 10)));
        assertEquals(0, grid.size());
        assertEquals(0, grid.occupiedCells());
    }

    @Test
    void pointModeMissesPairStraddlingCellBorder() {
        var grid = new SpatialGrid<GameEntity>(800, 600, 50);
        grid.insert(enemy(49, 25));
        grid.insert(enemy(51, 25));

        assertTrue(grid.computePairs().isEmpty());
    }

    @Test
    void extentModeFindsStraddlingPairOnce() {
        var grid = new SpatialGrid<GameEntity>(new GridSettings(800, 600, 50, InsertionMode.EXTENT));
        var a = enemy(49, 25);
        var b = enemy(51, 25);
        grid.insert(a);
        grid.insert(b);

        var pairs = grid.computePairs();

        assertEquals(1, pairs.size());
        assertTrue(pairs.get(0).contains(a) && pairs.get(0).contains(b));
        assertEquals(2, grid.occupiedCells());
    }

    @Test
    void extentModeDeduplicatesPairsSharingManyCells() {
        var grid = new SpatialGrid<GameEntity>(new GridSettings(800, 600, 50, InsertionMode.EXTENT));
        grid.insert(GameEntity.withRadius(EntityType.ENEMY, 50, 50, 10));
        grid.insert(GameEntity.withRadius(EntityType.ENEMY, 50, 50, 10));

        assertEquals(4, grid.occupiedCells());
        assertEquals(1, grid.computePairs().size());
        assertEquals(2, grid.size());
    }

    @Test
    void degenerateSettingsAreClamped() {
        var grid = new SpatialGrid<GameEntity>(0, 0, 0);

        assertEquals(1, grid.cols());
        assertEquals(1, grid.rows());
        grid.insert(enemy(10, 10));
        grid.insert(enemy(500, 500));
        assertEquals(1, grid.computePairs().size());
    }

    @Test
    void zeroCellSizeIsRaisedToFitCellLimit() {
        var grid = new SpatialGrid<GameEntity>(800, 600, 0);

        assertTrue((long) grid.cols() * grid.rows() <= SpatialGrid.MAX_CELLS);
        assertTrue(grid.cellSize() >= SpatialGrid.MIN_CELL_SIZE);
        assertEquals(grid.cols() * grid.rows() - 1, grid.cellIndexFor(799.999, 599.999));
        grid.insert(enemy(300, 300));
        grid.insert(enemy(300, 300));
        assertEquals(1, grid.computePairs().size());
    }

    @Test
    void tinyCellSizeIsRaisedToFitCellLimit() {
        var grid = new SpatialGrid<GameEntity>(800, 600, 0.001);

        assertTrue((long) grid.cols() * grid.rows() <= SpatialGrid.MAX_CELLS);
        assertTrue(grid.cellSize() > 0.001);
        grid.insert(enemy(10, 10));
        grid.insert(enemy(700, 500));
        assertTrue(grid.computePairs().isEmpty());
    }

    @Test
    void cellSizeWithinLimitIsKept() {
        var grid = new SpatialGrid<GameEntity>(800, 600, 1);

        assertEquals(1.0, grid.cellSize());
        assertEquals(800, grid.cols());
        assertEquals(600, grid.rows());
    }
}
