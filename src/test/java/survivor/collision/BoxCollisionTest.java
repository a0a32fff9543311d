package survivor.collision;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class BoxCollisionTest {
    private static final double EPS = 1e-9;

    @Test
    void overlapUsesMinimumAxis() {
        var a = new BoundingBox(50, 50, 100, 30);
        var b = new BoundingBox(120, 60, 80, 25);

        var r = Collision.testBoxBox(a, b);

        assertTrue(r.collided());
        assertEquals(20.0, r.overlap(), EPS); // overlapX = 30, overlapY = 20
        assertEquals(0.0, r.distance(), "Distância não é calculada para AABB");
        assertEquals(Axis.Y, Collision.minimumPenetrationAxis(a, b));
    }

    @Test
    void normalFollowsCentersNotPenetrationAxis() {
        var a = new BoundingBox(50, 50, 100, 30);  // centro (100, 65)
        var b = new BoundingBox(120, 60, 80, 25);  // centro (160, 72.5)

        var r = Collision.testBoxBox(a, b);

        double len = Math.hypot(60, 7.5);
        assertEquals(60 / len, r.normal().x(), EPS);
        assertEquals(7.5 / len, r.normal().y(), EPS);
        // a penetração mínima é em Y, mas a normal aponta majoritariamente em X
        assertTrue(Math.abs(r.normal().x()) > Math.abs(r.normal().y()));
    }

    @Test
    void edgeTouchingBoxesDoNotCollide() {
        var a = new BoundingBox(0, 0, 10, 10);
        var b = new BoundingBox(10, 0, 10, 10);

        var r = Collision.testBoxBox(a, b);

        assertFalse(r.collided());
        assertSame(CollisionResult.NONE, r);
        assertEquals(Axis.NONE, Collision.minimumPenetrationAxis(a, b));
    }

    @Test
    void sameCenterBoxesHaveZeroNormal() {
        var a = new BoundingBox(0, 0, 10, 10);
        var b = new BoundingBox(2, 2, 6, 6);

        var r = Collision.testBoxBox(a, b);

        assertTrue(r.collided());
        assertEquals(6.0, r.overlap(), EPS);
        assertTrue(r.normal().isZero());
    }

    @Test
    void tieBetweenAxesPicksX() {
        var a = new BoundingBox(0, 0, 10, 10);
        var b = new BoundingBox(5, 5, 10, 10);

        assertEquals(5.0, Collision.testBoxBox(a, b).overlap(), EPS);
        assertEquals(Axis.X, Collision.minimumPenetrationAxis(a, b));
    }
}
