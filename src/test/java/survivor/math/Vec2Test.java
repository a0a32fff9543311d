package survivor.math;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;

class Vec2Test {

    @Test
    void basicAlgebra() {
        var a = new Vec2(3, 4);
        var b = new Vec2(1, -2);

        assertEquals(new Vec2(4, 2), a.add(b));
        assertEquals(new Vec2(2, 6), a.sub(b));
        assertEquals(new Vec2(6, 8), a.mul(2));
        assertEquals(-5.0, a.dot(b));
        assertEquals(5.0, a.length());
        assertEquals(0.6, a.normalized().x(), 1e-12);
        assertEquals(0.8, a.normalized().y(), 1e-12);
    }

    @Test
    void zeroVectorNormalizesToItself() {
        assertSame(Vec2.ZERO, Vec2.ZERO.normalized());
    }

    @Test
    void directionTowardsTargetScaledToSpeed() {
        var from = new Vec2(100, 100);
        var velocity = new Vec2(130, 140).sub(from).normalized().mul(420);

        assertEquals(252.0, velocity.x(), 1e-9);
        assertEquals(336.0, velocity.y(), 1e-9);
        assertEquals(420.0, velocity.length(), 1e-9);
    }
}
