package work.lcod.twine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class RandomSourceTest {
    @Test
    void drawsStayWithinInclusiveBounds() {
        var random = RandomSource.seeded(7L);
        for (int i = 0; i < 200; i++) {
            long drawn = random.nextLong(1, 3);
            assertTrue(drawn >= 1 && drawn <= 3, "drawn " + drawn);
        }
    }

    @Test
    void reversedBoundsAreSwapped() {
        var random = RandomSource.seeded(7L);
        for (int i = 0; i < 50; i++) {
            long drawn = random.nextLong(6, 4);
            assertTrue(drawn >= 4 && drawn <= 6, "drawn " + drawn);
        }
    }

    @Test
    void coversTheWholeIntRange() {
        var random = RandomSource.seeded(1L);
        for (int i = 0; i < 200; i++) {
            long drawn = random.nextLong(0, Integer.MAX_VALUE);
            assertTrue(drawn >= 0 && drawn <= Integer.MAX_VALUE, "drawn " + drawn);
        }
    }

    @Test
    void acceptsBoundsBeyondInt() {
        var random = RandomSource.seeded(1L);
        for (int i = 0; i < 200; i++) {
            long drawn = random.nextLong(1, 3_000_000_000L);
            assertTrue(drawn >= 1 && drawn <= 3_000_000_000L, "drawn " + drawn);
        }
    }

    @Test
    void spansWiderThanLongStillDraw() {
        var random = RandomSource.seeded(3L);
        long drawn = random.nextLong(Long.MIN_VALUE, Long.MAX_VALUE - 1);
        assertTrue(drawn < Long.MAX_VALUE);
    }

    @Test
    void maximumUpperBoundIsRejected() {
        assertThrows(ArithmeticException.class, () -> RandomSource.seeded(1L).nextLong(0, Long.MAX_VALUE));
    }

    @Test
    void sameSeedGivesSameSequence() {
        var first = RandomSource.seeded(42L);
        var second = RandomSource.seeded(42L);
        for (int i = 0; i < 10; i++) {
            assertEquals(first.nextLong(1, 100), second.nextLong(1, 100));
        }
    }

    @Test
    void singleValueRange() {
        assertEquals(5L, RandomSource.system().nextLong(5, 5));
    }
}
