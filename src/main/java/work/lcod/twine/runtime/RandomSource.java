package work.lcod.twine.runtime;

import java.util.Random;

/**
 * Source of uniform integer draws for {@code (random:)}.
 */
@FunctionalInterface
public interface RandomSource {
    /**
     * Uniform draw in {@code [min, max]}, both inclusive. Bounds given in reverse order are swapped.
     *
     * @throws ArithmeticException when the upper bound is {@link Long#MAX_VALUE}
     */
    long nextLong(long min, long max);

    /**
     * Process-wide generator.
     */
    static RandomSource system() {
        return Generators.SYSTEM;
    }

    static RandomSource seeded(long seed) {
        return fromRandom(new Random(seed));
    }

    static RandomSource fromRandom(Random random) {
        return (min, max) -> {
            long low = Math.min(min, max);
            long high = Math.max(min, max);
            return random.nextLong(low, Math.addExact(high, 1L));
        };
    }

    final class Generators {
        private static final RandomSource SYSTEM = fromRandom(new Random());

        private Generators() {}
    }
}
