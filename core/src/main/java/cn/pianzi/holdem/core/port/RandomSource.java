package cn.pianzi.holdem.core.port;

import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

public interface RandomSource {
    int nextIntInclusive(int minInclusive, int maxInclusive);

    /**
     * Fisher–Yates over the whole list, drawing every swap index from
     * {@link #nextIntInclusive(int, int)} so a seeded source shuffles reproducibly.
     */
    default <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i > 0; i--) {
            int j = nextIntInclusive(0, i);
            T swap = list.get(i);
            list.set(i, list.get(j));
            list.set(j, swap);
        }
    }

    static RandomSource threadLocal() {
        return (minInclusive, maxInclusive) -> {
            checkRange(minInclusive, maxInclusive);
            return ThreadLocalRandom.current().nextInt(minInclusive, maxInclusive + 1);
        };
    }

    static RandomSource seeded(long seed) {
        Random random = new Random(seed);
        return (minInclusive, maxInclusive) -> {
            checkRange(minInclusive, maxInclusive);
            return minInclusive + random.nextInt(maxInclusive - minInclusive + 1);
        };
    }

    private static void checkRange(int minInclusive, int maxInclusive) {
        if (maxInclusive < minInclusive) {
            throw new IllegalArgumentException("maxInclusive must be >= minInclusive");
        }
    }
}
