package com.evertz.featured.core.selection;

import com.evertz.featured.core.exception.InvalidSelectionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks a rotating selection from an ordered pool.
 * The first pool element always leads the selection; the remaining slots are filled
 * with distinct, randomly drawn positions from the rest of the pool.
 * <p>
 * The draw for output slot {@code i} only considers pool positions below
 * {@code WINDOW_FACTOR * i + 1}, so newer items (lower positions) stay near the front.
 */
public final class RotatingSelectionPicker {

    private static final int WINDOW_FACTOR = 3;

    private RotatingSelectionPicker() {
    }

    /**
     * Selects {@code count} elements from {@code pool}.
     *
     * @param randomSource the source of random draws
     * @param pool         the ordered, non-empty pool
     * @param count        the selection size, between 1 and {@code pool.size()}
     * @return the selection, with {@code pool.get(0)} first and the rest in draw order
     * @throws InvalidSelectionException if the pool is empty or count is out of range
     */
    public static <T> List<T> select(RandomSource randomSource, List<T> pool, int count) {
        if (randomSource == null) {
            throw new InvalidSelectionException("Random source must not be null");
        }
        if (pool == null || pool.isEmpty()) {
            throw new InvalidSelectionException("Pool must not be empty");
        }
        if (count < 1 || count > pool.size()) {
            throw new InvalidSelectionException(
                    "Count " + count + " is out of range. Valid range is 1 to " + pool.size());
        }

        List<T> selected = new ArrayList<>(count);
        selected.add(pool.get(0));

        // Ascending; removals keep it sorted, so the positions inside a window form a prefix.
        List<Integer> remaining = new ArrayList<>(pool.size() - 1);
        for (int position = 1; position < pool.size(); position++) {
            remaining.add(position);
        }

        for (int slot = 1; slot < count; slot++) {
            int windowEnd = Math.min(pool.size(), WINDOW_FACTOR * slot + 1);
            int eligible = countBelow(remaining, windowEnd);
            int position = remaining.remove(randomSource.nextInt(eligible));
            selected.add(pool.get(position));
        }

        return selected;
    }

    private static int countBelow(List<Integer> sortedPositions, int limit) {
        int n = 0;
        while (n < sortedPositions.size() && sortedPositions.get(n) < limit) {
            n++;
        }
        return n;
    }
}
