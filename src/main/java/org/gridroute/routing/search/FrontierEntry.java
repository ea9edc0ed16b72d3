package org.gridroute.routing.search;

/**
 * A* frontier entry.
 *
 * <p>Ordered by {@code priority} ({@code g + h}) and then by insertion {@code sequence}, so
 * equal-priority entries are polled first-in first-out whatever the heap implementation.</p>
 *
 * @param cellIndex dense grid cell index.
 * @param gScore moves from the origin when the entry was pushed.
 * @param priority {@code gScore} plus heuristic estimate.
 * @param sequence monotonically increasing insertion counter.
 */
record FrontierEntry(
        int cellIndex,
        int gScore,
        int priority,
        long sequence
) implements Comparable<FrontierEntry> {
    @Override
    public int compareTo(FrontierEntry other) {
        int byPriority = Integer.compare(this.priority, other.priority);
        if (byPriority != 0) {
            return byPriority;
        }
        return Long.compare(this.sequence, other.sequence);
    }
}
