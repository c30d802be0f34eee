package org.Aayush.dungeon.path;

/**
 * Per-search bound on settled nodes.
 *
 * <p>A search that settles more nodes than allowed ends as unreachable instead of failing.</p>
 */
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private static final SearchBudget UNLIMITED = new SearchBudget(UNBOUNDED);

    private final int maxSettledNodes;

    private SearchBudget(int maxSettledNodes) {
        this.maxSettledNodes = normalizeBound(maxSettledNodes);
    }

    /**
     * Creates a budget with an explicit bound; non-positive values mean unbounded.
     */
    public static SearchBudget of(int maxSettledNodes) {
        return new SearchBudget(maxSettledNodes);
    }

    public static SearchBudget unbounded() {
        return UNLIMITED;
    }

    public int maxSettledNodes() {
        return maxSettledNodes;
    }

    public boolean isUnbounded() {
        return maxSettledNodes == UNBOUNDED;
    }

    boolean isExceeded(int settledNodes) {
        return settledNodes > maxSettledNodes;
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    @Override
    public String toString() {
        return isUnbounded() ? "SearchBudget{unbounded}" : "SearchBudget{maxSettledNodes=" + maxSettledNodes + '}';
    }
}
