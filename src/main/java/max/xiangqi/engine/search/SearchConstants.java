package max.xiangqi.engine.search;

public class SearchConstants {
    public static final int INF = 10_000_000;

    // Score of a position where the side to move has already lost its general
    public static final int MATE_VALUE = 5_000_000;

    // Nominal ply bound for killer tables and mate-score adjustment
    public static final int MAX_PLY = 128;

    // Per-ply move buffers, quiescence included
    public static final int STACK_PLY = 160;

    // Returned up the tree once the search has to stop; -TIMEOUT == TIMEOUT
    public static final int TIMEOUT = Integer.MIN_VALUE;

    public static boolean isMateScore(int score) {
        return score >= MATE_VALUE - MAX_PLY || score <= -MATE_VALUE + MAX_PLY;
    }
}
