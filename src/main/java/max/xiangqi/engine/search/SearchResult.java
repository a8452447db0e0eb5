package max.xiangqi.engine.search;

import max.xiangqi.engine.movegen.Move;

public record SearchResult(int move, int score, int depth, long nodes, long timeMs, Source source) {

    /** Where the move came from. */
    public enum Source {
        BOOK,
        HEURISTIC,
        SEARCH,
        FALLBACK,
        NONE
    }

    public static SearchResult none() {
        return new SearchResult(Move.NONE, 0, 0, 0, 0, Source.NONE);
    }

    public boolean hasMove() {
        return move != Move.NONE;
    }

    @Override
    public String toString() {
        return "SearchResult[" + (hasMove() ? Move.toIccs(move) : "none") +
                " score=" + score +
                " depth=" + depth +
                " nodes=" + nodes +
                " timeMs=" + timeMs +
                " source=" + source + "]";
    }
}
