package max.xiangqi.engine.search;

import max.xiangqi.engine.game.board.utils.BoardUtils;
import max.xiangqi.engine.movegen.MoveGenerator;
import max.xiangqi.engine.search.evaluator.PositionEvaluator;
import max.xiangqi.engine.search.transpositiontable.TranspositionTable;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable per-engine search state. One context serves one search at a time.
 */
public final class SearchContext {
    // Buffers per ply (quiescence goes deeper than the nominal depth)
    public final int[][] moveBuf = new int[SearchConstants.STACK_PLY][MoveGenerator.MAX_MOVES];
    public final int[][] scoreBuf = new int[SearchConstants.STACK_PLY][MoveGenerator.MAX_MOVES];

    // Quiet-move heuristics: history by from * 90 + to, two killers per ply
    public final int[] history = new int[BoardUtils.SQUARES * BoardUtils.SQUARES];
    public final int[][] killer;

    // Counters
    public long nodes, totalNodes, qNodes;
    public int currentDepth;

    // Time control
    AtomicBoolean stop;
    long startNs;
    long deadlineNs;
    public boolean timedOut;

    // TT
    public final TranspositionTable tt; // null when disabled
    final TranspositionTable.Hit ttHit = new TranspositionTable.Hit();

    public final SearchConfig cfg;
    public final PositionEvaluator evaluator;

    public SearchContext(SearchConfig cfg) {
        this.cfg = cfg;
        this.tt = cfg.useTT ? new TranspositionTable(cfg.ttEntries) : null;
        this.killer = new int[cfg.killerPlies][2];
        this.evaluator = new PositionEvaluator(cfg.advancedEvaluation);
    }

    /** Resets counters and heuristics and arms the clock for a new search. */
    public void newSearch(AtomicBoolean stop, long budgetMs) {
        this.stop = stop;
        this.startNs = System.nanoTime();
        this.deadlineNs = startNs + budgetMs * 1_000_000L;
        this.timedOut = false;
        nodes = totalNodes = qNodes = 0;
        currentDepth = 0;
        for (int[] k : killer) { k[0] = k[1] = 0; }
        Arrays.fill(history, 0);
        if (tt != null) tt.newSearch();
    }

    public long elapsedMs() {
        return (System.nanoTime() - startNs) / 1_000_000L;
    }
}
