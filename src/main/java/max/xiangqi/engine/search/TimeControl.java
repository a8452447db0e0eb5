package max.xiangqi.engine.search;

final class TimeControl {
    private TimeControl() {
    }

    /**
     * True once the search must unwind: external stop, node budget spent, or the
     * deadline passed. The clock is only read every {@code nodeCheckInterval} nodes.
     */
    static boolean aborted(SearchContext ctx) {
        if (ctx.timedOut) return true;
        if (ctx.stop != null && ctx.stop.get()) {
            ctx.timedOut = true;
        } else if (ctx.cfg.maxNodes > 0 && ctx.totalNodes >= ctx.cfg.maxNodes) {
            ctx.timedOut = true;
        } else if (ctx.totalNodes % ctx.cfg.nodeCheckInterval == 0 && System.nanoTime() >= ctx.deadlineNs) {
            ctx.timedOut = true;
        }
        return ctx.timedOut;
    }
}
