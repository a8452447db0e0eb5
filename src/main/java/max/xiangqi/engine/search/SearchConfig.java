package max.xiangqi.engine.search;

public final class SearchConfig {

    // Limits
    public final int maxDepth;
    public final long maxThinkingTimeMs;
    public final long maxNodes;          // 0 = unlimited
    public final int nodeCheckInterval;  // wall clock is read once every this many nodes

    // TT
    public final boolean useTT;
    public final int ttEntries;

    // Null move pruning
    public final boolean useNullMove;
    public final int nullReduction;
    public final int nullMinDepth;

    // Quiescence
    public final boolean useQuiescence;
    public final int quiescenceMaxDepth;

    // Ordering
    public final int killerPlies;

    // Root
    public final int rootMoveLimit;      // 0 = search every root move

    // Evaluation and shortcuts
    public final boolean advancedEvaluation;
    public final boolean usePhaseHeuristics;
    public final boolean useCloudBook;

    private SearchConfig(Builder b) {
        maxDepth = b.maxDepth;
        maxThinkingTimeMs = b.maxThinkingTimeMs;
        maxNodes = b.maxNodes;
        nodeCheckInterval = b.nodeCheckInterval;

        useTT = b.useTT;
        ttEntries = b.ttEntries;

        useNullMove = b.useNullMove;
        nullReduction = b.nullReduction;
        nullMinDepth = b.nullMinDepth;

        useQuiescence = b.useQuiescence;
        quiescenceMaxDepth = b.quiescenceMaxDepth;

        killerPlies = b.killerPlies;
        rootMoveLimit = b.rootMoveLimit;

        advancedEvaluation = b.advancedEvaluation;
        usePhaseHeuristics = b.usePhaseHeuristics;
        useCloudBook = b.useCloudBook;
    }

    public static SearchConfig forDifficulty(Difficulty difficulty) {
        return new Builder()
                .maxDepth(difficulty.maxDepth)
                .advancedEvaluation(difficulty.usesAdvancedEvaluation())
                .rootMoveLimit(difficulty.level < Difficulty.NORMAL.level ? 10 : 0)
                .useCloudBook(difficulty == Difficulty.HARD)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxDepth(maxDepth).maxThinkingTimeMs(maxThinkingTimeMs).maxNodes(maxNodes)
                .nodeCheckInterval(nodeCheckInterval)
                .useTT(useTT).ttEntries(ttEntries)
                .useNullMove(useNullMove).nullReduction(nullReduction).nullMinDepth(nullMinDepth)
                .useQuiescence(useQuiescence).quiescenceMaxDepth(quiescenceMaxDepth)
                .killerPlies(killerPlies).rootMoveLimit(rootMoveLimit)
                .advancedEvaluation(advancedEvaluation).usePhaseHeuristics(usePhaseHeuristics)
                .useCloudBook(useCloudBook);
    }

    public static class Builder {
        private int maxDepth = Difficulty.EASY.maxDepth;
        private long maxThinkingTimeMs = 60_000;
        private long maxNodes = 0;
        private int nodeCheckInterval = 1000;

        private boolean useTT = true;
        private int ttEntries = 1 << 20;

        private boolean useNullMove = true;
        private int nullReduction = 2;
        private int nullMinDepth = 3;

        private boolean useQuiescence = true;
        private int quiescenceMaxDepth = 10;

        private int killerPlies = 50;
        private int rootMoveLimit = 0;

        private boolean advancedEvaluation = false;
        private boolean usePhaseHeuristics = true;
        private boolean useCloudBook = false;

        public Builder maxDepth(int v){maxDepth=v;return this;}
        public Builder maxThinkingTimeMs(long v){maxThinkingTimeMs=v;return this;}
        public Builder maxNodes(long v){maxNodes=v;return this;}
        public Builder nodeCheckInterval(int v){nodeCheckInterval=v;return this;}

        public Builder useTT(boolean v){useTT=v;return this;}
        public Builder ttEntries(int v){ttEntries=v;return this;}

        public Builder useNullMove(boolean v){useNullMove=v;return this;}
        public Builder nullReduction(int v){nullReduction=v;return this;}
        public Builder nullMinDepth(int v){nullMinDepth=v;return this;}

        public Builder useQuiescence(boolean v){useQuiescence=v;return this;}
        public Builder quiescenceMaxDepth(int v){quiescenceMaxDepth=v;return this;}

        public Builder killerPlies(int v){killerPlies=v;return this;}
        public Builder rootMoveLimit(int v){rootMoveLimit=v;return this;}

        public Builder advancedEvaluation(boolean v){advancedEvaluation=v;return this;}
        public Builder usePhaseHeuristics(boolean v){usePhaseHeuristics=v;return this;}
        public Builder useCloudBook(boolean v){useCloudBook=v;return this;}

        public SearchConfig build() {
            if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1: " + maxDepth);
            if (maxThinkingTimeMs <= 0) throw new IllegalArgumentException("maxThinkingTimeMs must be > 0: " + maxThinkingTimeMs);
            if (nodeCheckInterval < 1) throw new IllegalArgumentException("nodeCheckInterval must be >= 1: " + nodeCheckInterval);
            if (useTT && ttEntries < 1) throw new IllegalArgumentException("ttEntries must be >= 1: " + ttEntries);
            if (maxDepth > SearchConstants.MAX_PLY) throw new IllegalArgumentException("maxDepth must be <= " + SearchConstants.MAX_PLY + ": " + maxDepth);
            if (quiescenceMaxDepth < 0 || maxDepth + quiescenceMaxDepth >= SearchConstants.STACK_PLY) {
                throw new IllegalArgumentException("quiescenceMaxDepth out of range: " + quiescenceMaxDepth);
            }
            if (nullReduction < 1) throw new IllegalArgumentException("nullReduction must be >= 1: " + nullReduction);
            if (rootMoveLimit < 0) throw new IllegalArgumentException("rootMoveLimit must be >= 0: " + rootMoveLimit);
            if (killerPlies < 1) throw new IllegalArgumentException("killerPlies must be >= 1: " + killerPlies);
            return new SearchConfig(this);
        }
    }
}
