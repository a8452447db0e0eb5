package max.xiangqi.engine.search;

/**
 * Strength tiers. Levels outside 3..6 are clamped; level 4 plays like level 3.
 */
public enum Difficulty {
    EASY(3, 5),
    NORMAL(5, 9),
    HARD(6, 12);

    public final int level;
    public final int maxDepth;

    Difficulty(int level, int maxDepth) {
        this.level = level;
        this.maxDepth = maxDepth;
    }

    public static Difficulty fromLevel(int level) {
        int clamped = Math.min(Math.max(level, 3), 6);
        if (clamped >= HARD.level) return HARD;
        if (clamped >= NORMAL.level) return NORMAL;
        return EASY;
    }

    /** Check paths and aggression terms are only evaluated from level 5 on. */
    public boolean usesAdvancedEvaluation() {
        return level >= NORMAL.level;
    }
}
