package max.xiangqi.engine.session;

import max.xiangqi.engine.search.Difficulty;

import java.time.Duration;
import java.util.Objects;

/** Per-session settings, fixed when the session is created. */
public record SessionConfig(Difficulty difficulty, Duration aiThinkTime) {
    public static final Duration DEFAULT_THINK_TIME = Duration.ofSeconds(60);

    public SessionConfig {
        Objects.requireNonNull(difficulty, "difficulty");
        Objects.requireNonNull(aiThinkTime, "aiThinkTime");
        if (aiThinkTime.isNegative() || aiThinkTime.isZero()) {
            throw new IllegalArgumentException("aiThinkTime must be positive: " + aiThinkTime);
        }
    }

    public static SessionConfig defaults() {
        return new SessionConfig(Difficulty.EASY, DEFAULT_THINK_TIME);
    }

    public static SessionConfig of(Difficulty difficulty) {
        return new SessionConfig(difficulty, DEFAULT_THINK_TIME);
    }
}
