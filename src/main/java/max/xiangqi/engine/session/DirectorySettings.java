package max.xiangqi.engine.session;

import java.time.Duration;
import java.util.Objects;

public record DirectorySettings(Duration inviteTtl, Duration idleTimeout) {
    public static final Duration DEFAULT_INVITE_TTL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofHours(12);

    public DirectorySettings {
        Objects.requireNonNull(inviteTtl, "inviteTtl");
        Objects.requireNonNull(idleTimeout, "idleTimeout");
    }

    public static DirectorySettings defaults() {
        return new DirectorySettings(DEFAULT_INVITE_TTL, DEFAULT_IDLE_TIMEOUT);
    }
}
