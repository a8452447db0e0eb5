package max.xiangqi.engine.utils.notations;

import max.xiangqi.engine.common.Coordinate;

import java.util.Objects;

/**
 * Outcome of {@link NotationCodec#parse}: either an origin/destination pair or the token that failed.
 */
public record ParseResult(Coordinate from, Coordinate to, NotationToken failedToken, String message) {

    public static ParseResult success(Coordinate from, Coordinate to) {
        return new ParseResult(Objects.requireNonNull(from), Objects.requireNonNull(to), null, null);
    }

    public static ParseResult failure(NotationToken token, String message) {
        return new ParseResult(null, null, Objects.requireNonNull(token), message);
    }

    public boolean isSuccess() {
        return failedToken == null;
    }
}
