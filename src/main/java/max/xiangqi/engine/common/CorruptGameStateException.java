package max.xiangqi.engine.common;

/** Internal state can no longer be trusted; the affected game must be abandoned. */
public class CorruptGameStateException extends RuntimeException {
    public CorruptGameStateException(String message) {
        super(message);
    }
}
