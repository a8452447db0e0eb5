package max.xiangqi.engine.book;

import max.xiangqi.engine.movegen.Move;

/**
 * Body of a {@code querybest} answer: {@code move:h2e2}, {@code egtb:h2e2},
 * {@code nobestmove} or {@code unknown}.
 */
public record CloudBookReply(Kind kind, int move, String raw) {

    public enum Kind {
        MOVE,
        ENDGAME_TABLE,
        NO_BEST_MOVE,
        UNKNOWN,
        MALFORMED
    }

    public static CloudBookReply parse(String body) {
        String text = body == null ? "" : body.trim();
        // The service may append fields after a NUL or a pipe
        int end = indexOfAny(text, '\0', '|');
        if (end >= 0) text = text.substring(0, end).trim();

        if (text.startsWith("move:") || text.startsWith("egtb:")) {
            Kind kind = text.startsWith("move:") ? Kind.MOVE : Kind.ENDGAME_TABLE;
            int move = Move.fromIccs(text.substring(5).trim());
            return move == Move.NONE ? new CloudBookReply(Kind.MALFORMED, Move.NONE, body) : new CloudBookReply(kind, move, body);
        }
        if (text.equals("nobestmove")) return new CloudBookReply(Kind.NO_BEST_MOVE, Move.NONE, body);
        if (text.equals("unknown")) return new CloudBookReply(Kind.UNKNOWN, Move.NONE, body);
        return new CloudBookReply(Kind.MALFORMED, Move.NONE, body);
    }

    public boolean hasMove() {
        return move != Move.NONE;
    }

    private static int indexOfAny(String s, char a, char b) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == a || c == b) return i;
        }
        return -1;
    }
}
