package max.xiangqi.engine.book;

import max.xiangqi.engine.movegen.Move;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class CloudBookReplyTest {

    @Test
    public void parsesABestMove() {
        CloudBookReply reply = CloudBookReply.parse("move:h2e2");
        assertEquals(CloudBookReply.Kind.MOVE, reply.kind());
        assertEquals(Move.fromIccs("h2e2"), reply.move());
        assertTrue(reply.hasMove());
    }

    @Test
    public void parsesAnEndgameTableMoveAndDropsTrailingFields() {
        CloudBookReply reply = CloudBookReply.parse("egtb:b0c2|score:12\0");
        assertEquals(CloudBookReply.Kind.ENDGAME_TABLE, reply.kind());
        assertEquals(Move.fromIccs("b0c2"), reply.move());
        assertEquals(CloudBookReply.Kind.MOVE, CloudBookReply.parse(" move:h2e2\0\n").kind());
    }

    @ParameterizedTest
    @CsvSource({
            "nobestmove, NO_BEST_MOVE",
            "unknown, UNKNOWN",
            "move:z9z9, MALFORMED",
            "move:h2h2, MALFORMED",
            "invalid board, MALFORMED",
            "'', MALFORMED"
    })
    public void repliesWithoutMove(String body, CloudBookReply.Kind expected) {
        CloudBookReply reply = CloudBookReply.parse(body);
        assertEquals(expected, reply.kind());
        assertFalse(reply.hasMove());
    }

    @Test
    public void nullBodyIsMalformed() {
        assertEquals(CloudBookReply.Kind.MALFORMED, CloudBookReply.parse(null).kind());
    }
}
