package max.xiangqi.engine.book;

import max.xiangqi.engine.game.Game;

import java.util.Optional;

public interface OpeningBook {
    /** Returns a legal move (engine int) from the book for this position, or empty if none. */
    Optional<Integer> pickMove(Game game);

    /** @return true if the book may be asked at all. */
    boolean isAvailable();

    /** Book that never answers. */
    OpeningBook NONE = new OpeningBook() {
        @Override
        public Optional<Integer> pickMove(Game game) {
            return Optional.empty();
        }

        @Override
        public boolean isAvailable() {
            return false;
        }
    };
}
