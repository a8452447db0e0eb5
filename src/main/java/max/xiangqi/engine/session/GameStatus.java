package max.xiangqi.engine.session;

public enum GameStatus {
    PLAYING,
    FINISHED
}
