package max.xiangqi.engine.book;

import max.xiangqi.engine.game.Game;
import max.xiangqi.engine.movegen.Move;
import max.xiangqi.engine.movegen.MoveGenerator;
import max.xiangqi.engine.utils.notations.FENUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Asks a remote position database for its best move. One attempt per call, no retry;
 * every failure reads as "no book move".
 */
public final class CloudOpeningBook implements OpeningBook {
    private static final Logger LOG = LoggerFactory.getLogger(CloudOpeningBook.class);

    public static final URI DEFAULT_URI = URI.create("http://www.chessdb.cn/chessdb.php");
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3);

    private final URI baseUri;
    private final Duration timeout;
    private final HttpClient httpClient;

    public CloudOpeningBook() {
        this(DEFAULT_URI, DEFAULT_TIMEOUT);
    }

    public CloudOpeningBook(URI baseUri, Duration timeout) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Optional<Integer> pickMove(Game game) {
        URI uri = queryUri(game);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                LOG.warn("Cloud book answered HTTP {} for {}", response.statusCode(), uri);
                return Optional.empty();
            }
            return accept(game, CloudBookReply.parse(response.body()));
        } catch (IOException e) {
            LOG.warn("Cloud book request failed: {}", e.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Cloud book request interrupted");
            return Optional.empty();
        }
    }

    URI queryUri(Game game) {
        String board = URLEncoder.encode(FENUtils.getFENFromGame(game), StandardCharsets.UTF_8)
                .replace("+", "%20");
        return URI.create(baseUri + "?action=querybest&board=" + board);
    }

    private Optional<Integer> accept(Game game, CloudBookReply reply) {
        switch (reply.kind()) {
            case MOVE, ENDGAME_TABLE -> {
                int move = reply.move();
                if (!MoveGenerator.legalMoves(game).contains(move)) {
                    LOG.warn("Cloud book move {} is not legal here, ignoring", Move.toIccs(move));
                    return Optional.empty();
                }
                LOG.debug("Cloud book move {} ({})", Move.toIccs(move), reply.kind());
                return Optional.of(move);
            }
            case NO_BEST_MOVE, UNKNOWN -> {
                LOG.info("Cloud book has no move for this position ({})", reply.kind());
                return Optional.empty();
            }
            default -> {
                LOG.warn("Unreadable cloud book reply: {}", reply.raw());
                return Optional.empty();
            }
        }
    }
}
