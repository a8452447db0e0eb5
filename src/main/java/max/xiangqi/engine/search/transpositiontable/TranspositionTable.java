package max.xiangqi.engine.search.transpositiontable;

import java.util.Arrays;

import static max.xiangqi.engine.search.SearchConstants.MATE_VALUE;
import static max.xiangqi.engine.search.SearchConstants.MAX_PLY;

/**
 * Direct-mapped table, one entry per slot, laid out as parallel arrays.
 * A slot is overwritten when it is empty, when it was written by an older search,
 * or when it was written by the current search at a depth not greater than the new one.
 */
public final class TranspositionTable {
    public static final byte TT_EXACT = 0, TT_LOWER = 1, TT_UPPER = 2;

    private final long[] keys;
    private final int[] moves;
    private final int[] scores;
    private final byte[] depths;
    private final byte[] flags;
    private final int[] ages;
    private final boolean[] used;
    private final int size;

    private int age;

    // counters
    private long probes, hits, stores;

    public TranspositionTable(int entries) {
        if (entries < 1) {
            throw new IllegalArgumentException("Transposition table needs at least one entry");
        }
        this.size = entries;
        this.keys = new long[entries];
        this.moves = new int[entries];
        this.scores = new int[entries];
        this.depths = new byte[entries];
        this.flags = new byte[entries];
        this.ages = new int[entries];
        this.used = new boolean[entries];
    }

    public void clear() {
        Arrays.fill(used, false);
        Arrays.fill(keys, 0L);
        age = 0;
        probes = hits = stores = 0;
    }

    /** Starts a new search generation; entries of previous generations become replaceable. */
    public void newSearch() {
        age++;
    }

    public int age() {
        return age;
    }

    /** Lightweight probe result, reusable. */
    public static final class Hit {
        public int move;
        public int score;
        public int depth;
        public byte flag;

        public void reset() {
            move = score = depth = 0;
            flag = 0;
        }
    }

    /**
     * @return true when an entry for {@code key} exists; {@code out} then holds it,
     * with mate scores made relative to {@code ply}
     */
    public boolean probe(long key, int ply, Hit out) {
        probes++;
        int idx = index(key);
        if (!used[idx] || keys[idx] != key) {
            out.reset();
            return false;
        }
        hits++;
        out.move = moves[idx];
        out.depth = depths[idx];
        out.flag = flags[idx];
        out.score = fromTT(scores[idx], ply);
        return true;
    }

    /** Best move stored for the key, 0 when none. */
    public int peekMove(long key) {
        int idx = index(key);
        return used[idx] && keys[idx] == key ? moves[idx] : 0;
    }

    public void store(long key, int move, int depth, int score, byte flag, int ply) {
        int idx = index(key);
        if (used[idx] && ages[idx] == age && depths[idx] > depth) {
            return;
        }
        stores++;
        used[idx] = true;
        keys[idx] = key;
        moves[idx] = move;
        depths[idx] = (byte) Math.min(depth, Byte.MAX_VALUE);
        flags[idx] = flag;
        scores[idx] = toTT(score, ply);
        ages[idx] = age;
    }

    public int capacity() {
        return size;
    }

    public long probes() {
        return probes;
    }

    public long hits() {
        return hits;
    }

    public long stores() {
        return stores;
    }

    // Mate scores are stored relative to the node, not to the root
    private static int toTT(int score, int ply) {
        if (score >= MATE_VALUE - MAX_PLY) return score + ply;
        if (score <= -MATE_VALUE + MAX_PLY) return score - ply;
        return score;
    }

    private static int fromTT(int score, int ply) {
        if (score >= MATE_VALUE - MAX_PLY) return score - ply;
        if (score <= -MATE_VALUE + MAX_PLY) return score + ply;
        return score;
    }

    private int index(long key) {
        return (int) Long.remainderUnsigned(key, size);
    }
}
