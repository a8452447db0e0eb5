package max.xiangqi.engine.common;

public enum PieceKind {
    GENERAL('k', "帅", "将", "帥", "將", true),
    ADVISOR('a', "仕", "士", "仕", "士", false),
    ELEPHANT('b', "相", "象", "相", "象", false),
    HORSE('n', "马", "马", "馬", "馬", false),
    CHARIOT('r', "车", "车", "車", "車", true),
    CANNON('c', "炮", "炮", "砲", "砲", true),
    SOLDIER('p', "兵", "卒", "兵", "卒", true);

    public static final PieceKind[] VALUES = PieceKind.values();

    public final char fenLetter;
    private final String redGlyph;
    private final String blackGlyph;
    private final String redTraditionalGlyph;
    private final String blackTraditionalGlyph;
    // Advance/retreat counts steps along the file instead of naming a target column
    public final boolean linear;

    PieceKind(char fenLetter, String redGlyph, String blackGlyph,
              String redTraditionalGlyph, String blackTraditionalGlyph, boolean linear) {
        this.fenLetter = fenLetter;
        this.redGlyph = redGlyph;
        this.blackGlyph = blackGlyph;
        this.redTraditionalGlyph = redTraditionalGlyph;
        this.blackTraditionalGlyph = blackTraditionalGlyph;
        this.linear = linear;
    }

    public String glyph(Side side) {
        return side == Side.RED ? redGlyph : blackGlyph;
    }

    public String traditionalGlyph(Side side) {
        return side == Side.RED ? redTraditionalGlyph : blackTraditionalGlyph;
    }

    public char fenChar(Side side) {
        return side == Side.RED ? Character.toUpperCase(fenLetter) : fenLetter;
    }

    public static PieceKind fromFenChar(char c) {
        char lower = Character.toLowerCase(c);
        for (PieceKind kind : VALUES) {
            if (kind.fenLetter == lower) {
                return kind;
            }
        }
        // Common alias letters for horse and elephant
        if (lower == 'h') return HORSE;
        if (lower == 'e') return ELEPHANT;
        return null;
    }
}
