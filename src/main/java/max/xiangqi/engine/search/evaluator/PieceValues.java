package max.xiangqi.engine.search.evaluator;

import max.xiangqi.engine.common.PieceKind;

public class PieceValues {
    public static final int GENERAL_VALUE = 100_000;
    public static final int CHARIOT_VALUE = 1000;
    public static final int CANNON_VALUE = 500;
    public static final int HORSE_VALUE = 450;
    public static final int ELEPHANT_VALUE = 200;
    public static final int ADVISOR_VALUE = 200;
    public static final int SOLDIER_VALUE = 150;

    public static final int SOLDIER_CROSS_RIVER_BONUS = 70;

    // Indexed by PieceKind.ordinal()
    public static final int[] VAL = {
            GENERAL_VALUE,
            ADVISOR_VALUE,
            ELEPHANT_VALUE,
            HORSE_VALUE,
            CHARIOT_VALUE,
            CANNON_VALUE,
            SOLDIER_VALUE
    };

    public static int of(PieceKind kind) {
        return VAL[kind.ordinal()];
    }
}
