package redkv.protocol;

/**
 * The closed set of RESP wire types, each identified by its prefix byte.
 */
public enum FrameType {
    SIMPLE_STRING('+'),
    ERROR('-'),
    INTEGER(':'),
    BULK_STRING('$'),
    ARRAY('*'),
    NULL('_'),
    BOOLEAN('#'),
    DOUBLE(','),
    MAP('%'),
    SET('~');

    private static final FrameType[] BY_PREFIX = new FrameType[128];

    static {
        for (FrameType type : values()) {
            BY_PREFIX[type.prefix] = type;
        }
    }

    public final byte prefix;

    FrameType(char prefix) {
        this.prefix = (byte) prefix;
    }

    /**
     * Returns the type introduced by the given prefix byte, or null if the byte
     * does not start any known frame.
     */
    public static FrameType fromPrefix(byte b) {
        if (b < 0) return null;
        return BY_PREFIX[b];
    }

    /** Whether a length of -1 denotes the null value of this type. */
    public boolean isNullable() {
        return this == BULK_STRING || this == ARRAY;
    }
}
