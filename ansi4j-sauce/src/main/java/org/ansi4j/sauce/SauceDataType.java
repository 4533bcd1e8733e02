package org.ansi4j.sauce;

/**
 * Payload kinds a SAUCE record can declare.
 */
public enum SauceDataType {
    NONE(0),
    CHARACTER(1),
    BITMAP(2),
    VECTOR(3),
    AUDIO(4),
    BINARY_TEXT(5),
    XBIN(6),
    ARCHIVE(7),
    EXECUTABLE(8);

    private final int code;

    SauceDataType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @return the data type for a raw record byte; unknown values map to {@link #NONE}
     */
    public static SauceDataType fromCode(int code) {
        for (SauceDataType t : values()) {
            if (t.code == code) {
                return t;
            }
        }
        return NONE;
    }
}
