package autoexplore.model;

import java.util.Locale;

/** Target platform; selects the screenshot mechanism and page-source dialect. */
public enum Platform {
    ANDROID,
    IOS;

    /** Lower-case wire name used in reports and on the command line. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses {@code android} / {@code ios}, case-insensitively.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static Platform fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Platform must not be blank");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown platform '" + raw + "' (expected android or ios)", e);
        }
    }
}
