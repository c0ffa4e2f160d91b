package github.sarthakdev143.music_video.model;

import java.util.Locale;

public enum ClipQuality {
    DRAFT,
    HIGH;

    public static ClipQuality fromInput(String input, ClipQuality fallback) {
        if (input == null || input.isBlank()) {
            return fallback;
        }

        try {
            return ClipQuality.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("quality must be one of DRAFT, HIGH.");
        }
    }

    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
