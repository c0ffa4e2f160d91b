package github.sarthakdev143.music_video.model;

import java.util.Locale;

public enum BibleKind {
    CHARACTER,
    LOCATION;

    public static BibleKind fromInput(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("bible kind is required.");
        }

        try {
            return BibleKind.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("bible kind must be one of CHARACTER, LOCATION.");
        }
    }
}
