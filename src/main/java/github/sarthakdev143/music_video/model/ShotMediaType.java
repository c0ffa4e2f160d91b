package github.sarthakdev143.music_video.model;

import java.util.Locale;

public enum ShotMediaType {
    IMAGE,
    VIDEO;

    public static ShotMediaType fromInput(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("mediaType is required.");
        }

        try {
            return ShotMediaType.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("mediaType must be one of IMAGE, VIDEO.");
        }
    }
}
