package github.sarthakdev143.music_video.model;

import java.util.Locale;

public enum SingerGender {
    MALE,
    FEMALE,
    UNSPECIFIED;

    public static SingerGender fromInput(String input) {
        if (input == null || input.isBlank()) {
            return UNSPECIFIED;
        }

        try {
            return SingerGender.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("singerGender must be one of MALE, FEMALE, UNSPECIFIED.");
        }
    }
}
