package github.sarthakdev143.music_video.model;

import java.util.Locale;

public enum ModelTier {
    FREEMIUM,
    PREMIUM;

    public static ModelTier fromInput(String input) {
        if (input == null || input.isBlank()) {
            return FREEMIUM;
        }

        try {
            return ModelTier.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("modelTier must be one of FREEMIUM, PREMIUM.");
        }
    }
}
