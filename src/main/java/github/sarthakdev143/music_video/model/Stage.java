package github.sarthakdev143.music_video.model;

import java.util.Locale;

public enum Stage {
    UPLOAD,
    CONTROLS,
    PLAN,
    STORYBOARD,
    REVIEW;

    public static Stage fromInput(String input) {
        if (input == null || input.isBlank()) {
            return UPLOAD;
        }

        try {
            return Stage.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("stage must be one of UPLOAD, CONTROLS, PLAN, STORYBOARD, REVIEW.");
        }
    }
}
