package github.sarthakdev143.music_video.model;

import java.util.Locale;

public enum PostProductionTask {
    VFX,
    COLOR,
    STABILIZATION;

    public static PostProductionTask fromInput(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("post-production task is required.");
        }

        try {
            return PostProductionTask.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("post-production task must be one of VFX, COLOR, STABILIZATION.");
        }
    }
}
