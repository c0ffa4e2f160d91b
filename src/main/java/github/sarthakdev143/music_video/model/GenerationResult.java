package github.sarthakdev143.music_video.model;

public record GenerationResult<T>(T value, long usageCost) {

    public GenerationResult {
        if (usageCost < 0) {
            throw new IllegalArgumentException("usageCost must not be negative.");
        }
    }

    public static <T> GenerationResult<T> of(T value, long usageCost) {
        return new GenerationResult<>(value, usageCost);
    }
}
