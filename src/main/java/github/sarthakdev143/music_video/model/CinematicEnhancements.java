package github.sarthakdev143.music_video.model;

public record CinematicEnhancements(
        String cameraLens,
        String cameraMotion,
        String lightingStyle) {

    public static CinematicEnhancements none() {
        return new CinematicEnhancements(null, null, null);
    }
}
