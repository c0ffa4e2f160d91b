package github.sarthakdev143.music_video.model;

public record VisualContinuityIssue(
        String shotId,
        String sceneId,
        String section,
        String assetType,
        String assetUrl,
        String severity,
        String finding,
        String recommendation) {
}
