package github.sarthakdev143.music_video.model;

public record Transition(
        String type,
        double durationSec,
        String description) {
}
