package github.sarthakdev143.music_video.model;

public record SongSection(
        String name,
        double start,
        double end,
        String description) {
}
