package github.sarthakdev143.music_video.snapshot;

public record SnapshotAudio(String name, String mimeType, String encodedData) {
}
