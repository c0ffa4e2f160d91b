package github.sarthakdev143.music_video.model;

public enum ReviewStatus {
    IDLE,
    IN_PROGRESS,
    COMPLETE
}
