package github.sarthakdev143.music_video.model;

public enum TaskStatus {
    IDLE,
    PROCESSING,
    DONE
}
