package github.sarthakdev143.music_video.clip;

public class ClipGenerationException extends Exception {

    private final String shotId;

    public ClipGenerationException(String shotId, String message) {
        super(message);
        this.shotId = shotId;
    }

    public ClipGenerationException(String shotId, String message, Throwable cause) {
        super(message, cause);
        this.shotId = shotId;
    }

    public String getShotId() {
        return shotId;
    }
}
