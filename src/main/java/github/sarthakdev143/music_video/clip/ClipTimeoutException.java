package github.sarthakdev143.music_video.clip;

public class ClipTimeoutException extends ClipGenerationException {

    private final int attempts;

    public ClipTimeoutException(String shotId, int attempts) {
        super(shotId, "Video generation timed out after " + attempts + " attempts");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
