package github.sarthakdev143.music_video.integration;

/**
 * Raised by an AI or render collaborator when a generation call cannot produce a result.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
