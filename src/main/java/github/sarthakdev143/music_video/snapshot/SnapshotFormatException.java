package github.sarthakdev143.music_video.snapshot;

/**
 * The uploaded snapshot is not a JSON object at all. Individual malformed fields never raise
 * this; they fall back to their defaults.
 */
public class SnapshotFormatException extends Exception {

    public SnapshotFormatException(String message) {
        super(message);
    }

    public SnapshotFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
