package github.sarthakdev143.music_video.model;

/**
 * Lifecycle of a generated asset field. Pending and failed are encoded in the field itself:
 * no value (or an empty one) means pending, the {@link #ERROR_SENTINEL} value means failed.
 */
public enum AssetState {
    PENDING,
    READY,
    FAILED;

    public static final String ERROR_SENTINEL = "error";

    public static AssetState ofUrl(String url) {
        if (url == null || url.isEmpty()) {
            return PENDING;
        }
        if (ERROR_SENTINEL.equals(url)) {
            return FAILED;
        }
        return READY;
    }
}
