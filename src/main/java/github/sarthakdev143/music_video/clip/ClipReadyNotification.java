package github.sarthakdev143.music_video.clip;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Push message from the render backend. {@code id} is either a job id or a shot id; an explicit
 * {@code shotId} wins.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClipReadyNotification(String shotId, String id, String url) {

    public String target() {
        if (shotId != null && !shotId.isBlank()) {
            return shotId;
        }
        return id;
    }
}
