package github.sarthakdev143.music_video.integration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Render backend answer for a clip job. {@code progress} is absent when the backend has no
 * estimate yet.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClipJobStatus(
        Boolean success,
        String clipUrl,
        Integer progress,
        String status,
        String error) {

    public boolean isComplete() {
        return Boolean.TRUE.equals(success) && clipUrl != null && !clipUrl.isBlank();
    }

    public boolean isFailed() {
        return error != null && !error.isBlank();
    }
}
