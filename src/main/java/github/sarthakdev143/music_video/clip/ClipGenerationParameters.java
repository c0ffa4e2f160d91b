package github.sarthakdev143.music_video.clip;

import github.sarthakdev143.music_video.model.CameraMotion;

/**
 * Backend-specific settings derived from a shot. {@code workflow} is null when neither the shot
 * nor its backend names one.
 */
public record ClipGenerationParameters(
        String workflow,
        int fps,
        String negativePrompt,
        CameraMotion cameraMotion) {
}
