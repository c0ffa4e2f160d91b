package github.sarthakdev143.music_video.integration;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import github.sarthakdev143.music_video.model.CameraMotion;
import github.sarthakdev143.music_video.model.VideoBackend;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClipGenerationRequest(
        String imageUrl,
        String prompt,
        double duration,
        String quality,
        @JsonProperty("camera_motion") CameraMotion cameraMotion,
        boolean lipSync,
        String audioUrl,
        String shotId,
        String workflow,
        @JsonProperty("video_model") VideoBackend videoModel,
        @JsonProperty("render_profile") String renderProfile,
        int fps,
        @JsonProperty("negative_prompt") String negativePrompt) {
}
