package github.sarthakdev143.music_video.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Clip generation backends with their frame budget and prompt defaults.
 */
public enum VideoBackend {
    WAVER(24, 96, "realistic",
            "text, subtitles, watermark, logo, blurry, low quality, distorted face, extra limbs, duplicate faces"),
    STEP_VIDEO_TI2V(24, 96, "portrait",
            "text, subtitles, watermark, logo, blurry, low quality, face distortion, extra limbs, duplicate faces"),
    ANIMATEDIFF_V3(16, 32, "animatediff",
            "text, subtitles, watermark, logo, flicker, warped limbs, bad hands, bad feet, multiple faces, face melting"),
    WAN2_2(16, 48, "stylized",
            "text, watermark, logo, low detail eyes, off-model face, flicker, extra limbs, bad hands"),
    VIDEOCRAFTER2(16, 48, "plate",
            "text, watermark, logo, muddy details, low contrast, overexposed, underexposed");

    public static final VideoBackend DEFAULT = WAVER;

    private final int defaultFps;
    private final int maxFrames;
    private final String workflow;
    private final String negativePrompt;

    VideoBackend(int defaultFps, int maxFrames, String workflow, String negativePrompt) {
        this.defaultFps = defaultFps;
        this.maxFrames = maxFrames;
        this.workflow = workflow;
        this.negativePrompt = negativePrompt;
    }

    public int defaultFps() {
        return defaultFps;
    }

    public int maxFrames() {
        return maxFrames;
    }

    public String workflow() {
        return workflow;
    }

    public String negativePrompt() {
        return negativePrompt;
    }

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VideoBackend fromInput(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }

        try {
            return VideoBackend.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(
                    "videoBackend must be one of waver, step_video_ti2v, animatediff_v3, wan2_2, videocrafter2.");
        }
    }
}
