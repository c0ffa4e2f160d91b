package github.sarthakdev143.music_video.clip;

import github.sarthakdev143.music_video.model.CameraMotion;
import github.sarthakdev143.music_video.model.StoryboardShot;
import github.sarthakdev143.music_video.model.VideoBackend;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

@Component
public class ClipParameterDeriver {

    static final int MIN_FPS = 8;
    private static final double MIN_DURATION_SECONDS = 0.1;
    private static final Set<String> PROFILE_WORKFLOWS = Set.of("stylized", "portrait", "plate");

    public ClipGenerationParameters derive(StoryboardShot shot, double durationSeconds) {
        VideoBackend backend = shot.videoBackend() != null ? shot.videoBackend() : VideoBackend.DEFAULT;
        return new ClipGenerationParameters(
                resolveWorkflow(shot),
                frameRate(backend, durationSeconds),
                backend.negativePrompt(),
                mapCameraMotion(shot.cameraMove(), shot.cinematicEnhancements().cameraMotion()));
    }

    /**
     * Highest frame rate the backend allows without exceeding its frame budget for the clip,
     * never below {@value #MIN_FPS}.
     */
    public int frameRate(VideoBackend backend, double durationSeconds) {
        double duration = Math.max(MIN_DURATION_SECONDS, durationSeconds);
        int budgetFps = (int) Math.floor(backend.maxFrames() / duration);
        return Math.max(MIN_FPS, Math.min(backend.defaultFps(), budgetFps));
    }

    public CameraMotion mapCameraMotion(String cameraMove, String cinematicMotion) {
        String combined = (nullToEmpty(cameraMove) + " " + nullToEmpty(cinematicMotion)).toLowerCase(Locale.ROOT);

        if (containsAny(combined, "zoom in", "zooming in", "dolly in")) {
            return CameraMotion.ZOOM_IN;
        }
        if (containsAny(combined, "zoom out", "zooming out", "dolly out", "pulling back")) {
            return CameraMotion.ZOOM_OUT;
        }
        if (containsAny(combined, "pan left", "panning left")) {
            return CameraMotion.PAN_LEFT;
        }
        if (containsAny(combined, "pan right", "panning right")) {
            return CameraMotion.PAN_RIGHT;
        }
        return CameraMotion.STATIC;
    }

    private String resolveWorkflow(StoryboardShot shot) {
        if (shot.workflowHint() != null && !shot.workflowHint().isBlank()) {
            return shot.workflowHint();
        }
        if (shot.videoBackend() != null) {
            return shot.videoBackend().workflow();
        }
        String profile = shot.renderProfile();
        return profile != null && PROFILE_WORKFLOWS.contains(profile) ? profile : null;
    }

    private static boolean containsAny(String text, String... phrases) {
        for (String phrase : phrases) {
            if (text.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
