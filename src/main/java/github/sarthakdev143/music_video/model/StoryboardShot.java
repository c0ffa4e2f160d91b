package github.sarthakdev143.music_video.model;

import java.util.List;
import java.util.Objects;

/**
 * The atomic unit of the storyboard. Image and clip generation state is carried on the shot:
 * {@code previewImageUrl} follows {@link AssetState}, {@code generatingClip} and
 * {@code generationProgress} describe an in-flight clip job, {@code clipUrl} the finished clip.
 */
public record StoryboardShot(
        String id,
        double start,
        double end,
        String shotType,
        String subject,
        String action,
        String composition,
        String cameraMove,
        CinematicEnhancements cinematicEnhancements,
        String lyricOverlay,
        List<String> characterRefs,
        String locationRef,
        String vfx,
        boolean lipSyncHint,
        VideoBackend videoBackend,
        String workflowHint,
        String renderProfile,
        PostProductionEnhancements postProductionEnhancements,
        String previewImageUrl,
        boolean generatingClip,
        int generationProgress,
        String clipUrl) {

    public StoryboardShot {
        Objects.requireNonNull(id, "id");
        cinematicEnhancements = cinematicEnhancements == null ? CinematicEnhancements.none() : cinematicEnhancements;
        characterRefs = characterRefs == null ? List.of() : List.copyOf(characterRefs);
        postProductionEnhancements = postProductionEnhancements == null
                ? PostProductionEnhancements.none()
                : postProductionEnhancements;
        generationProgress = Math.max(0, Math.min(100, generationProgress));
    }

    public AssetState imageState() {
        return AssetState.ofUrl(previewImageUrl);
    }

    public double duration() {
        return end - start;
    }

    public StoryboardShot withPreviewImageUrl(String url) {
        return new StoryboardShot(id, start, end, shotType, subject, action, composition, cameraMove,
                cinematicEnhancements, lyricOverlay, characterRefs, locationRef, vfx, lipSyncHint, videoBackend,
                workflowHint, renderProfile, postProductionEnhancements, url, generatingClip, generationProgress,
                clipUrl);
    }

    public StoryboardShot withClipState(boolean generating, int progress, String url) {
        return new StoryboardShot(id, start, end, shotType, subject, action, composition, cameraMove,
                cinematicEnhancements, lyricOverlay, characterRefs, locationRef, vfx, lipSyncHint, videoBackend,
                workflowHint, renderProfile, postProductionEnhancements, previewImageUrl, generating, progress, url);
    }

    public StoryboardShot withVfx(String value) {
        return new StoryboardShot(id, start, end, shotType, subject, action, composition, cameraMove,
                cinematicEnhancements, lyricOverlay, characterRefs, locationRef, value, lipSyncHint, videoBackend,
                workflowHint, renderProfile, postProductionEnhancements, previewImageUrl, generatingClip,
                generationProgress, clipUrl);
    }

    public StoryboardShot withPostProductionEnhancements(PostProductionEnhancements enhancements) {
        return new StoryboardShot(id, start, end, shotType, subject, action, composition, cameraMove,
                cinematicEnhancements, lyricOverlay, characterRefs, locationRef, vfx, lipSyncHint, videoBackend,
                workflowHint, renderProfile, enhancements, previewImageUrl, generatingClip, generationProgress,
                clipUrl);
    }
}
