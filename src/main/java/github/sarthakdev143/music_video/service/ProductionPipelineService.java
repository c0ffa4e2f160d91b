package github.sarthakdev143.music_video.service;

import github.sarthakdev143.music_video.clip.ClipReadyNotification;
import github.sarthakdev143.music_video.dto.SongUploadDetails;
import github.sarthakdev143.music_video.model.BibleKind;
import github.sarthakdev143.music_video.model.ClipQuality;
import github.sarthakdev143.music_video.model.CreativeBriefPatch;
import github.sarthakdev143.music_video.model.ModelTier;
import github.sarthakdev143.music_video.model.MoodboardImage;
import github.sarthakdev143.music_video.model.PostProductionTask;
import github.sarthakdev143.music_video.model.ProjectState;
import github.sarthakdev143.music_video.model.ShotMediaType;
import github.sarthakdev143.music_video.model.SongSource;
import github.sarthakdev143.music_video.snapshot.SnapshotFormatException;
import github.sarthakdev143.music_video.snapshot.SnapshotLoadResult;

import java.util.List;
import java.util.Optional;

/**
 * Production workflow operations. Long running operations validate their prerequisites, record
 * the starting transition and continue on the task executor; progress is visible through
 * {@link #currentState()}.
 *
 * <p>Missing prerequisites raise {@link IllegalStateException} without touching the project;
 * unknown shots or bible entries raise {@link java.util.NoSuchElementException}.
 */
public interface ProductionPipelineService {

    ProjectState currentState();

    void processSongUpload(SongSource song, SongUploadDetails details);

    ProjectState setModelTier(ModelTier modelTier);

    ProjectState updateCreativeBrief(CreativeBriefPatch patch);

    void requestDirectorSuggestions();

    void analyzeMoodboard(List<MoodboardImage> images);

    void generateCreativeAssets();

    void generateAllShotImages();

    void regenerateShotImage(String shotId);

    void editShotImage(String shotId, String instruction);

    void regenerateBibleImage(BibleKind kind, String name);

    void generateClip(String shotId, ClipQuality quality);

    void generateStoryboardClips(ClipQuality quality);

    ProjectState setShotVfx(String shotId, String vfx);

    ProjectState uploadShotMedia(String shotId, ShotMediaType mediaType, String url);

    void applyPostProduction(PostProductionTask task);

    void startReview();

    void runVisualReview();

    ProjectState clearApiError();

    ProjectState reset();

    String exportSnapshot();

    SnapshotLoadResult importSnapshot(String document) throws SnapshotFormatException;

    Optional<String> onClipReady(ClipReadyNotification notification);
}
