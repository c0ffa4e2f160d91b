package github.sarthakdev143.music_video.state;

import github.sarthakdev143.music_video.model.AssetState;
import github.sarthakdev143.music_video.model.Bibles;
import github.sarthakdev143.music_video.model.ProjectState;
import github.sarthakdev143.music_video.model.ReviewState;
import github.sarthakdev143.music_video.model.ShotMediaType;
import github.sarthakdev143.music_video.model.Stage;
import github.sarthakdev143.music_video.model.Storyboard;
import github.sarthakdev143.music_video.model.StoryboardShot;
import github.sarthakdev143.music_video.state.ProjectEvent.AnalysisCompleted;
import github.sarthakdev143.music_video.state.ProjectEvent.ApiErrorCleared;
import github.sarthakdev143.music_video.state.ProjectEvent.ApiErrorRaised;
import github.sarthakdev143.music_video.state.ProjectEvent.AudioUrlAssigned;
import github.sarthakdev143.music_video.state.ProjectEvent.BibleImagesUpdated;
import github.sarthakdev143.music_video.state.ProjectEvent.BiblesGenerated;
import github.sarthakdev143.music_video.state.ProjectEvent.ClipCompleted;
import github.sarthakdev143.music_video.state.ProjectEvent.ClipGenerationFailed;
import github.sarthakdev143.music_video.state.ProjectEvent.ClipGenerationStarted;
import github.sarthakdev143.music_video.state.ProjectEvent.ClipProgressUpdated;
import github.sarthakdev143.music_video.state.ProjectEvent.CreativeBriefPatched;
import github.sarthakdev143.music_video.state.ProjectEvent.ErrorRaised;
import github.sarthakdev143.music_video.state.ProjectEvent.ExecutiveFeedbackReceived;
import github.sarthakdev143.music_video.state.ProjectEvent.ModelTierChanged;
import github.sarthakdev143.music_video.state.ProjectEvent.PlanningFailed;
import github.sarthakdev143.music_video.state.ProjectEvent.PlanningStarted;
import github.sarthakdev143.music_video.state.ProjectEvent.PostProductionStatusChanged;
import github.sarthakdev143.music_video.state.ProjectEvent.ProcessingStarted;
import github.sarthakdev143.music_video.state.ProjectEvent.ProjectReset;
import github.sarthakdev143.music_video.state.ProjectEvent.ReviewStarted;
import github.sarthakdev143.music_video.state.ProjectEvent.SceneTransitionsUpdated;
import github.sarthakdev143.music_video.state.ProjectEvent.ShotImageUpdated;
import github.sarthakdev143.music_video.state.ProjectEvent.ShotMediaUploaded;
import github.sarthakdev143.music_video.state.ProjectEvent.ShotReplaced;
import github.sarthakdev143.music_video.state.ProjectEvent.ShotVfxChanged;
import github.sarthakdev143.music_video.state.ProjectEvent.ShotsEnhanced;
import github.sarthakdev143.music_video.state.ProjectEvent.SongSelected;
import github.sarthakdev143.music_video.state.ProjectEvent.StateReplaced;
import github.sarthakdev143.music_video.state.ProjectEvent.StoryboardGenerated;
import github.sarthakdev143.music_video.state.ProjectEvent.TokenUsageRecorded;
import github.sarthakdev143.music_video.state.ProjectEvent.VisualReviewCompleted;
import github.sarthakdev143.music_video.state.ProjectEvent.VisualReviewStarted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Pure transition function {@code (state, event) -> state'}. The input state is never modified.
 * Events whose prerequisites are missing (no analysis, no bibles, unknown shot id) return the
 * input state unchanged.
 *
 * <p>Stage flow: UPLOAD -> CONTROLS -> PLAN -> STORYBOARD -> REVIEW, with PLAN falling back to
 * CONTROLS when storyboard generation fails.
 */
@Component
public class ProjectStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(ProjectStateMachine.class);

    public ProjectState transition(ProjectState state, ProjectEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof ProcessingStarted) {
            return state.toBuilder().processing(true).lastError(null).build();
        }
        if (event instanceof ErrorRaised e) {
            return state.toBuilder().processing(false).lastError(e.message()).build();
        }
        if (event instanceof ApiErrorRaised e) {
            return state.toBuilder().processing(false).apiError(e.message()).build();
        }
        if (event instanceof ApiErrorCleared) {
            return state.apiError() == null ? state : state.toBuilder().apiError(null).build();
        }
        if (event instanceof SongSelected e) {
            return state.toBuilder()
                    .song(e.song())
                    .singerGender(e.singerGender())
                    .modelTier(e.modelTier())
                    .build();
        }
        if (event instanceof AudioUrlAssigned e) {
            return state.toBuilder().audioUrl(e.audioUrl()).build();
        }
        if (event instanceof ModelTierChanged e) {
            return state.toBuilder().modelTier(e.modelTier()).build();
        }
        if (event instanceof AnalysisCompleted e) {
            return state.toBuilder()
                    .songAnalysis(e.analysis())
                    .stage(Stage.CONTROLS)
                    .processing(false)
                    .build();
        }
        if (event instanceof CreativeBriefPatched e) {
            return state.toBuilder().creativeBrief(state.creativeBrief().apply(e.patch())).build();
        }
        if (event instanceof PlanningStarted) {
            return startPlanning(state);
        }
        if (event instanceof BiblesGenerated e) {
            return state.toBuilder().bibles(e.bibles()).build();
        }
        if (event instanceof StoryboardGenerated e) {
            return completePlanning(state, e.storyboard());
        }
        if (event instanceof PlanningFailed e) {
            Stage fallback = state.stage() == Stage.PLAN ? Stage.CONTROLS : state.stage();
            return state.toBuilder().processing(false).apiError(e.message()).stage(fallback).build();
        }
        if (event instanceof BibleImagesUpdated e) {
            return updateBibleImages(state, e);
        }
        if (event instanceof ShotReplaced e) {
            return updateShot(state, e.shot().id(), ignored -> e.shot());
        }
        if (event instanceof ShotImageUpdated e) {
            return updateShot(state, e.shotId(), shot -> shot.withPreviewImageUrl(e.imageUrl()));
        }
        if (event instanceof ShotMediaUploaded e) {
            return applyMediaUpload(state, e);
        }
        if (event instanceof ClipGenerationStarted e) {
            return updateShot(state, e.shotId(), shot -> shot.imageState() == AssetState.READY
                    ? shot.withClipState(true, 0, shot.clipUrl())
                    : shot);
        }
        if (event instanceof ClipProgressUpdated e) {
            return updateShot(state, e.shotId(), shot -> shot.generatingClip()
                    ? shot.withClipState(true, e.progress(), shot.clipUrl())
                    : shot);
        }
        if (event instanceof ClipCompleted e) {
            return updateShot(state, e.shotId(), shot -> completeClip(shot, e.clipUrl()));
        }
        if (event instanceof ClipGenerationFailed e) {
            return updateShot(state, e.shotId(), shot -> shot.withClipState(false, shot.generationProgress(), shot.clipUrl()));
        }
        if (event instanceof ShotVfxChanged e) {
            return updateShot(state, e.shotId(), shot -> shot.withVfx(e.vfx()));
        }
        if (event instanceof ShotsEnhanced e) {
            if (state.storyboard() == null) {
                return state;
            }
            Storyboard enhanced = state.storyboard().updateEveryShot(shot ->
                    shot.withPostProductionEnhancements(shot.postProductionEnhancements().apply(e.task())));
            return state.toBuilder().storyboard(enhanced).build();
        }
        if (event instanceof SceneTransitionsUpdated e) {
            if (state.storyboard() == null) {
                return state;
            }
            Storyboard updated = state.storyboard().withSceneTransitions(e.sceneId(), e.transitions());
            return updated == state.storyboard() ? state : state.toBuilder().storyboard(updated).build();
        }
        if (event instanceof TokenUsageRecorded e) {
            if (e.delta().isEmpty()) {
                return state;
            }
            return state.toBuilder().tokenUsage(state.tokenUsage().merge(e.delta())).build();
        }
        if (event instanceof PostProductionStatusChanged e) {
            return state.toBuilder()
                    .postProductionTasks(state.postProductionTasks().with(e.task(), e.status()))
                    .build();
        }
        if (event instanceof ReviewStarted) {
            return startReview(state);
        }
        if (event instanceof ExecutiveFeedbackReceived e) {
            return state.toBuilder().reviewState(state.reviewState().withExecutiveFeedback(e.feedback())).build();
        }
        if (event instanceof VisualReviewStarted) {
            return state.toBuilder().reviewState(state.reviewState().withVisualReviewStarted()).build();
        }
        if (event instanceof VisualReviewCompleted e) {
            return state.toBuilder().reviewState(state.reviewState().withVisualReport(e.report())).build();
        }
        if (event instanceof StateReplaced e) {
            return e.state();
        }
        if (event instanceof ProjectReset) {
            return ProjectState.initial();
        }

        throw new IllegalArgumentException("Unsupported project event: " + event.getClass().getSimpleName());
    }

    private ProjectState startPlanning(ProjectState state) {
        if (state.songAnalysis() == null) {
            logger.debug("Ignoring planning start without a song analysis");
            return state;
        }
        return state.toBuilder().stage(Stage.PLAN).processing(true).lastError(null).build();
    }

    private ProjectState completePlanning(ProjectState state, Storyboard storyboard) {
        if (state.bibles() == null) {
            logger.debug("Ignoring storyboard without generated bibles");
            return state;
        }
        return state.toBuilder().storyboard(storyboard).stage(Stage.STORYBOARD).processing(false).build();
    }

    private ProjectState startReview(ProjectState state) {
        if (state.storyboard() == null) {
            logger.debug("Ignoring review request without a storyboard");
            return state;
        }
        return state.toBuilder()
                .stage(Stage.REVIEW)
                .reviewState(ReviewState.started())
                .build();
    }

    private ProjectState updateBibleImages(ProjectState state, BibleImagesUpdated event) {
        if (state.bibles() == null) {
            return state;
        }
        Bibles updated = state.bibles().withEntryImages(event.kind(), event.name(), event.imageUrls());
        return updated == state.bibles() ? state : state.toBuilder().bibles(updated).build();
    }

    private ProjectState applyMediaUpload(ProjectState state, ShotMediaUploaded event) {
        if (event.mediaType() == ShotMediaType.IMAGE) {
            // a new image makes any clip derived from the old one stale
            return updateShot(state, event.shotId(), shot -> shot
                    .withPreviewImageUrl(event.url())
                    .withClipState(false, shot.generationProgress(), null));
        }
        return updateShot(state, event.shotId(), shot -> shot.withClipState(
                shot.generatingClip(),
                shot.generationProgress(),
                event.url()));
    }

    private StoryboardShot completeClip(StoryboardShot shot, String clipUrl) {
        // only a clip in flight can complete; the first terminal write clears the flag
        if (!shot.generatingClip()) {
            return shot;
        }
        return shot.withClipState(false, 100, clipUrl);
    }

    private ProjectState updateShot(ProjectState state, String shotId, UnaryOperator<StoryboardShot> change) {
        if (state.storyboard() == null) {
            return state;
        }
        Storyboard updated = state.storyboard().updateShot(shotId, change);
        if (updated == state.storyboard()) {
            return state;
        }
        return state.toBuilder().storyboard(updated).build();
    }
}
