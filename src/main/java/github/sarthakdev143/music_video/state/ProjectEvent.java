package github.sarthakdev143.music_video.state;

import github.sarthakdev143.music_video.model.BibleKind;
import github.sarthakdev143.music_video.model.Bibles;
import github.sarthakdev143.music_video.model.CreativeBriefPatch;
import github.sarthakdev143.music_video.model.ExecutiveProducerFeedback;
import github.sarthakdev143.music_video.model.ModelTier;
import github.sarthakdev143.music_video.model.PostProductionTask;
import github.sarthakdev143.music_video.model.ProjectState;
import github.sarthakdev143.music_video.model.ShotMediaType;
import github.sarthakdev143.music_video.model.SingerGender;
import github.sarthakdev143.music_video.model.SongAnalysis;
import github.sarthakdev143.music_video.model.SongSource;
import github.sarthakdev143.music_video.model.Storyboard;
import github.sarthakdev143.music_video.model.StoryboardShot;
import github.sarthakdev143.music_video.model.TaskStatus;
import github.sarthakdev143.music_video.model.TokenCategory;
import github.sarthakdev143.music_video.model.TokenUsage;
import github.sarthakdev143.music_video.model.Transition;
import github.sarthakdev143.music_video.model.VisualContinuityReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Every change to a {@link ProjectState} is expressed as one of these events and applied by
 * {@link ProjectStateMachine}.
 */
public sealed interface ProjectEvent {

    record ProcessingStarted() implements ProjectEvent {
    }

    record ErrorRaised(String message) implements ProjectEvent {
    }

    record ApiErrorRaised(String message) implements ProjectEvent {
    }

    record ApiErrorCleared() implements ProjectEvent {
    }

    record SongSelected(SongSource song, SingerGender singerGender, ModelTier modelTier) implements ProjectEvent {
    }

    record AudioUrlAssigned(String audioUrl) implements ProjectEvent {
    }

    record ModelTierChanged(ModelTier modelTier) implements ProjectEvent {
    }

    record AnalysisCompleted(SongAnalysis analysis) implements ProjectEvent {

        public AnalysisCompleted {
            Objects.requireNonNull(analysis, "analysis");
        }
    }

    record CreativeBriefPatched(CreativeBriefPatch patch) implements ProjectEvent {
    }

    record PlanningStarted() implements ProjectEvent {
    }

    record BiblesGenerated(Bibles bibles) implements ProjectEvent {

        public BiblesGenerated {
            Objects.requireNonNull(bibles, "bibles");
        }
    }

    record StoryboardGenerated(Storyboard storyboard) implements ProjectEvent {

        public StoryboardGenerated {
            Objects.requireNonNull(storyboard, "storyboard");
        }
    }

    record PlanningFailed(String message) implements ProjectEvent {
    }

    record BibleImagesUpdated(BibleKind kind, String name, List<String> imageUrls) implements ProjectEvent {

        public BibleImagesUpdated {
            Objects.requireNonNull(kind, "kind");
            imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
        }
    }

    record ShotReplaced(StoryboardShot shot) implements ProjectEvent {

        public ShotReplaced {
            Objects.requireNonNull(shot, "shot");
        }
    }

    /**
     * Sets the preview image field: a URL, {@code null} for pending, or the error sentinel.
     */
    record ShotImageUpdated(String shotId, String imageUrl) implements ProjectEvent {
    }

    record ShotMediaUploaded(String shotId, ShotMediaType mediaType, String url) implements ProjectEvent {

        public ShotMediaUploaded {
            Objects.requireNonNull(mediaType, "mediaType");
        }
    }

    record ClipGenerationStarted(String shotId) implements ProjectEvent {
    }

    record ClipProgressUpdated(String shotId, int progress) implements ProjectEvent {
    }

    record ClipCompleted(String shotId, String clipUrl) implements ProjectEvent {

        public ClipCompleted {
            Objects.requireNonNull(clipUrl, "clipUrl");
        }
    }

    record ClipGenerationFailed(String shotId) implements ProjectEvent {
    }

    record ShotVfxChanged(String shotId, String vfx) implements ProjectEvent {
    }

    record ShotsEnhanced(PostProductionTask task) implements ProjectEvent {

        public ShotsEnhanced {
            Objects.requireNonNull(task, "task");
        }
    }

    record SceneTransitionsUpdated(String sceneId, List<Transition> transitions) implements ProjectEvent {

        public SceneTransitionsUpdated {
            transitions = transitions == null
                    ? List.of()
                    : Collections.unmodifiableList(new ArrayList<>(transitions));
        }
    }

    record TokenUsageRecorded(Map<String, Object> delta) implements ProjectEvent {

        public TokenUsageRecorded {
            delta = delta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(delta));
        }

        public static TokenUsageRecorded of(TokenCategory category, long amount) {
            return new TokenUsageRecorded(TokenUsage.delta(category, amount));
        }
    }

    record PostProductionStatusChanged(PostProductionTask task, TaskStatus status) implements ProjectEvent {

        public PostProductionStatusChanged {
            Objects.requireNonNull(task, "task");
            Objects.requireNonNull(status, "status");
        }
    }

    record ReviewStarted() implements ProjectEvent {
    }

    record ExecutiveFeedbackReceived(ExecutiveProducerFeedback feedback) implements ProjectEvent {
    }

    record VisualReviewStarted() implements ProjectEvent {
    }

    record VisualReviewCompleted(VisualContinuityReport report) implements ProjectEvent {
    }

    record StateReplaced(ProjectState state) implements ProjectEvent {

        public StateReplaced {
            Objects.requireNonNull(state, "state");
        }
    }

    record ProjectReset() implements ProjectEvent {
    }
}
