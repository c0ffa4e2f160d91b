package github.sarthakdev143.music_video.service.impl;

import github.sarthakdev143.music_video.clip.ClipCompletionPoller;
import github.sarthakdev143.music_video.clip.ClipGenerationException;
import github.sarthakdev143.music_video.clip.ClipGenerationParameters;
import github.sarthakdev143.music_video.clip.ClipNotificationHandler;
import github.sarthakdev143.music_video.clip.ClipParameterDeriver;
import github.sarthakdev143.music_video.clip.ClipPromptBuilder;
import github.sarthakdev143.music_video.clip.ClipReadyNotification;
import github.sarthakdev143.music_video.dto.SongUploadDetails;
import github.sarthakdev143.music_video.generation.BatchItemHandler;
import github.sarthakdev143.music_video.generation.BatchSummary;
import github.sarthakdev143.music_video.generation.GenerationTaskRunner;
import github.sarthakdev143.music_video.integration.ClipGenerationRequest;
import github.sarthakdev143.music_video.integration.ClipJobService;
import github.sarthakdev143.music_video.integration.CreativeDirector;
import github.sarthakdev143.music_video.integration.ImageGenerator;
import github.sarthakdev143.music_video.integration.SongAnalysisService;
import github.sarthakdev143.music_video.integration.VisualReviewer;
import github.sarthakdev143.music_video.model.AssetState;
import github.sarthakdev143.music_video.model.BibleEntry;
import github.sarthakdev143.music_video.model.BibleKind;
import github.sarthakdev143.music_video.model.Bibles;
import github.sarthakdev143.music_video.model.CharacterBible;
import github.sarthakdev143.music_video.model.ClipQuality;
import github.sarthakdev143.music_video.model.CreativeBrief;
import github.sarthakdev143.music_video.model.CreativeBriefPatch;
import github.sarthakdev143.music_video.model.ExecutiveProducerFeedback;
import github.sarthakdev143.music_video.model.GenerationResult;
import github.sarthakdev143.music_video.model.LocationBible;
import github.sarthakdev143.music_video.model.ModelTier;
import github.sarthakdev143.music_video.model.MoodboardImage;
import github.sarthakdev143.music_video.model.PostProductionTask;
import github.sarthakdev143.music_video.model.ProjectState;
import github.sarthakdev143.music_video.model.ShotMediaType;
import github.sarthakdev143.music_video.model.SongAnalysis;
import github.sarthakdev143.music_video.model.SongSource;
import github.sarthakdev143.music_video.model.Storyboard;
import github.sarthakdev143.music_video.model.StoryboardScene;
import github.sarthakdev143.music_video.model.StoryboardShot;
import github.sarthakdev143.music_video.model.TaskStatus;
import github.sarthakdev143.music_video.model.TokenCategory;
import github.sarthakdev143.music_video.model.Transition;
import github.sarthakdev143.music_video.model.VisualContinuityReport;
import github.sarthakdev143.music_video.service.ProductionPipelineService;
import github.sarthakdev143.music_video.snapshot.ProjectSnapshotSerializer;
import github.sarthakdev143.music_video.snapshot.SnapshotFormatException;
import github.sarthakdev143.music_video.snapshot.SnapshotLoadResult;
import github.sarthakdev143.music_video.state.ProjectEvent;
import github.sarthakdev143.music_video.state.ProjectStateStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class DefaultProductionPipelineService implements ProductionPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultProductionPipelineService.class);

    private final ProjectStateStore stateStore;
    private final GenerationTaskRunner taskRunner;
    private final SongAnalysisService songAnalysisService;
    private final CreativeDirector creativeDirector;
    private final ImageGenerator imageGenerator;
    private final VisualReviewer visualReviewer;
    private final ClipJobService clipJobService;
    private final ClipParameterDeriver clipParameterDeriver;
    private final ClipPromptBuilder clipPromptBuilder;
    private final ClipCompletionPoller clipCompletionPoller;
    private final ClipNotificationHandler clipNotificationHandler;
    private final ProjectSnapshotSerializer snapshotSerializer;
    private final TaskExecutor taskExecutor;
    private final Set<String> clipsInFlight = ConcurrentHashMap.newKeySet();
    private final Counter audioUploadFailureCounter;
    private final Counter clipFailureCounter;
    private final Counter planningFailureCounter;

    public DefaultProductionPipelineService(
            ProjectStateStore stateStore,
            GenerationTaskRunner taskRunner,
            SongAnalysisService songAnalysisService,
            CreativeDirector creativeDirector,
            ImageGenerator imageGenerator,
            VisualReviewer visualReviewer,
            ClipJobService clipJobService,
            ClipParameterDeriver clipParameterDeriver,
            ClipPromptBuilder clipPromptBuilder,
            ClipCompletionPoller clipCompletionPoller,
            ClipNotificationHandler clipNotificationHandler,
            ProjectSnapshotSerializer snapshotSerializer,
            TaskExecutor taskExecutor,
            MeterRegistry meterRegistry) {
        this.stateStore = stateStore;
        this.taskRunner = taskRunner;
        this.songAnalysisService = songAnalysisService;
        this.creativeDirector = creativeDirector;
        this.imageGenerator = imageGenerator;
        this.visualReviewer = visualReviewer;
        this.clipJobService = clipJobService;
        this.clipParameterDeriver = clipParameterDeriver;
        this.clipPromptBuilder = clipPromptBuilder;
        this.clipCompletionPoller = clipCompletionPoller;
        this.clipNotificationHandler = clipNotificationHandler;
        this.snapshotSerializer = snapshotSerializer;
        this.taskExecutor = taskExecutor;
        this.audioUploadFailureCounter = meterRegistry.counter("music_video.audio_upload.failures");
        this.clipFailureCounter = meterRegistry.counter("music_video.clips.failures");
        this.planningFailureCounter = meterRegistry.counter("music_video.planning.failures");
    }

    @Override
    public ProjectState currentState() {
        return stateStore.current();
    }

    @Override
    public void processSongUpload(SongSource song, SongUploadDetails details) {
        if (song == null || song.size() == 0) {
            String message = "Song file is required.";
            stateStore.dispatchAndWait(new ProjectEvent.ErrorRaised(message));
            throw new IllegalArgumentException(message);
        }
        SongUploadDetails normalizedDetails = details != null
                ? details
                : new SongUploadDetails(null, null, null, null, null);

        stateStore.dispatchAndWait(new ProjectEvent.ProcessingStarted());
        stateStore.dispatchAndWait(new ProjectEvent.SongSelected(
                song,
                normalizedDetails.singerGender(),
                normalizedDetails.modelTier()));
        logger.info("Accepted song {} ({} bytes) modelTier={}", song.fileName(), song.size(), normalizedDetails.modelTier());

        taskExecutor.execute(() -> analyzeSong(song, normalizedDetails));
    }

    private void analyzeSong(SongSource song, SongUploadDetails details) {
        try {
            String audioUrl = clipJobService.uploadAudio(song);
            stateStore.dispatch(new ProjectEvent.AudioUrlAssigned(audioUrl));
        } catch (RuntimeException e) {
            audioUploadFailureCounter.increment();
            logger.warn("Audio upload failed; continuing without audio URL: {}", e.getMessage());
        }

        try {
            GenerationResult<SongAnalysis> result = songAnalysisService.analyze(
                    song,
                    details.lyrics(),
                    details.title(),
                    details.artist(),
                    details.modelTier());
            stateStore.dispatch(new ProjectEvent.AnalysisCompleted(result.value()));
            recordUsage(TokenCategory.ANALYSIS, result);
        } catch (RuntimeException e) {
            logger.error("Song analysis failed for {}", song.fileName(), e);
            raiseApiError(e, "Failed to analyze song.");
        }
    }

    @Override
    public ProjectState setModelTier(ModelTier modelTier) {
        if (modelTier == null) {
            throw new IllegalArgumentException("modelTier is required.");
        }
        return stateStore.dispatchAndWait(new ProjectEvent.ModelTierChanged(modelTier));
    }

    @Override
    public ProjectState updateCreativeBrief(CreativeBriefPatch patch) {
        if (patch == null) {
            throw new IllegalArgumentException("Creative brief update is required.");
        }
        return stateStore.dispatchAndWait(new ProjectEvent.CreativeBriefPatched(patch));
    }

    @Override
    public void requestDirectorSuggestions() {
        ProjectState state = stateStore.current();
        SongAnalysis analysis = requireAnalysis(state);

        taskExecutor.execute(() -> {
            try {
                GenerationResult<CreativeBriefPatch> result = creativeDirector.suggestBrief(
                        analysis,
                        state.creativeBrief(),
                        state.modelTier());
                stateStore.dispatch(new ProjectEvent.CreativeBriefPatched(result.value()));
                // suggestions are billed with the bible work they feed into
                recordUsage(TokenCategory.BIBLES, result);
            } catch (RuntimeException e) {
                logger.error("Director suggestions failed", e);
                raiseApiError(e, "Failed to get AI Director suggestions.");
            }
        });
    }

    @Override
    public void analyzeMoodboard(List<MoodboardImage> images) {
        if (images == null || images.isEmpty()) {
            throw new IllegalArgumentException("At least one moodboard image is required.");
        }
        ModelTier modelTier = stateStore.current().modelTier();
        List<MoodboardImage> moodboard = List.copyOf(images);

        taskExecutor.execute(() -> {
            try {
                GenerationResult<CreativeBriefPatch> result = creativeDirector.analyzeMoodboard(moodboard, modelTier);
                stateStore.dispatch(new ProjectEvent.CreativeBriefPatched(result.value()));
                recordUsage(TokenCategory.MOODBOARD_ANALYSIS, result);
            } catch (RuntimeException e) {
                logger.error("Moodboard analysis failed for {} images", moodboard.size(), e);
                raiseApiError(e, "Failed to analyze moodboard.");
            }
        });
    }

    @Override
    public void generateCreativeAssets() {
        ProjectState state = stateStore.current();
        SongAnalysis analysis = requireAnalysis(state);

        stateStore.dispatchAndWait(new ProjectEvent.PlanningStarted());
        logger.info("Planning started for modelTier={}", state.modelTier());
        taskExecutor.execute(() -> plan(state, analysis));
    }

    private void plan(ProjectState state, SongAnalysis analysis) {
        CreativeBrief brief = state.creativeBrief();
        try {
            GenerationResult<Bibles> biblesResult = creativeDirector.generateBibles(
                    analysis,
                    brief,
                    state.singerGender(),
                    state.modelTier());
            Bibles bibles = biblesResult.value();
            stateStore.dispatch(new ProjectEvent.BiblesGenerated(bibles));
            recordUsage(TokenCategory.BIBLES, biblesResult);

            taskExecutor.execute(() -> generateBibleImages(bibles, brief, state.modelTier()));

            GenerationResult<Storyboard> storyboardResult = creativeDirector.generateStoryboard(
                    analysis,
                    brief,
                    bibles,
                    state.singerGender(),
                    state.modelTier());
            Storyboard storyboard = storyboardResult.value();
            stateStore.dispatch(new ProjectEvent.StoryboardGenerated(storyboard));
            recordUsage(TokenCategory.STORYBOARD, storyboardResult);

            taskExecutor.execute(() -> generateAllTransitions(storyboard, brief, state.modelTier()));
        } catch (RuntimeException e) {
            planningFailureCounter.increment();
            logger.error("Creative asset generation failed", e);
            stateStore.dispatch(new ProjectEvent.PlanningFailed(messageOf(e, "Failed to generate creative assets.")));
        }
    }

    BatchSummary generateBibleImages(Bibles bibles, CreativeBrief brief, ModelTier modelTier) {
        List<BibleEntry> entries = new ArrayList<>();
        entries.addAll(bibles.characters());
        entries.addAll(bibles.locations());

        BatchSummary summary = taskRunner.runBatch(
                entries,
                entry -> generateBibleImage(entry, brief, modelTier),
                new BatchItemHandler<BibleEntry, String>() {
                    @Override
                    public void onSuccess(BibleEntry entry, GenerationResult<String> result) {
                        stateStore.dispatch(new ProjectEvent.BibleImagesUpdated(
                                entry.kind(),
                                entry.name(),
                                List.of(result.value())));
                        recordUsage(TokenCategory.IMAGE_GENERATION, result);
                    }

                    @Override
                    public void onFailure(BibleEntry entry, Exception error) {
                        stateStore.dispatch(new ProjectEvent.BibleImagesUpdated(
                                entry.kind(),
                                entry.name(),
                                List.of(AssetState.ERROR_SENTINEL)));
                        raiseApiError(error, "Image generation failed for "
                                + describe(entry.kind()) + ": " + entry.name() + ".");
                    }
                });
        logger.info("Bible images finished: {} of {} succeeded", summary.succeeded(), summary.attempted());
        return summary;
    }

    private GenerationResult<String> generateBibleImage(BibleEntry entry, CreativeBrief brief, ModelTier modelTier) {
        if (entry instanceof CharacterBible character) {
            return imageGenerator.generateCharacterImage(character, brief, modelTier);
        }
        return imageGenerator.generateLocationImage((LocationBible) entry, brief, modelTier);
    }

    BatchSummary generateAllTransitions(Storyboard storyboard, CreativeBrief brief, ModelTier modelTier) {
        return taskRunner.runBatch(
                storyboard.scenes(),
                scene -> creativeDirector.generateTransitions(scene, brief, modelTier),
                new BatchItemHandler<StoryboardScene, List<Transition>>() {
                    @Override
                    public void onSuccess(StoryboardScene scene, GenerationResult<List<Transition>> result) {
                        stateStore.dispatch(new ProjectEvent.SceneTransitionsUpdated(scene.id(), result.value()));
                        recordUsage(TokenCategory.TRANSITIONS, result);
                    }

                    @Override
                    public void onFailure(StoryboardScene scene, Exception error) {
                        raiseApiError(error, "Transition generation failed for scene " + scene.id() + ".");
                    }
                });
    }

    @Override
    public void generateAllShotImages() {
        ProjectState state = stateStore.current();
        Storyboard storyboard = requireStoryboard(state);
        Bibles bibles = requireBibles(state);

        // shots that already hold an image or the error sentinel are left alone
        List<StoryboardShot> pending = storyboard.allShots().stream()
                .filter(shot -> shot.imageState() == AssetState.PENDING)
                .toList();
        logger.info("Generating images for {} pending shots", pending.size());

        taskExecutor.execute(() -> taskRunner.runBatch(
                pending,
                shot -> imageGenerator.generateShotImage(shot, bibles, state.creativeBrief(), state.modelTier()),
                new BatchItemHandler<StoryboardShot, String>() {
                    @Override
                    public void onSuccess(StoryboardShot shot, GenerationResult<String> result) {
                        stateStore.dispatch(new ProjectEvent.ShotImageUpdated(shot.id(), result.value()));
                        recordUsage(TokenCategory.IMAGE_GENERATION, result);
                    }

                    @Override
                    public void onFailure(StoryboardShot shot, Exception error) {
                        stateStore.dispatch(new ProjectEvent.ShotImageUpdated(shot.id(), AssetState.ERROR_SENTINEL));
                        raiseApiError(error, "Image generation failed for shot " + shot.id() + ".");
                    }
                }));
    }

    @Override
    public void regenerateShotImage(String shotId) {
        ProjectState state = stateStore.current();
        Bibles bibles = requireBibles(state);
        StoryboardShot shot = requireShot(state, shotId);

        stateStore.dispatchAndWait(new ProjectEvent.ShotImageUpdated(shotId, ""));
        taskExecutor.execute(() -> {
            try {
                GenerationResult<String> result = imageGenerator.generateShotImage(
                        shot,
                        bibles,
                        state.creativeBrief(),
                        state.modelTier());
                stateStore.dispatch(new ProjectEvent.ShotImageUpdated(shotId, result.value()));
                recordUsage(TokenCategory.IMAGE_GENERATION, result);
            } catch (RuntimeException e) {
                logger.error("Image regeneration failed for shot {}", shotId, e);
                stateStore.dispatch(new ProjectEvent.ShotImageUpdated(shotId, AssetState.ERROR_SENTINEL));
                raiseApiError(e, "Failed to regenerate image.");
            }
        });
    }

    @Override
    public void editShotImage(String shotId, String instruction) {
        if (instruction == null || instruction.isBlank()) {
            throw new IllegalArgumentException("Edit instruction is required.");
        }
        ProjectState state = stateStore.current();
        Bibles bibles = requireBibles(state);
        StoryboardShot shot = requireShot(state, shotId);
        if (shot.imageState() != AssetState.READY) {
            throw new IllegalStateException("Shot " + shotId + " has no image to edit.");
        }
        String originalUrl = shot.previewImageUrl();

        stateStore.dispatchAndWait(new ProjectEvent.ShotImageUpdated(shotId, ""));
        taskExecutor.execute(() -> {
            try {
                GenerationResult<String> result = imageGenerator.editShotImage(
                        shot,
                        bibles,
                        state.creativeBrief(),
                        instruction.trim());
                stateStore.dispatch(new ProjectEvent.ShotImageUpdated(shotId, result.value()));
                recordUsage(TokenCategory.IMAGE_EDITING, result);
            } catch (RuntimeException e) {
                logger.error("Image edit failed for shot {}", shotId, e);
                stateStore.dispatch(new ProjectEvent.ShotImageUpdated(shotId, originalUrl));
                raiseApiError(e, "Failed to edit image.");
            }
        });
    }

    @Override
    public void regenerateBibleImage(BibleKind kind, String name) {
        ProjectState state = stateStore.current();
        Bibles bibles = requireBibles(state);
        BibleEntry entry = bibles.findEntry(kind, name)
                .orElseThrow(() -> new NoSuchElementException(describe(kind) + " not found: " + name));

        stateStore.dispatchAndWait(new ProjectEvent.BibleImagesUpdated(kind, name, List.of()));
        taskExecutor.execute(() -> {
            try {
                GenerationResult<String> result = generateBibleImage(entry, state.creativeBrief(), state.modelTier());
                stateStore.dispatch(new ProjectEvent.BibleImagesUpdated(kind, name, List.of(result.value())));
                recordUsage(TokenCategory.IMAGE_GENERATION, result);
            } catch (RuntimeException e) {
                logger.error("Image regeneration failed for {} {}", describe(kind), name, e);
                stateStore.dispatch(new ProjectEvent.BibleImagesUpdated(kind, name, List.of(AssetState.ERROR_SENTINEL)));
                raiseApiError(e, "Failed to regenerate image for " + describe(kind) + " " + name + ".");
            }
        });
    }

    @Override
    public void generateClip(String shotId, ClipQuality quality) {
        ProjectState state = stateStore.current();
        StoryboardShot shot = requireShot(state, shotId);
        if (shot.imageState() != AssetState.READY) {
            throw new IllegalStateException("Shot " + shotId + " needs a generated image before a clip can be made.");
        }
        if (clipsInFlight.contains(shotId)) {
            throw new IllegalStateException("A clip is already being generated for shot " + shotId + ".");
        }
        ClipQuality normalizedQuality = quality != null ? quality : ClipQuality.DRAFT;
        logger.info("Accepted clip job for shot {} quality={}", shotId, normalizedQuality);
        taskExecutor.execute(() -> generateClipAndWait(shotId, normalizedQuality));
    }

    /**
     * Submits the shot's clip job and blocks until it settles.
     *
     * @return true when a clip URL was recorded for the shot
     */
    boolean generateClipAndWait(String shotId, ClipQuality quality) {
        ProjectState state = stateStore.current();
        if (state.storyboard() == null) {
            return false;
        }
        Optional<StoryboardShot> match = state.storyboard().findShot(shotId);
        if (match.isEmpty() || match.get().imageState() != AssetState.READY) {
            return false;
        }
        if (!clipsInFlight.add(shotId)) {
            logger.warn("Skipping clip for shot {}: a job is already in flight", shotId);
            return false;
        }

        StoryboardShot shot = match.get();
        try {
            stateStore.dispatchAndWait(new ProjectEvent.ClipGenerationStarted(shotId));
            String jobId = clipJobService.submit(buildClipRequest(state, shot, quality));
            clipCompletionPoller.awaitCompletion(shotId, jobId);
            return true;
        } catch (ClipGenerationException | RuntimeException e) {
            clipFailureCounter.increment();
            logger.error("Clip generation failed for shot {}", shotId, e);
            stateStore.dispatch(new ProjectEvent.ClipGenerationFailed(shotId));
            raiseApiError(e, "Failed to generate clip.");
            return false;
        } finally {
            clipsInFlight.remove(shotId);
        }
    }

    private ClipGenerationRequest buildClipRequest(ProjectState state, StoryboardShot shot, ClipQuality quality) {
        double duration = shot.duration();
        ClipGenerationParameters parameters = clipParameterDeriver.derive(shot, duration);
        String prompt = clipPromptBuilder.build(shot, state.bibles(), state.creativeBrief(), quality == ClipQuality.HIGH);
        return new ClipGenerationRequest(
                shot.previewImageUrl(),
                prompt,
                duration,
                quality.toApiValue(),
                parameters.cameraMotion(),
                shot.lipSyncHint(),
                state.audioUrl(),
                shot.id(),
                parameters.workflow(),
                shot.videoBackend(),
                shot.renderProfile(),
                parameters.fps(),
                parameters.negativePrompt());
    }

    @Override
    public void generateStoryboardClips(ClipQuality quality) {
        Storyboard storyboard = requireStoryboard(stateStore.current());
        ClipQuality normalizedQuality = quality != null ? quality : ClipQuality.HIGH;
        List<String> orderedShotIds = clipOrder(storyboard);
        logger.info("Accepted storyboard clip batch: {} shots quality={}", orderedShotIds.size(), normalizedQuality);

        taskExecutor.execute(() -> {
            List<String> failed = new ArrayList<>();
            for (String shotId : orderedShotIds) {
                if (!generateClipAndWait(shotId, normalizedQuality)) {
                    failed.add(shotId);
                }
            }
            if (!failed.isEmpty()) {
                stateStore.dispatch(new ProjectEvent.ApiErrorRaised(
                        "Some clips failed to generate: " + String.join(", ", failed)));
            }
        });
    }

    /**
     * Shots with a ready image, ordered by start time, then scene position, shot position and id.
     */
    static List<String> clipOrder(Storyboard storyboard) {
        record Slot(StoryboardShot shot, int sceneIndex, int shotIndex) {
        }

        List<Slot> slots = new ArrayList<>();
        List<StoryboardScene> scenes = storyboard.scenes();
        for (int sceneIndex = 0; sceneIndex < scenes.size(); sceneIndex++) {
            List<StoryboardShot> shots = scenes.get(sceneIndex).shots();
            for (int shotIndex = 0; shotIndex < shots.size(); shotIndex++) {
                StoryboardShot shot = shots.get(shotIndex);
                if (shot.imageState() == AssetState.READY) {
                    slots.add(new Slot(shot, sceneIndex, shotIndex));
                }
            }
        }
        slots.sort(Comparator.<Slot>comparingDouble(slot -> slot.shot().start())
                .thenComparingInt(Slot::sceneIndex)
                .thenComparingInt(Slot::shotIndex)
                .thenComparing(slot -> slot.shot().id()));
        return slots.stream().map(slot -> slot.shot().id()).toList();
    }

    @Override
    public ProjectState setShotVfx(String shotId, String vfx) {
        requireShot(stateStore.current(), shotId);
        String normalizedVfx = vfx == null || vfx.isBlank() ? "None" : vfx.trim();
        return stateStore.dispatchAndWait(new ProjectEvent.ShotVfxChanged(shotId, normalizedVfx));
    }

    @Override
    public ProjectState uploadShotMedia(String shotId, ShotMediaType mediaType, String url) {
        if (mediaType == null) {
            throw new IllegalArgumentException("mediaType is required.");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Media content is required.");
        }
        requireShot(stateStore.current(), shotId);
        return stateStore.dispatchAndWait(new ProjectEvent.ShotMediaUploaded(shotId, mediaType, url));
    }

    @Override
    public void applyPostProduction(PostProductionTask task) {
        if (task == null) {
            throw new IllegalArgumentException("post-production task is required.");
        }
        ProjectState state = stateStore.current();
        Storyboard storyboard = requireStoryboard(state);
        if (task == PostProductionTask.VFX) {
            SongAnalysis analysis = requireAnalysis(state);
            stateStore.dispatchAndWait(new ProjectEvent.PostProductionStatusChanged(task, TaskStatus.PROCESSING));
            taskExecutor.execute(() -> applyBeatSyncedVfx(analysis, storyboard, state.modelTier()));
            return;
        }

        stateStore.dispatchAndWait(new ProjectEvent.PostProductionStatusChanged(task, TaskStatus.PROCESSING));
        taskExecutor.execute(() -> {
            stateStore.dispatch(new ProjectEvent.ShotsEnhanced(task));
            stateStore.dispatch(new ProjectEvent.PostProductionStatusChanged(task, TaskStatus.DONE));
            logger.info("Post-production task {} applied to {} shots", task, storyboard.allShots().size());
        });
    }

    private void applyBeatSyncedVfx(SongAnalysis analysis, Storyboard storyboard, ModelTier modelTier) {
        try {
            GenerationResult<Map<String, String>> result =
                    creativeDirector.suggestBeatSyncedVfx(analysis, storyboard, modelTier);
            Map<String, String> suggestions = result.value() == null ? Map.of() : result.value();
            for (Map.Entry<String, String> suggestion : suggestions.entrySet()) {
                stateStore.dispatch(new ProjectEvent.ShotVfxChanged(suggestion.getKey(), suggestion.getValue()));
            }
            recordUsage(TokenCategory.POST_PRODUCTION, result);
            stateStore.dispatch(new ProjectEvent.PostProductionStatusChanged(PostProductionTask.VFX, TaskStatus.DONE));
        } catch (RuntimeException e) {
            logger.error("Beat-synced VFX suggestions failed", e);
            raiseApiError(e, "Failed to get VFX suggestions.");
            stateStore.dispatch(new ProjectEvent.PostProductionStatusChanged(PostProductionTask.VFX, TaskStatus.IDLE));
        }
    }

    @Override
    public void startReview() {
        ProjectState state = stateStore.current();
        requireStoryboard(state);

        ProjectState reviewing = stateStore.dispatchAndWait(new ProjectEvent.ReviewStarted());
        taskExecutor.execute(() -> runExecutiveReview(reviewing));
        runVisualReview();
    }

    private void runExecutiveReview(ProjectState state) {
        try {
            GenerationResult<ExecutiveProducerFeedback> result = creativeDirector.reviewProduction(
                    state.storyboard(),
                    state.bibles(),
                    state.creativeBrief(),
                    state.modelTier());
            stateStore.dispatch(new ProjectEvent.ExecutiveFeedbackReceived(result.value()));
            recordUsage(TokenCategory.EXECUTIVE_REVIEW, result);
        } catch (RuntimeException e) {
            logger.error("Executive producer review failed", e);
            raiseApiError(e, "Failed to get executive producer feedback.");
            stateStore.dispatch(new ProjectEvent.ExecutiveFeedbackReceived(ExecutiveProducerFeedback.failed()));
        }
    }

    @Override
    public void runVisualReview() {
        ProjectState state = stateStore.current();
        if (state.storyboard() == null || state.bibles() == null || !hasReviewableAsset(state.storyboard())) {
            logger.info("Skipping visual review: no generated visuals to audit");
            stateStore.dispatchAndWait(new ProjectEvent.VisualReviewCompleted(null));
            return;
        }

        stateStore.dispatchAndWait(new ProjectEvent.VisualReviewStarted());
        taskExecutor.execute(() -> {
            try {
                GenerationResult<VisualContinuityReport> result = visualReviewer.audit(
                        state.storyboard(),
                        state.bibles(),
                        state.creativeBrief());
                stateStore.dispatch(new ProjectEvent.VisualReviewCompleted(result.value()));
                recordUsage(TokenCategory.VISUAL_REVIEW, result);
            } catch (RuntimeException e) {
                logger.error("Visual continuity review failed", e);
                raiseApiError(e, "Visual QA agent failed to review generated visuals.");
                stateStore.dispatch(new ProjectEvent.VisualReviewCompleted(null));
            }
        });
    }

    private static boolean hasReviewableAsset(Storyboard storyboard) {
        return storyboard.allShots().stream().anyMatch(shot -> {
            boolean hasAsset = hasText(shot.clipUrl()) || hasText(shot.previewImageUrl());
            return hasAsset && shot.imageState() != AssetState.FAILED;
        });
    }

    @Override
    public ProjectState clearApiError() {
        return stateStore.dispatchAndWait(new ProjectEvent.ApiErrorCleared());
    }

    @Override
    public ProjectState reset() {
        logger.info("Project reset");
        return stateStore.dispatchAndWait(new ProjectEvent.ProjectReset());
    }

    @Override
    public String exportSnapshot() {
        return snapshotSerializer.save(stateStore.current());
    }

    @Override
    public SnapshotLoadResult importSnapshot(String document) throws SnapshotFormatException {
        SnapshotLoadResult result;
        try {
            result = snapshotSerializer.load(document);
        } catch (SnapshotFormatException e) {
            logger.warn("Rejected project file: {}", e.getMessage());
            stateStore.dispatchAndWait(new ProjectEvent.ErrorRaised("Failed to load project file: " + e.getMessage()));
            throw e;
        }
        stateStore.dispatchAndWait(new ProjectEvent.StateReplaced(result.state()));
        if (result.audioMissing()) {
            logger.warn("Loaded project has no audio; the original song must be uploaded again");
        }
        logger.info("Loaded project snapshot at stage {}", result.state().stage());
        return result;
    }

    @Override
    public Optional<String> onClipReady(ClipReadyNotification notification) {
        return clipNotificationHandler.onClipReady(notification);
    }

    private void recordUsage(TokenCategory category, GenerationResult<?> result) {
        stateStore.dispatch(ProjectEvent.TokenUsageRecorded.of(category, result.usageCost()));
    }

    private void raiseApiError(Exception error, String fallbackMessage) {
        stateStore.dispatch(new ProjectEvent.ApiErrorRaised(messageOf(error, fallbackMessage)));
    }

    private static String messageOf(Exception error, String fallbackMessage) {
        return error != null && hasText(error.getMessage()) ? error.getMessage() : fallbackMessage;
    }

    private static SongAnalysis requireAnalysis(ProjectState state) {
        if (state.songAnalysis() == null) {
            throw new IllegalStateException("Song analysis is not available yet.");
        }
        return state.songAnalysis();
    }

    private static Storyboard requireStoryboard(ProjectState state) {
        if (state.storyboard() == null) {
            throw new IllegalStateException("Storyboard has not been generated yet.");
        }
        return state.storyboard();
    }

    private static Bibles requireBibles(ProjectState state) {
        if (state.bibles() == null) {
            throw new IllegalStateException("Visual bibles have not been generated yet.");
        }
        return state.bibles();
    }

    private static StoryboardShot requireShot(ProjectState state, String shotId) {
        return requireStoryboard(state).findShot(shotId)
                .orElseThrow(() -> new NoSuchElementException("Shot not found: " + shotId));
    }

    private static String describe(BibleKind kind) {
        return kind == BibleKind.CHARACTER ? "character" : "location";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
