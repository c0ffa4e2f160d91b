package github.sarthakdev143.music_video.service.impl;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.music_video.clip.ClipCompletionPoller;
import github.sarthakdev143.music_video.clip.ClipNotificationHandler;
import github.sarthakdev143.music_video.clip.ClipParameterDeriver;
import github.sarthakdev143.music_video.clip.ClipPromptBuilder;
import github.sarthakdev143.music_video.clip.ClipReadyNotification;
import github.sarthakdev143.music_video.dto.SongUploadDetails;
import github.sarthakdev143.music_video.generation.BatchSummary;
import github.sarthakdev143.music_video.generation.GenerationTaskRunner;
import github.sarthakdev143.music_video.integration.ClipGenerationRequest;
import github.sarthakdev143.music_video.integration.ClipJobService;
import github.sarthakdev143.music_video.integration.ClipJobStatus;
import github.sarthakdev143.music_video.integration.CreativeDirector;
import github.sarthakdev143.music_video.integration.GenerationException;
import github.sarthakdev143.music_video.integration.ImageGenerator;
import github.sarthakdev143.music_video.integration.SongAnalysisService;
import github.sarthakdev143.music_video.integration.VisualReviewer;
import github.sarthakdev143.music_video.model.AssetState;
import github.sarthakdev143.music_video.model.CameraMotion;
import github.sarthakdev143.music_video.model.ClipQuality;
import github.sarthakdev143.music_video.model.CreativeBrief;
import github.sarthakdev143.music_video.model.ExecutiveProducerFeedback;
import github.sarthakdev143.music_video.model.GenerationResult;
import github.sarthakdev143.music_video.model.ModelTier;
import github.sarthakdev143.music_video.model.PostProductionTask;
import github.sarthakdev143.music_video.model.ProjectState;
import github.sarthakdev143.music_video.model.ReviewStatus;
import github.sarthakdev143.music_video.model.SingerGender;
import github.sarthakdev143.music_video.model.Stage;
import github.sarthakdev143.music_video.model.Storyboard;
import github.sarthakdev143.music_video.model.StoryboardShot;
import github.sarthakdev143.music_video.model.TaskStatus;
import github.sarthakdev143.music_video.model.TokenCategory;
import github.sarthakdev143.music_video.model.Transition;
import github.sarthakdev143.music_video.snapshot.ProjectSnapshotSerializer;
import github.sarthakdev143.music_video.snapshot.SnapshotFormatException;
import github.sarthakdev143.music_video.snapshot.SnapshotLoadResult;
import github.sarthakdev143.music_video.state.ProjectEvent;
import github.sarthakdev143.music_video.state.ProjectStateMachine;
import github.sarthakdev143.music_video.state.ProjectStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static github.sarthakdev143.music_video.ProductionFixtures.analysis;
import static github.sarthakdev143.music_video.ProductionFixtures.bibles;
import static github.sarthakdev143.music_video.ProductionFixtures.scene;
import static github.sarthakdev143.music_video.ProductionFixtures.shot;
import static github.sarthakdev143.music_video.ProductionFixtures.song;
import static github.sarthakdev143.music_video.ProductionFixtures.stateWithStoryboard;
import static github.sarthakdev143.music_video.ProductionFixtures.storyboard;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultProductionPipelineServiceTest {

    @Mock
    private SongAnalysisService songAnalysisService;

    @Mock
    private CreativeDirector creativeDirector;

    @Mock
    private ImageGenerator imageGenerator;

    @Mock
    private VisualReviewer visualReviewer;

    @Mock
    private ClipJobService clipJobService;

    private ProjectStateStore stateStore;
    private SimpleMeterRegistry meterRegistry;
    private DefaultProductionPipelineService service;

    @BeforeEach
    void setUp() {
        TaskExecutor directExecutor = Runnable::run;
        meterRegistry = new SimpleMeterRegistry();
        stateStore = new ProjectStateStore(new ProjectStateMachine());
        ClipCompletionPoller poller = new ClipCompletionPoller(
                clipJobService,
                stateStore,
                duration -> {
                },
                Duration.ZERO,
                5,
                meterRegistry);
        ObjectMapper objectMapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        service = new DefaultProductionPipelineService(
                stateStore,
                new GenerationTaskRunner(Duration.ZERO, duration -> {
                }, meterRegistry),
                songAnalysisService,
                creativeDirector,
                imageGenerator,
                visualReviewer,
                clipJobService,
                new ClipParameterDeriver(),
                new ClipPromptBuilder(),
                poller,
                new ClipNotificationHandler(poller, stateStore),
                new ProjectSnapshotSerializer(objectMapper),
                directExecutor,
                meterRegistry);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        stateStore.destroy();
    }

    @Test
    void songUploadUploadsAudioAndAnalyzes() {
        when(clipJobService.uploadAudio(any())).thenReturn("https://render/audio/night-drive.mp3");
        when(songAnalysisService.analyze(any(), eq("la la"), eq("Night Drive"), eq("The Examples"), eq(ModelTier.PREMIUM)))
                .thenReturn(GenerationResult.of(analysis(), 250));

        service.processSongUpload(song(), new SongUploadDetails(
                "la la",
                "Night Drive",
                "The Examples",
                SingerGender.FEMALE,
                ModelTier.PREMIUM));

        ProjectState state = settled();
        assertThat(state.stage()).isEqualTo(Stage.CONTROLS);
        assertThat(state.processing()).isFalse();
        assertThat(state.song()).isEqualTo(song());
        assertThat(state.singerGender()).isEqualTo(SingerGender.FEMALE);
        assertThat(state.audioUrl()).isEqualTo("https://render/audio/night-drive.mp3");
        assertThat(state.songAnalysis()).isEqualTo(analysis());
        assertThat(state.tokenUsage().get(TokenCategory.ANALYSIS)).isEqualTo(250L);
    }

    @Test
    void songUploadContinuesWhenAudioUploadFails() {
        when(clipJobService.uploadAudio(any())).thenThrow(new GenerationException("render backend offline"));
        when(songAnalysisService.analyze(any(), any(), any(), any(), any())).thenReturn(GenerationResult.of(analysis(), 10));

        service.processSongUpload(song(), null);

        ProjectState state = settled();
        assertThat(state.stage()).isEqualTo(Stage.CONTROLS);
        assertThat(state.audioUrl()).isNull();
        assertThat(state.apiError()).isNull();
        assertThat(meterRegistry.counter("music_video.audio_upload.failures").count()).isEqualTo(1.0);
    }

    @Test
    void songAnalysisFailureRaisesApiError() {
        when(songAnalysisService.analyze(any(), any(), any(), any(), any())).thenThrow(new GenerationException(""));

        service.processSongUpload(song(), null);

        ProjectState state = settled();
        assertThat(state.stage()).isEqualTo(Stage.UPLOAD);
        assertThat(state.processing()).isFalse();
        assertThat(state.apiError()).isEqualTo("Failed to analyze song.");
    }

    @Test
    void songUploadRejectsEmptyFile() {
        SongUploadDetails details = new SongUploadDetails(null, null, null, null, null);

        assertThatThrownBy(() -> service.processSongUpload(null, details))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Song file is required.");
        verifyNoInteractions(songAnalysisService, clipJobService);
        assertThat(service.currentState().lastError()).isEqualTo("Song file is required.");
        assertThat(service.currentState().processing()).isFalse();
    }

    @Test
    void creativeAssetsProduceBiblesStoryboardImagesAndTransitions() {
        seed(ProjectState.initial().toBuilder().stage(Stage.CONTROLS).song(song()).songAnalysis(analysis()).build());
        Storyboard planned = storyboard(scene("scene-1", shot("s1", 0, 4, null), shot("s2", 4, 8, null)));
        List<Transition> transitions = List.of(new Transition("Crossfade", 0.5, "soft"));
        when(creativeDirector.generateBibles(any(), any(), any(), any())).thenReturn(GenerationResult.of(bibles(), 100));
        when(creativeDirector.generateStoryboard(any(), any(), any(), any(), any())).thenReturn(GenerationResult.of(planned, 200));
        when(imageGenerator.generateCharacterImage(any(), any(), any())).thenReturn(GenerationResult.of("https://img/ava.png", 5));
        when(imageGenerator.generateLocationImage(any(), any(), any())).thenReturn(GenerationResult.of("https://img/rooftop.png", 5));
        when(creativeDirector.generateTransitions(any(), any(), any())).thenReturn(GenerationResult.of(transitions, 7));

        service.generateCreativeAssets();

        ProjectState state = settled();
        assertThat(state.stage()).isEqualTo(Stage.STORYBOARD);
        assertThat(state.processing()).isFalse();
        assertThat(state.bibles().findCharacter("Ava").orElseThrow().sourceImages()).containsExactly("https://img/ava.png");
        assertThat(state.bibles().findLocation("Rooftop").orElseThrow().sourceImages()).containsExactly("https://img/rooftop.png");
        assertThat(state.storyboard().scenes().get(0).transitions()).isEqualTo(transitions);
        assertThat(state.tokenUsage().get(TokenCategory.BIBLES)).isEqualTo(100L);
        assertThat(state.tokenUsage().get(TokenCategory.STORYBOARD)).isEqualTo(200L);
        assertThat(state.tokenUsage().get(TokenCategory.IMAGE_GENERATION)).isEqualTo(10L);
        assertThat(state.tokenUsage().get(TokenCategory.TRANSITIONS)).isEqualTo(7L);
    }

    @Test
    void storyboardFailureRevertsToControlsAndKeepsBibles() {
        seed(ProjectState.initial().toBuilder().stage(Stage.CONTROLS).song(song()).songAnalysis(analysis()).build());
        when(creativeDirector.generateBibles(any(), any(), any(), any())).thenReturn(GenerationResult.of(bibles(), 100));
        when(imageGenerator.generateCharacterImage(any(), any(), any())).thenReturn(GenerationResult.of("https://img/ava.png", 5));
        when(imageGenerator.generateLocationImage(any(), any(), any())).thenReturn(GenerationResult.of("https://img/rooftop.png", 5));
        when(creativeDirector.generateStoryboard(any(), any(), any(), any(), any()))
                .thenThrow(new GenerationException("Storyboard model returned no scenes."));

        service.generateCreativeAssets();

        ProjectState state = settled();
        assertThat(state.stage()).isEqualTo(Stage.CONTROLS);
        assertThat(state.processing()).isFalse();
        assertThat(state.apiError()).isEqualTo("Storyboard model returned no scenes.");
        assertThat(state.bibles()).isNotNull();
        assertThat(state.storyboard()).isNull();
        assertThat(meterRegistry.counter("music_video.planning.failures").count()).isEqualTo(1.0);
    }

    @Test
    void creativeAssetsRequireAnalysis() {
        ProjectState before = stateStore.current();

        assertThatThrownBy(() -> service.generateCreativeAssets()).isInstanceOf(IllegalStateException.class);

        assertThat(stateStore.current()).isSameAs(before);
        verifyNoInteractions(creativeDirector);
    }

    @Test
    void bibleImageFailureMarksOnlyThatEntry() {
        seed(stateWithStoryboard(storyboard(scene("scene-1", shot("s1", 0, 4, null)))));
        when(imageGenerator.generateCharacterImage(any(), any(), any())).thenThrow(new GenerationException("quota exceeded"));
        when(imageGenerator.generateLocationImage(any(), any(), any())).thenReturn(GenerationResult.of("https://img/rooftop.png", 5));

        BatchSummary summary = service.generateBibleImages(bibles(), CreativeBrief.defaults(), ModelTier.FREEMIUM);

        ProjectState state = settled();
        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(state.bibles().findCharacter("Ava").orElseThrow().sourceImages()).containsExactly(AssetState.ERROR_SENTINEL);
        assertThat(state.bibles().findLocation("Rooftop").orElseThrow().sourceImages()).containsExactly("https://img/rooftop.png");
        assertThat(state.apiError()).isEqualTo("quota exceeded");
    }

    @Test
    void shotImageBatchSkipsReadyAndFailedShots() {
        seed(stateWithStoryboard(storyboard(scene(
                "scene-1",
                shot("s1", 0, 4, null),
                shot("s2", 4, 8, "https://img/s2.png"),
                shot("s3", 8, 12, AssetState.ERROR_SENTINEL)))));
        when(imageGenerator.generateShotImage(any(), any(), any(), any())).thenReturn(GenerationResult.of("https://img/s1.png", 5));

        service.generateAllShotImages();

        ProjectState state = settled();
        verify(imageGenerator, times(1)).generateShotImage(argThat(shot -> shot.id().equals("s1")), any(), any(), any());
        assertThat(state.storyboard().findShot("s1").orElseThrow().previewImageUrl()).isEqualTo("https://img/s1.png");
        assertThat(state.storyboard().findShot("s3").orElseThrow().imageState()).isEqualTo(AssetState.FAILED);

        service.generateAllShotImages();

        assertThat(settled()).isSameAs(state);
        verifyNoMoreInteractions(imageGenerator);
    }

    @Test
    void failedImageEditRestoresOriginalImage() {
        seed(stateWithStoryboard(storyboard(scene("scene-1", shot("s1", 0, 4, "https://img/original.png")))));
        when(imageGenerator.editShotImage(any(), any(), any(), eq("make it rain")))
                .thenThrow(new GenerationException("edit model unavailable"));

        service.editShotImage("s1", "  make it rain ");

        ProjectState state = settled();
        assertThat(state.storyboard().findShot("s1").orElseThrow().previewImageUrl()).isEqualTo("https://img/original.png");
        assertThat(state.apiError()).isEqualTo("edit model unavailable");
    }

    @Test
    void imageEditRequiresInstructionAndReadyImage() {
        seed(stateWithStoryboard(storyboard(scene("scene-1", shot("s1", 0, 4, null)))));

        assertThatThrownBy(() -> service.editShotImage("s1", " ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.editShotImage("s1", "brighter")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> service.editShotImage("missing", "brighter")).isInstanceOf(NoSuchElementException.class);
        verifyNoInteractions(imageGenerator);
    }

    @Test
    void clipRequiresReadyImage() {
        seed(stateWithStoryboard(storyboard(scene("scene-1", shot("s1", 0, 4, null)))));

        assertThatThrownBy(() -> service.generateClip("s1", ClipQuality.DRAFT))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("needs a generated image");
        assertThat(service.generateClipAndWait("s1", ClipQuality.DRAFT)).isFalse();
        verifyNoInteractions(clipJobService);
    }

    @Test
    void clipIsSubmittedWithDerivedParametersAndRecorded() {
        seed(stateWithStoryboard(storyboard(scene("scene-1", shot("s1", 0, 4, "https://img/s1.png"))))
                .toBuilder()
                .audioUrl("https://render/audio/song.mp3")
                .build());
        when(clipJobService.submit(any())).thenReturn("job-1");
        when(clipJobService.status("job-1")).thenReturn(new ClipJobStatus(true, "https://clip/s1.mp4", 100, "done", null));

        service.generateClip("s1", null);

        ProjectState state = settled();
        ArgumentCaptor<ClipGenerationRequest> requestCaptor = ArgumentCaptor.forClass(ClipGenerationRequest.class);
        verify(clipJobService).submit(requestCaptor.capture());
        ClipGenerationRequest request = requestCaptor.getValue();
        assertThat(request.shotId()).isEqualTo("s1");
        assertThat(request.imageUrl()).isEqualTo("https://img/s1.png");
        assertThat(request.quality()).isEqualTo("draft");
        assertThat(request.duration()).isEqualTo(4.0);
        assertThat(request.fps()).isEqualTo(24);
        assertThat(request.cameraMotion()).isEqualTo(CameraMotion.ZOOM_IN);
        assertThat(request.audioUrl()).isEqualTo("https://render/audio/song.mp3");
        assertThat(request.prompt()).startsWith("(Ava, wearing leather jacket:1.3)");

        StoryboardShot shot = state.storyboard().findShot("s1").orElseThrow();
        assertThat(shot.clipUrl()).isEqualTo("https://clip/s1.mp4");
        assertThat(shot.generatingClip()).isFalse();
    }

    @Test
    void storyboardClipsRunInStartOrderAndReportFailures() {
        seed(stateWithStoryboard(storyboard(
                scene("scene-1", shot("s2", 4, 8, "https://img/s2.png"), shot("s1", 0, 4, "https://img/s1.png")),
                scene("scene-2", shot("s3", 2, 6, "https://img/s3.png"), shot("s4", 6, 10, null)))));
        when(clipJobService.submit(any())).thenAnswer(invocation -> {
            ClipGenerationRequest request = invocation.getArgument(0);
            if (request.shotId().equals("s3")) {
                throw new GenerationException("render queue full");
            }
            return "job-" + request.shotId();
        });
        when(clipJobService.status(anyString())).thenAnswer(invocation ->
                new ClipJobStatus(true, "https://clip/" + invocation.getArgument(0) + ".mp4", 100, "done", null));

        service.generateStoryboardClips(null);

        ProjectState state = settled();
        ArgumentCaptor<ClipGenerationRequest> requestCaptor = ArgumentCaptor.forClass(ClipGenerationRequest.class);
        verify(clipJobService, times(3)).submit(requestCaptor.capture());
        assertThat(requestCaptor.getAllValues()).extracting(ClipGenerationRequest::shotId).containsExactly("s1", "s3", "s2");
        assertThat(requestCaptor.getAllValues()).extracting(ClipGenerationRequest::quality).containsOnly("high");
        assertThat(state.apiError()).isEqualTo("Some clips failed to generate: s3");
        assertThat(state.storyboard().findShot("s2").orElseThrow().clipUrl()).isEqualTo("https://clip/job-s2.mp4");
        assertThat(state.storyboard().findShot("s3").orElseThrow().generatingClip()).isFalse();
        assertThat(state.storyboard().findShot("s4").orElseThrow().clipUrl()).isNull();
        assertThat(meterRegistry.counter("music_video.clips.failures").count()).isEqualTo(1.0);
    }

    @Test
    void timedOutClipIsReportedAsFailure() {
        seed(stateWithStoryboard(storyboard(scene("scene-1", shot("s1", 0, 4, "https://img/s1.png")))));
        when(clipJobService.submit(any())).thenReturn("job-1");
        when(clipJobService.status("job-1")).thenReturn(new ClipJobStatus(false, null, 20, "running", null));

        assertThat(service.generateClipAndWait("s1", ClipQuality.HIGH)).isFalse();

        ProjectState state = settled();
        verify(clipJobService, times(5)).status("job-1");
        assertThat(state.apiError()).isEqualTo("Video generation timed out after 5 attempts");
        assertThat(state.storyboard().findShot("s1").orElseThrow().generatingClip()).isFalse();
    }

    @Test
    void reviewFallsBackWhenAgentsFail() {
        seed(stateWithStoryboard(storyboard(scene("scene-1", shot("s1", 0, 4, "https://img/s1.png")))));
        when(creativeDirector.reviewProduction(any(), any(), any(), any())).thenThrow(new GenerationException("review timeout"));
        when(visualReviewer.audit(any(), any(), any())).thenThrow(new GenerationException(null));

        service.startReview();

        ProjectState state = settled();
        assertThat(state.stage()).isEqualTo(Stage.REVIEW);
        assertThat(state.reviewState().executiveFeedback()).isEqualTo(ExecutiveProducerFeedback.failed());
        assertThat(state.reviewState().visualStatus()).isEqualTo(ReviewStatus.COMPLETE);
        assertThat(state.reviewState().visualReport()).isNull();
        assertThat(state.apiError()).isEqualTo("Visual QA agent failed to review generated visuals.");
    }

    @Test
    void visualReviewIsSkippedWithoutGeneratedVisuals() {
        seed(stateWithStoryboard(storyboard(scene(
                "scene-1",
                shot("s1", 0, 4, null),
                shot("s2", 4, 8, AssetState.ERROR_SENTINEL)))));

        service.runVisualReview();

        ProjectState state = settled();
        assertThat(state.reviewState().visualStatus()).isEqualTo(ReviewStatus.COMPLETE);
        assertThat(state.reviewState().visualReport()).isNull();
        verifyNoInteractions(visualReviewer);
    }

    @Test
    void colorCorrectionMarksEveryShot() {
        seed(stateWithStoryboard(storyboard(
                scene("scene-1", shot("s1", 0, 4, null)),
                scene("scene-2", shot("s2", 4, 8, null)))));

        service.applyPostProduction(PostProductionTask.COLOR);

        ProjectState state = settled();
        assertThat(state.postProductionTasks().color()).isEqualTo(TaskStatus.DONE);
        assertThat(state.storyboard().allShots())
                .allSatisfy(shot -> assertThat(shot.postProductionEnhancements().colorCorrected()).isTrue());
    }

    @Test
    void beatSyncedVfxAppliesSuggestionsAndResetsOnFailure() {
        seed(stateWithStoryboard(storyboard(scene("scene-1", shot("s1", 0, 4, null), shot("s2", 4, 8, null)))));
        when(creativeDirector.suggestBeatSyncedVfx(any(), any(), any()))
                .thenReturn(GenerationResult.of(Map.of("s2", "Glitch"), 30))
                .thenThrow(new GenerationException("vfx agent down"));

        service.applyPostProduction(PostProductionTask.VFX);
        ProjectState applied = settled();
        service.applyPostProduction(PostProductionTask.VFX);
        ProjectState failed = settled();

        assertThat(applied.storyboard().findShot("s2").orElseThrow().vfx()).isEqualTo("Glitch");
        assertThat(applied.storyboard().findShot("s1").orElseThrow().vfx()).isEqualTo("None");
        assertThat(applied.postProductionTasks().vfx()).isEqualTo(TaskStatus.DONE);
        assertThat(applied.tokenUsage().get(TokenCategory.POST_PRODUCTION)).isEqualTo(30L);
        assertThat(failed.postProductionTasks().vfx()).isEqualTo(TaskStatus.IDLE);
        assertThat(failed.apiError()).isEqualTo("vfx agent down");
    }

    @Test
    void vfxTextIsNormalized() {
        seed(stateWithStoryboard(storyboard(scene("scene-1", shot("s1", 0, 4, null)))));

        ProjectState glitch = service.setShotVfx("s1", "  Glitch ");
        ProjectState cleared = service.setShotVfx("s1", "");

        assertThat(glitch.storyboard().findShot("s1").orElseThrow().vfx()).isEqualTo("Glitch");
        assertThat(cleared.storyboard().findShot("s1").orElseThrow().vfx()).isEqualTo("None");
    }

    @Test
    void exportedSnapshotImportsIntoFreshProject() throws Exception {
        seed(stateWithStoryboard(storyboard(scene("scene-1", shot("s1", 0, 4, "https://img/s1.png")))));
        String document = service.exportSnapshot();
        service.reset();

        SnapshotLoadResult result = service.importSnapshot(document);

        assertThat(result.audioMissing()).isFalse();
        ProjectState state = service.currentState();
        assertThat(state.stage()).isEqualTo(Stage.STORYBOARD);
        assertThat(state.song()).isEqualTo(song());
        assertThat(state.storyboard().findShot("s1").orElseThrow().previewImageUrl()).isEqualTo("https://img/s1.png");
    }

    @Test
    void unreadableSnapshotKeepsProjectAndRecordsError() {
        seed(stateWithStoryboard(storyboard(scene("scene-1", shot("s1", 0, 4, "https://img/s1.png")))));

        assertThatThrownBy(() -> service.importSnapshot("not json"))
                .isInstanceOf(SnapshotFormatException.class);

        ProjectState state = service.currentState();
        assertThat(state.storyboard().findShot("s1")).isPresent();
        assertThat(state.lastError()).startsWith("Failed to load project file: ");
    }

    @Test
    void lastErrorIsClearedWhenProcessingStarts() {
        assertThatThrownBy(() -> service.processSongUpload(null, null)).isInstanceOf(IllegalArgumentException.class);
        when(songAnalysisService.analyze(any(), any(), any(), any(), any())).thenReturn(GenerationResult.of(analysis(), 10));

        service.processSongUpload(song(), null);

        assertThat(settled().lastError()).isNull();
    }

    @Test
    void clipNotificationForUnknownShotIsIgnored() {
        seed(stateWithStoryboard(storyboard(scene("scene-1", shot("s1", 0, 4, "https://img/s1.png")))));

        assertThat(service.onClipReady(new ClipReadyNotification(
                "missing", null, "https://clip/x.mp4"))).isEmpty();
        verify(clipJobService, never()).status(anyString());
    }

    private void seed(ProjectState state) {
        stateStore.dispatchAndWait(new ProjectEvent.StateReplaced(state));
    }

    private ProjectState settled() {
        return stateStore.dispatchAndWait(new ProjectEvent.TokenUsageRecorded(Map.of()));
    }
}
