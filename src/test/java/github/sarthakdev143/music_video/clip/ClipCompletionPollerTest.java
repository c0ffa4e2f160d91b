package github.sarthakdev143.music_video.clip;

import github.sarthakdev143.music_video.integration.ClipJobService;
import github.sarthakdev143.music_video.integration.ClipJobStatus;
import github.sarthakdev143.music_video.model.StoryboardShot;
import github.sarthakdev143.music_video.state.ProjectEvent;
import github.sarthakdev143.music_video.state.ProjectStateMachine;
import github.sarthakdev143.music_video.state.ProjectStateStore;
import github.sarthakdev143.music_video.support.Sleeper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static github.sarthakdev143.music_video.ProductionFixtures.scene;
import static github.sarthakdev143.music_video.ProductionFixtures.shot;
import static github.sarthakdev143.music_video.ProductionFixtures.stateWithStoryboard;
import static github.sarthakdev143.music_video.ProductionFixtures.storyboard;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClipCompletionPollerTest {

    private static final Sleeper NO_WAIT = duration -> {
    };

    @Mock
    private ClipJobService clipJobService;

    private ProjectStateStore stateStore;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        stateStore = new ProjectStateStore(new ProjectStateMachine());
        stateStore.dispatchAndWait(new ProjectEvent.StateReplaced(
                stateWithStoryboard(storyboard(scene("scene-1", shot("s1", 0, 4, "https://img/s1.png"))))));
        stateStore.dispatchAndWait(new ProjectEvent.ClipGenerationStarted("s1"));
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        stateStore.destroy();
    }

    @Test
    void awaitCompletionReportsProgressThenCompletes() throws Exception {
        when(clipJobService.status("job-1")).thenReturn(
                new ClipJobStatus(false, null, 40, "running", null),
                new ClipJobStatus(true, "https://clip/s1.mp4", 100, "done", null));

        String clipUrl = poller(NO_WAIT, 10).awaitCompletion("s1", "job-1");

        assertThat(clipUrl).isEqualTo("https://clip/s1.mp4");
        StoryboardShot shot = stateStore.current().storyboard().findShot("s1").orElseThrow();
        assertThat(shot.clipUrl()).isEqualTo("https://clip/s1.mp4");
        assertThat(shot.generatingClip()).isFalse();
        assertThat(shot.generationProgress()).isEqualTo(100);
        assertThat(meterRegistry.counter("music_video.clips.completed").count()).isEqualTo(1.0);
    }

    @Test
    void awaitCompletionFailsOnBackendError() {
        when(clipJobService.status("job-1")).thenReturn(new ClipJobStatus(false, null, null, "failed", "GPU out of memory"));

        assertThatThrownBy(() -> poller(NO_WAIT, 10).awaitCompletion("s1", "job-1"))
                .isInstanceOf(ClipGenerationException.class)
                .hasMessage("GPU out of memory");
    }

    @Test
    void awaitCompletionTimesOutAfterMaxAttempts() {
        when(clipJobService.status("job-1")).thenReturn(new ClipJobStatus(false, null, 10, "queued", null));

        assertThatThrownBy(() -> poller(NO_WAIT, 3).awaitCompletion("s1", "job-1"))
                .isInstanceOf(ClipTimeoutException.class)
                .hasMessage("Video generation timed out after 3 attempts");

        verify(clipJobService, times(3)).status("job-1");
        assertThat(meterRegistry.counter("music_video.clips.timeouts").count()).isEqualTo(1.0);
        StoryboardShot shot = stateStore.dispatchAndWait(new ProjectEvent.TokenUsageRecorded(Map.of()))
                .storyboard().findShot("s1").orElseThrow();
        assertThat(shot.clipUrl()).isNull();
        assertThat(shot.generationProgress()).isEqualTo(10);
        assertThat(meterRegistry.counter("music_video.clips.completed").count()).isZero();
    }

    @Test
    void failingStatusCallsCountAsAttempts() throws Exception {
        when(clipJobService.status("job-1"))
                .thenThrow(new ResourceAccessException("connection refused"))
                .thenReturn(null)
                .thenReturn(new ClipJobStatus(true, "https://clip/s1.mp4", null, "done", null));

        String clipUrl = poller(NO_WAIT, 3).awaitCompletion("s1", "job-1");

        assertThat(clipUrl).isEqualTo("https://clip/s1.mp4");
    }

    @Test
    void secondPollForSameShotIsRejected() throws Exception {
        AtomicReference<Throwable> rejection = new AtomicReference<>();
        AtomicReference<ClipCompletionPoller> pollerRef = new AtomicReference<>();
        Sleeper reentrant = duration -> {
            try {
                pollerRef.get().awaitCompletion("s1", "job-2");
            } catch (IllegalStateException | ClipGenerationException e) {
                rejection.compareAndSet(null, e);
            }
        };
        ClipCompletionPoller poller = poller(reentrant, 5);
        pollerRef.set(poller);
        when(clipJobService.status("job-1")).thenReturn(new ClipJobStatus(true, "https://clip/s1.mp4", 100, "done", null));

        poller.awaitCompletion("s1", "job-1");

        assertThat(rejection.get())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already being polled");
        assertThat(poller.isPolling("s1")).isFalse();
    }

    @Test
    void notificationSettlesActivePoll() throws Exception {
        AtomicInteger sleeps = new AtomicInteger();
        AtomicReference<ClipNotificationHandler> handlerRef = new AtomicReference<>();
        Sleeper notifyOnSecondSleep = duration -> {
            if (sleeps.incrementAndGet() == 2) {
                handlerRef.get().onClipReady(new ClipReadyNotification(null, "job-1", "https://clip/pushed.mp4"));
            }
        };
        ClipCompletionPoller poller = poller(notifyOnSecondSleep, 10);
        handlerRef.set(new ClipNotificationHandler(poller, stateStore));
        when(clipJobService.status("job-1")).thenReturn(new ClipJobStatus(false, null, 30, "running", null));

        String clipUrl = poller.awaitCompletion("s1", "job-1");

        assertThat(clipUrl).isEqualTo("https://clip/pushed.mp4");
        verify(clipJobService, times(1)).status("job-1");
        assertThat(stateStore.current().storyboard().findShot("s1").orElseThrow().clipUrl())
                .isEqualTo("https://clip/pushed.mp4");
    }

    private ClipCompletionPoller poller(Sleeper sleeper, int maxAttempts) {
        return new ClipCompletionPoller(clipJobService, stateStore, sleeper, Duration.ZERO, maxAttempts, meterRegistry);
    }
}
