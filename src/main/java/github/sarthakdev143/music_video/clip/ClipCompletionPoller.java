package github.sarthakdev143.music_video.clip;

import github.sarthakdev143.music_video.config.MusicVideoProperties;
import github.sarthakdev143.music_video.integration.ClipJobService;
import github.sarthakdev143.music_video.integration.ClipJobStatus;
import github.sarthakdev143.music_video.state.ProjectEvent;
import github.sarthakdev143.music_video.state.ProjectStateStore;
import github.sarthakdev143.music_video.support.Sleeper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Polls the render backend until a clip job finishes. At most one poll runs per shot; a push
 * notification can settle the shot while its poll is still sleeping.
 */
@Component
public class ClipCompletionPoller {

    private static final Logger logger = LoggerFactory.getLogger(ClipCompletionPoller.class);

    private final ClipJobService clipJobService;
    private final ProjectStateStore stateStore;
    private final Sleeper sleeper;
    private final Duration pollInterval;
    private final int maxAttempts;
    private final Map<String, ActivePoll> activePolls = new ConcurrentHashMap<>();
    private final Counter completedCounter;
    private final Counter timeoutCounter;

    @Autowired
    public ClipCompletionPoller(
            ClipJobService clipJobService,
            ProjectStateStore stateStore,
            MusicVideoProperties properties,
            MeterRegistry meterRegistry) {
        this(
                clipJobService,
                stateStore,
                Sleeper.system(),
                properties.clips().pollInterval(),
                properties.clips().maxPollAttempts(),
                meterRegistry);
    }

    public ClipCompletionPoller(
            ClipJobService clipJobService,
            ProjectStateStore stateStore,
            Sleeper sleeper,
            Duration pollInterval,
            int maxAttempts,
            MeterRegistry meterRegistry) {
        this.clipJobService = clipJobService;
        this.stateStore = stateStore;
        this.sleeper = sleeper;
        this.pollInterval = pollInterval;
        this.maxAttempts = maxAttempts;
        this.completedCounter = meterRegistry.counter("music_video.clips.completed");
        this.timeoutCounter = meterRegistry.counter("music_video.clips.timeouts");
    }

    /**
     * Blocks until the job reports a clip URL, fails, or runs out of attempts.
     *
     * @return the finished clip URL
     * @throws IllegalStateException when the shot already has an active poll
     */
    public String awaitCompletion(String shotId, String jobId) throws ClipGenerationException {
        ActivePoll poll = new ActivePoll(jobId);
        if (activePolls.putIfAbsent(shotId, poll) != null) {
            throw new IllegalStateException("Shot " + shotId + " is already being polled.");
        }

        try {
            return poll(shotId, poll);
        } finally {
            activePolls.remove(shotId, poll);
        }
    }

    private String poll(String shotId, ActivePoll poll) throws ClipGenerationException {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ClipGenerationException(shotId, "Clip polling was interrupted", e);
            }

            if (poll.settledUrl != null) {
                logger.info("Clip for shot {} settled by notification after {} attempts", shotId, attempt);
                return poll.settledUrl;
            }

            ClipJobStatus status;
            try {
                status = clipJobService.status(poll.jobId);
            } catch (RuntimeException e) {
                logger.warn("Error polling clip status for shot {} (attempt {}): {}", shotId, attempt, e.getMessage());
                continue;
            }
            if (status == null) {
                continue;
            }

            if (status.progress() != null) {
                stateStore.dispatch(new ProjectEvent.ClipProgressUpdated(shotId, status.progress()));
            }
            if (status.isComplete()) {
                stateStore.dispatchAndWait(new ProjectEvent.ClipCompleted(shotId, status.clipUrl()));
                completedCounter.increment();
                logger.info("Clip for shot {} completed after {} attempts", shotId, attempt);
                return status.clipUrl();
            }
            if (status.isFailed()) {
                throw new ClipGenerationException(shotId, status.error());
            }
        }

        timeoutCounter.increment();
        throw new ClipTimeoutException(shotId, maxAttempts);
    }

    public Optional<String> shotForJob(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return activePolls.entrySet().stream()
                .filter(entry -> jobId.equals(entry.getValue().jobId))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public boolean isPolling(String shotId) {
        return shotId != null && activePolls.containsKey(shotId);
    }

    /**
     * Records that the shot's clip arrived through another channel. The active poll, if any,
     * returns this URL at its next attempt.
     */
    public void markSettled(String shotId, String clipUrl) {
        if (shotId == null) {
            return;
        }
        ActivePoll poll = activePolls.get(shotId);
        if (poll != null) {
            poll.settledUrl = clipUrl;
        }
    }

    private static final class ActivePoll {

        private final String jobId;
        private volatile String settledUrl;

        private ActivePoll(String jobId) {
            this.jobId = jobId;
        }
    }
}
