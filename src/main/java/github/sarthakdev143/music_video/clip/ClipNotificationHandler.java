package github.sarthakdev143.music_video.clip;

import github.sarthakdev143.music_video.model.ProjectState;
import github.sarthakdev143.music_video.model.StoryboardShot;
import github.sarthakdev143.music_video.state.ProjectEvent;
import github.sarthakdev143.music_video.state.ProjectStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class ClipNotificationHandler {

    private static final Logger logger = LoggerFactory.getLogger(ClipNotificationHandler.class);

    private final ClipCompletionPoller poller;
    private final ProjectStateStore stateStore;

    public ClipNotificationHandler(ClipCompletionPoller poller, ProjectStateStore stateStore) {
        this.poller = poller;
        this.stateStore = stateStore;
    }

    /**
     * Completes the addressed shot's clip while that clip is being generated. Unknown targets,
     * missing URLs, idle shots and repeated notifications leave the project unchanged.
     *
     * @return the shot id that was updated, empty when nothing changed
     */
    public Optional<String> onClipReady(ClipReadyNotification notification) {
        if (notification == null || notification.url() == null || notification.url().isBlank()) {
            return Optional.empty();
        }
        String target = notification.target();
        if (target == null || target.isBlank()) {
            return Optional.empty();
        }

        String shotId = poller.shotForJob(target).orElse(target);
        if (!isGenerating(findShot(stateStore.current(), shotId))) {
            logger.debug("Ignoring clip notification for {}: no clip in flight", target);
            return Optional.empty();
        }

        ProjectState after = stateStore.dispatchAndWait(new ProjectEvent.ClipCompleted(shotId, notification.url()));
        Optional<StoryboardShot> updated = findShot(after, shotId);
        if (isGenerating(updated) || !updated.map(shot -> notification.url().equals(shot.clipUrl())).orElse(false)) {
            logger.debug("Ignoring clip notification for {}: shot changed before it applied", target);
            return Optional.empty();
        }

        poller.markSettled(shotId, notification.url());
        logger.info("Clip for shot {} delivered by notification", shotId);
        return Optional.of(shotId);
    }

    private static Optional<StoryboardShot> findShot(ProjectState state, String shotId) {
        if (state == null || state.storyboard() == null) {
            return Optional.empty();
        }
        return state.storyboard().findShot(shotId);
    }

    private static boolean isGenerating(Optional<StoryboardShot> shot) {
        return shot.map(StoryboardShot::generatingClip).orElse(false);
    }
}
