package github.sarthakdev143.music_video.state;

import github.sarthakdev143.music_video.model.ProjectState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Owner of the current {@link ProjectState}. Events are queued on a single writer thread and
 * applied one at a time in arrival order, so callers on any thread never share mutable state.
 */
@Component
public class ProjectStateStore implements DisposableBean {

    private static final Logger logger = LoggerFactory.getLogger(ProjectStateStore.class);

    private final ProjectStateMachine stateMachine;
    private final ExecutorService writer;
    private volatile ProjectState current = ProjectState.initial();

    public ProjectStateStore(ProjectStateMachine stateMachine) {
        this.stateMachine = stateMachine;
        this.writer = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "project-state-writer");
            thread.setDaemon(true);
            return thread;
        });
    }

    public ProjectState current() {
        return current;
    }

    public CompletableFuture<ProjectState> dispatch(ProjectEvent event) {
        return CompletableFuture.supplyAsync(() -> apply(event), writer);
    }

    /**
     * Dispatches and blocks until the event has been applied. Must not be called from the writer
     * thread itself.
     */
    public ProjectState dispatchAndWait(ProjectEvent event) {
        try {
            return dispatch(event).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw e;
        }
    }

    private ProjectState apply(ProjectEvent event) {
        ProjectState previous = current;
        ProjectState next = stateMachine.transition(previous, event);
        if (next.stage() != previous.stage()) {
            logger.info("Project stage changed {} -> {} on {}", previous.stage(), next.stage(),
                    event.getClass().getSimpleName());
        }
        if (next.apiError() != null && !next.apiError().equals(previous.apiError())) {
            logger.warn("Project API error raised: {}", next.apiError());
        }
        current = next;
        return next;
    }

    @Override
    public void destroy() throws InterruptedException {
        writer.shutdown();
        if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
            writer.shutdownNow();
        }
    }
}
