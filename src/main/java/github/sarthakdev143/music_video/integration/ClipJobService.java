package github.sarthakdev143.music_video.integration;

import github.sarthakdev143.music_video.model.SongSource;

/**
 * Asynchronous clip rendering. A submitted job is identified by the returned id and polled
 * through {@link #status(String)}.
 */
public interface ClipJobService {

    String submit(ClipGenerationRequest request);

    ClipJobStatus status(String jobId);

    String uploadAudio(SongSource song);
}
