package github.sarthakdev143.music_video.generation;

import github.sarthakdev143.music_video.model.GenerationResult;

/**
 * Receives the outcome of each batch item. Called on the runner's thread, in item order.
 */
public interface BatchItemHandler<T, R> {

    void onSuccess(T item, GenerationResult<R> result);

    void onFailure(T item, Exception error);
}
