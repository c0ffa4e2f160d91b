package github.sarthakdev143.music_video.generation;

import github.sarthakdev143.music_video.model.GenerationResult;

@FunctionalInterface
public interface ItemGenerator<T, R> {

    GenerationResult<R> generate(T item) throws Exception;
}
