package github.sarthakdev143.music_video.integration;

import github.sarthakdev143.music_video.model.GenerationResult;
import github.sarthakdev143.music_video.model.ModelTier;
import github.sarthakdev143.music_video.model.SongAnalysis;
import github.sarthakdev143.music_video.model.SongSource;

public interface SongAnalysisService {

    GenerationResult<SongAnalysis> analyze(
            SongSource audio,
            String lyrics,
            String title,
            String artist,
            ModelTier modelTier);
}
