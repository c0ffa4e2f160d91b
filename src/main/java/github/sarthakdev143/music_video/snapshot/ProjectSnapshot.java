package github.sarthakdev143.music_video.snapshot;

import com.fasterxml.jackson.annotation.JsonInclude;
import github.sarthakdev143.music_video.model.Bibles;
import github.sarthakdev143.music_video.model.CreativeBrief;
import github.sarthakdev143.music_video.model.ModelTier;
import github.sarthakdev143.music_video.model.SingerGender;
import github.sarthakdev143.music_video.model.SongAnalysis;
import github.sarthakdev143.music_video.model.Stage;
import github.sarthakdev143.music_video.model.Storyboard;
import github.sarthakdev143.music_video.model.TokenUsage;

/**
 * Downloadable project document. Generation progress, review results and errors are session
 * state and are not part of it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectSnapshot(
        Stage stage,
        SingerGender gender,
        SongAnalysis songAnalysis,
        CreativeBrief creativeBrief,
        Bibles bibles,
        Storyboard storyboard,
        TokenUsage tokenUsage,
        ModelTier modelTier,
        SnapshotAudio audio) {
}
