package github.sarthakdev143.music_video.integration;

import github.sarthakdev143.music_video.model.Bibles;
import github.sarthakdev143.music_video.model.CreativeBrief;
import github.sarthakdev143.music_video.model.GenerationResult;
import github.sarthakdev143.music_video.model.Storyboard;
import github.sarthakdev143.music_video.model.VisualContinuityReport;

public interface VisualReviewer {

    GenerationResult<VisualContinuityReport> audit(Storyboard storyboard, Bibles bibles, CreativeBrief brief);
}
