package github.sarthakdev143.music_video.integration;

import github.sarthakdev143.music_video.model.Bibles;
import github.sarthakdev143.music_video.model.CreativeBrief;
import github.sarthakdev143.music_video.model.CreativeBriefPatch;
import github.sarthakdev143.music_video.model.ExecutiveProducerFeedback;
import github.sarthakdev143.music_video.model.GenerationResult;
import github.sarthakdev143.music_video.model.MoodboardImage;
import github.sarthakdev143.music_video.model.ModelTier;
import github.sarthakdev143.music_video.model.SingerGender;
import github.sarthakdev143.music_video.model.SongAnalysis;
import github.sarthakdev143.music_video.model.Storyboard;
import github.sarthakdev143.music_video.model.StoryboardScene;
import github.sarthakdev143.music_video.model.Transition;

import java.util.List;
import java.util.Map;

/**
 * Text generation collaborator covering pre-production planning and review.
 */
public interface CreativeDirector {

    GenerationResult<Bibles> generateBibles(
            SongAnalysis analysis,
            CreativeBrief brief,
            SingerGender singerGender,
            ModelTier modelTier);

    GenerationResult<Storyboard> generateStoryboard(
            SongAnalysis analysis,
            CreativeBrief brief,
            Bibles bibles,
            SingerGender singerGender,
            ModelTier modelTier);

    GenerationResult<List<Transition>> generateTransitions(
            StoryboardScene scene,
            CreativeBrief brief,
            ModelTier modelTier);

    GenerationResult<CreativeBriefPatch> suggestBrief(SongAnalysis analysis, CreativeBrief brief, ModelTier modelTier);

    GenerationResult<CreativeBriefPatch> analyzeMoodboard(List<MoodboardImage> images, ModelTier modelTier);

    /**
     * @return VFX name per shot id
     */
    GenerationResult<Map<String, String>> suggestBeatSyncedVfx(
            SongAnalysis analysis,
            Storyboard storyboard,
            ModelTier modelTier);

    GenerationResult<ExecutiveProducerFeedback> reviewProduction(
            Storyboard storyboard,
            Bibles bibles,
            CreativeBrief brief,
            ModelTier modelTier);
}
