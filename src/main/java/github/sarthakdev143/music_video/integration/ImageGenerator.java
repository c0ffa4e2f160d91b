package github.sarthakdev143.music_video.integration;

import github.sarthakdev143.music_video.model.Bibles;
import github.sarthakdev143.music_video.model.CharacterBible;
import github.sarthakdev143.music_video.model.CreativeBrief;
import github.sarthakdev143.music_video.model.GenerationResult;
import github.sarthakdev143.music_video.model.LocationBible;
import github.sarthakdev143.music_video.model.ModelTier;
import github.sarthakdev143.music_video.model.StoryboardShot;

/**
 * Image collaborator. Every call returns the URL (or data URL) of the produced image.
 */
public interface ImageGenerator {

    GenerationResult<String> generateCharacterImage(CharacterBible character, CreativeBrief brief, ModelTier modelTier);

    GenerationResult<String> generateLocationImage(LocationBible location, CreativeBrief brief, ModelTier modelTier);

    GenerationResult<String> generateShotImage(
            StoryboardShot shot,
            Bibles bibles,
            CreativeBrief brief,
            ModelTier modelTier);

    GenerationResult<String> editShotImage(
            StoryboardShot shot,
            Bibles bibles,
            CreativeBrief brief,
            String instruction);
}
