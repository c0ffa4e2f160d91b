package github.sarthakdev143.music_video.clip;

import github.sarthakdev143.music_video.model.Bibles;
import github.sarthakdev143.music_video.model.CharacterBible;
import github.sarthakdev143.music_video.model.CinematicEnhancements;
import github.sarthakdev143.music_video.model.CreativeBrief;
import github.sarthakdev143.music_video.model.LocationBible;
import github.sarthakdev143.music_video.model.StoryboardShot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds the text prompt sent with a clip job. High quality jobs get a descriptive prompt, drafts
 * a short weighted one that fits a CLIP token window.
 */
@Component
public class ClipPromptBuilder {

    static final String CONCERT_VIDEO_TYPE = "Concert Performance";

    public String build(StoryboardShot shot, Bibles bibles, CreativeBrief brief, boolean detailed) {
        return detailed ? detailedPrompt(shot, bibles, brief) : draftPrompt(shot, bibles, brief);
    }

    private String detailedPrompt(StoryboardShot shot, Bibles bibles, CreativeBrief brief) {
        CinematicEnhancements cinematics = shot.cinematicEnhancements();
        List<String> parts = new ArrayList<>();
        parts.add("Animate this scene for a music video.");

        String characters = describeCharacters(shot, bibles, true);
        if (!characters.isEmpty()) {
            parts.add("Characters: " + characters);
        }
        findLocation(shot, bibles).ifPresent(location -> parts.add("Setting: Location \"" + location.name() + "\": "
                + location.settingType() + ", " + location.timeOfDay() + ", " + location.weather()
                + " weather, " + location.dominantMood() + " mood. Architecture: " + location.architecturalStyle()
                + ". Key features: " + String.join(", ", location.keyFeatures()) + "."));
        parts.add("Subject: " + shot.subject());
        if (hasText(shot.action())) {
            parts.add("Character Action: " + shot.action());
        }
        parts.add("Shot type: " + shot.shotType() + ", " + shot.composition());
        parts.add("Camera: " + cinematics.cameraMotion() + " motion, " + shot.cameraMove());
        parts.add("Cinematography: " + cinematics.lightingStyle() + " lighting, using " + cinematics.cameraLens());
        parts.add("Visual style: " + brief.style() + ", " + brief.feel());
        if (!brief.colorPalette().isEmpty()) {
            parts.add("Color palette: " + String.join(", ", brief.colorPalette()));
        }
        if (CONCERT_VIDEO_TYPE.equals(brief.videoType())) {
            parts.add("Live concert performance energy, stage lighting, audience atmosphere.");
        }
        if (shot.lipSyncHint()) {
            parts.add("Align mouth movements to implied singing (lip-synced look).");
        }
        parts.add(String.format(Locale.ROOT, "Duration: %.1f seconds", shot.duration()));
        return String.join(" ", parts);
    }

    private String draftPrompt(StoryboardShot shot, Bibles bibles, CreativeBrief brief) {
        List<String> parts = new ArrayList<>();
        String characters = describeCharacters(shot, bibles, false);
        parts.add(characters.isEmpty() ? "(person:1.2)" : characters);
        parts.add(hasText(shot.action()) ? shot.subject() + ", " + shot.action() : shot.subject());
        findLocation(shot, bibles).ifPresent(location ->
                parts.add("(" + location.settingType() + ", " + location.timeOfDay() + ":1.1)"));
        parts.add("(" + shot.cinematicEnhancements().cameraMotion() + ":1.2)");
        parts.add("(" + brief.style() + ", " + brief.feel() + ":1.1)");
        parts.add("(high quality, cinematic:1.2)");
        return String.join(", ", parts);
    }

    private String describeCharacters(StoryboardShot shot, Bibles bibles, boolean detailed) {
        if (bibles == null) {
            return "";
        }
        List<String> descriptions = new ArrayList<>();
        for (String ref : shot.characterRefs()) {
            Optional<CharacterBible> match = bibles.findCharacter(ref);
            if (match.isEmpty()) {
                continue;
            }
            CharacterBible character = match.get();
            descriptions.add(detailed
                    ? "Character \"" + character.name() + "\": " + character.appearance()
                            + ". Wearing " + character.wardrobe() + ". Performance style: " + character.personality() + "."
                    : "(" + character.name() + ", wearing " + character.wardrobe() + ":1.3)");
        }
        return String.join(", ", descriptions);
    }

    private Optional<LocationBible> findLocation(StoryboardShot shot, Bibles bibles) {
        if (bibles == null || shot.locationRef() == null) {
            return Optional.empty();
        }
        return bibles.findLocation(shot.locationRef());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
