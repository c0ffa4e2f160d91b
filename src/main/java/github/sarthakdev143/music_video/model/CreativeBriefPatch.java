package github.sarthakdev143.music_video.model;

import java.util.List;

/**
 * Partial creative brief. Null fields are left untouched when applied.
 */
public record CreativeBriefPatch(
        String feel,
        String style,
        List<String> mood,
        String videoType,
        Boolean lyricsOverlay,
        String userNotes,
        List<String> colorPalette) {

    public CreativeBriefPatch {
        mood = mood == null ? null : List.copyOf(mood);
        colorPalette = colorPalette == null ? null : List.copyOf(colorPalette);
    }

    public static CreativeBriefPatch empty() {
        return new CreativeBriefPatch(null, null, null, null, null, null, null);
    }
}
