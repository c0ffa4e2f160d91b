package github.sarthakdev143.music_video.model;

import java.util.List;

public record CreativeBrief(
        String feel,
        String style,
        List<String> mood,
        String videoType,
        Boolean lyricsOverlay,
        String userNotes,
        List<String> colorPalette) {

    public static final String DEFAULT_VIDEO_TYPE = "Story Narrative";

    public CreativeBrief {
        feel = feel == null ? "" : feel;
        style = style == null ? "" : style;
        mood = mood == null ? List.of() : List.copyOf(mood);
        videoType = videoType == null || videoType.isBlank() ? DEFAULT_VIDEO_TYPE : videoType;
        lyricsOverlay = lyricsOverlay == null ? Boolean.TRUE : lyricsOverlay;
        userNotes = userNotes == null ? "" : userNotes;
        colorPalette = colorPalette == null ? List.of() : List.copyOf(colorPalette);
    }

    public static CreativeBrief defaults() {
        return new CreativeBrief("", "", List.of(), DEFAULT_VIDEO_TYPE, true, "", List.of());
    }

    /**
     * Shallow merge: every non-null field of the patch replaces the current value.
     */
    public CreativeBrief apply(CreativeBriefPatch patch) {
        if (patch == null) {
            return this;
        }
        return new CreativeBrief(
                patch.feel() != null ? patch.feel() : feel,
                patch.style() != null ? patch.style() : style,
                patch.mood() != null ? patch.mood() : mood,
                patch.videoType() != null ? patch.videoType() : videoType,
                patch.lyricsOverlay() != null ? patch.lyricsOverlay() : lyricsOverlay,
                patch.userNotes() != null ? patch.userNotes() : userNotes,
                patch.colorPalette() != null ? patch.colorPalette() : colorPalette);
    }
}
