package github.sarthakdev143.music_video.model;

import java.util.List;

public record LyricAnalysis(
        List<String> themes,
        String narrativeStructure,
        String imageryStyle,
        String emotionalArc,
        List<String> keyVisualElements) {

    public LyricAnalysis {
        themes = themes == null ? List.of() : List.copyOf(themes);
        keyVisualElements = keyVisualElements == null ? List.of() : List.copyOf(keyVisualElements);
    }
}
