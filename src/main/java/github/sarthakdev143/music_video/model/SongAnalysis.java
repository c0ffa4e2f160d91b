package github.sarthakdev143.music_video.model;

import java.util.List;

public record SongAnalysis(
        String title,
        String artist,
        int bpm,
        List<String> mood,
        String genre,
        List<String> instrumentation,
        List<SongSection> structure,
        List<Beat> beats,
        LyricAnalysis lyricAnalysis,
        List<String> recommendedVideoTypes) {

    public SongAnalysis {
        mood = mood == null ? List.of() : List.copyOf(mood);
        instrumentation = instrumentation == null ? List.of() : List.copyOf(instrumentation);
        structure = structure == null ? List.of() : List.copyOf(structure);
        beats = beats == null ? List.of() : List.copyOf(beats);
        recommendedVideoTypes = recommendedVideoTypes == null ? List.of() : List.copyOf(recommendedVideoTypes);
    }
}
