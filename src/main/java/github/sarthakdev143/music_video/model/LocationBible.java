package github.sarthakdev143.music_video.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record LocationBible(
        String name,
        String settingType,
        String timeOfDay,
        String weather,
        String dominantMood,
        String architecturalStyle,
        List<String> keyFeatures,
        List<String> sourceImages) implements BibleEntry {

    public LocationBible {
        keyFeatures = keyFeatures == null ? List.of() : List.copyOf(keyFeatures);
        sourceImages = sourceImages == null ? List.of() : List.copyOf(sourceImages);
    }

    @Override
    @JsonIgnore
    public BibleKind kind() {
        return BibleKind.LOCATION;
    }

    public LocationBible withSourceImages(List<String> images) {
        return new LocationBible(
                name,
                settingType,
                timeOfDay,
                weather,
                dominantMood,
                architecturalStyle,
                keyFeatures,
                images);
    }
}
