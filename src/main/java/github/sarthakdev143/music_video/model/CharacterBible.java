package github.sarthakdev143.music_video.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record CharacterBible(
        String name,
        String role,
        String appearance,
        String wardrobe,
        String personality,
        List<String> sourceImages) implements BibleEntry {

    public CharacterBible {
        sourceImages = sourceImages == null ? List.of() : List.copyOf(sourceImages);
    }

    @Override
    @JsonIgnore
    public BibleKind kind() {
        return BibleKind.CHARACTER;
    }

    public CharacterBible withSourceImages(List<String> images) {
        return new CharacterBible(name, role, appearance, wardrobe, personality, images);
    }
}
