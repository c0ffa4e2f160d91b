package github.sarthakdev143.music_video.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public record Bibles(List<CharacterBible> characters, List<LocationBible> locations) {

    public Bibles {
        characters = characters == null ? List.of() : List.copyOf(characters);
        locations = locations == null ? List.of() : List.copyOf(locations);
    }

    public Optional<BibleEntry> findEntry(BibleKind kind, String name) {
        List<? extends BibleEntry> entries = kind == BibleKind.CHARACTER ? characters : locations;
        return entries.stream()
                .filter(entry -> entry.name() != null && entry.name().equals(name))
                .map(BibleEntry.class::cast)
                .findFirst();
    }

    public Optional<LocationBible> findLocation(String name) {
        return locations.stream().filter(location -> location.name() != null && location.name().equals(name)).findFirst();
    }

    public Optional<CharacterBible> findCharacter(String name) {
        return characters.stream().filter(character -> character.name() != null && character.name().equals(name)).findFirst();
    }

    /**
     * Returns this instance when no entry carries the given name.
     */
    public Bibles withEntryImages(BibleKind kind, String name, List<String> images) {
        boolean changed = false;
        if (kind == BibleKind.CHARACTER) {
            List<CharacterBible> updated = new ArrayList<>(characters.size());
            for (CharacterBible character : characters) {
                if (!changed && name != null && name.equals(character.name())) {
                    updated.add(character.withSourceImages(images));
                    changed = true;
                } else {
                    updated.add(character);
                }
            }
            return changed ? new Bibles(updated, locations) : this;
        }

        List<LocationBible> updated = new ArrayList<>(locations.size());
        for (LocationBible location : locations) {
            if (!changed && name != null && name.equals(location.name())) {
                updated.add(location.withSourceImages(images));
                changed = true;
            } else {
                updated.add(location);
            }
        }
        return changed ? new Bibles(characters, updated) : this;
    }
}
