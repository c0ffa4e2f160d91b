package github.sarthakdev143.music_video.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A storyboard scene. {@code transitions} is index-aligned with the gaps after each shot and may
 * hold null entries.
 */
public record StoryboardScene(
        String id,
        String section,
        double start,
        double end,
        String description,
        List<StoryboardShot> shots,
        List<Transition> transitions) {

    public StoryboardScene {
        shots = shots == null ? List.of() : List.copyOf(shots);
        transitions = transitions == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(transitions));
    }

    public StoryboardScene withShots(List<StoryboardShot> updatedShots) {
        return new StoryboardScene(id, section, start, end, description, updatedShots, transitions);
    }

    public StoryboardScene withTransitions(List<Transition> updatedTransitions) {
        return new StoryboardScene(id, section, start, end, description, shots, updatedTransitions);
    }
}
