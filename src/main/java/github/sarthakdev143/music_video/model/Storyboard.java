package github.sarthakdev143.music_video.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public record Storyboard(List<StoryboardScene> scenes) {

    public Storyboard {
        scenes = scenes == null ? List.of() : List.copyOf(scenes);
    }

    public List<StoryboardShot> allShots() {
        List<StoryboardShot> shots = new ArrayList<>();
        for (StoryboardScene scene : scenes) {
            shots.addAll(scene.shots());
        }
        return shots;
    }

    public Optional<StoryboardShot> findShot(String shotId) {
        if (shotId == null) {
            return Optional.empty();
        }
        for (StoryboardScene scene : scenes) {
            for (StoryboardShot shot : scene.shots()) {
                if (shotId.equals(shot.id())) {
                    return Optional.of(shot);
                }
            }
        }
        return Optional.empty();
    }

    public Optional<StoryboardScene> findSceneOf(String shotId) {
        return scenes.stream()
                .filter(scene -> scene.shots().stream().anyMatch(shot -> shot.id().equals(shotId)))
                .findFirst();
    }

    /**
     * Applies {@code change} to the shot with the given id. Returns this instance when no shot
     * matches or the change produces an equal shot.
     */
    public Storyboard updateShot(String shotId, UnaryOperator<StoryboardShot> change) {
        if (shotId == null) {
            return this;
        }
        List<StoryboardScene> updatedScenes = new ArrayList<>(scenes.size());
        boolean changed = false;
        for (StoryboardScene scene : scenes) {
            List<StoryboardShot> updatedShots = null;
            for (int index = 0; index < scene.shots().size(); index++) {
                StoryboardShot shot = scene.shots().get(index);
                if (!shotId.equals(shot.id())) {
                    continue;
                }
                StoryboardShot replacement = change.apply(shot);
                if (replacement != null && !replacement.equals(shot)) {
                    if (updatedShots == null) {
                        updatedShots = new ArrayList<>(scene.shots());
                    }
                    updatedShots.set(index, replacement);
                }
            }
            if (updatedShots != null) {
                updatedScenes.add(scene.withShots(updatedShots));
                changed = true;
            } else {
                updatedScenes.add(scene);
            }
        }
        return changed ? new Storyboard(updatedScenes) : this;
    }

    public Storyboard updateEveryShot(UnaryOperator<StoryboardShot> change) {
        List<StoryboardScene> updatedScenes = new ArrayList<>(scenes.size());
        for (StoryboardScene scene : scenes) {
            List<StoryboardShot> updatedShots = new ArrayList<>(scene.shots().size());
            for (StoryboardShot shot : scene.shots()) {
                updatedShots.add(change.apply(shot));
            }
            updatedScenes.add(scene.withShots(updatedShots));
        }
        return new Storyboard(updatedScenes);
    }

    public Storyboard withSceneTransitions(String sceneId, List<Transition> transitions) {
        if (sceneId == null) {
            return this;
        }
        List<StoryboardScene> updatedScenes = new ArrayList<>(scenes.size());
        boolean changed = false;
        for (StoryboardScene scene : scenes) {
            if (sceneId.equals(scene.id())) {
                updatedScenes.add(scene.withTransitions(transitions));
                changed = true;
            } else {
                updatedScenes.add(scene);
            }
        }
        return changed ? new Storyboard(updatedScenes) : this;
    }
}
