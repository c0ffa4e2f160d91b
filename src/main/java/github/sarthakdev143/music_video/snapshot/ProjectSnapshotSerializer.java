package github.sarthakdev143.music_video.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.music_video.model.Bibles;
import github.sarthakdev143.music_video.model.CreativeBrief;
import github.sarthakdev143.music_video.model.CreativeBriefPatch;
import github.sarthakdev143.music_video.model.ModelTier;
import github.sarthakdev143.music_video.model.ProjectState;
import github.sarthakdev143.music_video.model.SingerGender;
import github.sarthakdev143.music_video.model.SongAnalysis;
import github.sarthakdev143.music_video.model.SongSource;
import github.sarthakdev143.music_video.model.Stage;
import github.sarthakdev143.music_video.model.Storyboard;
import github.sarthakdev143.music_video.model.StoryboardScene;
import github.sarthakdev143.music_video.model.StoryboardShot;
import github.sarthakdev143.music_video.model.TokenUsage;
import github.sarthakdev143.music_video.model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Converts a project to its downloadable JSON document and back. Loading validates the tree
 * field by field: a malformed field falls back to its default instead of failing the load.
 */
@Component
public class ProjectSnapshotSerializer {

    private static final Logger logger = LoggerFactory.getLogger(ProjectSnapshotSerializer.class);

    private final ObjectMapper objectMapper;

    public ProjectSnapshotSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ProjectSnapshot toSnapshot(ProjectState state) {
        return new ProjectSnapshot(
                state.stage(),
                state.singerGender(),
                state.songAnalysis(),
                state.creativeBrief(),
                state.bibles(),
                state.storyboard(),
                state.tokenUsage(),
                state.modelTier(),
                encodeAudio(state.song()));
    }

    public String save(ProjectState state) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toSnapshot(state));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize project snapshot", e);
        }
    }

    public SnapshotLoadResult load(String document) throws SnapshotFormatException {
        if (document == null || document.isBlank()) {
            throw new SnapshotFormatException("Snapshot document is empty.");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw new SnapshotFormatException("Invalid or corrupt production file.", e);
        }
        if (root == null || !root.isObject()) {
            throw new SnapshotFormatException("JSON file is not a valid state object.");
        }

        SongSource song = decodeAudio(root.get("audio"));
        ProjectState state = ProjectState.initial().toBuilder()
                .stage(readEnum(root, "stage", Stage::fromInput, Stage.UPLOAD))
                .singerGender(readEnum(root, "gender", SingerGender::fromInput, SingerGender.UNSPECIFIED))
                .modelTier(readEnum(root, "modelTier", ModelTier::fromInput, ModelTier.FREEMIUM))
                .songAnalysis(readValue(root.get("songAnalysis"), SongAnalysis.class))
                .creativeBrief(readCreativeBrief(root.get("creativeBrief")))
                .bibles(readBibles(root.get("bibles")))
                .storyboard(readStoryboard(root.get("storyboard")))
                .tokenUsage(readTokenUsage(root.get("tokenUsage")))
                .song(song)
                .build();

        return new SnapshotLoadResult(state, song == null);
    }

    private SnapshotAudio encodeAudio(SongSource song) {
        if (song == null) {
            return null;
        }
        return new SnapshotAudio(song.fileName(), song.mimeType(), Base64.getEncoder().encodeToString(song.data()));
    }

    private SongSource decodeAudio(JsonNode node) {
        if (node == null || !node.isObject() || !node.path("encodedData").isTextual()) {
            logger.warn("Snapshot has no audio data; the song must be uploaded again");
            return null;
        }
        try {
            byte[] data = Base64.getDecoder().decode(node.get("encodedData").asText());
            return new SongSource(textOrNull(node, "name"), textOrNull(node, "mimeType"), data);
        } catch (IllegalArgumentException e) {
            logger.warn("Snapshot audio could not be decoded: {}", e.getMessage());
            return null;
        }
    }

    private <E extends Enum<E>> E readEnum(JsonNode root, String field, Function<String, E> parser, E fallback) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual()) {
            return fallback;
        }
        try {
            E value = parser.apply(node.asText());
            return value == null ? fallback : value;
        } catch (IllegalArgumentException e) {
            logger.debug("Snapshot field {} has unknown value {}", field, node.asText());
            return fallback;
        }
    }

    private CreativeBrief readCreativeBrief(JsonNode node) {
        if (node == null || !node.isObject()) {
            return CreativeBrief.defaults();
        }
        CreativeBriefPatch patch = readValue(node, CreativeBriefPatch.class);
        return CreativeBrief.defaults().apply(patch);
    }

    private Bibles readBibles(JsonNode node) {
        if (node == null || !node.path("characters").isArray() || !node.path("locations").isArray()) {
            return null;
        }
        return readValue(node, Bibles.class);
    }

    private Storyboard readStoryboard(JsonNode node) {
        if (node == null || !node.path("scenes").isArray()) {
            return null;
        }
        List<StoryboardScene> scenes = new ArrayList<>();
        for (JsonNode sceneNode : node.get("scenes")) {
            if (sceneNode == null || !sceneNode.isObject()) {
                continue;
            }
            scenes.add(new StoryboardScene(
                    textOrNull(sceneNode, "id"),
                    textOrNull(sceneNode, "section"),
                    sceneNode.path("start").asDouble(0),
                    sceneNode.path("end").asDouble(0),
                    textOrNull(sceneNode, "description"),
                    readShots(sceneNode.get("shots")),
                    readTransitions(sceneNode.get("transitions"))));
        }
        return new Storyboard(scenes);
    }

    private List<StoryboardShot> readShots(JsonNode node) {
        List<StoryboardShot> shots = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return shots;
        }
        for (JsonNode shotNode : node) {
            StoryboardShot shot = readValue(shotNode, StoryboardShot.class);
            if (shot == null) {
                continue;
            }
            // no clip job survives a reload
            shots.add(shot.generatingClip() ? shot.withClipState(false, shot.generationProgress(), shot.clipUrl()) : shot);
        }
        return shots;
    }

    private List<Transition> readTransitions(JsonNode node) {
        List<Transition> transitions = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return transitions;
        }
        for (JsonNode transitionNode : node) {
            transitions.add(transitionNode == null || transitionNode.isNull()
                    ? null
                    : readValue(transitionNode, Transition.class));
        }
        return transitions;
    }

    private TokenUsage readTokenUsage(JsonNode node) {
        if (node == null || !node.isObject()) {
            return TokenUsage.initial();
        }
        Map<String, Object> values = readValue(node, new TypeReference<Map<String, Object>>() { });
        return values == null ? TokenUsage.initial() : TokenUsage.initial().overlay(TokenUsage.of(values));
    }

    private <T> T readValue(JsonNode node, Class<T> type) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.debug("Dropping malformed {} from snapshot: {}", type.getSimpleName(), e.getMessage());
            return null;
        }
    }

    private <T> T readValue(JsonNode node, TypeReference<T> type) {
        try {
            return objectMapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            logger.debug("Dropping malformed snapshot value: {}", e.getMessage());
            return null;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
