package github.sarthakdev143.music_video.integration.gateway;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.music_video.config.MusicVideoProperties;
import github.sarthakdev143.music_video.integration.CreativeDirector;
import github.sarthakdev143.music_video.integration.GenerationException;
import github.sarthakdev143.music_video.integration.ImageGenerator;
import github.sarthakdev143.music_video.integration.SongAnalysisService;
import github.sarthakdev143.music_video.integration.VisualReviewer;
import github.sarthakdev143.music_video.model.Bibles;
import github.sarthakdev143.music_video.model.CharacterBible;
import github.sarthakdev143.music_video.model.CreativeBrief;
import github.sarthakdev143.music_video.model.CreativeBriefPatch;
import github.sarthakdev143.music_video.model.ExecutiveProducerFeedback;
import github.sarthakdev143.music_video.model.GenerationResult;
import github.sarthakdev143.music_video.model.LocationBible;
import github.sarthakdev143.music_video.model.ModelTier;
import github.sarthakdev143.music_video.model.MoodboardImage;
import github.sarthakdev143.music_video.model.SingerGender;
import github.sarthakdev143.music_video.model.SongAnalysis;
import github.sarthakdev143.music_video.model.SongSource;
import github.sarthakdev143.music_video.model.Storyboard;
import github.sarthakdev143.music_video.model.StoryboardScene;
import github.sarthakdev143.music_video.model.StoryboardShot;
import github.sarthakdev143.music_video.model.Transition;
import github.sarthakdev143.music_video.model.VisualContinuityReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AI collaborators reached through a JSON generation gateway. Every operation is a
 * {@code POST {baseUrl}/{operation}} whose answer is {@code {"result": ..., "tokenUsage": n}}.
 */
@Component
public class GenerationGatewayClient implements SongAnalysisService, CreativeDirector, ImageGenerator, VisualReviewer {

    private static final Logger logger = LoggerFactory.getLogger(GenerationGatewayClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public GenerationGatewayClient(
            @Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            MusicVideoProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        String configured = properties.gateway().baseUrl();
        this.baseUrl = configured.endsWith("/") ? configured.substring(0, configured.length() - 1) : configured;
    }

    @Override
    public GenerationResult<SongAnalysis> analyze(
            SongSource audio,
            String lyrics,
            String title,
            String artist,
            ModelTier modelTier) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("audio", encodeFile(audio.fileName(), audio.mimeType(), audio.data()));
        body.put("lyrics", lyrics);
        body.put("title", title);
        body.put("artist", artist);
        body.put("modelTier", modelTier);
        return call("analyze-song", body, new TypeReference<SongAnalysis>() { });
    }

    @Override
    public GenerationResult<Bibles> generateBibles(
            SongAnalysis analysis,
            CreativeBrief brief,
            SingerGender singerGender,
            ModelTier modelTier) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("songAnalysis", analysis);
        body.put("creativeBrief", brief);
        body.put("singerGender", singerGender);
        body.put("modelTier", modelTier);
        return call("generate-bibles", body, new TypeReference<Bibles>() { });
    }

    @Override
    public GenerationResult<Storyboard> generateStoryboard(
            SongAnalysis analysis,
            CreativeBrief brief,
            Bibles bibles,
            SingerGender singerGender,
            ModelTier modelTier) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("songAnalysis", analysis);
        body.put("creativeBrief", brief);
        body.put("bibles", bibles);
        body.put("singerGender", singerGender);
        body.put("modelTier", modelTier);
        return call("generate-storyboard", body, new TypeReference<Storyboard>() { });
    }

    @Override
    public GenerationResult<List<Transition>> generateTransitions(
            StoryboardScene scene,
            CreativeBrief brief,
            ModelTier modelTier) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("scene", scene);
        body.put("creativeBrief", brief);
        body.put("modelTier", modelTier);
        return call("generate-transitions", body, new TypeReference<List<Transition>>() { });
    }

    @Override
    public GenerationResult<CreativeBriefPatch> suggestBrief(
            SongAnalysis analysis,
            CreativeBrief brief,
            ModelTier modelTier) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("songAnalysis", analysis);
        body.put("creativeBrief", brief);
        body.put("modelTier", modelTier);
        return call("suggest-brief", body, new TypeReference<CreativeBriefPatch>() { });
    }

    @Override
    public GenerationResult<CreativeBriefPatch> analyzeMoodboard(List<MoodboardImage> images, ModelTier modelTier) {
        List<Map<String, Object>> encoded = new ArrayList<>(images.size());
        for (MoodboardImage image : images) {
            encoded.add(encodeFile(image.fileName(), image.mimeType(), image.data()));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("images", encoded);
        body.put("modelTier", modelTier);
        return call("analyze-moodboard", body, new TypeReference<CreativeBriefPatch>() { });
    }

    @Override
    public GenerationResult<Map<String, String>> suggestBeatSyncedVfx(
            SongAnalysis analysis,
            Storyboard storyboard,
            ModelTier modelTier) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("songAnalysis", analysis);
        body.put("storyboard", storyboard);
        body.put("modelTier", modelTier);
        return call("suggest-vfx", body, new TypeReference<Map<String, String>>() { });
    }

    @Override
    public GenerationResult<ExecutiveProducerFeedback> reviewProduction(
            Storyboard storyboard,
            Bibles bibles,
            CreativeBrief brief,
            ModelTier modelTier) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("storyboard", storyboard);
        body.put("bibles", bibles);
        body.put("creativeBrief", brief);
        body.put("modelTier", modelTier);
        return call("review-production", body, new TypeReference<ExecutiveProducerFeedback>() { });
    }

    @Override
    public GenerationResult<String> generateCharacterImage(
            CharacterBible character,
            CreativeBrief brief,
            ModelTier modelTier) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("character", character);
        body.put("creativeBrief", brief);
        body.put("modelTier", modelTier);
        return call("generate-character-image", body, new TypeReference<String>() { });
    }

    @Override
    public GenerationResult<String> generateLocationImage(
            LocationBible location,
            CreativeBrief brief,
            ModelTier modelTier) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("location", location);
        body.put("creativeBrief", brief);
        body.put("modelTier", modelTier);
        return call("generate-location-image", body, new TypeReference<String>() { });
    }

    @Override
    public GenerationResult<String> generateShotImage(
            StoryboardShot shot,
            Bibles bibles,
            CreativeBrief brief,
            ModelTier modelTier) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("shot", shot);
        body.put("bibles", bibles);
        body.put("creativeBrief", brief);
        body.put("modelTier", modelTier);
        return call("generate-shot-image", body, new TypeReference<String>() { });
    }

    @Override
    public GenerationResult<String> editShotImage(
            StoryboardShot shot,
            Bibles bibles,
            CreativeBrief brief,
            String instruction) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("shot", shot);
        body.put("bibles", bibles);
        body.put("creativeBrief", brief);
        body.put("instruction", instruction);
        return call("edit-shot-image", body, new TypeReference<String>() { });
    }

    @Override
    public GenerationResult<VisualContinuityReport> audit(Storyboard storyboard, Bibles bibles, CreativeBrief brief) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("storyboard", storyboard);
        body.put("bibles", bibles);
        body.put("creativeBrief", brief);
        return call("audit-visuals", body, new TypeReference<VisualContinuityReport>() { });
    }

    <T> GenerationResult<T> call(String operation, Map<String, Object> body, TypeReference<T> resultType) {
        JsonNode response;
        try {
            response = restTemplate.postForObject(baseUrl + "/" + operation, body, JsonNode.class);
        } catch (RestClientException e) {
            throw new GenerationException("Generation operation " + operation + " failed: " + e.getMessage(), e);
        }

        if (response == null || !response.hasNonNull("result")) {
            throw new GenerationException("Generation operation " + operation + " returned no result.");
        }

        T result;
        try {
            result = objectMapper.convertValue(response.get("result"), resultType);
        } catch (IllegalArgumentException e) {
            throw new GenerationException("Generation operation " + operation + " returned an unreadable result.", e);
        }

        long usage = Math.max(0L, response.path("tokenUsage").asLong(0L));
        logger.debug("Generation operation {} used {} tokens", operation, usage);
        return GenerationResult.of(result, usage);
    }

    private static Map<String, Object> encodeFile(String fileName, String mimeType, byte[] data) {
        Map<String, Object> file = new LinkedHashMap<>();
        file.put("name", fileName);
        file.put("mimeType", mimeType);
        file.put("data", Base64.getEncoder().encodeToString(data));
        return file;
    }
}
