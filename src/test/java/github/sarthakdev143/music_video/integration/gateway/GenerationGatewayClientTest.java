package github.sarthakdev143.music_video.integration.gateway;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.music_video.config.MusicVideoProperties;
import github.sarthakdev143.music_video.integration.GenerationException;
import github.sarthakdev143.music_video.model.CreativeBrief;
import github.sarthakdev143.music_video.model.CreativeBriefPatch;
import github.sarthakdev143.music_video.model.GenerationResult;
import github.sarthakdev143.music_video.model.ModelTier;
import github.sarthakdev143.music_video.model.MoodboardImage;
import github.sarthakdev143.music_video.model.Transition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static github.sarthakdev143.music_video.ProductionFixtures.analysis;
import static github.sarthakdev143.music_video.ProductionFixtures.scene;
import static github.sarthakdev143.music_video.ProductionFixtures.shot;
import static github.sarthakdev143.music_video.ProductionFixtures.storyboard;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GenerationGatewayClientTest {

    private MockRestServiceServer server;
    private GenerationGatewayClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        MusicVideoProperties properties = new MusicVideoProperties(
                null,
                null,
                null,
                new MusicVideoProperties.Gateway("http://gateway.test/api/generation/", null, null));
        ObjectMapper objectMapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        client = new GenerationGatewayClient(restTemplate, objectMapper, properties);
    }

    @Test
    void transitionsAreReadFromResultWithUsage() {
        server.expect(requestTo("http://gateway.test/api/generation/generate-transitions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.scene.id").value("scene-1"))
                .andExpect(jsonPath("$.modelTier").value("PREMIUM"))
                .andRespond(withSuccess(
                        "{\"result\":[{\"type\":\"Whip pan\",\"durationSec\":0.3,\"description\":\"fast\"}],\"tokenUsage\":64}",
                        MediaType.APPLICATION_JSON));

        GenerationResult<List<Transition>> result = client.generateTransitions(
                scene("scene-1", shot("s1", 0, 4, null)),
                CreativeBrief.defaults(),
                ModelTier.PREMIUM);

        assertThat(result.value()).containsExactly(new Transition("Whip pan", 0.3, "fast"));
        assertThat(result.usageCost()).isEqualTo(64L);
        server.verify();
    }

    @Test
    void vfxSuggestionsMapShotIdsToEffects() {
        server.expect(requestTo("http://gateway.test/api/generation/suggest-vfx"))
                .andExpect(jsonPath("$.storyboard.scenes[0].shots[0].id").value("s1"))
                .andRespond(withSuccess("{\"result\":{\"s1\":\"Light leak\"}}", MediaType.APPLICATION_JSON));

        GenerationResult<Map<String, String>> result = client.suggestBeatSyncedVfx(
                analysis(),
                storyboard(scene("scene-1", shot("s1", 0, 4, null))),
                ModelTier.FREEMIUM);

        assertThat(result.value()).containsEntry("s1", "Light leak");
        assertThat(result.usageCost()).isZero();
    }

    @Test
    void moodboardImagesAreBase64Encoded() {
        server.expect(requestTo("http://gateway.test/api/generation/analyze-moodboard"))
                .andExpect(jsonPath("$.images[0].name").value("ref.png"))
                .andExpect(jsonPath("$.images[0].mimeType").value("image/png"))
                .andExpect(jsonPath("$.images[0].data").value("AQID"))
                .andRespond(withSuccess(
                        "{\"result\":{\"style\":\"Film noir\",\"colorPalette\":[\"#101010\"]},\"tokenUsage\":12}",
                        MediaType.APPLICATION_JSON));

        GenerationResult<CreativeBriefPatch> result = client.analyzeMoodboard(
                List.of(new MoodboardImage("ref.png", "image/png", new byte[]{1, 2, 3})),
                ModelTier.FREEMIUM);

        assertThat(result.value().style()).isEqualTo("Film noir");
        assertThat(result.value().feel()).isNull();
        assertThat(result.value().colorPalette()).containsExactly("#101010");
    }

    @Test
    void missingResultIsAGenerationFailure() {
        server.expect(requestTo("http://gateway.test/api/generation/generate-character-image"))
                .andRespond(withSuccess("{\"tokenUsage\":3}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.generateCharacterImage(null, CreativeBrief.defaults(), ModelTier.FREEMIUM))
                .isInstanceOf(GenerationException.class)
                .hasMessage("Generation operation generate-character-image returned no result.");
    }

    @Test
    void transportErrorsAreWrapped() {
        server.expect(requestTo("http://gateway.test/api/generation/suggest-brief"))
                .andRespond(withBadRequest());

        assertThatThrownBy(() -> client.suggestBrief(analysis(), CreativeBrief.defaults(), ModelTier.FREEMIUM))
                .isInstanceOf(GenerationException.class)
                .hasMessageStartingWith("Generation operation suggest-brief failed:");
    }
}
