package github.sarthakdev143.music_video.integration.backend;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import github.sarthakdev143.music_video.config.MusicVideoProperties;
import github.sarthakdev143.music_video.integration.ClipGenerationRequest;
import github.sarthakdev143.music_video.integration.ClipJobService;
import github.sarthakdev143.music_video.integration.ClipJobStatus;
import github.sarthakdev143.music_video.integration.GenerationException;
import github.sarthakdev143.music_video.model.SongSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * {@link ClipJobService} backed by the render backend's HTTP API.
 */
@Component
public class RenderBackendClient implements ClipJobService {

    private static final Logger logger = LoggerFactory.getLogger(RenderBackendClient.class);

    static final String GENERATE_CLIP_PATH = "/api/comfyui/generate-video-clip";
    static final String CLIP_STATUS_PATH = "/api/comfyui/video-status/{jobId}";
    static final String AUDIO_UPLOAD_PATH = "/api/audio/upload";

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public RenderBackendClient(
            @Qualifier("renderBackendRestTemplate") RestTemplate restTemplate,
            MusicVideoProperties properties) {
        this.restTemplate = restTemplate;
        this.baseUrl = trimTrailingSlash(properties.renderBackend().baseUrl());
    }

    @Override
    public String submit(ClipGenerationRequest request) {
        SubmitResponse response;
        try {
            response = restTemplate.postForObject(baseUrl + GENERATE_CLIP_PATH, request, SubmitResponse.class);
        } catch (RestClientException e) {
            throw new GenerationException("Failed to generate video clip: " + e.getMessage(), e);
        }

        if (response == null || response.promptId() == null || response.promptId().isBlank()) {
            throw new GenerationException("Render backend did not return a job id for shot " + request.shotId() + ".");
        }
        logger.info("Submitted clip job {} for shot {}", response.promptId(), request.shotId());
        return response.promptId();
    }

    @Override
    public ClipJobStatus status(String jobId) {
        try {
            ClipJobStatus status = restTemplate.getForObject(baseUrl + CLIP_STATUS_PATH, ClipJobStatus.class, jobId);
            if (status == null) {
                throw new GenerationException("Empty status response for clip job " + jobId + ".");
            }
            return status;
        } catch (RestClientException e) {
            throw new GenerationException("Failed to get video status: " + e.getMessage(), e);
        }
    }

    @Override
    public String uploadAudio(SongSource song) {
        ByteArrayResource resource = new ByteArrayResource(song.data()) {
            @Override
            public String getFilename() {
                return song.fileName();
            }
        };
        HttpHeaders partHeaders = new HttpHeaders();
        partHeaders.setContentType(audioMediaType(song.mimeType()));

        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("audio", new HttpEntity<>(resource, partHeaders));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        AudioUploadResponse response;
        try {
            response = restTemplate.postForObject(
                    baseUrl + AUDIO_UPLOAD_PATH,
                    new HttpEntity<>(body, headers),
                    AudioUploadResponse.class);
        } catch (RestClientException e) {
            throw new GenerationException("Failed to upload audio: " + e.getMessage(), e);
        }

        if (response == null || response.url() == null || response.url().isBlank()) {
            throw new GenerationException("Render backend did not return an audio URL.");
        }
        return response.url();
    }

    private static MediaType audioMediaType(String mimeType) {
        try {
            return MediaType.parseMediaType(mimeType);
        } catch (InvalidMediaTypeException e) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SubmitResponse(String promptId, String message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AudioUploadResponse(String url, String filename) {
    }
}
