package github.sarthakdev143.music_video.controller;

import github.sarthakdev143.music_video.clip.ClipReadyNotification;
import github.sarthakdev143.music_video.dto.ImageEditRequest;
import github.sarthakdev143.music_video.dto.ProductionJobResponse;
import github.sarthakdev143.music_video.dto.ShotVfxRequest;
import github.sarthakdev143.music_video.dto.SnapshotImportResponse;
import github.sarthakdev143.music_video.dto.SongUploadDetails;
import github.sarthakdev143.music_video.model.BibleKind;
import github.sarthakdev143.music_video.model.ClipQuality;
import github.sarthakdev143.music_video.model.CreativeBriefPatch;
import github.sarthakdev143.music_video.model.ModelTier;
import github.sarthakdev143.music_video.model.MoodboardImage;
import github.sarthakdev143.music_video.model.PostProductionTask;
import github.sarthakdev143.music_video.model.ShotMediaType;
import github.sarthakdev143.music_video.model.SingerGender;
import github.sarthakdev143.music_video.model.SongSource;
import github.sarthakdev143.music_video.service.ProductionPipelineService;
import github.sarthakdev143.music_video.snapshot.SnapshotFormatException;
import github.sarthakdev143.music_video.snapshot.SnapshotLoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/production")
public class ProductionController {

    private static final Logger logger = LoggerFactory.getLogger(ProductionController.class);
    private static final int MAX_LYRICS_LENGTH = 20_000;
    private static final int MAX_INSTRUCTION_LENGTH = 1_000;
    private static final int MAX_MOODBOARD_IMAGES = 10;
    private static final String SNAPSHOT_FILE_NAME = "music-video-production.json";

    private final ProductionPipelineService pipelineService;

    public ProductionController(ProductionPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @GetMapping("/state")
    public ResponseEntity<?> getState() {
        return ResponseEntity.ok(pipelineService.currentState());
    }

    @PostMapping(value = "/song", consumes = "multipart/form-data")
    public ResponseEntity<?> uploadSong(
            @RequestParam("song") MultipartFile song,
            @RequestParam(value = "lyrics", required = false) String lyrics,
            @RequestParam(value = "title", required = false) String title,
            @RequestParam(value = "artist", required = false) String artist,
            @RequestParam(value = "singerGender", required = false) String singerGenderInput,
            @RequestParam(value = "modelTier", required = false) String modelTierInput) {
        return respond("song analysis", () -> {
            if (song == null || song.isEmpty()) {
                throw new IllegalArgumentException("Song file is required.");
            }
            validateMimeType("song", song.getContentType(), "audio/");
            if (lyrics != null && lyrics.length() > MAX_LYRICS_LENGTH) {
                throw new IllegalArgumentException("Lyrics must be at most " + MAX_LYRICS_LENGTH + " characters.");
            }

            SongUploadDetails details = new SongUploadDetails(
                    lyrics,
                    trimToNull(title),
                    trimToNull(artist),
                    SingerGender.fromInput(singerGenderInput),
                    ModelTier.fromInput(modelTierInput));
            pipelineService.processSongUpload(
                    new SongSource(song.getOriginalFilename(), song.getContentType(), song.getBytes()),
                    details);
            return accepted("song analysis", "Song accepted. Poll /api/production/state for the analysis.");
        });
    }

    @PutMapping("/model-tier")
    public ResponseEntity<?> setModelTier(@RequestParam("modelTier") String modelTierInput) {
        return respond("model tier", () -> ResponseEntity.ok(pipelineService.setModelTier(ModelTier.fromInput(modelTierInput))));
    }

    @PatchMapping("/brief")
    public ResponseEntity<?> updateBrief(@RequestBody CreativeBriefPatch patch) {
        return respond("creative brief", () -> ResponseEntity.ok(pipelineService.updateCreativeBrief(patch)));
    }

    @PostMapping("/brief/suggestions")
    public ResponseEntity<?> suggestBrief() {
        return respond("director suggestions", () -> {
            pipelineService.requestDirectorSuggestions();
            return accepted("director suggestions", "Director suggestions requested.");
        });
    }

    @PostMapping(value = "/brief/moodboard", consumes = "multipart/form-data")
    public ResponseEntity<?> analyzeMoodboard(@RequestParam("images") List<MultipartFile> images) {
        return respond("moodboard analysis", () -> {
            if (images == null || images.isEmpty()) {
                throw new IllegalArgumentException("At least one moodboard image is required.");
            }
            if (images.size() > MAX_MOODBOARD_IMAGES) {
                throw new IllegalArgumentException("A maximum of " + MAX_MOODBOARD_IMAGES + " moodboard images is allowed.");
            }

            List<MoodboardImage> moodboard = new ArrayList<>(images.size());
            for (MultipartFile image : images) {
                validateMimeType("images", image.getContentType(), "image/");
                moodboard.add(new MoodboardImage(image.getOriginalFilename(), image.getContentType(), image.getBytes()));
            }
            pipelineService.analyzeMoodboard(moodboard);
            return accepted("moodboard analysis", "Moodboard analysis started.");
        });
    }

    @PostMapping("/plan")
    public ResponseEntity<?> generatePlan() {
        return respond("planning", () -> {
            pipelineService.generateCreativeAssets();
            return accepted("planning", "Bible and storyboard generation started.");
        });
    }

    @PostMapping("/images")
    public ResponseEntity<?> generateImages() {
        return respond("shot images", () -> {
            pipelineService.generateAllShotImages();
            return accepted("shot images", "Image generation started for shots without an image.");
        });
    }

    @PostMapping("/shots/{shotId}/image")
    public ResponseEntity<?> regenerateShotImage(@PathVariable String shotId) {
        return respond("shot image", () -> {
            pipelineService.regenerateShotImage(shotId);
            return accepted("shot image", "Image regeneration started for shot " + shotId + ".");
        });
    }

    @PostMapping("/shots/{shotId}/image/edit")
    public ResponseEntity<?> editShotImage(@PathVariable String shotId, @RequestBody ImageEditRequest request) {
        return respond("image edit", () -> {
            String instruction = request == null ? null : request.instruction();
            if (instruction == null || instruction.isBlank()) {
                throw new IllegalArgumentException("instruction is required.");
            }
            if (instruction.length() > MAX_INSTRUCTION_LENGTH) {
                throw new IllegalArgumentException("instruction must be at most " + MAX_INSTRUCTION_LENGTH + " characters.");
            }
            pipelineService.editShotImage(shotId, instruction);
            return accepted("image edit", "Image edit started for shot " + shotId + ".");
        });
    }

    @PostMapping("/bibles/{kind}/{name}/image")
    public ResponseEntity<?> regenerateBibleImage(@PathVariable String kind, @PathVariable String name) {
        return respond("bible image", () -> {
            pipelineService.regenerateBibleImage(BibleKind.fromInput(kind), name);
            return accepted("bible image", "Image regeneration started for " + name + ".");
        });
    }

    @PostMapping("/shots/{shotId}/clip")
    public ResponseEntity<?> generateClip(
            @PathVariable String shotId,
            @RequestParam(value = "quality", required = false) String qualityInput) {
        return respond("clip", () -> {
            pipelineService.generateClip(shotId, ClipQuality.fromInput(qualityInput, ClipQuality.DRAFT));
            return accepted("clip", "Clip generation started for shot " + shotId + ".");
        });
    }

    @PostMapping("/shots/{shotId}/clip/regenerate")
    public ResponseEntity<?> regenerateClip(
            @PathVariable String shotId,
            @RequestParam(value = "quality", required = false) String qualityInput) {
        return respond("clip", () -> {
            pipelineService.generateClip(shotId, ClipQuality.fromInput(qualityInput, ClipQuality.HIGH));
            return accepted("clip", "Clip regeneration started for shot " + shotId + ".");
        });
    }

    @PostMapping("/clips")
    public ResponseEntity<?> generateClips(@RequestParam(value = "quality", required = false) String qualityInput) {
        return respond("storyboard clips", () -> {
            pipelineService.generateStoryboardClips(ClipQuality.fromInput(qualityInput, ClipQuality.HIGH));
            return accepted("storyboard clips", "Clip generation started for every shot with an image.");
        });
    }

    @PutMapping("/shots/{shotId}/vfx")
    public ResponseEntity<?> setShotVfx(@PathVariable String shotId, @RequestBody ShotVfxRequest request) {
        return respond("vfx", () -> ResponseEntity.ok(
                pipelineService.setShotVfx(shotId, request == null ? null : request.vfx())));
    }

    @PostMapping(value = "/shots/{shotId}/media", consumes = "multipart/form-data")
    public ResponseEntity<?> uploadShotMedia(
            @PathVariable String shotId,
            @RequestParam("mediaType") String mediaTypeInput,
            @RequestParam("file") MultipartFile file) {
        return respond("shot media", () -> {
            ShotMediaType mediaType = ShotMediaType.fromInput(mediaTypeInput);
            if (file == null || file.isEmpty()) {
                throw new IllegalArgumentException("Media file is required.");
            }
            validateMimeType("file", file.getContentType(), mediaType == ShotMediaType.IMAGE ? "image/" : "video/");
            return ResponseEntity.ok(pipelineService.uploadShotMedia(shotId, mediaType, toDataUrl(file)));
        });
    }

    @PostMapping("/post-production/{task}")
    public ResponseEntity<?> applyPostProduction(@PathVariable String task) {
        return respond("post-production", () -> {
            PostProductionTask postProductionTask = PostProductionTask.fromInput(task);
            pipelineService.applyPostProduction(postProductionTask);
            return accepted("post-production", "Post-production task " + postProductionTask + " started.");
        });
    }

    @PostMapping("/review")
    public ResponseEntity<?> startReview() {
        return respond("review", () -> {
            pipelineService.startReview();
            return accepted("review", "Executive and visual reviews started.");
        });
    }

    @PostMapping("/review/visual")
    public ResponseEntity<?> runVisualReview() {
        return respond("visual review", () -> {
            pipelineService.runVisualReview();
            return accepted("visual review", "Visual continuity review requested.");
        });
    }

    @DeleteMapping("/api-error")
    public ResponseEntity<?> clearApiError() {
        return ResponseEntity.ok(pipelineService.clearApiError());
    }

    @PostMapping("/reset")
    public ResponseEntity<?> reset() {
        return ResponseEntity.ok(pipelineService.reset());
    }

    @GetMapping("/snapshot")
    public ResponseEntity<?> downloadSnapshot() {
        return respond("snapshot", () -> ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + SNAPSHOT_FILE_NAME + "\"")
                .contentType(MediaType.APPLICATION_JSON)
                .body(pipelineService.exportSnapshot()));
    }

    @PostMapping(value = "/snapshot", consumes = "application/json")
    public ResponseEntity<?> uploadSnapshot(@RequestBody String document) {
        return respond("snapshot", () -> {
            SnapshotLoadResult result = pipelineService.importSnapshot(document);
            String message = result.audioMissing()
                    ? "Production loaded without audio. Upload the original song again."
                    : "Production loaded.";
            return ResponseEntity.ok(new SnapshotImportResponse(result.state(), result.audioMissing(), message));
        });
    }

    @PostMapping("/notifications/clip-ready")
    public ResponseEntity<?> clipReady(@RequestBody ClipReadyNotification notification) {
        return pipelineService.onClipReady(notification)
                .<ResponseEntity<?>>map(shotId -> ResponseEntity.ok(
                        new ProductionJobResponse("clip", pipelineService.currentState().stage(),
                                "Clip recorded for shot " + shotId + ".")))
                .orElseGet(() -> ResponseEntity.accepted().build());
    }

    private ResponseEntity<?> respond(String operation, ControllerAction action) {
        try {
            return action.run();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (SnapshotFormatException e) {
            return ResponseEntity.badRequest().body("Invalid production file: " + e.getMessage());
        } catch (NoSuchElementException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body("Cannot start " + operation + ": " + e.getMessage());
        } catch (Exception e) {
            logger.error("Production operation {} failed", operation, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to run " + operation + ". Please try again.");
        }
    }

    private ResponseEntity<?> accepted(String operation, String message) {
        return ResponseEntity.accepted()
                .body(new ProductionJobResponse(operation, pipelineService.currentState().stage(), message));
    }

    private void validateMimeType(String fieldName, String contentType, String expectedPrefix) {
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith(expectedPrefix)) {
            throw new IllegalArgumentException(fieldName + " must have a " + expectedPrefix + "* content type.");
        }
    }

    private static String toDataUrl(MultipartFile file) throws IOException {
        return "data:" + file.getContentType() + ";base64," + Base64.getEncoder().encodeToString(file.getBytes());
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @FunctionalInterface
    private interface ControllerAction {

        ResponseEntity<?> run() throws Exception;
    }
}
