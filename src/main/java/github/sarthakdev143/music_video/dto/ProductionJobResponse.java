package github.sarthakdev143.music_video.dto;

import github.sarthakdev143.music_video.model.Stage;

public record ProductionJobResponse(
        String operation,
        Stage stage,
        String message) {
}
