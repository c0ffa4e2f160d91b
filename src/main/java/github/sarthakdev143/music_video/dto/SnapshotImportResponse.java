package github.sarthakdev143.music_video.dto;

import github.sarthakdev143.music_video.model.ProjectState;

public record SnapshotImportResponse(
        ProjectState state,
        boolean audioMissing,
        String message) {
}
