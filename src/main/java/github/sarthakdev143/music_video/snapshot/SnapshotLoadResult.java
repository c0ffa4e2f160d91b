package github.sarthakdev143.music_video.snapshot;

import github.sarthakdev143.music_video.model.ProjectState;

/**
 * @param audioMissing true when the document had no decodable audio and the song must be uploaded again
 */
public record SnapshotLoadResult(ProjectState state, boolean audioMissing) {
}
