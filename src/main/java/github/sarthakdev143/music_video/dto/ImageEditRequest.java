package github.sarthakdev143.music_video.dto;

public record ImageEditRequest(String instruction) {
}
