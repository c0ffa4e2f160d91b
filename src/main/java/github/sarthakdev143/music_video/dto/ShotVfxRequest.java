package github.sarthakdev143.music_video.dto;

public record ShotVfxRequest(String vfx) {
}
