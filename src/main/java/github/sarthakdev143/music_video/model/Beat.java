package github.sarthakdev143.music_video.model;

public record Beat(double time, double energy) {
}
