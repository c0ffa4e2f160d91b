package github.sarthakdev143.music_video.generation;

public record BatchSummary(int attempted, int succeeded, int failed, long usageCost, boolean interrupted) {

    public static BatchSummary empty() {
        return new BatchSummary(0, 0, 0, 0L, false);
    }
}
