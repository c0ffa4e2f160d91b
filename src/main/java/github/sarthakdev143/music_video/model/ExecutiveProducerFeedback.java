package github.sarthakdev143.music_video.model;

public record ExecutiveProducerFeedback(
        double pacingScore,
        double narrativeScore,
        double consistencyScore,
        String finalNotes) {

    public static ExecutiveProducerFeedback failed() {
        return new ExecutiveProducerFeedback(0, 0, 0, "Error generating feedback.");
    }
}
