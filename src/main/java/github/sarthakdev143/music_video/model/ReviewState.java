package github.sarthakdev143.music_video.model;

public record ReviewState(
        ReviewStatus executiveStatus,
        ExecutiveProducerFeedback executiveFeedback,
        ReviewStatus visualStatus,
        VisualContinuityReport visualReport) {

    public ReviewState {
        executiveStatus = executiveStatus == null ? ReviewStatus.IDLE : executiveStatus;
        visualStatus = visualStatus == null ? ReviewStatus.IDLE : visualStatus;
    }

    public static ReviewState idle() {
        return new ReviewState(ReviewStatus.IDLE, null, ReviewStatus.IDLE, null);
    }

    public static ReviewState started() {
        return new ReviewState(ReviewStatus.IN_PROGRESS, null, ReviewStatus.IN_PROGRESS, null);
    }

    public ReviewState withExecutiveFeedback(ExecutiveProducerFeedback feedback) {
        return new ReviewState(ReviewStatus.COMPLETE, feedback, visualStatus, visualReport);
    }

    public ReviewState withVisualReviewStarted() {
        return new ReviewState(executiveStatus, executiveFeedback, ReviewStatus.IN_PROGRESS, null);
    }

    public ReviewState withVisualReport(VisualContinuityReport report) {
        return new ReviewState(executiveStatus, executiveFeedback, ReviewStatus.COMPLETE, report);
    }
}
