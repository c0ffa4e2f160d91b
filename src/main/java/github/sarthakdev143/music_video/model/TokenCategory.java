package github.sarthakdev143.music_video.model;

public enum TokenCategory {
    ANALYSIS("analysis"),
    BIBLES("bibles"),
    STORYBOARD("storyboard"),
    TRANSITIONS("transitions"),
    IMAGE_GENERATION("imageGeneration"),
    IMAGE_EDITING("imageEditing"),
    VIDEO_GENERATION("videoGeneration"),
    POST_PRODUCTION("postProduction"),
    MOODBOARD_ANALYSIS("moodboardAnalysis"),
    EXECUTIVE_REVIEW("executiveReview"),
    VISUAL_REVIEW("visualReview");

    private final String key;

    TokenCategory(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
