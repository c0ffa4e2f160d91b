package github.sarthakdev143.music_video.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Canonical state of one production. Instances are immutable and only replaced through
 * {@code ProjectStateMachine}.
 */
public record ProjectState(
        Stage stage,
        @JsonIgnore SongSource song,
        String audioUrl,
        SingerGender singerGender,
        ModelTier modelTier,
        SongAnalysis songAnalysis,
        CreativeBrief creativeBrief,
        Bibles bibles,
        Storyboard storyboard,
        TokenUsage tokenUsage,
        PostProductionTasks postProductionTasks,
        ReviewState reviewState,
        boolean processing,
        String lastError,
        String apiError) {

    public ProjectState {
        stage = stage == null ? Stage.UPLOAD : stage;
        singerGender = singerGender == null ? SingerGender.UNSPECIFIED : singerGender;
        modelTier = modelTier == null ? ModelTier.FREEMIUM : modelTier;
        creativeBrief = creativeBrief == null ? CreativeBrief.defaults() : creativeBrief;
        tokenUsage = tokenUsage == null ? TokenUsage.initial() : tokenUsage;
        postProductionTasks = postProductionTasks == null ? PostProductionTasks.idle() : postProductionTasks;
        reviewState = reviewState == null ? ReviewState.idle() : reviewState;
    }

    public static ProjectState initial() {
        return new ProjectState(
                Stage.UPLOAD,
                null,
                null,
                SingerGender.UNSPECIFIED,
                ModelTier.FREEMIUM,
                null,
                CreativeBrief.defaults(),
                null,
                null,
                TokenUsage.initial(),
                PostProductionTasks.idle(),
                ReviewState.idle(),
                false,
                null,
                null);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {

        private Stage stage;
        private SongSource song;
        private String audioUrl;
        private SingerGender singerGender;
        private ModelTier modelTier;
        private SongAnalysis songAnalysis;
        private CreativeBrief creativeBrief;
        private Bibles bibles;
        private Storyboard storyboard;
        private TokenUsage tokenUsage;
        private PostProductionTasks postProductionTasks;
        private ReviewState reviewState;
        private boolean processing;
        private String lastError;
        private String apiError;

        private Builder(ProjectState source) {
            this.stage = source.stage;
            this.song = source.song;
            this.audioUrl = source.audioUrl;
            this.singerGender = source.singerGender;
            this.modelTier = source.modelTier;
            this.songAnalysis = source.songAnalysis;
            this.creativeBrief = source.creativeBrief;
            this.bibles = source.bibles;
            this.storyboard = source.storyboard;
            this.tokenUsage = source.tokenUsage;
            this.postProductionTasks = source.postProductionTasks;
            this.reviewState = source.reviewState;
            this.processing = source.processing;
            this.lastError = source.lastError;
            this.apiError = source.apiError;
        }

        public Builder stage(Stage value) {
            this.stage = value;
            return this;
        }

        public Builder song(SongSource value) {
            this.song = value;
            return this;
        }

        public Builder audioUrl(String value) {
            this.audioUrl = value;
            return this;
        }

        public Builder singerGender(SingerGender value) {
            this.singerGender = value;
            return this;
        }

        public Builder modelTier(ModelTier value) {
            this.modelTier = value;
            return this;
        }

        public Builder songAnalysis(SongAnalysis value) {
            this.songAnalysis = value;
            return this;
        }

        public Builder creativeBrief(CreativeBrief value) {
            this.creativeBrief = value;
            return this;
        }

        public Builder bibles(Bibles value) {
            this.bibles = value;
            return this;
        }

        public Builder storyboard(Storyboard value) {
            this.storyboard = value;
            return this;
        }

        public Builder tokenUsage(TokenUsage value) {
            this.tokenUsage = value;
            return this;
        }

        public Builder postProductionTasks(PostProductionTasks value) {
            this.postProductionTasks = value;
            return this;
        }

        public Builder reviewState(ReviewState value) {
            this.reviewState = value;
            return this;
        }

        public Builder processing(boolean value) {
            this.processing = value;
            return this;
        }

        public Builder lastError(String value) {
            this.lastError = value;
            return this;
        }

        public Builder apiError(String value) {
            this.apiError = value;
            return this;
        }

        public ProjectState build() {
            return new ProjectState(
                    stage,
                    song,
                    audioUrl,
                    singerGender,
                    modelTier,
                    songAnalysis,
                    creativeBrief,
                    bibles,
                    storyboard,
                    tokenUsage,
                    postProductionTasks,
                    reviewState,
                    processing,
                    lastError,
                    apiError);
        }
    }
}
