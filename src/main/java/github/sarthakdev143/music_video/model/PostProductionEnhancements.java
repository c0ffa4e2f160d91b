package github.sarthakdev143.music_video.model;

public record PostProductionEnhancements(boolean colorCorrected, boolean stabilized) {

    public static PostProductionEnhancements none() {
        return new PostProductionEnhancements(false, false);
    }

    public PostProductionEnhancements apply(PostProductionTask task) {
        return switch (task) {
            case COLOR -> new PostProductionEnhancements(true, stabilized);
            case STABILIZATION -> new PostProductionEnhancements(colorCorrected, true);
            case VFX -> this;
        };
    }
}
