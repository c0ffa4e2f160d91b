package github.sarthakdev143.music_video.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CameraMotion {
    ZOOM_IN,
    ZOOM_OUT,
    PAN_LEFT,
    PAN_RIGHT,
    STATIC;

    @JsonValue
    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
