package github.sarthakdev143.music_video.model;

import java.util.Arrays;
import java.util.Objects;

public record MoodboardImage(String fileName, String mimeType, byte[] data) {

    public MoodboardImage {
        Objects.requireNonNull(data, "data");
        data = data.clone();
        mimeType = mimeType == null || mimeType.isBlank() ? "image/png" : mimeType;
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof MoodboardImage image
                && Objects.equals(fileName, image.fileName)
                && Objects.equals(mimeType, image.mimeType)
                && Arrays.equals(data, image.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileName, mimeType, Arrays.hashCode(data));
    }

    @Override
    public String toString() {
        return "MoodboardImage[fileName=" + fileName + ", mimeType=" + mimeType + ", size=" + data.length + "]";
    }
}
