package github.sarthakdev143.music_video.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * The uploaded song file held in memory for analysis, lip-sync requests and snapshots.
 */
public record SongSource(String fileName, String mimeType, byte[] data) {

    public SongSource {
        Objects.requireNonNull(data, "data");
        fileName = fileName == null || fileName.isBlank() ? "song" : fileName;
        mimeType = mimeType == null || mimeType.isBlank() ? "application/octet-stream" : mimeType;
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public int size() {
        return data.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SongSource that)) {
            return false;
        }
        return fileName.equals(that.fileName)
                && mimeType.equals(that.mimeType)
                && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileName, mimeType, Arrays.hashCode(data));
    }

    @Override
    public String toString() {
        return "SongSource[fileName=" + fileName + ", mimeType=" + mimeType + ", bytes=" + data.length + "]";
    }
}
