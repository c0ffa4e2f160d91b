package github.sarthakdev143.music_video.model;

import java.util.List;

/**
 * A character or location reference sheet. Entries are addressed by name.
 */
public interface BibleEntry {

    String name();

    List<String> sourceImages();

    BibleKind kind();

    default AssetState imageState() {
        List<String> images = sourceImages();
        if (images.isEmpty()) {
            return AssetState.PENDING;
        }
        if (images.size() == 1 && AssetState.ERROR_SENTINEL.equals(images.get(0))) {
            return AssetState.FAILED;
        }
        return AssetState.READY;
    }
}
