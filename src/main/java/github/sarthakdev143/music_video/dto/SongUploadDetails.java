package github.sarthakdev143.music_video.dto;

import github.sarthakdev143.music_video.model.ModelTier;
import github.sarthakdev143.music_video.model.SingerGender;

public record SongUploadDetails(
        String lyrics,
        String title,
        String artist,
        SingerGender singerGender,
        ModelTier modelTier) {

    public SongUploadDetails {
        lyrics = lyrics == null ? "" : lyrics;
        singerGender = singerGender == null ? SingerGender.UNSPECIFIED : singerGender;
        modelTier = modelTier == null ? ModelTier.FREEMIUM : modelTier;
    }
}
