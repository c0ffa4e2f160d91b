package github.sarthakdev143.music_video.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StartupPreflightChecksTest {

    @Test
    void defaultPropertiesPassPreflight() {
        StartupPreflightChecks checks = new StartupPreflightChecks(new MusicVideoProperties(null, null, null, null));

        assertThatCode(() -> checks.run(new DefaultApplicationArguments())).doesNotThrowAnyException();
    }

    @Test
    void relativeOrNonHttpUrlsAreRejected() {
        assertThatThrownBy(() -> StartupPreflightChecks.checkBaseUrl("music-video.gateway.base-url", "/api/generation"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("absolute http(s) URL");
        assertThatThrownBy(() -> StartupPreflightChecks.checkBaseUrl("music-video.render-backend.base-url", "ftp://render:21"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("music-video.render-backend.base-url");
    }

    @Test
    void urlWithoutHostIsRejected() {
        assertThatThrownBy(() -> StartupPreflightChecks.checkBaseUrl("music-video.gateway.base-url", "http:///generation"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must include a host");
    }

    @Test
    void malformedUrlIsRejected() {
        assertThatThrownBy(() -> StartupPreflightChecks.checkBaseUrl("music-video.gateway.base-url", "http://exa mple.com"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("is not a valid URL");
    }
}
