package github.sarthakdev143.music_video.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

@Component
@ConditionalOnProperty(name = "music-video.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);

    private final MusicVideoProperties properties;

    public StartupPreflightChecks(MusicVideoProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkBaseUrl("music-video.render-backend.base-url", properties.renderBackend().baseUrl());
        checkBaseUrl("music-video.gateway.base-url", properties.gateway().baseUrl());
        logger.info(
                "Preflight passed: renderBackend={} gateway={} throttleDelay={} clipPollInterval={} maxPollAttempts={}",
                properties.renderBackend().baseUrl(),
                properties.gateway().baseUrl(),
                properties.generation().throttleDelay(),
                properties.clips().pollInterval(),
                properties.clips().maxPollAttempts());
    }

    static void checkBaseUrl(String propertyName, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(propertyName + " must be set.");
        }

        URI uri;
        try {
            uri = new URI(value.trim());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(propertyName + " is not a valid URL: " + value, e);
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalStateException(propertyName + " must be an absolute http(s) URL, got " + value + ".");
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new IllegalStateException(propertyName + " must include a host, got " + value + ".");
        }
    }
}
