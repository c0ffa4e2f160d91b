package github.sarthakdev143.music_video.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "music-video")
public record MusicVideoProperties(
        Generation generation,
        Clips clips,
        RenderBackend renderBackend,
        Gateway gateway) {

    public MusicVideoProperties {
        generation = generation == null ? new Generation(null) : generation;
        clips = clips == null ? new Clips(null, 0) : clips;
        renderBackend = renderBackend == null ? new RenderBackend(null, null, null) : renderBackend;
        gateway = gateway == null ? new Gateway(null, null, null) : gateway;
    }

    public record Generation(Duration throttleDelay) {

        public Generation {
            throttleDelay = throttleDelay == null ? Duration.ofMillis(1500) : throttleDelay;
        }
    }

    public record Clips(Duration pollInterval, int maxPollAttempts) {

        public Clips {
            pollInterval = pollInterval == null ? Duration.ofSeconds(1) : pollInterval;
            maxPollAttempts = maxPollAttempts <= 0 ? 300 : maxPollAttempts;
        }
    }

    public record RenderBackend(String baseUrl, Duration connectTimeout, Duration readTimeout) {

        public RenderBackend {
            baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://localhost:3002" : baseUrl;
            connectTimeout = connectTimeout == null ? Duration.ofSeconds(30) : connectTimeout;
            readTimeout = readTimeout == null ? Duration.ofMinutes(2) : readTimeout;
        }
    }

    public record Gateway(String baseUrl, Duration connectTimeout, Duration readTimeout) {

        public Gateway {
            baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://localhost:3001/api/generation" : baseUrl;
            connectTimeout = connectTimeout == null ? Duration.ofSeconds(30) : connectTimeout;
            readTimeout = readTimeout == null ? Duration.ofMinutes(5) : readTimeout;
        }
    }
}
