package github.sarthakdev143.music_video.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * One {@link RestTemplate} per upstream so each gets its own timeouts.
 * Clip renders are polled, so the render backend read timeout only covers single requests.
 */
@Configuration
@EnableConfigurationProperties(MusicVideoProperties.class)
public class HttpClientConfig {

    @Bean
    public RestTemplate renderBackendRestTemplate(MusicVideoProperties properties) {
        MusicVideoProperties.RenderBackend renderBackend = properties.renderBackend();
        return restTemplate(renderBackend.connectTimeout(), renderBackend.readTimeout());
    }

    @Bean
    public RestTemplate gatewayRestTemplate(MusicVideoProperties properties) {
        MusicVideoProperties.Gateway gateway = properties.gateway();
        return restTemplate(gateway.connectTimeout(), gateway.readTimeout());
    }

    private static RestTemplate restTemplate(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        return new RestTemplate(factory);
    }
}
