package io.tabdeck.board.infra;

import io.tabdeck.board.config.BoardProperties;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfiguration implements WebMvcConfigurer {
    private static final Logger log = LoggerFactory.getLogger(WebConfiguration.class);

    private final BoardProperties.Cors cors;

    public WebConfiguration(BoardProperties properties) {
        this.cors = Objects.requireNonNull(properties, "properties").getCors();
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (!cors.isEnabled()) {
            return;
        }
        log.info("CORS enabled for /api/** from {}", cors.getAllowedOrigins());
        registry.addMapping("/api/**")
            .allowedOriginPatterns(cors.getAllowedOrigins().toArray(String[]::new))
            .allowedMethods("GET", "POST", "OPTIONS");
    }
}
