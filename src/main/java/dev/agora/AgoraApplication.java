package dev.agora;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Agora metasearch aggregator.
 *
 * <p>Wires the engine registry, the telemetry sink and the {@link
 * dev.agora.search.SearchCoordinator}; callers obtain result containers through {@link
 * dev.agora.aggregation.ResultContainerFactory}.
 */
@SpringBootApplication
public class AgoraApplication {
    public static void main(String[] args) {
        SpringApplication.run(AgoraApplication.class, args);
    }
}
