package com.example.shortsbot_backend.config;

import com.example.shortsbot_backend.engine.Interfaces.ProcessRunner;
import com.example.shortsbot_backend.engine.MediaCommand;
import com.example.shortsbot_backend.engine.ProcessResult;
import com.example.shortsbot_backend.exception.ExternalToolException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator ffmpegHealth(ProcessRunner runner, MediaToolProperties props) {
        return () -> {
            try {
                ProcessResult r = runner.run(new MediaCommand("ffmpeg-version", props.getFfmpegBinary(),
                        List.of("-version"), Duration.ofSeconds(5)));
                if (r.succeeded()) {
                    return Health.up().withDetail("ffmpeg", "ok").build();
                }
                return Health.down().withDetail("ffmpeg", "exit " + r.exitCode()).build();
            } catch (ExternalToolException e) {
                return Health.down(e).withDetail("ffmpeg", "missing").build();
            }
        };
    }
}
