package com.z254.sentinel.guardian.orchestration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.sentinel.guardian.config.GuardianProperties;
import com.z254.sentinel.guardian.domain.model.HealthSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads the latest snapshot written by the external health checker.
 */
@Slf4j
@Component
public class FileHealthCheckProvider implements HealthCheckProvider {

    private final Path snapshotPath;
    private final ObjectMapper objectMapper;

    public FileHealthCheckProvider(GuardianProperties properties, ObjectMapper objectMapper) {
        this.snapshotPath = Path.of(properties.getWorkingDirectory()).resolve(properties.getSnapshots().getPath());
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<HealthSnapshot> performHealthCheck() {
        return Mono.fromCallable(() -> {
                    if (!Files.exists(snapshotPath)) {
                        throw new NoSuchFileException(snapshotPath.toString(), null, "No health snapshot available");
                    }
                    log.debug("Loading health snapshot from {}", snapshotPath);
                    return objectMapper.readValue(snapshotPath.toFile(), HealthSnapshot.class);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Path getSnapshotPath() {
        return snapshotPath;
    }
}
