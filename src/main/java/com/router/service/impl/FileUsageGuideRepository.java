package com.router.service.impl;

import com.router.service.api.UsageGuideRepository;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Reads {@code <router.guides-dir>/<namespace>.md}.
 */
@Service
@Slf4j
public class FileUsageGuideRepository implements UsageGuideRepository {

    @Value("${router.guides-dir:guides}")
    private String guidesDir;

    @Override
    public String load(String namespace) {
        Path dir = Path.of(guidesDir).normalize();
        Path guide = dir.resolve(namespace + ".md").normalize();
        if (!guide.startsWith(dir) || !Files.isRegularFile(guide)) {
            log.info("No usage guide found for integration {}", namespace);
            return "";
        }
        try {
            return Files.readString(guide, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Error loading usage guide for {}: {}", namespace, e.getMessage());
            return "";
        }
    }
}
