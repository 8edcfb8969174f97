package com.router.service.impl;

import com.router.config.RouterProperties;
import com.router.model.Integration;
import com.router.service.api.IntegrationDirectory;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Integration names and descriptions from {@code router.integrations}.
 */
@Service
public class ConfiguredIntegrationDirectory implements IntegrationDirectory {

    private final Map<String, Integration> integrations = new LinkedHashMap<>();

    public ConfiguredIntegrationDirectory(RouterProperties properties) {
        properties.getIntegrations().stream()
                .filter(entry -> entry.getId() != null && !entry.getId().isBlank())
                .forEach(entry -> integrations.put(entry.getId(), entry.toIntegration()));
    }

    @Override
    public List<Integration> lookup(List<String> namespaces) {
        return namespaces.stream()
                .map(id -> integrations.getOrDefault(id, Integration.unnamed(id)))
                .toList();
    }
}
