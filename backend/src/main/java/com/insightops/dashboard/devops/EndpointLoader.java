package com.insightops.dashboard.devops;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads and parses devops-endpoints.yaml and exposes the Azure DevOps
 * {@link EndpointDefinition}s used by the polling tasks.
 */
@Slf4j
@Component
public class EndpointLoader {

    static final String ENDPOINTS_FILE = "devops-endpoints.yaml";

    @Getter
    private List<EndpointDefinition> endpoints = Collections.emptyList();

    @PostConstruct
    public void init() {
        loadEndpoints();
    }

    /**
     * Reads devops-endpoints.yaml from the working directory (or classpath as fallback)
     * and parses every endpoint entry.
     */
    @SuppressWarnings("unchecked")
    private void loadEndpoints() {
        Yaml yaml = new Yaml();
        Map<String, Object> root = null;

        Path workingDirFile = Paths.get(ENDPOINTS_FILE);
        if (Files.exists(workingDirFile)) {
            try (InputStream is = Files.newInputStream(workingDirFile)) {
                root = yaml.load(is);
                log.info("Loaded {} from working directory: {}", ENDPOINTS_FILE, workingDirFile.toAbsolutePath());
            } catch (Exception e) {
                log.warn("Failed to read {} from working directory, falling back to classpath", ENDPOINTS_FILE, e);
            }
        }

        if (root == null) {
            try (InputStream is = getClass().getClassLoader().getResourceAsStream(ENDPOINTS_FILE)) {
                if (is != null) {
                    root = yaml.load(is);
                    log.info("Loaded {} from classpath", ENDPOINTS_FILE);
                }
            } catch (Exception e) {
                log.error("Failed to load {} from classpath", ENDPOINTS_FILE, e);
            }
        }

        if (root == null) {
            log.error("{} not found – polling tasks will fail", ENDPOINTS_FILE);
            return;
        }

        List<Map<String, Object>> rawEndpoints = (List<Map<String, Object>>) root.get("endpoints");
        if (rawEndpoints == null || rawEndpoints.isEmpty()) {
            log.warn("No endpoints found in {}", ENDPOINTS_FILE);
            return;
        }

        List<EndpointDefinition> parsed = new ArrayList<>();
        for (Map<String, Object> entry : rawEndpoints) {
            parsed.add(EndpointDefinition.builder()
                    .name((String) entry.get("name"))
                    .path((String) entry.get("path"))
                    .method((String) entry.getOrDefault("method", "GET"))
                    .description((String) entry.get("description"))
                    .build());
        }

        this.endpoints = Collections.unmodifiableList(parsed);
        log.info("Loaded {} endpoint definitions from {}", endpoints.size(), ENDPOINTS_FILE);
    }

    /**
     * Find an endpoint definition by its unique name.
     *
     * @param name the endpoint name (e.g. "query_work_items")
     * @return an Optional containing the endpoint if found
     */
    public Optional<EndpointDefinition> findByName(String name) {
        return endpoints.stream()
                .filter(e -> e.getName().equals(name))
                .findFirst();
    }

    /**
     * Like {@link #findByName(String)} but fails when the endpoint is not configured.
     *
     * @throws IllegalStateException if no endpoint has that name
     */
    public EndpointDefinition require(String name) {
        return findByName(name).orElseThrow(() ->
                new IllegalStateException("Endpoint " + name + " is not defined in " + ENDPOINTS_FILE));
    }
}
