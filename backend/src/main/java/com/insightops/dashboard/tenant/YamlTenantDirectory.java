package com.insightops.dashboard.tenant;

import com.insightops.dashboard.config.DashboardProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TenantDirectory} backed by a YAML file ({@code tenants.yaml} by default).
 *
 * <p>The file is read from the working directory first and from the classpath as a
 * fallback. Settings updates are kept in memory. Example entry:</p>
 * <pre>
 * tenants:
 *   - id: contoso
 *     name: Contoso Ltd
 *     azureDevOps:
 *       organization: contoso
 *       project: Payments
 *       patEnv: CONTOSO_ADO_PAT
 *     polling:
 *       pullRequestEnabled: true
 *       pullRequestInterval: "0 *&#47;10 * * *"
 * </pre>
 * <p>{@code patEnv} names an environment variable holding the token; a literal
 * {@code pat} value is also accepted.</p>
 */
@Slf4j
@Component
public class YamlTenantDirectory implements TenantDirectory {

    private final DashboardProperties properties;
    private final Map<String, Tenant> tenants = new ConcurrentHashMap<>();

    public YamlTenantDirectory(DashboardProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        loadTenants();
    }

    @Override
    public Optional<Tenant> getTenantWithCredentials(String tenantId) {
        MissingTenantException.require(tenantId, "tenant lookup");
        return Optional.ofNullable(tenants.get(tenantId)).map(YamlTenantDirectory::copyOf);
    }

    @Override
    public List<Tenant> findTenantsWithPollingEnabled() {
        return tenants.values().stream()
                .filter(Tenant::isActive)
                .filter(tenant -> tenant.getPolling() != null && tenant.getPolling().isAnyJobEnabled())
                .sorted(Comparator.comparing(Tenant::getId))
                .map(YamlTenantDirectory::copyOf)
                .toList();
    }

    @Override
    public void updatePollingSettings(String tenantId, PollingSettings settings) {
        MissingTenantException.require(tenantId, "polling settings update");
        Tenant updated = tenants.computeIfPresent(tenantId, (id, tenant) -> tenant.toBuilder()
                .polling(settings.toBuilder().build())
                .build());
        if (updated == null) {
            throw new IllegalArgumentException("Unknown tenant " + tenantId);
        }
    }

    /** Number of loaded tenants. */
    public int size() {
        return tenants.size();
    }

    /**
     * Reads the tenants file from the working directory (or classpath as fallback)
     * and replaces the in-memory directory with its content.
     */
    @SuppressWarnings("unchecked")
    private void loadTenants() {
        String fileName = properties.getTenantsFile();
        Yaml yaml = new Yaml();
        Map<String, Object> root = null;

        Path filePath = Paths.get(fileName);
        if (Files.exists(filePath)) {
            try (InputStream is = Files.newInputStream(filePath)) {
                root = yaml.load(is);
                log.info("Loaded {} from working directory: {}", fileName, filePath.toAbsolutePath());
            } catch (Exception e) {
                log.warn("Failed to read {} from working directory, falling back to classpath", fileName, e);
            }
        }

        if (root == null) {
            try (InputStream is = getClass().getClassLoader().getResourceAsStream(fileName)) {
                if (is != null) {
                    root = yaml.load(is);
                    log.info("Loaded {} from classpath", fileName);
                }
            } catch (Exception e) {
                log.error("Failed to load {} from classpath", fileName, e);
            }
        }

        if (root == null) {
            log.error("{} not found – no tenants will be polled", fileName);
            return;
        }

        List<Map<String, Object>> rawTenants = (List<Map<String, Object>>) root.get("tenants");
        if (rawTenants == null || rawTenants.isEmpty()) {
            log.warn("No tenants found in {}", fileName);
            return;
        }

        tenants.clear();
        for (Map<String, Object> entry : rawTenants) {
            Tenant tenant = parseTenant(entry);
            if (tenant.getId() == null || tenant.getId().isBlank()) {
                log.warn("Skipping tenant entry without id: {}", entry.get("name"));
                continue;
            }
            tenants.put(tenant.getId(), tenant);
        }
        log.info("Loaded {} tenant(s) from {}", tenants.size(), fileName);
    }

    @SuppressWarnings("unchecked")
    private Tenant parseTenant(Map<String, Object> entry) {
        Map<String, Object> devOps = (Map<String, Object>) entry.getOrDefault("azureDevOps", Map.of());
        Map<String, Object> polling = (Map<String, Object>) entry.getOrDefault("polling", Map.of());

        String pat = asString(devOps.get("pat"));
        String patEnv = asString(devOps.get("patEnv"));
        if (patEnv != null) {
            pat = System.getenv(patEnv);
        }

        DevOpsCredentials credentials = DevOpsCredentials.builder()
                .organization(asString(devOps.get("organization")))
                .project(asString(devOps.get("project")))
                .pat(pat)
                .baseUrl(asString(devOps.get("baseUrl")))
                .build();

        PollingSettings settings = PollingSettings.builder()
                .workItemsEnabled((Boolean) polling.get("workItemsEnabled"))
                .workItemsInterval(asString(polling.get("workItemsInterval")))
                .pullRequestEnabled((Boolean) polling.get("pullRequestEnabled"))
                .pullRequestInterval(asString(polling.get("pullRequestInterval")))
                .overdueCheckEnabled((Boolean) polling.get("overdueCheckEnabled"))
                .overdueCheckInterval(asString(polling.get("overdueCheckInterval")))
                .idlePrFilterEnabled((Boolean) polling.get("idlePrFilterEnabled"))
                .idlePrMaxDays((Integer) polling.get("idlePrMaxDays"))
                .overdueFilterEnabled((Boolean) polling.get("overdueFilterEnabled"))
                .overdueMaxDays((Integer) polling.get("overdueMaxDays"))
                .build();

        return Tenant.builder()
                .id(asString(entry.get("id")))
                .name(asString(entry.get("name")))
                .active(!Boolean.FALSE.equals(entry.get("active")))
                .credentials(credentials)
                .polling(settings)
                .build();
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static Tenant copyOf(Tenant tenant) {
        return tenant.toBuilder()
                .credentials(tenant.getCredentials() == null ? null : tenant.getCredentials().toBuilder().build())
                .polling(tenant.getPolling() == null ? new PollingSettings() : tenant.getPolling().toBuilder().build())
                .build();
    }
}
