package com.insightops.dashboard.tenant;

import com.insightops.dashboard.config.DashboardProperties;
import com.insightops.dashboard.job.JobType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link YamlTenantDirectory}.
 */
class YamlTenantDirectoryTest {

    private static final String TENANTS = """
            tenants:
              - id: contoso
                name: Contoso Ltd
                azureDevOps:
                  organization: contoso
                  project: Payments
                  pat: secret-pat
                polling:
                  pullRequestEnabled: true
                  pullRequestInterval: "0 */10 * * *"
                  idlePrMaxDays: 30
              - id: fabrikam
                name: Fabrikam
                active: false
                azureDevOps:
                  organization: fabrikam
                  project: Web
                  pat: other-pat
                polling:
                  workItemsEnabled: true
              - id: northwind
                name: Northwind
                azureDevOps:
                  organization: northwind
              - name: no id at all
            """;

    @TempDir
    Path tempDir;

    private YamlTenantDirectory directory;

    @BeforeEach
    void setUp() throws IOException {
        Path file = tempDir.resolve("tenants.yaml");
        Files.writeString(file, TENANTS);
        DashboardProperties properties = new DashboardProperties();
        properties.setTenantsFile(file.toString());
        directory = new YamlTenantDirectory(properties);
        directory.init();
    }

    @Test
    @DisplayName("Loads every entry that has an id")
    void loadsTenantsWithId() {
        assertEquals(3, directory.size());
    }

    @Test
    @DisplayName("Parses credentials and polling settings")
    void parsesTenant() {
        Tenant tenant = directory.getTenantWithCredentials("contoso").orElseThrow();

        assertEquals("Contoso Ltd", tenant.getName());
        assertTrue(tenant.isActive());
        assertTrue(tenant.hasCompleteCredentials());
        assertEquals("https://dev.azure.com", tenant.getCredentials().resolvedBaseUrl());
        assertTrue(tenant.getPolling().jobConfig(JobType.PULL_REQUESTS).isEnabled());
        assertEquals(30, tenant.getPolling().resolvedIdlePrMaxDays());
    }

    @Test
    @DisplayName("Incomplete credentials are loaded but reported incomplete")
    void incompleteCredentials() {
        Tenant tenant = directory.getTenantWithCredentials("northwind").orElseThrow();

        assertFalse(tenant.hasCompleteCredentials());
    }

    @Test
    @DisplayName("findTenantsWithPollingEnabled() skips inactive tenants and tenants without enabled jobs")
    void pollingEnabledFilter() {
        List<Tenant> tenants = directory.findTenantsWithPollingEnabled();

        assertEquals(1, tenants.size());
        assertEquals("contoso", tenants.get(0).getId());
    }

    @Test
    @DisplayName("updatePollingSettings() replaces the stored settings")
    void updateReplacesSettings() {
        directory.updatePollingSettings("contoso", PollingSettings.builder().overdueCheckEnabled(true).build());

        PollingSettings stored = directory.getTenantWithCredentials("contoso").orElseThrow().getPolling();
        assertTrue(stored.jobConfig(JobType.OVERDUE).isEnabled());
        assertFalse(stored.jobConfig(JobType.PULL_REQUESTS).isEnabled());
    }

    @Test
    @DisplayName("Returned tenants are copies that cannot change the directory")
    void returnsCopies() {
        Tenant copy = directory.getTenantWithCredentials("contoso").orElseThrow();
        copy.getPolling().setPullRequestEnabled(false);
        copy.setActive(false);

        Tenant reloaded = directory.getTenantWithCredentials("contoso").orElseThrow();
        assertTrue(reloaded.isActive());
        assertTrue(reloaded.getPolling().jobConfig(JobType.PULL_REQUESTS).isEnabled());
    }

    @Test
    @DisplayName("Unknown tenants are empty, missing ids fail closed")
    void unknownAndMissing() {
        assertTrue(directory.getTenantWithCredentials("unknown").isEmpty());
        assertThrows(MissingTenantException.class, () -> directory.getTenantWithCredentials(null));
        assertThrows(IllegalArgumentException.class,
                () -> directory.updatePollingSettings("unknown", new PollingSettings()));
    }

    @Test
    @DisplayName("A missing tenants file leaves the directory empty")
    void missingFileGivesEmptyDirectory() {
        DashboardProperties properties = new DashboardProperties();
        properties.setTenantsFile(tempDir.resolve("does-not-exist.yaml").toString());
        YamlTenantDirectory empty = new YamlTenantDirectory(properties);
        empty.init();

        assertEquals(0, empty.size());
        assertTrue(empty.findTenantsWithPollingEnabled().isEmpty());
    }
}
