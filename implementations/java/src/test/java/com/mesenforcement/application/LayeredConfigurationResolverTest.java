package com.mesenforcement.application;

import com.mesenforcement.application.exceptions.EnforcementUnavailableException;
import com.mesenforcement.config.EnforcementProperties;
import com.mesenforcement.domain.model.config.ConfigurationDomain;
import com.mesenforcement.domain.model.config.ConfigurationLayer;
import com.mesenforcement.domain.model.config.ConfigurationScope;
import com.mesenforcement.domain.model.config.EffectiveConfiguration;
import com.mesenforcement.domain.model.config.QualityMode;
import com.mesenforcement.domain.model.config.ScopeLevel;
import com.mesenforcement.domain.model.config.WorkflowMode;
import com.mesenforcement.domain.repository.ConfigurationOverrideRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("LayeredConfigurationResolver")
class LayeredConfigurationResolverTest {

    private ConfigurationOverrideRepository overrides;
    private EnforcementProperties properties;
    private LayeredConfigurationResolver resolver;

    private final ConfigurationScope scope = ConfigurationScope.builder()
        .siteId("site-1")
        .routingId("routing-1")
        .workOrderId("wo-1")
        .operationId("op-1")
        .build();

    @BeforeEach
    void setUp() {
        overrides = mock(ConfigurationOverrideRepository.class);
        when(overrides.findLayer(any(), any(), any())).thenReturn(Optional.empty());
        properties = new EnforcementProperties();
        resolver = new LayeredConfigurationResolver(overrides, properties);
    }

    @Test
    @DisplayName("no overrides resolve to the bound system defaults")
    void noOverrides() {
        EffectiveConfiguration config = resolver.resolve(ConfigurationDomain.WORKFLOW, scope);

        assertEquals(WorkflowMode.STRICT, config.getWorkflowMode());
        assertTrue(config.isEnforceStatusGating());
        assertEquals(ScopeLevel.SYSTEM_DEFAULT, config.getSource().getModeSource());
    }

    @Test
    @DisplayName("system defaults follow application configuration")
    void propertiesDriveDefaults() {
        properties.getWorkflowDefaults().setMode(WorkflowMode.HYBRID);
        properties.getWorkflowDefaults().setEnforceStatusGating(false);

        EffectiveConfiguration config = resolver.resolve(ConfigurationDomain.WORKFLOW, scope);

        assertEquals(WorkflowMode.HYBRID, config.getWorkflowMode());
        assertFalse(config.isEnforceStatusGating());
    }

    @Test
    @DisplayName("an operation override beats a site override")
    void operationBeatsSite() {
        when(overrides.findLayer(ConfigurationDomain.WORKFLOW, ScopeLevel.SITE, "site-1")).thenReturn(Optional.of(
            ConfigurationLayer.builder().level(ScopeLevel.SITE).mode(WorkflowMode.FLEXIBLE).build()));
        when(overrides.findLayer(ConfigurationDomain.WORKFLOW, ScopeLevel.OPERATION, "op-1")).thenReturn(Optional.of(
            ConfigurationLayer.builder().level(ScopeLevel.OPERATION).mode(WorkflowMode.STRICT).build()));

        EffectiveConfiguration config = resolver.resolve(ConfigurationDomain.WORKFLOW, scope);

        assertEquals(WorkflowMode.STRICT, config.getWorkflowMode());
        assertEquals(ScopeLevel.OPERATION, config.getSource().getModeSource());
        assertFalse(config.getSource().isSite());
    }

    @Test
    @DisplayName("workflow and quality overrides are read independently")
    void domainsAreIndependent() {
        when(overrides.findLayer(ConfigurationDomain.QUALITY, ScopeLevel.SITE, "site-1")).thenReturn(Optional.of(
            ConfigurationLayer.builder().level(ScopeLevel.SITE).mode(QualityMode.EXTERNAL).build()));

        assertEquals(QualityMode.EXTERNAL, resolver.resolve(ConfigurationDomain.QUALITY, scope).getQualityMode());
        assertEquals(WorkflowMode.STRICT, resolver.resolve(ConfigurationDomain.WORKFLOW, scope).getWorkflowMode());
    }

    @Test
    @DisplayName("absent scopes are not queried")
    void onlyPresentScopes() {
        resolver.resolve(ConfigurationDomain.WORKFLOW, ConfigurationScope.builder().siteId("site-1").build());

        verify(overrides).findLayer(ConfigurationDomain.WORKFLOW, ScopeLevel.SITE, "site-1");
        verifyNoMoreInteractions(overrides);
    }

    @Test
    @DisplayName("store failures propagate as EnforcementUnavailableException")
    void storeFailure() {
        when(overrides.findLayer(eq(ConfigurationDomain.WORKFLOW), eq(ScopeLevel.OPERATION), any()))
            .thenThrow(new QueryTimeoutException("timeout"));

        EnforcementUnavailableException error = assertThrows(EnforcementUnavailableException.class,
            () -> resolver.resolve(ConfigurationDomain.WORKFLOW, scope));
        assertTrue(error.getMessage().startsWith("Failed to"));
        assertInstanceOf(QueryTimeoutException.class, error.getCause());
    }
}
