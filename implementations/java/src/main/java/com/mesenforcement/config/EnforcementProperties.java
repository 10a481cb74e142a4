package com.mesenforcement.config;

import com.mesenforcement.domain.model.config.ConfigurationDomain;
import com.mesenforcement.domain.model.config.ConfigurationLayer;
import com.mesenforcement.domain.model.config.QualityMode;
import com.mesenforcement.domain.model.config.WorkflowMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the enforcement engine.
 *
 * <p>The system defaults are the last layer of every configuration merge. Out of the
 * box they are strict: every rule enforced, quality required.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "mes.enforcement")
public class EnforcementProperties {

    @Valid
    private WorkflowDefaults workflowDefaults = new WorkflowDefaults();

    @Valid
    private QualityDefaults qualityDefaults = new QualityDefaults();

    @Valid
    private Cache cache = new Cache();

    /**
     * Fully populated fallback layer for a domain.
     */
    public ConfigurationLayer systemDefaults(ConfigurationDomain domain) {
        ConfigurationLayer.ConfigurationLayerBuilder builder =
            ConfigurationLayer.systemDefaults(domain).toBuilder();

        return switch (domain) {
            case WORKFLOW -> builder
                .mode(workflowDefaults.getMode())
                .enforceStatusGating(workflowDefaults.isEnforceStatusGating())
                .enforceOperationSequence(workflowDefaults.isEnforceOperationSequence())
                .enforceQualityChecks(workflowDefaults.isEnforceQualityChecks())
                .build();
            case QUALITY -> builder
                .mode(qualityDefaults.getMode())
                .enforceInspectionPass(qualityDefaults.isEnforceInspectionPass())
                .requireElectronicSig(qualityDefaults.isRequireElectronicSig())
                .acceptExternalQuality(qualityDefaults.isAcceptExternalQuality())
                .qualityRequired(qualityDefaults.isQualityRequired())
                .build();
        };
    }

    @Data
    public static class WorkflowDefaults {
        @NotNull
        private WorkflowMode mode = WorkflowMode.STRICT;
        private boolean enforceStatusGating = true;
        private boolean enforceOperationSequence = true;
        private boolean enforceQualityChecks = true;
    }

    @Data
    public static class QualityDefaults {
        @NotNull
        private QualityMode mode = QualityMode.STRICT;
        private boolean enforceInspectionPass = true;
        private boolean requireElectronicSig = false;
        private boolean acceptExternalQuality = false;
        private boolean qualityRequired = true;
    }

    @Data
    public static class Cache {
        @NotNull
        private Duration ruleTtl = Duration.ofMinutes(5);
        @Min(1)
        private long maximumSize = 1_000;
    }
}
