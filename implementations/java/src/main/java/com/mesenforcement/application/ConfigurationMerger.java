package com.mesenforcement.application;

import com.mesenforcement.domain.model.config.ConfigurationDomain;
import com.mesenforcement.domain.model.config.ConfigurationLayer;
import com.mesenforcement.domain.model.config.ConfigurationSource;
import com.mesenforcement.domain.model.config.EffectiveConfiguration;
import com.mesenforcement.domain.model.config.EnforcementMode;
import com.mesenforcement.domain.model.config.ScopeLevel;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Field-wise "first non-null wins" reduction over configuration layers.
 *
 * <p>Layers are given most-specific first. Each field takes the value of the first layer
 * that defines it; the scope of that layer is recorded as the field's provenance. The
 * last layer must be complete, which is what the system-default layer guarantees.
 */
public final class ConfigurationMerger {

    private ConfigurationMerger() {
    }

    public static EffectiveConfiguration merge(ConfigurationDomain domain, List<ConfigurationLayer> mostSpecificFirst) {
        Objects.requireNonNull(domain, "domain must not be null");
        if (mostSpecificFirst == null || mostSpecificFirst.isEmpty()) {
            throw new IllegalArgumentException("At least one configuration layer is required");
        }

        ConfigurationLayer leastSpecific = mostSpecificFirst.get(mostSpecificFirst.size() - 1);
        if (!leastSpecific.isComplete()) {
            throw new IllegalArgumentException(
                "Least specific configuration layer " + leastSpecific.getLevel() + " must define every field");
        }

        Set<ScopeLevel> contributors = EnumSet.noneOf(ScopeLevel.class);

        Winner<EnforcementMode> mode = firstNonNull(mostSpecificFirst, ConfigurationLayer::getMode, "mode");
        if (mode.value.domain() != domain) {
            throw new IllegalArgumentException(
                "Mode " + mode.value.name() + " at " + mode.level + " is not a " + domain + " mode");
        }
        Winner<Boolean> statusGating = firstNonNull(mostSpecificFirst,
            ConfigurationLayer::getEnforceStatusGating, "enforceStatusGating");
        Winner<Boolean> operationSequence = firstNonNull(mostSpecificFirst,
            ConfigurationLayer::getEnforceOperationSequence, "enforceOperationSequence");
        Winner<Boolean> qualityChecks = firstNonNull(mostSpecificFirst,
            ConfigurationLayer::getEnforceQualityChecks, "enforceQualityChecks");
        Winner<Boolean> inspectionPass = firstNonNull(mostSpecificFirst,
            ConfigurationLayer::getEnforceInspectionPass, "enforceInspectionPass");
        Winner<Boolean> electronicSig = firstNonNull(mostSpecificFirst,
            ConfigurationLayer::getRequireElectronicSig, "requireElectronicSig");
        Winner<Boolean> externalQuality = firstNonNull(mostSpecificFirst,
            ConfigurationLayer::getAcceptExternalQuality, "acceptExternalQuality");
        Winner<Boolean> qualityRequired = firstNonNull(mostSpecificFirst,
            ConfigurationLayer::getQualityRequired, "qualityRequired");

        List.of(mode, statusGating, operationSequence, qualityChecks, inspectionPass,
                electronicSig, externalQuality, qualityRequired)
            .forEach(winner -> contributors.add(winner.level));

        ConfigurationSource source = ConfigurationSource.builder()
            .site(contributors.contains(ScopeLevel.SITE))
            .routing(contributors.contains(ScopeLevel.ROUTING))
            .workOrder(contributors.contains(ScopeLevel.WORK_ORDER))
            .operation(contributors.contains(ScopeLevel.OPERATION))
            .modeSource(mode.level)
            .qualityRequiredSource(qualityRequired.level)
            .build();

        return EffectiveConfiguration.builder()
            .domain(domain)
            .mode(mode.value)
            .enforceStatusGating(statusGating.value)
            .enforceOperationSequence(operationSequence.value)
            .enforceQualityChecks(qualityChecks.value)
            .enforceInspectionPass(inspectionPass.value)
            .requireElectronicSig(electronicSig.value)
            .acceptExternalQuality(externalQuality.value)
            .qualityRequired(qualityRequired.value)
            .source(source)
            .build();
    }

    private static <T> Winner<T> firstNonNull(
            List<ConfigurationLayer> layers,
            Function<ConfigurationLayer, T> field,
            String fieldName) {
        for (ConfigurationLayer layer : layers) {
            T value = field.apply(layer);
            if (value != null) {
                return new Winner<>(value, layer.getLevel());
            }
        }
        throw new IllegalStateException("No configuration layer defines " + fieldName);
    }

    private record Winner<T>(T value, ScopeLevel level) {
    }
}
