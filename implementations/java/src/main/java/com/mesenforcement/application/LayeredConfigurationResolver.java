package com.mesenforcement.application;

import com.mesenforcement.config.EnforcementProperties;
import com.mesenforcement.domain.model.config.ConfigurationDomain;
import com.mesenforcement.domain.model.config.ConfigurationLayer;
import com.mesenforcement.domain.model.config.ConfigurationScope;
import com.mesenforcement.domain.model.config.EffectiveConfiguration;
import com.mesenforcement.domain.model.config.ScopeLevel;
import com.mesenforcement.domain.repository.ConfigurationOverrideRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Resolver backed by persisted override rows.
 *
 * <p>Reads one optional override per present scope, appends the system defaults bound
 * from {@code mes.enforcement.*} and hands the ordered layers to
 * {@link ConfigurationMerger}.
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class LayeredConfigurationResolver implements ConfigurationResolver {

    private final ConfigurationOverrideRepository overrideRepository;
    private final EnforcementProperties properties;

    @Override
    public EffectiveConfiguration resolve(ConfigurationDomain domain, ConfigurationScope scope) {
        List<ConfigurationLayer> layers = new ArrayList<>(5);

        for (Map.Entry<ScopeLevel, String> entry : scope.mostSpecificFirst()) {
            StoreCalls.call(
                "Failed to load " + domain + " configuration for " + entry.getKey(),
                () -> overrideRepository.findLayer(domain, entry.getKey(), entry.getValue())
            ).ifPresent(layers::add);
        }
        layers.add(properties.systemDefaults(domain));

        EffectiveConfiguration effective = ConfigurationMerger.merge(domain, layers);

        if (log.isDebugEnabled()) {
            log.debug("Resolved {} configuration: mode={}, modeSource={}, overrides={}",
                domain, effective.getMode().name(), effective.getSource().getModeSource(), layers.size() - 1);
        }
        return effective;
    }
}
