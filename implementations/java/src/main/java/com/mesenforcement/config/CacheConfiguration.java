package com.mesenforcement.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Caffeine caches for administrative rule data.
 *
 * <p>Only rows that change through administration (disposition rules, signature
 * requirements) are cached. Work order state, inspections and configuration overrides
 * are read fresh for every decision.
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfiguration {

    public static final String NCR_DISPOSITION_RULES = "ncrDispositionRules";
    public static final String SITE_SIGNATURE_REQUIREMENTS = "siteSignatureRequirements";
    public static final String GLOBAL_SIGNATURE_REQUIREMENTS = "globalSignatureRequirements";

    @Bean
    public CacheManager cacheManager(EnforcementProperties properties) {
        EnforcementProperties.Cache cache = properties.getCache();
        log.info("Configuring Caffeine rule cache: ttl={}, maximumSize={}",
            cache.getRuleTtl(), cache.getMaximumSize());

        CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        cacheManager.setCaffeine(Caffeine.newBuilder()
            .maximumSize(cache.getMaximumSize())
            .expireAfterWrite(cache.getRuleTtl())
            .recordStats()
        );
        cacheManager.setCacheNames(List.of(
            NCR_DISPOSITION_RULES,
            SITE_SIGNATURE_REQUIREMENTS,
            GLOBAL_SIGNATURE_REQUIREMENTS
        ));
        return cacheManager;
    }
}
