package com.mesenforcement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import java.time.Clock;

/**
 * Main application class for the workflow and quality enforcement engine.
 *
 * <p>The engine answers whether a state-changing action on a work order or operation
 * may proceed, and records what was bypassed:
 *
 * <ul>
 *   <li><strong>Configuration resolution</strong>: site, routing, work order and operation overrides merged over system defaults</li>
 *   <li><strong>Workflow enforcement</strong>: status gating and prerequisite sequencing per mode</li>
 *   <li><strong>Quality enforcement</strong>: inspections, electronic signatures, NCR dispositions</li>
 *   <li><strong>Audit trail</strong>: append-only record of every bypass</li>
 * </ul>
 *
 * <p><strong>Architecture:</strong> hexagonal; domain ports in {@code domain.repository},
 * Spring Data JPA adapters in {@code infrastructure.persistence}. No transport is exposed;
 * the services in {@code application} are the public contract.
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class MesEnforcementApplication {

    public static void main(String[] args) {
        SpringApplication.run(MesEnforcementApplication.class, args);

        log.info("MES enforcement engine started");
    }

    @Bean
    Clock auditClock() {
        return Clock.systemUTC();
    }
}
