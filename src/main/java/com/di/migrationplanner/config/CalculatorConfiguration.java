package com.di.migrationplanner.config;

import com.di.migrationplanner.estimation.Calculator;
import com.di.migrationplanner.estimation.calculators.PostMigrationTroubleshooting;
import com.di.migrationplanner.estimation.calculators.StorageMigration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * One {@link Calculator} bean per migration stage, built from {@link EstimationProperties}.
 * New calculators only need a bean here to show up in the registry and the API.
 */
@Slf4j
@Configuration
public class CalculatorConfiguration {

    @Bean
    public PostMigrationTroubleshooting postMigrationTroubleshooting(EstimationProperties properties) {
        EstimationProperties.PostMigration cfg = properties.getPostMigration();
        if (cfg.getEngineerCount() <= 0) {
            log.warn("migration-planner.estimation.post-migration.engineer-count={} is not positive; "
                    + "post-migration estimates will fail unless the request overrides it", cfg.getEngineerCount());
        }
        return PostMigrationTroubleshooting.builder()
                .troubleshootMinsPerVm(cfg.getTroubleshootMinsPerVm())
                .engineerCount(cfg.getEngineerCount())
                .workHoursPerDay(cfg.getWorkHoursPerDay())
                .build();
    }

    @Bean
    public StorageMigration storageMigration(EstimationProperties properties) {
        return StorageMigration.builder()
                .transferRateMbps(properties.getStorage().getTransferRateMbps())
                .build();
    }
}
