package com.di.migrationplanner.config;

import com.di.migrationplanner.estimation.calculators.PostMigrationTroubleshooting;
import com.di.migrationplanner.estimation.calculators.StorageMigration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Calculator defaults, bound from YAML. Per-request parameters still take precedence over these.
 *
 * <pre>
 * migration-planner:
 *   estimation:
 *     post-migration:
 *       troubleshoot-mins-per-vm: 60
 *       engineer-count: 10
 *       work-hours-per-day: 8
 *     storage:
 *       transfer-rate-mbps: 620
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "migration-planner.estimation")
public class EstimationProperties {

    private PostMigration postMigration = new PostMigration();
    private Storage storage = new Storage();

    @Data
    public static class PostMigration {
        /** Minutes of hands-on troubleshooting per migrated VM. */
        private double troubleshootMinsPerVm = PostMigrationTroubleshooting.DEFAULT_TROUBLESHOOT_MINS_PER_VM;
        /** Engineers working in parallel; must be positive or every estimate fails. */
        private int engineerCount = PostMigrationTroubleshooting.DEFAULT_ENGINEER_COUNT;
        private double workHoursPerDay = PostMigrationTroubleshooting.DEFAULT_WORK_HOURS_PER_DAY;
    }

    @Data
    public static class Storage {
        /** Sustained transfer rate in Mbps. Non-positive values fall back to the built-in default. */
        private double transferRateMbps = StorageMigration.DEFAULT_TRANSFER_RATE_MBPS;
    }
}
