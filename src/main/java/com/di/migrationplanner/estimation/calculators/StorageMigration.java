package com.di.migrationplanner.estimation.calculators;

import com.di.migrationplanner.estimation.Calculator;
import com.di.migrationplanner.estimation.Estimation;
import com.di.migrationplanner.estimation.Param;
import com.di.migrationplanner.estimation.ParamValues;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Estimates how long it takes to copy VM disks from the source to the target cluster
 * at a sustained network rate.
 *
 * <pre>
 *   minutes = (totalDiskGb * 1024) / (transferRateMbps / 8) / 60
 * </pre>
 */
@Slf4j
public final class StorageMigration implements Calculator {

    public static final String NAME = "Storage Migration";

    /** Total disk size across all VMs in GB. Required. */
    public static final String PARAM_TOTAL_DISK_GB = "total_disk_gb";
    /** Sustained transfer rate in megabits per second. Optional. */
    public static final String PARAM_TRANSFER_RATE_MBPS = "transfer_rate_mbps";

    /** 620 Mbps = 77.5 MB/s, i.e. roughly 110 min per 500 GB. */
    public static final double DEFAULT_TRANSFER_RATE_MBPS = 620.0;

    private final double transferRateMbps;

    private StorageMigration(Builder builder) {
        this.transferRateMbps = builder.transferRateMbps;
    }

    public static StorageMigration withDefaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> keys() {
        return List.of(PARAM_TOTAL_DISK_GB);
    }

    @Override
    public Estimation calculate(Map<String, Param> params) {
        double totalGb = ParamValues.requireNonNegative(params, PARAM_TOTAL_DISK_GB);

        double rateMbps = transferRateMbps;
        // type-checked even when the value ends up ignored
        OptionalDouble override = ParamValues.optionalDouble(params, PARAM_TRANSFER_RATE_MBPS);
        if (override.isPresent() && override.getAsDouble() > 0) {
            rateMbps = override.getAsDouble();
        }

        double rateMBps = rateMbps / 8;
        double totalMinutes = (totalGb * 1024) / rateMBps / 60;
        double minsPer500Gb = (500.0 * 1024.0) / rateMBps / 60.0;

        log.debug("[STORAGE] totalGb={} rateMbps={} totalMinutes={}", totalGb, rateMbps, totalMinutes);

        String reason = String.format(Locale.ROOT, "%.2f GB at %.0f Mbps (%.0f min/500GB)",
                totalGb, rateMbps, minsPer500Gb);
        return Estimation.ofMinutes(totalMinutes, reason);
    }

    public double getTransferRateMbps() {
        return transferRateMbps;
    }

    public static final class Builder {
        private double transferRateMbps = DEFAULT_TRANSFER_RATE_MBPS;

        private Builder() {}

        /** Non-positive values are ignored and the previous rate is kept. */
        public Builder transferRateMbps(double mbps) {
            if (mbps > 0) {
                this.transferRateMbps = mbps;
            }
            return this;
        }

        public StorageMigration build() {
            return new StorageMigration(this);
        }
    }
}
