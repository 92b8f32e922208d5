package com.hyperunmix.server.config;

/**
 * Configuration read from unmix_config.json. Null fields fall back to the defaults of the owning section.
 */
public class UnmixConfig {

    public static class MnfConfig {
        public Double eigenvalueFloor;
        // Components handed to PPI; null keeps all of them
        public Integer components;

        public double eigenvalueFloorOrDefault() {
            return eigenvalueFloor != null ? eigenvalueFloor : 1e-8;
        }
    }

    public static class PpiConfig {
        public Integer iterations;
        public Double thresholdFactor;
        public Integer batchSize;
        public Long seed;

        public int iterationsOrDefault() {
            return iterations != null ? iterations : 10000;
        }

        public double thresholdFactorOrDefault() {
            return thresholdFactor != null ? thresholdFactor : 0.10;
        }

        public int batchSizeOrDefault() {
            return batchSize != null ? batchSize : 1000;
        }
    }

    public static class EndmemberConfig {
        public Integer count;
        public Double topPercentile;
        public Integer kmeansInitializations;
        public Integer kmeansMaxIterations;
        public Long kmeansSeed;

        public int countOrDefault() {
            return count != null ? count : 5;
        }

        public double topPercentileOrDefault() {
            return topPercentile != null ? topPercentile : 98.0;
        }

        public int kmeansInitializationsOrDefault() {
            return kmeansInitializations != null ? kmeansInitializations : 10;
        }

        public int kmeansMaxIterationsOrDefault() {
            return kmeansMaxIterations != null ? kmeansMaxIterations : 300;
        }

        public long kmeansSeedOrDefault() {
            return kmeansSeed != null ? kmeansSeed : 42L;
        }
    }

    public static class AbundanceConfig {
        public Boolean addShade;

        public boolean addShadeOrDefault() {
            return addShade != null ? addShade : true;
        }
    }

    public static class WorkerConfig {
        public Integer threads;
        // Finished jobs kept for polling; the oldest finished ones go first
        public Integer maxRetainedJobs;
        public Long retentionSeconds;

        public int threadsOrDefault() {
            return threads != null && threads > 0 ? threads : 1;
        }

        public int maxRetainedJobsOrDefault() {
            return maxRetainedJobs != null && maxRetainedJobs >= 0 ? maxRetainedJobs : 100;
        }

        public long retentionSecondsOrDefault() {
            return retentionSeconds != null && retentionSeconds >= 0 ? retentionSeconds : 3600L;
        }
    }

    public static class ConfigRoot {
        public String backend = "cpu";
        public MnfConfig mnf = new MnfConfig();
        public PpiConfig ppi = new PpiConfig();
        public EndmemberConfig endmembers = new EndmemberConfig();
        public AbundanceConfig abundance = new AbundanceConfig();
        public WorkerConfig worker = new WorkerConfig();
    }
}
