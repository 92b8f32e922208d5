package com.hyperunmix.server.unmixing;

import com.hyperunmix.server.config.UnmixConfig;

/**
 * Per-run parameters of {@link UnmixingPipeline#run}.
 */
public class PipelineParameters {
    // MNF components handed to PPI, null keeps all
    public Integer components = null;
    public int iterations = 10000;
    public double thresholdFactor = 0.10;
    public Long seed = null;
    public int endmemberCount = 5;
    public boolean addShade = true;

    public PipelineParameters() {
    }

    public PipelineParameters(Integer components, int iterations, double thresholdFactor, Long seed,
            int endmemberCount, boolean addShade) {
        this.components = components;
        this.iterations = iterations;
        this.thresholdFactor = thresholdFactor;
        this.seed = seed;
        this.endmemberCount = endmemberCount;
        this.addShade = addShade;
    }

    public static PipelineParameters fromConfig(UnmixConfig.ConfigRoot config) {
        return new PipelineParameters(
                config.mnf.components,
                config.ppi.iterationsOrDefault(),
                config.ppi.thresholdFactorOrDefault(),
                config.ppi.seed,
                config.endmembers.countOrDefault(),
                config.abundance.addShadeOrDefault());
    }

    public PipelineParameters copy() {
        return new PipelineParameters(
                this.components,
                this.iterations,
                this.thresholdFactor,
                this.seed,
                this.endmemberCount,
                this.addShade);
    }

    @Override
    public String toString() {
        return "PipelineParameters{" +
                "components=" + components +
                ", iterations=" + iterations +
                ", thresholdFactor=" + thresholdFactor +
                ", seed=" + seed +
                ", endmemberCount=" + endmemberCount +
                ", addShade=" + addShade +
                '}';
    }
}
