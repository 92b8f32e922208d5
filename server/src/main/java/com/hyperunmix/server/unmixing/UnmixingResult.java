package com.hyperunmix.server.unmixing;

/**
 * Every stage result of one pipeline run.
 */
public class UnmixingResult {
    private final MnfResult mnf;
    private final HyperspectralCube reducedCube;
    private final PurityResult purity;
    private final EndmemberSet endmembers;
    private final AbundanceResult abundances;

    public UnmixingResult(MnfResult mnf, HyperspectralCube reducedCube, PurityResult purity,
            EndmemberSet endmembers, AbundanceResult abundances) {
        this.mnf = mnf;
        this.reducedCube = reducedCube;
        this.purity = purity;
        this.endmembers = endmembers;
        this.abundances = abundances;
    }

    public MnfResult getMnf() {
        return mnf;
    }

    public HyperspectralCube getReducedCube() {
        return reducedCube;
    }

    public PurityResult getPurity() {
        return purity;
    }

    public EndmemberSet getEndmembers() {
        return endmembers;
    }

    public AbundanceResult getAbundances() {
        return abundances;
    }

    /**
     * Copy that drops the per-pixel PPI projections, for results held after the run.
     */
    public UnmixingResult withoutProjections() {
        return new UnmixingResult(mnf, reducedCube, purity.withoutProjections(), endmembers, abundances);
    }
}
