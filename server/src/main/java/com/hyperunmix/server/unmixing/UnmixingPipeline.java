package com.hyperunmix.server.unmixing;

import com.hyperunmix.server.config.UnmixConfig;
import com.hyperunmix.server.unmixing.backend.ArrayBackend;
import com.hyperunmix.server.unmixing.backend.ArrayBackendFactory;
import com.hyperunmix.server.unmixing.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;

/**
 * MNF -> PPI -> endmember extraction -> abundance mapping.
 *
 * Each stage takes the typed result of the stage before it, so a stage can never read output that has not
 * been computed. Stage results are immutable; re-running an upstream stage means re-running everything after
 * it.
 */
public class UnmixingPipeline {
    private static final Logger logger = LoggerFactory.getLogger(UnmixingPipeline.class);

    private final MnfTransform mnfTransform;
    private final PixelPurityScorer purityScorer;
    private final EndmemberExtractor endmemberExtractor;
    private final AbundanceMapper abundanceMapper;

    public UnmixingPipeline(MnfTransform mnfTransform, PixelPurityScorer purityScorer,
            EndmemberExtractor endmemberExtractor, AbundanceMapper abundanceMapper) {
        this.mnfTransform = mnfTransform;
        this.purityScorer = purityScorer;
        this.endmemberExtractor = endmemberExtractor;
        this.abundanceMapper = abundanceMapper;
    }

    public UnmixingPipeline() {
        this(new MnfTransform(), new PixelPurityScorer(), new EndmemberExtractor(), new AbundanceMapper());
    }

    public static UnmixingPipeline fromConfig(UnmixConfig.ConfigRoot config) {
        ArrayBackend backend = ArrayBackendFactory.create(config);
        UnmixConfig.EndmemberConfig em = config.endmembers;
        return new UnmixingPipeline(
                new MnfTransform(new NoiseCovarianceEstimator(), config.mnf.eigenvalueFloorOrDefault()),
                new PixelPurityScorer(backend, config.ppi.batchSizeOrDefault()),
                new EndmemberExtractor(em.topPercentileOrDefault(), em.kmeansInitializationsOrDefault(),
                        em.kmeansMaxIterationsOrDefault(), em.kmeansSeedOrDefault()),
                new AbundanceMapper());
    }

    public MnfResult mnf(HyperspectralCube cube) {
        return mnfTransform.apply(cube);
    }

    public PurityResult ppi(HyperspectralCube reducedCube, int iterations, double thresholdFactor, Long seed) {
        return purityScorer.score(reducedCube, iterations, thresholdFactor, seed);
    }

    public PurityResult ppi(HyperspectralCube reducedCube, int iterations, double thresholdFactor, Long seed,
            CancellationSignal cancellation, ProgressListener progress) {
        return purityScorer.score(reducedCube, iterations, thresholdFactor, seed, cancellation, progress);
    }

    public EndmemberSet extractEndmembers(PurityResult purity, HyperspectralCube original, int count) {
        return endmemberExtractor.extract(purity, original, count);
    }

    public AbundanceResult abundanceMap(EndmemberSet endmembers, HyperspectralCube original, boolean addShade) {
        return abundanceMapper.map(endmembers, original, addShade);
    }

    public UnmixingResult run(HyperspectralCube cube, PipelineParameters params) {
        return run(cube, params, CancellationSignal.NONE, ProgressListener.NONE);
    }

    public UnmixingResult run(HyperspectralCube cube, PipelineParameters params, CancellationSignal cancellation,
            ProgressListener progress) {
        validateParameters(cube, params);
        long start = System.currentTimeMillis();
        logger.info("Running unmixing pipeline on {} with {}", cube, params);

        MnfResult mnf = mnf(cube);
        checkCancelled(cancellation, "MNF");

        HyperspectralCube reduced = params.components != null ? mnf.reduce(params.components) : mnf.getComponents();
        PurityResult purity = ppi(reduced, params.iterations, params.thresholdFactor, params.seed, cancellation,
                progress);
        checkCancelled(cancellation, "PPI");

        EndmemberSet endmembers = extractEndmembers(purity, cube, params.endmemberCount);
        checkCancelled(cancellation, "endmember extraction");

        AbundanceResult abundances = abundanceMap(endmembers, cube, params.addShade);

        logger.info("Unmixing pipeline finished in {} ms: {} endmembers, {} abundance layers",
                (System.currentTimeMillis() - start), endmembers.size(), abundances.getLayerCount());
        return new UnmixingResult(mnf, reduced, purity, endmembers, abundances);
    }

    private static void checkCancelled(CancellationSignal cancellation, String afterStage) {
        if (cancellation.isCancelled() || Thread.currentThread().isInterrupted()) {
            logger.info("Pipeline cancelled after {}", afterStage);
            throw new CancellationException("Pipeline cancelled after " + afterStage);
        }
    }

    /**
     * Rejects inputs that would fail a later stage before any work is done.
     */
    public static void validateParameters(HyperspectralCube cube, PipelineParameters params) {
        if (cube == null || params == null) {
            throw new ValidationException("Cube and parameters are required");
        }
        if (cube.getHeight() < 2) {
            throw new ValidationException("Cube needs at least 2 rows, got " + cube.getHeight());
        }
        if (params.components != null && (params.components < 1 || params.components > cube.getBands())) {
            throw new ValidationException(
                    "Component count must be in [1, " + cube.getBands() + "], got " + params.components);
        }
        if (params.iterations <= 0) {
            throw new ValidationException("Iteration count must be positive, got " + params.iterations);
        }
        if (!(params.thresholdFactor >= 0.0 && params.thresholdFactor <= 1.0)) {
            throw new ValidationException("Threshold factor must be in [0, 1], got " + params.thresholdFactor);
        }
        if (params.endmemberCount < 2) {
            throw new ValidationException("Endmember count must be at least 2, got " + params.endmemberCount);
        }
    }
}
