package com.hyperunmix.server.unmixing;

import com.hyperunmix.server.config.UnmixConfig;
import com.hyperunmix.server.unmixing.error.InsufficientPurePixelsException;
import com.hyperunmix.server.unmixing.error.ValidationException;
import com.hyperunmix.util.SpectralMath;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

public class UnmixingPipelineTest {

    @Test
    public void testTwoMaterialSceneIsUnmixed() {
        HyperspectralCube cube = SyntheticCubes.twoMaterials(50, 50, 20, 0.01, 2024L);
        PipelineParameters params = new PipelineParameters(5, 5000, 0.1, 7L, 2, true);

        UnmixingResult result = new UnmixingPipeline().run(cube, params);

        assertEquals(20, result.getMnf().getEigenvalues().length);
        assertEquals(5, result.getReducedCube().getBands());
        assertEquals(2, result.getEndmembers().size());

        // Each true spectrum is matched by an extracted endmember
        double[] a = SyntheticCubes.materialA(20);
        double[] b = SyntheticCubes.materialB(20);
        double[][] spectra = result.getEndmembers().getSpectra();
        int indexA = SpectralMath.cosineSimilarity(spectra[0], a) > SpectralMath.cosineSimilarity(spectra[1], a)
                ? 0 : 1;
        int indexB = 1 - indexA;
        assertTrue(SpectralMath.cosineSimilarity(spectra[indexA], a) > 0.99);
        assertTrue(SpectralMath.cosineSimilarity(spectra[indexB], b) > 0.99);

        AbundanceResult abundances = result.getAbundances();
        assertEquals(3, abundances.getLayerCount());
        for (int r = 0; r < 50; r += 7) {
            assertTrue(abundances.get(r, 3, indexA) > 0.95, "Left half should be material A");
            assertTrue(abundances.get(r, 46, indexB) > 0.95, "Right half should be material B");
        }
    }

    @Test
    public void testLowNoiseSceneScoredOnAllMnfComponents() {
        HyperspectralCube cube = SyntheticCubes.twoMaterials(50, 50, 20, 1e-3, 99L);
        PipelineParameters params = new PipelineParameters(null, 5000, 0.1, 7L, 2, true);

        UnmixingResult result = new UnmixingPipeline().run(cube, params);

        // PPI ran on the full MNF output
        assertEquals(20, result.getReducedCube().getBands());
        assertEquals(2, result.getEndmembers().size());

        double[] a = SyntheticCubes.materialA(20);
        double[] b = SyntheticCubes.materialB(20);
        double[][] spectra = result.getEndmembers().getSpectra();
        int indexA = SpectralMath.cosineSimilarity(spectra[0], a) > SpectralMath.cosineSimilarity(spectra[1], a)
                ? 0 : 1;
        int indexB = 1 - indexA;
        assertTrue(SpectralMath.cosineSimilarity(spectra[indexA], a) > 0.99);
        assertTrue(SpectralMath.cosineSimilarity(spectra[indexB], b) > 0.99);

        AbundanceResult abundances = result.getAbundances();
        for (int r = 0; r < 50; r += 7) {
            assertEquals(1.0, abundances.get(r, 3, indexA), 0.05);
            assertEquals(0.0, abundances.get(r, 3, indexB), 0.05);
            assertEquals(1.0, abundances.get(r, 46, indexB), 0.05);
            assertEquals(0.0, abundances.get(r, 46, indexA), 0.05);
        }
    }

    @Test
    public void testConstantCubeHasNoPurePixels() {
        HyperspectralCube cube = SyntheticCubes.constant(10, 10, 5, 0.3);
        PipelineParameters params = new PipelineParameters(null, 500, 0.1, 1L, 2, true);
        assertThrows(InsufficientPurePixelsException.class, () -> new UnmixingPipeline().run(cube, params));
    }

    @Test
    public void testStagesCanRunIndividually() {
        UnmixingPipeline pipeline = new UnmixingPipeline();
        HyperspectralCube cube = SyntheticCubes.twoMaterials(20, 20, 8, 0.01, 77L);

        MnfResult mnf = pipeline.mnf(cube);
        PurityResult purity = pipeline.ppi(mnf.reduce(3), 1000, 0.1, 3L);
        EndmemberSet endmembers = pipeline.extractEndmembers(purity, cube, 2);
        AbundanceResult abundances = pipeline.abundanceMap(endmembers, cube, false);

        assertEquals(20, purity.getHeight());
        assertEquals(8, endmembers.getBands());
        assertEquals(2, abundances.getLayerCount());
    }

    @Test
    public void testCancellationBetweenStages() {
        HyperspectralCube cube = SyntheticCubes.twoMaterials(10, 10, 4, 0.01, 1L);
        PipelineParameters params = new PipelineParameters(null, 100, 0.1, 1L, 2, true);
        assertThrows(CancellationException.class,
                () -> new UnmixingPipeline().run(cube, params, () -> true, ProgressListener.NONE));
    }

    @Test
    public void testParametersAreValidatedUpFront() {
        HyperspectralCube cube = SyntheticCubes.twoMaterials(10, 10, 4, 0.01, 1L);
        UnmixingPipeline pipeline = new UnmixingPipeline();
        assertThrows(ValidationException.class,
                () -> pipeline.run(cube, new PipelineParameters(5, 100, 0.1, 1L, 2, true)));
        assertThrows(ValidationException.class,
                () -> pipeline.run(cube, new PipelineParameters(null, 0, 0.1, 1L, 2, true)));
        assertThrows(ValidationException.class,
                () -> pipeline.run(cube, new PipelineParameters(null, 100, -0.1, 1L, 2, true)));
        assertThrows(ValidationException.class,
                () -> pipeline.run(cube, new PipelineParameters(null, 100, 0.1, 1L, 1, true)));
    }

    @Test
    public void testBuildsFromConfig() {
        UnmixConfig.ConfigRoot config = new UnmixConfig.ConfigRoot();
        config.backend = "parallel";
        config.ppi.batchSize = 64;
        PipelineParameters params = PipelineParameters.fromConfig(config);
        assertEquals(10000, params.iterations);
        assertEquals(5, params.endmemberCount);
        assertTrue(params.addShade);
        assertNull(params.components);

        params.iterations = 500;
        params.endmemberCount = 2;
        params.seed = 4L;
        UnmixingResult result = UnmixingPipeline.fromConfig(config)
                .run(SyntheticCubes.twoMaterials(16, 16, 6, 0.01, 3L), params);
        assertEquals(2, result.getEndmembers().size());
    }
}
