package com.hyperunmix.server.controller;

import com.hyperunmix.server.service.UnmixingJobService;
import com.hyperunmix.server.unmixing.AbundanceResult;
import com.hyperunmix.server.unmixing.Endmember;
import com.hyperunmix.server.unmixing.EndmemberVisualizer;
import com.hyperunmix.server.unmixing.HyperspectralCube;
import com.hyperunmix.server.unmixing.NdProjection;
import com.hyperunmix.server.unmixing.PipelineParameters;
import com.hyperunmix.server.unmixing.UnmixingResult;
import com.hyperunmix.server.unmixing.error.UnmixingException;
import com.hyperunmix.server.unmixing.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/unmix/jobs")
public class UnmixingController {

    private static final Logger logger = LoggerFactory.getLogger(UnmixingController.class);
    private final UnmixingJobService jobService;
    private final EndmemberVisualizer visualizer = new EndmemberVisualizer();

    public UnmixingController(UnmixingJobService jobService) {
        this.jobService = jobService;
    }

    public static class UnmixRequest {
        // [row][col][band]
        public double[][][] cube;
        // Optional overrides, config defaults otherwise
        public Integer iterations;
        public Double thresholdFactor;
        public Long seed;
        public Integer components;
        public Integer endmembers;
        public Boolean addShade;
    }

    @PostMapping
    public ResponseEntity<?> submit(@RequestBody UnmixRequest request) {
        if (request == null || request.cube == null) {
            return ResponseEntity.badRequest().body("Missing cube. Expected a [height][width][bands] array.");
        }
        try {
            HyperspectralCube cube = HyperspectralCube.of(request.cube);
            PipelineParameters params = toParameters(request);
            logger.info("Received unmixing request for {}", cube);
            UnmixingJobService.Job job = jobService.submit(cube, params);

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("jobId", job.getId());
            body.put("status", job.getStatus());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        } catch (ValidationException e) {
            logger.info("Rejected unmixing request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> status(@PathVariable("id") String id) {
        UnmixingJobService.Job job = jobService.get(id);
        if (job == null) {
            return ResponseEntity.notFound().build();
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jobId", job.getId());
        body.put("status", job.getStatus());
        body.put("completedIterations", job.getCompletedIterations());
        body.put("totalIterations", job.getTotalIterations());
        if (job.getErrorMessage() != null) {
            body.put("error", job.getErrorMessage());
        }
        UnmixingResult result = job.getResult();
        if (result != null) {
            body.put("summary", summarize(result));
        }
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{id}/abundance/{index}")
    public ResponseEntity<?> abundance(@PathVariable("id") String id, @PathVariable("index") int index) {
        UnmixingJobService.Job job = jobService.get(id);
        if (job == null) {
            return ResponseEntity.notFound().build();
        }
        UnmixingResult result = job.getResult();
        if (result == null) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body("Job " + id + " is " + job.getStatus());
        }
        try {
            return ResponseEntity.ok(result.getAbundances().getMap(index));
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    // Endmember clusters projected to their leading principal components
    @GetMapping("/{id}/projection")
    public ResponseEntity<?> projection(@PathVariable("id") String id,
            @RequestParam(name = "components", defaultValue = "3") int components) {
        UnmixingJobService.Job job = jobService.get(id);
        if (job == null) {
            return ResponseEntity.notFound().build();
        }
        UnmixingResult result = job.getResult();
        if (result == null) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body("Job " + id + " is " + job.getStatus());
        }
        try {
            NdProjection projection = visualizer.project(result.getEndmembers(), components);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("components", projection.getComponents());
            body.put("variances", projection.getVariances());
            body.put("endmemberPoints", projection.getEndmemberPoints());
            body.put("clusterPoints", projection.getClusterPoints());
            return ResponseEntity.ok(body);
        } catch (ValidationException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (UnmixingException e) {
            logger.warn("Projection of job {} failed: {}", id, e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(e.getMessage());
        }
    }

    /**
     * Cancels an active job (202) or releases a finished one (200 with its final status).
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<?> cancel(@PathVariable("id") String id) {
        UnmixingJobService.Job job = jobService.get(id);
        if (job == null) {
            return ResponseEntity.notFound().build();
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jobId", id);
        UnmixingJobService.Job removed = jobService.remove(id);
        if (removed != null) {
            body.put("status", removed.getStatus());
            body.put("removed", true);
            return ResponseEntity.ok(body);
        }
        jobService.cancel(id);
        body.put("status", job.getStatus());
        body.put("cancelRequested", true);
        return ResponseEntity.accepted().body(body);
    }

    private PipelineParameters toParameters(UnmixRequest request) {
        PipelineParameters params = jobService.defaultParameters();
        if (request.iterations != null)
            params.iterations = request.iterations;
        if (request.thresholdFactor != null)
            params.thresholdFactor = request.thresholdFactor;
        if (request.seed != null)
            params.seed = request.seed;
        if (request.components != null)
            params.components = request.components;
        if (request.endmembers != null)
            params.endmemberCount = request.endmembers;
        if (request.addShade != null)
            params.addShade = request.addShade;
        return params;
    }

    private static Map<String, Object> summarize(UnmixingResult result) {
        int width = result.getEndmembers().getWidth();
        List<Map<String, Object>> endmembers = new ArrayList<>();
        for (Endmember em : result.getEndmembers().getEndmembers()) {
            Map<String, Object> e = new LinkedHashMap<>();
            e.put("spectrum", em.getSpectrum());
            e.put("sourceRow", em.getSourcePixel() / width);
            e.put("sourceCol", em.getSourcePixel() % width);
            e.put("purity", em.getSourcePurity());
            e.put("cluster", em.getClusterIndex());
            e.put("members", em.getMemberCount());
            endmembers.add(e);
        }

        AbundanceResult abundances = result.getAbundances();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("eigenvalues", result.getMnf().getEigenvalues());
        summary.put("ppiComponents", result.getReducedCube().getBands());
        summary.put("scoredPixels", result.getPurity().countScoredPixels());
        int purest = result.getPurity().getPurestPixel();
        summary.put("purestPixel", purest);
        summary.put("purestScore", result.getPurity().getScore(purest / width, purest % width));
        summary.put("purityThreshold", result.getEndmembers().getPurityThreshold());
        summary.put("endmembers", endmembers);
        summary.put("abundanceShape",
                new int[] { abundances.getHeight(), abundances.getWidth(), abundances.getLayerCount() });
        summary.put("shadeIncluded", abundances.isShadeIncluded());
        return summary;
    }
}
