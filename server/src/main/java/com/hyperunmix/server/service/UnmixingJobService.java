package com.hyperunmix.server.service;

import com.hyperunmix.server.config.UnmixConfig;
import com.hyperunmix.server.config.UnmixConfigLoader;
import com.hyperunmix.server.unmixing.HyperspectralCube;
import com.hyperunmix.server.unmixing.PipelineParameters;
import com.hyperunmix.server.unmixing.UnmixingPipeline;
import com.hyperunmix.server.unmixing.UnmixingResult;
import com.hyperunmix.server.unmixing.error.UnmixingException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs unmixing pipelines off the request thread. Finished jobs stay in memory until they are removed,
 * outlive the retention period, or are pushed out by newer finished jobs past the retention cap.
 */
@Service
public class UnmixingJobService {

    private static final Logger logger = LoggerFactory.getLogger(UnmixingJobService.class);

    public enum JobStatus {
        QUEUED, RUNNING, COMPLETED, FAILED, CANCELLED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == CANCELLED;
        }
    }

    public static class Job {
        private final String id;
        private final PipelineParameters parameters;
        private final CountDownLatch done = new CountDownLatch(1);
        private volatile JobStatus status = JobStatus.QUEUED;
        private volatile boolean cancelRequested = false;
        private volatile int completedIterations = 0;
        private volatile int totalIterations;
        private volatile UnmixingResult result;
        private volatile String errorMessage;
        private volatile long finishedAt;

        Job(String id, PipelineParameters parameters) {
            this.id = id;
            this.parameters = parameters;
            this.totalIterations = parameters.iterations;
        }

        public String getId() {
            return id;
        }

        public PipelineParameters getParameters() {
            return parameters.copy();
        }

        public JobStatus getStatus() {
            return status;
        }

        public int getCompletedIterations() {
            return completedIterations;
        }

        public int getTotalIterations() {
            return totalIterations;
        }

        // Only set once the job has COMPLETED
        public UnmixingResult getResult() {
            return result;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public boolean isCancelRequested() {
            return cancelRequested;
        }

        /**
         * Blocks until the job reaches a terminal status or the timeout elapses.
         */
        public boolean awaitDone(long timeout, TimeUnit unit) throws InterruptedException {
            return done.await(timeout, unit);
        }

        private void finish(JobStatus terminal) {
            finishedAt = System.currentTimeMillis();
            status = terminal;
            done.countDown();
        }
    }

    private final UnmixConfig.ConfigRoot config;
    private final UnmixingPipeline pipeline;
    private final ExecutorService executor;
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @Autowired
    public UnmixingJobService() {
        this(UnmixConfigLoader.load());
    }

    public UnmixingJobService(UnmixConfig.ConfigRoot config) {
        this.config = config;
        this.pipeline = UnmixingPipeline.fromConfig(config);
        int threads = config.worker.threadsOrDefault();
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "unmix-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        logger.info("Unmixing job service started with {} worker thread(s), backend={}", threads, config.backend);
    }

    /**
     * Parameters with every field taken from the loaded configuration.
     */
    public PipelineParameters defaultParameters() {
        return PipelineParameters.fromConfig(config);
    }

    /**
     * Validates the request and queues it. Invalid input is rejected here, before a job exists.
     */
    public Job submit(HyperspectralCube cube, PipelineParameters parameters) {
        UnmixingPipeline.validateParameters(cube, parameters);
        evictFinished();
        PipelineParameters params = parameters.copy();
        Job job = new Job(UUID.randomUUID().toString(), params);
        jobs.put(job.id, job);
        logger.info("Queued unmixing job {} for {}", job.id, cube);
        executor.submit(() -> runJob(job, cube));
        return job;
    }

    public Job get(String id) {
        return jobs.get(id);
    }

    /**
     * Requests cancellation. Returns false for an unknown id.
     * A running job stops at its next checkpoint and never exposes a partial result.
     */
    public boolean cancel(String id) {
        Job job = jobs.get(id);
        if (job == null) {
            return false;
        }
        job.cancelRequested = true;
        logger.info("Cancellation requested for job {} (status {})", id, job.status);
        return true;
    }

    /**
     * Drops a finished job. Returns the removed job, or null if the id is unknown or the job is still active.
     */
    public Job remove(String id) {
        Job job = jobs.get(id);
        if (job == null || !job.status.isTerminal()) {
            return null;
        }
        jobs.remove(id, job);
        logger.info("Removed job {} ({})", id, job.status);
        return job;
    }

    public int getTrackedJobCount() {
        return jobs.size();
    }

    /**
     * Drops finished jobs older than the retention period, then the oldest finished jobs beyond the cap.
     */
    void evictFinished() {
        long now = System.currentTimeMillis();
        long ttlMillis = TimeUnit.SECONDS.toMillis(config.worker.retentionSecondsOrDefault());
        List<Job> finished = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (!job.status.isTerminal()) {
                continue;
            }
            if (now - job.finishedAt >= ttlMillis) {
                jobs.remove(job.id, job);
                logger.debug("Evicted job {} after retention period", job.id);
            } else {
                finished.add(job);
            }
        }

        int excess = finished.size() - config.worker.maxRetainedJobsOrDefault();
        if (excess > 0) {
            finished.sort(Comparator.comparingLong(j -> j.finishedAt));
            for (int i = 0; i < excess; i++) {
                jobs.remove(finished.get(i).id, finished.get(i));
            }
            logger.info("Evicted {} finished job(s) over the retention cap", excess);
        }
    }

    private void runJob(Job job, HyperspectralCube cube) {
        if (job.cancelRequested) {
            logger.info("Job {} cancelled before it started", job.id);
            job.finish(JobStatus.CANCELLED);
            return;
        }
        job.status = JobStatus.RUNNING;
        long start = System.currentTimeMillis();
        try {
            UnmixingResult result = pipeline.run(cube, job.parameters, () -> job.cancelRequested,
                    (completed, total) -> {
                        job.completedIterations = completed;
                        job.totalIterations = total;
                    });
            job.result = result.withoutProjections();
            job.finish(JobStatus.COMPLETED);
            logger.info("Job {} completed in {} ms", job.id, (System.currentTimeMillis() - start));
        } catch (CancellationException e) {
            logger.info("Job {} cancelled: {}", job.id, e.getMessage());
            job.finish(JobStatus.CANCELLED);
        } catch (UnmixingException e) {
            logger.warn("Job {} failed: {}", job.id, e.getMessage());
            job.errorMessage = e.getMessage();
            job.finish(JobStatus.FAILED);
        } catch (RuntimeException e) {
            logger.error("Job {} failed unexpectedly", job.id, e);
            job.errorMessage = e.toString();
            job.finish(JobStatus.FAILED);
        }
    }

    @PreDestroy
    public void shutdown() {
        logger.info("Shutting down unmixing workers ({} jobs tracked)", jobs.size());
        for (Job job : jobs.values()) {
            if (!job.status.isTerminal()) {
                job.cancelRequested = true;
            }
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
