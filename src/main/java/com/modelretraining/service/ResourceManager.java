package com.modelretraining.service;

import com.modelretraining.config.RetrainingSettings;
import com.modelretraining.entity.JobLedgerEntry;
import com.modelretraining.model.JobStatus;
import com.modelretraining.model.ResourceRequirement;
import com.modelretraining.model.ResourceSnapshot;
import com.modelretraining.model.TrainingJob;
import com.modelretraining.repository.JobLedgerRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded priority queue of training jobs drained by a fixed set of background
 * workers (one by default, so jobs never interleave).
 *
 * <p>Admission is checked under the submission call only: the resource probe is
 * not a reservation, so two racing submissions may both pass it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResourceManager {

    private static final Comparator<QueuedJob> ORDER = Comparator
        .comparingInt((QueuedJob q) -> q.job().getPriority())
        .thenComparingLong(QueuedJob::sequence);

    private final RetrainingSettings settings;
    private final ResourceProbe probe;
    private final ContainerJobRunner containerRunner;
    private final JobLedgerRepository ledger;
    private final Clock clock;

    private final PriorityBlockingQueue<QueuedJob> queue = new PriorityBlockingQueue<>(11, ORDER);
    private final AtomicLong sequence = new AtomicLong();
    private final List<Thread> workers = new ArrayList<>();
    private volatile boolean stopping;

    @PostConstruct
    public void start() {
        abandonStaleJobs();
        for (int i = 1; i <= settings.getMaxConcurrentJobs(); i++) {
            Thread worker = new Thread(this::workerLoop, "retrain-worker-" + i);
            worker.setDaemon(true);
            workers.add(worker);
            worker.start();
        }
        log.info("Resource manager started | workers={} | maxQueueSize={} | isolated={}",
                 workers.size(), settings.getMaxQueueSize(), settings.isUseIsolatedExecution());
    }

    /**
     * Admits the job if the queue has room and the host currently has the CPU and
     * memory the job declares. Returns {@code false} without enqueuing otherwise.
     */
    public synchronized boolean submitJob(TrainingJob job) {
        if (stopping) {
            log.warn("Job rejected, resource manager stopping | jobId={}", job.getJobId());
            return false;
        }
        if (isAtCapacity()) {
            log.warn("Job rejected, queue full | jobId={} | triggerId={} | queueSize={}",
                     job.getJobId(), job.getTriggerId(), queue.size());
            return false;
        }
        ResourceRequirement requirement = requirementOf(job);
        ResourceSnapshot free = probe.snapshot();
        if (!free.satisfies(requirement)) {
            log.warn("Job rejected, insufficient resources | jobId={} | requiredCpu={} | requiredMemoryMb={} "
                     + "| freeCpu={} | freeMemoryMb={}",
                     job.getJobId(), requirement.cpuCores(), requirement.memoryMb(),
                     free.freeCpuCores(), free.freeMemoryMb());
            return false;
        }

        Instant now = Instant.now(clock);
        try {
            ledger.save(JobLedgerEntry.builder()
                .jobId(job.getJobId())
                .triggerId(job.getTriggerId())
                .priority(job.getPriority())
                .cpuCores(requirement.cpuCores())
                .memoryMb(requirement.memoryMb())
                .submittedAt(now)
                .status(JobStatus.QUEUED)
                .build());
        } catch (DataAccessException ex) {
            log.error("Job rejected, job ledger unwritable | jobId={}", job.getJobId(), ex);
            return false;
        }

        queue.offer(new QueuedJob(job, sequence.incrementAndGet(), now));
        log.info("Job queued | jobId={} | triggerId={} | priority={} | queueSize={}",
                 job.getJobId(), job.getTriggerId(), job.getPriority(), queue.size());
        return true;
    }

    public boolean isAtCapacity() {
        return queue.size() >= settings.getMaxQueueSize();
    }

    public int queueDepth() {
        return queue.size();
    }

    /**
     * Stops the workers after their current job and abandons whatever is still
     * queued. Running payloads are not interrupted.
     */
    @PreDestroy
    public void shutdown() {
        synchronized (this) {
            stopping = true;
        }
        long deadline = System.nanoTime() + settings.getShutdownTimeout().toNanos();
        for (Thread worker : workers) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            try {
                worker.join(Math.max(1, remainingMs));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                break;
            }
            if (worker.isAlive()) {
                log.warn("Worker still busy at shutdown | thread={}", worker.getName());
            }
        }
        List<QueuedJob> leftover = new ArrayList<>();
        queue.drainTo(leftover);
        leftover.forEach(q -> record(q.job().getJobId(), JobStatus.ABANDONED, "shutdown"));
        log.info("Resource manager stopped | abandonedJobs={}", leftover.size());
    }

    private void workerLoop() {
        long pollMs = settings.getPollTimeout().toMillis();
        while (!stopping) {
            QueuedJob next;
            try {
                next = queue.poll(pollMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            }
            if (next != null) {
                execute(next);
            }
        }
    }

    void execute(QueuedJob queued) {
        TrainingJob job = queued.job();
        record(job.getJobId(), JobStatus.RUNNING, null);
        log.info("Job started | jobId={} | triggerId={} | waitedMs={}", job.getJobId(), job.getTriggerId(),
                 Instant.now(clock).toEpochMilli() - queued.submittedAt().toEpochMilli());
        try {
            if (settings.isUseIsolatedExecution()) {
                if (job.getContainerCommand().isEmpty()) {
                    throw new IllegalStateException("isolated execution enabled but job has no container command");
                }
                containerRunner.run(job, requirementOf(job));
            } else {
                job.getPayload().run();
            }
            record(job.getJobId(), JobStatus.SUCCEEDED, null);
            log.info("Job finished | jobId={}", job.getJobId());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            record(job.getJobId(), JobStatus.ABANDONED, "interrupted");
            log.warn("Job interrupted | jobId={}", job.getJobId());
        } catch (Exception ex) {
            record(job.getJobId(), JobStatus.FAILED, truncate(ex.toString()));
            log.error("Job failed | jobId={} | triggerId={}", job.getJobId(), job.getTriggerId(), ex);
        }
    }

    private void abandonStaleJobs() {
        try {
            List<JobLedgerEntry> stale = ledger.findByStatusInOrderBySubmittedAtAsc(
                EnumSet.of(JobStatus.QUEUED, JobStatus.RUNNING));
            stale.forEach(e -> record(e.getJobId(), JobStatus.ABANDONED, "process restarted"));
            if (!stale.isEmpty()) {
                log.warn("Stale jobs abandoned | count={}", stale.size());
            }
        } catch (DataAccessException ex) {
            log.error("Stale job scan failed", ex);
        }
    }

    private void record(UUID jobId, JobStatus status, String message) {
        Instant at = status == JobStatus.RUNNING ? null : Instant.now(clock);
        try {
            ledger.updateStatus(jobId, status, at, message);
        } catch (DataAccessException ex) {
            log.error("Job ledger update failed | jobId={} | status={}", jobId, status, ex);
        }
    }

    private ResourceRequirement requirementOf(TrainingJob job) {
        return job.getRequirement() != null ? job.getRequirement() : settings.defaultRequirement();
    }

    private static String truncate(String message) {
        return message.length() <= 500 ? message : message.substring(0, 500);
    }

    record QueuedJob(TrainingJob job, long sequence, Instant submittedAt) {
    }
}
