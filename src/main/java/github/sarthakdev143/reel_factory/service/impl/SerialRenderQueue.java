package github.sarthakdev143.reel_factory.service.impl;

import github.sarthakdev143.reel_factory.model.RenderJob;
import github.sarthakdev143.reel_factory.model.RenderResult;
import github.sarthakdev143.reel_factory.service.RenderOutcomeListener;
import github.sarthakdev143.reel_factory.service.RenderPipeline;
import github.sarthakdev143.reel_factory.service.RenderQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * FIFO render queue drained by exactly one worker. Jobs finish in submission order and a failing job
 * never stops the worker.
 */
@Service
public class SerialRenderQueue implements RenderQueue {

    private static final Logger logger = LoggerFactory.getLogger(SerialRenderQueue.class);

    private final RenderQueueContext context;
    private final RenderPipeline pipeline;
    private final TaskExecutor workerExecutor;
    private final AtomicBoolean workerStarted = new AtomicBoolean(false);
    private final Counter completedCounter;
    private final Counter failedCounter;

    public SerialRenderQueue(
            RenderQueueContext context,
            RenderPipeline pipeline,
            @Qualifier("renderWorkerExecutor") TaskExecutor workerExecutor,
            MeterRegistry meterRegistry) {
        this.context = context;
        this.pipeline = pipeline;
        this.workerExecutor = workerExecutor;
        this.completedCounter = meterRegistry.counter("reel_factory.render.completed");
        this.failedCounter = meterRegistry.counter("reel_factory.render.failed");
    }

    @Override
    public void submit(RenderJob job, RenderOutcomeListener listener) {
        if (job == null || listener == null) {
            throw new IllegalArgumentException("job and listener are required.");
        }
        context.enqueue(new RenderQueueContext.PendingRender(job, listener));
        logger.info("Queued render job {} (pending={})", job.jobId(), context.pendingCount());
        startWorkerOnce();
    }

    @Override
    public int pendingCount() {
        return context.pendingCount();
    }

    private void startWorkerOnce() {
        if (!workerStarted.compareAndSet(false, true)) {
            return;
        }
        try {
            workerExecutor.execute(this::runWorkerLoop);
        } catch (RuntimeException e) {
            workerStarted.set(false);
            throw e;
        }
    }

    private void runWorkerLoop() {
        logger.info("Render worker started");
        boolean interrupted = false;
        try {
            while (!Thread.currentThread().isInterrupted()) {
                process(context.takeNext());
            }
            interrupted = true;
        } catch (InterruptedException e) {
            interrupted = true;
            Thread.currentThread().interrupt();
        } finally {
            workerStarted.set(false);
            logger.info("Render worker stopped");
            if (!interrupted) {
                relaunchIfPending();
            }
        }
    }

    private void relaunchIfPending() {
        if (context.pendingCount() == 0) {
            return;
        }
        logger.warn("Render worker exited abnormally, relaunching for {} pending job(s)", context.pendingCount());
        try {
            startWorkerOnce();
        } catch (RuntimeException e) {
            logger.error("Could not relaunch render worker", e);
        }
    }

    void process(RenderQueueContext.PendingRender render) throws InterruptedException {
        RenderJob job = render.job();
        RenderOutcomeListener listener = render.listener();
        context.markInFlight(job.jobId());
        try {
            notifyStarted(listener, job.jobId());
            RenderResult result = pipeline.render(job);
            completedCounter.increment();
            logger.info(
                    "Completed render job {} output={} duration={}s",
                    job.jobId(),
                    result.outputPath(),
                    result.durationSeconds());
            notifyCompleted(listener, job.jobId(), result);
        } catch (InterruptedException e) {
            failedCounter.increment();
            logger.warn("Render job {} interrupted", job.jobId());
            notifyFailed(listener, job.jobId(), e);
            throw e;
        } catch (Throwable e) {
            failedCounter.increment();
            logger.error("Render job {} failed", job.jobId(), e);
            notifyFailed(listener, job.jobId(), e);
            if (e instanceof VirtualMachineError fatal) {
                throw fatal;
            }
        } finally {
            context.clearInFlight();
        }
    }

    private void notifyStarted(RenderOutcomeListener listener, String jobId) {
        try {
            listener.onStarted(jobId);
        } catch (RuntimeException e) {
            logger.error("Start listener for render job {} threw", jobId, e);
        }
    }

    private void notifyCompleted(RenderOutcomeListener listener, String jobId, RenderResult result) {
        try {
            listener.onCompleted(jobId, result);
        } catch (RuntimeException e) {
            logger.error("Completion listener for render job {} threw", jobId, e);
        }
    }

    private void notifyFailed(RenderOutcomeListener listener, String jobId, Throwable cause) {
        try {
            listener.onFailed(jobId, cause);
        } catch (RuntimeException e) {
            logger.error("Failure listener for render job {} threw", jobId, e);
        }
    }
}
