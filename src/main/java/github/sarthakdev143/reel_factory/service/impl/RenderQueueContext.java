package github.sarthakdev143.reel_factory.service.impl;

import github.sarthakdev143.reel_factory.model.RenderJob;
import github.sarthakdev143.reel_factory.service.RenderOutcomeListener;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared state of the render queue: pending jobs in submission order and the job currently owned by
 * the worker. Enqueue is safe from any thread; only the worker dequeues.
 */
@Component
public class RenderQueueContext {

    public record PendingRender(RenderJob job, RenderOutcomeListener listener) {
    }

    private final BlockingQueue<PendingRender> pending = new LinkedBlockingQueue<>();
    private final AtomicReference<String> inFlightJobId = new AtomicReference<>();

    void enqueue(PendingRender render) {
        pending.add(render);
    }

    PendingRender takeNext() throws InterruptedException {
        return pending.take();
    }

    void markInFlight(String jobId) {
        inFlightJobId.set(jobId);
    }

    void clearInFlight() {
        inFlightJobId.set(null);
    }

    public int pendingCount() {
        return pending.size();
    }

    public Optional<String> inFlightJobId() {
        return Optional.ofNullable(inFlightJobId.get());
    }
}
