package github.sarthakdev143.reel_factory.service;

import github.sarthakdev143.reel_factory.model.RenderResult;

/**
 * Delivery hook for a queued job. Exactly one of the callbacks is invoked per job, on the render
 * worker thread, before the next job starts.
 */
public interface RenderOutcomeListener {

    default void onStarted(String jobId) {
    }

    void onCompleted(String jobId, RenderResult result);

    void onFailed(String jobId, Throwable cause);
}
