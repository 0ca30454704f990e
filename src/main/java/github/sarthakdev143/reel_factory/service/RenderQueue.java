package github.sarthakdev143.reel_factory.service;

import github.sarthakdev143.reel_factory.model.RenderJob;

public interface RenderQueue {

    void submit(RenderJob job, RenderOutcomeListener listener);

    int pendingCount();
}
