package github.sarthakdev143.reel_factory.service;

import github.sarthakdev143.reel_factory.model.RenderJob;
import github.sarthakdev143.reel_factory.model.RenderResult;

import java.io.IOException;

public interface RenderPipeline {

    RenderResult render(RenderJob job) throws IOException, InterruptedException;
}
