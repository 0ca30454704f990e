package github.sarthakdev143.reel_factory.service;

import java.io.IOException;

public class RenderFailureException extends IOException {

    public RenderFailureException(String message) {
        super(message);
    }
}
