package github.sarthakdev143.reel_factory.service;

import java.io.IOException;

public class EncodingException extends IOException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
