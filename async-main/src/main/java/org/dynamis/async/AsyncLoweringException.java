package org.dynamis.async;

public class AsyncLoweringException extends RuntimeException {

    public AsyncLoweringException(String message) {
        super(message);
    }

    public AsyncLoweringException(String message, Throwable cause) {
        super(message, cause);
    }

    public AsyncLoweringException(Throwable cause) {
        super(cause);
    }
}
