package ai.lzy.drainer.exceptions;

public class ObservationException extends Exception {

    public ObservationException(String message, Throwable cause) {
        super(message, cause);
    }
}
