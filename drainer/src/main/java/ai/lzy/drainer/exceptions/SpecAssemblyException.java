package ai.lzy.drainer.exceptions;

public class SpecAssemblyException extends Exception {

    public SpecAssemblyException(String message) {
        super(message);
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
