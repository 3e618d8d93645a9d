package it.berlink.dbmonitor.exception;

/**
 * Raised when an instrumented ORM call targets a model that is not registered
 * or an operation the model does not support. Nothing has been executed when
 * this is thrown.
 */
public class UnsupportedModelOperationException extends RuntimeException {

    public UnsupportedModelOperationException(String message) {
        super(message);
    }

}
