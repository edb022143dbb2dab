package ai.chandas.scanner.dataset;

/**
 * Runtime exception raised when a dataset file cannot be read or written.
 */
public class DatasetException extends RuntimeException {

    public DatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
