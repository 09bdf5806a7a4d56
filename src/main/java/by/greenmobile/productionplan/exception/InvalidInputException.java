package by.greenmobile.productionplan.exception;

/**
 * Structural problem with a request (duplicate names, pmax below pmin, bad efficiency...).
 * Raised before the engine runs.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
