package by.greenmobile.productionplan.exception;

/**
 * The fleet cannot produce exactly the requested load: either the load exceeds the available
 * capacity or no combination of running plants can stay above their minimum outputs.
 */
public class InfeasibleDemandException extends RuntimeException {

    /** Unmet load in MW when capacity is the cause, otherwise {@code null}. */
    private final Double missingMw;

    public InfeasibleDemandException(String message) {
        this(message, null);
    }

    public InfeasibleDemandException(String message, Double missingMw) {
        super(message);
        this.missingMw = missingMw;
    }

    public Double getMissingMw() {
        return missingMw;
    }
}
