package org.dbreport;

/**
 * Thrown when a weight override is not a JSON object mapping dimension names to numbers.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public class MalformedWeightsException extends Exception {
    public MalformedWeightsException(String message) {
        super(message);
    }

    public MalformedWeightsException(String message, Throwable cause) {
        super(message, cause);
    }
}
