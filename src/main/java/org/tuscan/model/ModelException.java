package org.tuscan.model;

/**
 * Thrown when a model cannot be loaded or cannot score its input.
 * <p>
 * Possible causes include:
 * <ul>
 *   <li>Model file missing or unreadable</li>
 *   <li>Malformed model document (unknown mode, dangling node references)</li>
 *   <li>Model trained for a different scoring mode or feature width</li>
 *   <li>Feature rows of the wrong width passed to {@link IScoringModel#predict(double[][])}</li>
 * </ul>
 */
public class ModelException extends RuntimeException {

    /**
     * Creates a ModelException with the specified message.
     *
     * @param message Description of the model failure
     */
    public ModelException(String message) {
        super(message);
    }

    /**
     * Creates a ModelException with the specified message and cause.
     *
     * @param message Description of the model failure
     * @param cause The underlying exception that caused the failure
     */
    public ModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
