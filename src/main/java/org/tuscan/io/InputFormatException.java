package org.tuscan.io;

/**
 * Thrown when an input file or location cannot be used.
 * <p>
 * Possible causes include:
 * <ul>
 *   <li>FASTA file without any record</li>
 *   <li>BED line with fewer than three columns or invalid coordinates</li>
 *   <li>Location string not of the form {@code chr:start-end}</li>
 *   <li>Region on a chromosome missing from the genome, or past its end</li>
 * </ul>
 */
public class InputFormatException extends RuntimeException {

    /**
     * Creates an InputFormatException with the specified message.
     *
     * @param message Description of the input problem
     */
    public InputFormatException(String message) {
        super(message);
    }

    /**
     * Creates an InputFormatException with the specified message and cause.
     *
     * @param message Description of the input problem
     * @param cause The underlying exception that caused the failure
     */
    public InputFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
