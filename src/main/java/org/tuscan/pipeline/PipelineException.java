package org.tuscan.pipeline;

/**
 * Thrown when a strand pass cannot complete.
 * <p>
 * Possible causes include:
 * <ul>
 *   <li>Model inference failure in a scoring worker</li>
 *   <li>Model returned a different number of scores than rows</li>
 *   <li>Candidate producer failure</li>
 *   <li>Report sink failure</li>
 * </ul>
 * <p>
 * The pass is aborted rather than reported with a partial result set.
 */
public class PipelineException extends RuntimeException {

    /**
     * Creates a PipelineException with the specified message.
     *
     * @param message Description of the pipeline failure
     */
    public PipelineException(String message) {
        super(message);
    }

    /**
     * Creates a PipelineException with the specified message and cause.
     *
     * @param message Description of the pipeline failure
     * @param cause The underlying exception that caused the failure
     */
    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
