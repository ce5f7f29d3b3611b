/**
 * Failure classification and retry pacing for the background loops.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.courier.transport.error.FailureCategory} - What a loop does with a
 *       failure
 *   <li>{@link express.mvp.courier.transport.error.FailureClassifier} - Maps throwables to
 *       categories
 *   <li>{@link express.mvp.courier.transport.error.RetryPolicy} - Backoff for transient accept
 *       failures
 * </ul>
 */
package express.mvp.courier.transport.error;
