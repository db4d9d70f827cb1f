/**
 * Executor factories for pipeline, callback and timer threads.
 * <p><strong>Role:</strong> Infrastructure utilities configuring the threads a pipeline runs on.</p>
 * <p><strong>Concurrency:</strong> The serial executor is the single serialization context of a pipeline.</p>
 * <p><strong>Observability:</strong> Threads carry the pipeline name in their thread name and in the
 * {@code pipeline} MDC key.</p>
 */
package ca.gc.cra.tether.infrastructure.exec;
