/**
 * Pipeline engine: stage base class, flow helpers, the pipeline thread guard and the pipeline root.
 * <p><strong>Role:</strong> Application core that all stages build on.</p>
 * <p><strong>Concurrency:</strong> Each pipeline runs all stage logic on one thread; public entry points marshal
 * onto it and caller callbacks run on a separate callback thread.</p>
 * <p><strong>Error handling:</strong> Operation failures travel through completions; defects escape to the task
 * boundary where they are logged, counted and raised as background exception events.</p>
 */
package ca.gc.cra.tether.application.pipeline;
