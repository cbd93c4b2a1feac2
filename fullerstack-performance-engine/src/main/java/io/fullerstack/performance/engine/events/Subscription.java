package io.fullerstack.performance.engine.events;

/**
 * Handle returned by {@link AnalyzerEvents#subscribe}. Closing it removes the listener.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
