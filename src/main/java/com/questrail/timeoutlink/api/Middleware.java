package com.questrail.timeoutlink.api;

/**
 * A pipeline stage that wraps the stages installed after it.
 */
@FunctionalInterface
public interface Middleware
{
    /**
     * @param next the remainder of the pipeline
     * @return a pipeline that runs this stage in front of {@code next}
     */
    RequestPipeline wrap(RequestPipeline next);
}
