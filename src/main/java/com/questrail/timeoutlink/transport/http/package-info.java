/**
 * HTTP Transport Port
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete HTTP server and the request
 * pipeline.
 *
 * <h2>Responsibilities of an endpoint</h2>
 * <ul>
 *   <li>Build one {@link com.questrail.timeoutlink.api.RequestContext} per
 *       request, seeded with a cancellation token that fires when the client
 *       connection goes away.</li>
 *   <li>Run the pipeline off the I/O thread.</li>
 *   <li>Commit the {@link com.questrail.timeoutlink.api.ResponseSink} once the
 *       pipeline returns.</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Endpoints MUST NOT compute deadlines, attribute cancellations or pick
 * terminal statuses. That is the gate's job; the endpoint only delivers the
 * disconnect signal and the host's remaining-time oracle.
 */
package com.questrail.timeoutlink.transport.http;
