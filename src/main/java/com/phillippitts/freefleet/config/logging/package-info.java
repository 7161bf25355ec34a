/**
 * Request correlation for logging.
 *
 * <p>MDC keys:
 * <ul>
 *   <li>{@code requestId} - per HTTP request, set by {@link com.phillippitts.freefleet.config.logging.MdcFilter}</li>
 *   <li>{@code raceId} - set by the racer for the duration of a race</li>
 *   <li>{@code candidate} - set on the worker thread running one race candidate</li>
 * </ul>
 *
 * <p>Log format:
 * <pre>
 * 2026-03-02 15:42:32.529 [race-3] [requestId] [raceId] [candidate] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.freefleet.config.logging;
