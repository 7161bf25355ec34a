/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.freefleet.exception.NoActiveProvidersException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.freefleet.exception.CircuitBreakerOpenException} → 503 Service Unavailable (retry)</li>
 *   <li>{@link com.phillippitts.freefleet.exception.FreeFleetException} → 502 Bad Gateway</li>
 *   <li>{@code IllegalArgumentException} and malformed parameters → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "NoActiveProvidersException",
 *   "message": "No active providers",
 *   "details": "Add at least one provider under 'providers' or 'categories' in ...",
 *   "timestamp": "2026-03-02T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.freefleet.presentation.exception;
