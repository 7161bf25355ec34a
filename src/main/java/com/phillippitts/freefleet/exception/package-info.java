/**
 * Free-fleet exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.freefleet.exception.FreeFleetException}:
 * <ul>
 *   <li>{@link com.phillippitts.freefleet.exception.ProviderFetchException} - transport or
 *       non-2xx failure of a provider, metadata source or scraper; recovered locally</li>
 *   <li>{@link com.phillippitts.freefleet.exception.CircuitBreakerOpenException} - a provider
 *       is cooling down; rejected without calling it</li>
 *   <li>{@link com.phillippitts.freefleet.exception.RaceExhaustedException} - every candidate
 *       of one race failed; lists each candidate's reason</li>
 *   <li>{@link com.phillippitts.freefleet.exception.FallbackExhaustedException} - every
 *       fallback wave failed</li>
 *   <li>{@link com.phillippitts.freefleet.exception.NoActiveProvidersException} - discovery
 *       found no provider; the only operator-facing configuration error</li>
 *   <li>{@link com.phillippitts.freefleet.exception.PersistenceException} - a JSON file could
 *       not be written; always logged and swallowed</li>
 * </ul>
 *
 * @see com.phillippitts.freefleet.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.freefleet.exception;
