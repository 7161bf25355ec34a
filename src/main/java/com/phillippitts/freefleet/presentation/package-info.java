/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Controllers are thin adapters over
 * the fleet services; the exception handler maps fleet exceptions to HTTP status codes.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * @see com.phillippitts.freefleet.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.freefleet.presentation;
