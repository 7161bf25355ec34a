/**
 * REST API controllers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /ping} - liveness and MDC check</li>
 *   <li>{@code GET /api/fleet/models?category=} - ranked free models</li>
 *   <li>{@code POST /api/fleet/models/refresh} - new discovery pass</li>
 *   <li>{@code GET /api/fleet/models/{id}/verdict?provider=} - Oracle verdict
 *       ({@code GET /api/fleet/verdict?model=} for ids containing a slash)</li>
 *   <li>{@code GET /api/fleet/metrics} - session savings</li>
 *   <li>{@code GET /api/fleet/blocked?limit=} - recently blocked models</li>
 * </ul>
 */
package com.phillippitts.freefleet.presentation.controller;
