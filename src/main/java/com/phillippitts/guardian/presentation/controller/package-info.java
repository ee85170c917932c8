/**
 * Read-only REST endpoints.
 *
 * <ul>
 *   <li>{@code GET /} - service name, version and whether the daemon is running</li>
 *   <li>{@code GET /health} and {@code GET /api/guardian/status} - latest guardian snapshot</li>
 *   <li>{@code GET /api/guardian/history} - recent metric samples</li>
 * </ul>
 */
package com.phillippitts.guardian.presentation.controller;
