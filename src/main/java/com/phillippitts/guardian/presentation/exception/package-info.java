/**
 * Exception to HTTP mapping for the status API.
 *
 * <ul>
 *   <li>{@link com.phillippitts.guardian.exception.GuardianException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 */
package com.phillippitts.guardian.presentation.exception;
