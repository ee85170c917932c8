/**
 * Logging infrastructure: HTTP request correlation through Log4j2's ThreadContext.
 *
 * <p>The control loop sets its own {@code tick} key; see
 * {@link com.phillippitts.guardian.service.guardian.GuardianControlLoop}.
 */
package com.phillippitts.guardian.config.logging;
