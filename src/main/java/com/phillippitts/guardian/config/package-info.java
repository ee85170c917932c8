/**
 * Spring wiring for the guardian: collaborator beans, the loop executor and startup validation.
 *
 * <p>Property classes live in {@code config.properties} and are bound from
 * {@code application.properties}.
 */
package com.phillippitts.guardian.config;
