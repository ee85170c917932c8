/**
 * Guardian exception hierarchy.
 *
 * <ul>
 *   <li>{@link com.phillippitts.guardian.exception.GuardianException} - base for all guardian errors</li>
 *   <li>{@link com.phillippitts.guardian.exception.ServingApiException} - transport or protocol failure
 *       talking to the serving system or the inference backend</li>
 *   <li>{@link com.phillippitts.guardian.exception.ProcessControlException} - backend process could not be
 *       launched or signalled</li>
 *   <li>{@link com.phillippitts.guardian.exception.InvalidThresholdConfigurationException} - threshold
 *       configuration rejected at startup</li>
 * </ul>
 *
 * <p>Only configuration errors escape to the caller. Everything raised at runtime is caught
 * by the component that performs the action or, at the latest, by the control loop.
 */
package com.phillippitts.guardian.exception;
