/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.aibakeoff.exception.BakeoffException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.aibakeoff.exception.ProviderException} - Thrown when a
 *       provider call fails (missing credential, non-2xx status, malformed body)</li>
 *   <li>{@link com.phillippitts.aibakeoff.exception.RealtimeSessionException} - Thrown when
 *       a realtime speech session fails, closes early or exceeds its deadline</li>
 * </ul>
 *
 * <p>Scenario runners catch provider failures per call and turn them into failed
 * measurement records; nothing from this hierarchy crosses a task boundary.
 *
 * @since 1.0
 */
package com.phillippitts.aibakeoff.exception;
