/**
 * Scenario runners: translation, text-to-speech and the chained pipeline.
 *
 * <p>Each runner fans its seed inputs out on the benchmark executor under a
 * {@link com.phillippitts.aibakeoff.service.concurrency.ConcurrencyLimiter} and converts every
 * provider failure into a failed {@link com.phillippitts.aibakeoff.domain.MeasurementRecord}.
 */
package com.phillippitts.aibakeoff.service.scenario;
