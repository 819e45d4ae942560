/**
 * Run driver: executes the scenarios, aggregates, reports.
 *
 * @see com.phillippitts.aibakeoff.service.orchestration.BakeoffOrchestrator
 */
package com.phillippitts.aibakeoff.service.orchestration;
