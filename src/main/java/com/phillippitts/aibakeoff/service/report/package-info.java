/**
 * Report model, JSON persistence and console table formatting.
 */
package com.phillippitts.aibakeoff.service.report;
