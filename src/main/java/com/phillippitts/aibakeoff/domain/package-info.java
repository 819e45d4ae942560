/**
 * Benchmark domain model: provider identities, scenarios, seed inputs and the immutable
 * measurement and summary records exchanged between runners and the aggregator.
 */
package com.phillippitts.aibakeoff.domain;
