/**
 * Pure extractors that turn raw logs, events and related series into the
 * evidence lists consumed by root-cause analysis.
 */
package com.metricsentinel.core.evidence;
