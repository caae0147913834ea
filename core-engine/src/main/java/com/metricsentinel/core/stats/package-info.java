/**
 * Descriptive statistics over series values, backed by Commons Math.
 */
package com.metricsentinel.core.stats;
