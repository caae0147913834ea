/**
 * Root-cause analysis: rule matching, confidence scoring and the optional
 * LLM fallback.
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.rca;
