/**
 * Incident and runbook knowledge base backed by an optional vector index,
 * with a keyword-overlap fallback over the local cache.
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.knowledge;
