/**
 * Runtime settings and RCA rule loading.
 *
 * <p>
 * {@link com.metricsentinel.core.config.SentinelConfig} carries the detector,
 * RCA and knowledge-base settings, read from the environment or built in code.
 * Rules and correlation patterns are defined in YAML and loaded by
 * {@link com.metricsentinel.core.config.RcaRulesLoader} into a
 * {@link com.metricsentinel.core.config.RcaRulesConfig}, which is validated
 * right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.config;
