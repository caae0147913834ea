package com.metricsentinel.core.rca;

import java.util.Optional;

/**
 * Free-text completion service used for advisory root-cause analysis.
 * <p>
 * Implementations never throw: any failure, including a timeout or a
 * malformed response, yields {@link Optional#empty()}.
 * </p>
 */
public interface LlmClient {

    Optional<String> complete(String prompt);
}
