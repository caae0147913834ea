package com.metricsentinel.core.config;

import com.metricsentinel.core.detection.AlgorithmKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Typed, immutable configuration for the detection, RCA and knowledge-base
 * components.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * a scheduler embedding the core can be configured from a Kubernetes
 * Deployment, Docker {@code -e} flags or a shell environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * <h3>Optional collaborators</h3>
 * <p>
 * The LLM client is only wired when {@link #getLlmApiKey()} is non-blank, the
 * vector index only when {@link #getQdrantUrl()} is non-blank, and the
 * embedding service only when an API key is configured or
 * {@link #isOfflineEmbeddings()} is set.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelConfig {

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------
    private final double zscoreThreshold;
    private final double madThreshold;
    private final int ensembleMinVotes;
    private final Set<AlgorithmKind> algorithms;
    private final double resolutionFactor;
    private final int detectionParallelism;
    private final int resolvedHistoryLimit;

    // ---------------------------------------------------------------
    // RCA
    // ---------------------------------------------------------------
    private final boolean useLlm;
    private final double llmConfidenceThreshold;
    private final String rulesPath;

    // ---------------------------------------------------------------
    // LLM
    // ---------------------------------------------------------------
    private final String llmApiKey;
    private final String llmModel;
    private final String llmBaseUrl;
    private final int llmMaxTokens;

    // ---------------------------------------------------------------
    // Knowledge base
    // ---------------------------------------------------------------
    private final String qdrantUrl;
    private final String qdrantCollection;
    private final int embeddingDimensions;
    private final String embeddingUrl;
    private final String embeddingApiKey;
    private final String embeddingModel;
    private final boolean offlineEmbeddings;

    // ---------------------------------------------------------------
    // Collaborators
    // ---------------------------------------------------------------
    private final long collaboratorTimeoutMs;

    private SentinelConfig(Builder b) {
        this.zscoreThreshold = b.zscoreThreshold;
        this.madThreshold = b.madThreshold;
        this.ensembleMinVotes = b.ensembleMinVotes;
        this.algorithms = Collections.unmodifiableSet(EnumSet.copyOf(b.algorithms));
        this.resolutionFactor = b.resolutionFactor;
        this.detectionParallelism = b.detectionParallelism;
        this.resolvedHistoryLimit = b.resolvedHistoryLimit;
        this.useLlm = b.useLlm;
        this.llmConfidenceThreshold = b.llmConfidenceThreshold;
        this.rulesPath = b.rulesPath;
        this.llmApiKey = b.llmApiKey;
        this.llmModel = b.llmModel;
        this.llmBaseUrl = b.llmBaseUrl;
        this.llmMaxTokens = b.llmMaxTokens;
        this.qdrantUrl = b.qdrantUrl;
        this.qdrantCollection = b.qdrantCollection;
        this.embeddingDimensions = b.embeddingDimensions;
        this.embeddingUrl = b.embeddingUrl;
        this.embeddingApiKey = b.embeddingApiKey;
        this.embeddingModel = b.embeddingModel;
        this.offlineEmbeddings = b.offlineEmbeddings;
        this.collaboratorTimeoutMs = b.collaboratorTimeoutMs;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link SentinelConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static SentinelConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Build a {@link SentinelConfig} from an arbitrary variable lookup.
     *
     * @param lookup returns the raw value of a variable, or {@code null} if unset
     */
    static SentinelConfig fromEnvironment(UnaryOperator<String> lookup) {
        Env env = new Env(lookup);
        try {
            return new Builder()
                    .zscoreThreshold(Double.parseDouble(env.get("ANOMALY_ZSCORE_THRESHOLD", "3.0")))
                    .madThreshold(Double.parseDouble(env.get("ANOMALY_MAD_THRESHOLD", "3.5")))
                    .ensembleMinVotes(Integer.parseInt(env.get("ANOMALY_ENSEMBLE_MIN_VOTES", "2")))
                    .algorithms(parseAlgorithms(env.get("ANOMALY_ALGORITHMS", "zscore,mad")))
                    .resolutionFactor(Double.parseDouble(env.get("ANOMALY_RESOLUTION_FACTOR", "0.7")))
                    .detectionParallelism(Integer.parseInt(env.get("ANOMALY_DETECTION_PARALLELISM", "1")))
                    .useLlm(Boolean.parseBoolean(env.get("RCA_USE_LLM", "true")))
                    .llmConfidenceThreshold(Double.parseDouble(env.get("RCA_LLM_CONFIDENCE_THRESHOLD", "0.7")))
                    .rulesPath(env.get("RCA_RULES_PATH", ""))
                    .llmApiKey(env.get("LLM_API_KEY", ""))
                    .llmModel(env.get("LLM_MODEL", Builder.DEFAULT_LLM_MODEL))
                    .llmBaseUrl(env.get("LLM_BASE_URL", Builder.DEFAULT_LLM_BASE_URL))
                    .llmMaxTokens(Integer.parseInt(env.get("LLM_MAX_TOKENS", "500")))
                    .qdrantUrl(env.get("QDRANT_URL", ""))
                    .qdrantCollection(env.get("QDRANT_COLLECTION", "sre_incidents"))
                    .embeddingDimensions(Integer.parseInt(env.get("EMBEDDING_DIMENSIONS", "1536")))
                    .embeddingUrl(env.get("EMBEDDING_URL", Builder.DEFAULT_EMBEDDING_URL))
                    .embeddingApiKey(env.get("EMBEDDING_API_KEY", ""))
                    .embeddingModel(env.get("EMBEDDING_MODEL", Builder.DEFAULT_EMBEDDING_MODEL))
                    .offlineEmbeddings(Boolean.parseBoolean(env.get("KNOWLEDGE_OFFLINE_EMBEDDINGS", "false")))
                    .collaboratorTimeoutMs(Long.parseLong(env.get("COLLABORATOR_TIMEOUT_MS", "10000")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * Parse a comma-separated list of algorithm identifiers.
     *
     * @throws IllegalArgumentException on an unknown identifier
     */
    public static Set<AlgorithmKind> parseAlgorithms(String csv) {
        Set<AlgorithmKind> kinds = EnumSet.noneOf(AlgorithmKind.class);
        if (csv != null) {
            Arrays.stream(csv.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(AlgorithmKind::fromId)
                    .forEach(kinds::add);
        }
        return kinds;
    }

    // ---------------------------------------------------------------
    // Derived flags
    // ---------------------------------------------------------------

    /** @return {@code true} if LLM use is enabled and an API key is present */
    public boolean isLlmConfigured() {
        return useLlm && !llmApiKey.isBlank();
    }

    public boolean isVectorIndexConfigured() {
        return !qdrantUrl.isBlank();
    }

    public boolean isEmbeddingConfigured() {
        return offlineEmbeddings || !embeddingApiKey.isBlank();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public double getZscoreThreshold() {
        return zscoreThreshold;
    }

    public double getMadThreshold() {
        return madThreshold;
    }

    public int getEnsembleMinVotes() {
        return ensembleMinVotes;
    }

    public Set<AlgorithmKind> getAlgorithms() {
        return algorithms;
    }

    public double getResolutionFactor() {
        return resolutionFactor;
    }

    public int getDetectionParallelism() {
        return detectionParallelism;
    }

    public int getResolvedHistoryLimit() {
        return resolvedHistoryLimit;
    }

    public boolean isUseLlm() {
        return useLlm;
    }

    public double getLlmConfidenceThreshold() {
        return llmConfidenceThreshold;
    }

    /** @return filesystem path of the RCA rules file, empty for the bundled classpath default */
    public String getRulesPath() {
        return rulesPath;
    }

    public String getLlmApiKey() {
        return llmApiKey;
    }

    public String getLlmModel() {
        return llmModel;
    }

    public String getLlmBaseUrl() {
        return llmBaseUrl;
    }

    public int getLlmMaxTokens() {
        return llmMaxTokens;
    }

    public String getQdrantUrl() {
        return qdrantUrl;
    }

    public String getQdrantCollection() {
        return qdrantCollection;
    }

    public int getEmbeddingDimensions() {
        return embeddingDimensions;
    }

    public String getEmbeddingUrl() {
        return embeddingUrl;
    }

    public String getEmbeddingApiKey() {
        return embeddingApiKey;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public boolean isOfflineEmbeddings() {
        return offlineEmbeddings;
    }

    public long getCollaboratorTimeoutMs() {
        return collaboratorTimeoutMs;
    }

    @Override
    public String toString() {
        return "SentinelConfig{" +
                "algorithms=" + algorithms +
                ", zscoreThreshold=" + zscoreThreshold +
                ", madThreshold=" + madThreshold +
                ", ensembleMinVotes=" + ensembleMinVotes +
                ", resolutionFactor=" + resolutionFactor +
                ", detectionParallelism=" + detectionParallelism +
                ", useLlm=" + useLlm +
                ", llmConfigured=" + isLlmConfigured() +
                ", vectorIndexConfigured=" + isVectorIndexConfigured() +
                ", offlineEmbeddings=" + offlineEmbeddings +
                '}';
    }

    // ---------------------------------------------------------------
    // Env helper
    // ---------------------------------------------------------------

    private static final class Env {
        private final UnaryOperator<String> lookup;

        Env(UnaryOperator<String> lookup) {
            this.lookup = lookup;
        }

        String get(String key, String defaultValue) {
            String value = lookup.apply(key);
            return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link SentinelConfig}. All fields start at their
     * production defaults.
     */
    public static final class Builder {
        static final String DEFAULT_LLM_MODEL = "claude-sonnet-4-20250514";
        static final String DEFAULT_LLM_BASE_URL = "https://api.anthropic.com";
        static final String DEFAULT_EMBEDDING_URL = "https://api.openai.com";
        static final String DEFAULT_EMBEDDING_MODEL = "text-embedding-3-small";

        private double zscoreThreshold = 3.0;
        private double madThreshold = 3.5;
        private int ensembleMinVotes = 2;
        private Set<AlgorithmKind> algorithms = EnumSet.of(AlgorithmKind.ZSCORE, AlgorithmKind.MAD);
        private double resolutionFactor = 0.7;
        private int detectionParallelism = 1;
        private int resolvedHistoryLimit = 500;
        private boolean useLlm = true;
        private double llmConfidenceThreshold = 0.7;
        private String rulesPath = "";
        private String llmApiKey = "";
        private String llmModel = DEFAULT_LLM_MODEL;
        private String llmBaseUrl = DEFAULT_LLM_BASE_URL;
        private int llmMaxTokens = 500;
        private String qdrantUrl = "";
        private String qdrantCollection = "sre_incidents";
        private int embeddingDimensions = 1536;
        private String embeddingUrl = DEFAULT_EMBEDDING_URL;
        private String embeddingApiKey = "";
        private String embeddingModel = DEFAULT_EMBEDDING_MODEL;
        private boolean offlineEmbeddings = false;
        private long collaboratorTimeoutMs = 10_000L;

        public Builder zscoreThreshold(double v) {
            this.zscoreThreshold = v;
            return this;
        }

        public Builder madThreshold(double v) {
            this.madThreshold = v;
            return this;
        }

        public Builder ensembleMinVotes(int v) {
            this.ensembleMinVotes = v;
            return this;
        }

        public Builder algorithms(Set<AlgorithmKind> v) {
            this.algorithms = Objects.requireNonNull(v, "algorithms must not be null");
            return this;
        }

        public Builder algorithms(AlgorithmKind first, AlgorithmKind... rest) {
            return algorithms(EnumSet.of(first, rest));
        }

        public Builder resolutionFactor(double v) {
            this.resolutionFactor = v;
            return this;
        }

        public Builder detectionParallelism(int v) {
            this.detectionParallelism = v;
            return this;
        }

        public Builder resolvedHistoryLimit(int v) {
            this.resolvedHistoryLimit = v;
            return this;
        }

        public Builder useLlm(boolean v) {
            this.useLlm = v;
            return this;
        }

        public Builder llmConfidenceThreshold(double v) {
            this.llmConfidenceThreshold = v;
            return this;
        }

        public Builder rulesPath(String v) {
            this.rulesPath = Objects.requireNonNull(v, "rulesPath must not be null");
            return this;
        }

        public Builder llmApiKey(String v) {
            this.llmApiKey = Objects.requireNonNull(v, "llmApiKey must not be null");
            return this;
        }

        public Builder llmModel(String v) {
            this.llmModel = Objects.requireNonNull(v, "llmModel must not be null");
            return this;
        }

        public Builder llmBaseUrl(String v) {
            this.llmBaseUrl = Objects.requireNonNull(v, "llmBaseUrl must not be null");
            return this;
        }

        public Builder llmMaxTokens(int v) {
            this.llmMaxTokens = v;
            return this;
        }

        public Builder qdrantUrl(String v) {
            this.qdrantUrl = Objects.requireNonNull(v, "qdrantUrl must not be null");
            return this;
        }

        public Builder qdrantCollection(String v) {
            this.qdrantCollection = Objects.requireNonNull(v, "qdrantCollection must not be null");
            return this;
        }

        public Builder embeddingDimensions(int v) {
            this.embeddingDimensions = v;
            return this;
        }

        public Builder embeddingUrl(String v) {
            this.embeddingUrl = Objects.requireNonNull(v, "embeddingUrl must not be null");
            return this;
        }

        public Builder embeddingApiKey(String v) {
            this.embeddingApiKey = Objects.requireNonNull(v, "embeddingApiKey must not be null");
            return this;
        }

        public Builder embeddingModel(String v) {
            this.embeddingModel = Objects.requireNonNull(v, "embeddingModel must not be null");
            return this;
        }

        public Builder offlineEmbeddings(boolean v) {
            this.offlineEmbeddings = v;
            return this;
        }

        public Builder collaboratorTimeoutMs(long v) {
            this.collaboratorTimeoutMs = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException listing every invalid field
         */
        public SentinelConfig build() {
            List<String> errors = new ArrayList<>();
            if (!(zscoreThreshold > 0)) {
                errors.add("zscoreThreshold must be > 0");
            }
            if (!(madThreshold > 0)) {
                errors.add("madThreshold must be > 0");
            }
            if (algorithms.isEmpty()) {
                errors.add("at least one algorithm must be enabled");
            }
            if (ensembleMinVotes < 1 || ensembleMinVotes > Math.max(1, algorithms.size())) {
                errors.add("ensembleMinVotes must be between 1 and the number of enabled algorithms ("
                        + algorithms.size() + ")");
            }
            if (!(resolutionFactor > 0 && resolutionFactor <= 1)) {
                errors.add("resolutionFactor must be in (0, 1]");
            }
            if (detectionParallelism < 1) {
                errors.add("detectionParallelism must be >= 1");
            }
            if (resolvedHistoryLimit < 0) {
                errors.add("resolvedHistoryLimit must be >= 0");
            }
            if (llmConfidenceThreshold < 0 || llmConfidenceThreshold > 1) {
                errors.add("llmConfidenceThreshold must be in [0, 1]");
            }
            if (llmMaxTokens < 1) {
                errors.add("llmMaxTokens must be >= 1");
            }
            if (embeddingDimensions < 1) {
                errors.add("embeddingDimensions must be >= 1");
            }
            if (collaboratorTimeoutMs < 1) {
                errors.add("collaboratorTimeoutMs must be >= 1");
            }
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid SentinelConfig: " + String.join("; ", errors));
            }
            return new SentinelConfig(this);
        }
    }
}
