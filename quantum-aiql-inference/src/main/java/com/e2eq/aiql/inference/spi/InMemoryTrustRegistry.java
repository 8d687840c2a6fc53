package com.e2eq.aiql.inference.spi;

import com.e2eq.aiql.ast.*;

import java.util.*;

/**
 * Trust scores keyed by origin. Unregistered origins fall back to a prefix table
 * ({@code doi}, {@code arxiv}, {@code blog} ...) and then to the default score.
 * Scores can be stated in the knowledge base as
 * {@code <Source> [trusted_at] <Level> { value: 0.9 }}.
 */
public final class InMemoryTrustRegistry implements TrustRegistry {

    public static final double DEFAULT_TRUST = 0.5;
    static final String TRUSTED_AT = "trusted_at";

    private static final Map<String, Double> PREFIX_SCORES = prefixScores();

    private final Map<String, Double> scores = new LinkedHashMap<>();
    private final double defaultTrust;

    public InMemoryTrustRegistry() {
        this(DEFAULT_TRUST);
    }

    public InMemoryTrustRegistry(double defaultTrust) {
        checkScore(defaultTrust);
        this.defaultTrust = defaultTrust;
    }

    public void setTrustScore(String origin, double score) {
        Objects.requireNonNull(origin, "origin");
        checkScore(score);
        scores.put(origin, score);
    }

    public double trustScore(String origin) {
        if (origin == null || origin.isBlank()) {
            return defaultTrust;
        }
        Double exact = scores.get(origin);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, Double> e : PREFIX_SCORES.entrySet()) {
            if (origin.startsWith(e.getKey())) {
                return e.getValue();
            }
        }
        return defaultTrust;
    }

    public boolean hasSource(String origin) {
        return scores.containsKey(origin);
    }

    @Override
    public int loadFromKnowledgeBase(List<Statement> statements) {
        int loaded = 0;
        for (Statement s : statements) {
            if (!TRUSTED_AT.equals(s.relation().name()) || !(s.subject() instanceof Concept source)) {
                continue;
            }
            Expression value = s.attributes().get("value");
            if (value instanceof Literal literal && literal.isNumber()) {
                double score = literal.asDouble();
                if (score >= 0.0 && score <= 1.0) {
                    setTrustScore(stripBrackets(source.name()), score);
                    loaded++;
                }
            }
        }
        return loaded;
    }

    @Override
    public double weightedConfidence(Optional<Double> confidence, String origin) {
        return confidence.orElse(1.0) * trustScore(origin);
    }

    @Override
    public LieAssessment assess(Intent highTrust, Intent lowTrust, double threshold) {
        String highOrigin = originOf(highTrust);
        String lowOrigin = originOf(lowTrust);
        double highScore = trustScore(highOrigin);
        double lowScore = trustScore(lowOrigin);
        double weightedDelta = weightedConfidence(highTrust.confidence(), highOrigin)
                - weightedConfidence(lowTrust.confidence(), lowOrigin);
        if (weightedDelta <= threshold) {
            return new LieAssessment(false, highScore - lowScore, weightedDelta, Optional.empty());
        }
        String reason = String.format(Locale.ROOT,
                "Low-trust source (%s, trust=%.2f) contradicts high-trust source (%s, trust=%.2f). "
                        + "Weighted confidence delta: %.3f > threshold %s",
                label(lowOrigin), lowScore, label(highOrigin), highScore, weightedDelta, threshold);
        return new LieAssessment(true, highScore - lowScore, weightedDelta, Optional.of(reason));
    }

    private static String originOf(Intent intent) {
        return intent.metadata().provenance().origin();
    }

    private static String label(String origin) {
        return origin == null ? "unknown" : origin;
    }

    private static String stripBrackets(String name) {
        if (name.startsWith("<") && name.endsWith(">") && name.length() > 1) {
            return name.substring(1, name.length() - 1);
        }
        return name;
    }

    private static void checkScore(double score) {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Trust score must be between 0.0 and 1.0, got " + score);
        }
    }

    private static Map<String, Double> prefixScores() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("doi", 0.95);
        m.put("arxiv", 0.85);
        m.put("pubmed", 0.90);
        m.put("wikipedia", 0.70);
        m.put("edu", 0.75);
        m.put("gov", 0.80);
        m.put("url", 0.50);
        m.put("https", 0.50);
        m.put("http", 0.50);
        m.put("blog", 0.30);
        m.put("forum", 0.25);
        m.put("social", 0.20);
        return Collections.unmodifiableMap(m);
    }
}
