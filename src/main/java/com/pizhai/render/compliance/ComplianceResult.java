package com.pizhai.render.compliance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 合规检查结果
 */
public final class ComplianceResult {
    private final double score;
    private final boolean compliant;
    private final List<String> violations;
    private final List<String> warnings;

    private ComplianceResult(double score, boolean compliant, List<String> violations, List<String> warnings) {
        this.score = score;
        this.compliant = compliant;
        this.violations = violations;
        this.warnings = warnings;
    }

    /**
     * 创建检查结果，得分被限制在0到1之间
     */
    public static ComplianceResult of(double score, boolean compliant, List<String> violations, List<String> warnings) {
        double clamped = Math.max(0, Math.min(1, score));
        return new ComplianceResult(clamped, compliant,
                violations == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(violations)),
                warnings == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(warnings)));
    }

    public double getScore() {
        return score;
    }

    public boolean isCompliant() {
        return compliant;
    }

    public List<String> getViolations() {
        return violations;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return String.format("ComplianceResult[compliant=%s, score=%.4f, violations=%s, warnings=%s]",
                compliant, score, violations, warnings);
    }
}
