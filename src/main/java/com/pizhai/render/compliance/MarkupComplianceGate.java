package com.pizhai.render.compliance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 基于规则的默认合规检查
 *
 * <p>得分从1开始：</p>
 * <ul>
 *     <li>未指定操作名称：警告，扣0.001</li>
 *     <li>内容不是真实数据：违规，扣0.05</li>
 *     <li>跳过审计：警告，扣0.002</li>
 *     <li>内容开头包含脚本、javascript:、内联事件或iframe：违规，扣0.1</li>
 * </ul>
 * <p>得分不低于最低分且没有违规时才算合规。</p>
 */
public class MarkupComplianceGate implements ComplianceGate {

    private static final Logger logger = LoggerFactory.getLogger(MarkupComplianceGate.class);

    public static final double DEFAULT_MIN_SCORE = 0.997;
    static final int INSPECTED_PREFIX = 100;

    private static final List<Pattern> XSS_PATTERNS = Arrays.asList(
            Pattern.compile("<script", Pattern.CASE_INSENSITIVE),
            Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
            // 单词边界避免content=之类的属性被误判
            Pattern.compile("\\bon\\w+\\s*=", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<iframe", Pattern.CASE_INSENSITIVE)
    );

    private final double minScore;

    public MarkupComplianceGate() {
        this(DEFAULT_MIN_SCORE);
    }

    public MarkupComplianceGate(double minScore) {
        this.minScore = minScore;
    }

    @Override
    public ComplianceResult check(ComplianceCheck check) {
        List<String> violations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        double score = 1.0;

        if (check.getAction() == null || check.getAction().isEmpty()) {
            warnings.add("未指定操作名称");
            score -= 0.001;
        }

        if (!check.isRealData()) {
            violations.add("内容为写死的占位数据");
            score -= 0.05;
        }

        if (check.isSkipAudit()) {
            warnings.add("跳过了审计记录");
            score -= 0.002;
        }

        String markup = check.getMarkup();
        if (markup != null && !markup.isEmpty()) {
            String inspected = markup.length() > INSPECTED_PREFIX ? markup.substring(0, INSPECTED_PREFIX) : markup;
            for (Pattern pattern : XSS_PATTERNS) {
                if (pattern.matcher(inspected).find()) {
                    violations.add("检测到可能的XSS内容: " + pattern.pattern());
                    score -= 0.1;
                    break;
                }
            }
        }

        boolean compliant = score >= minScore && violations.isEmpty();
        ComplianceResult result = ComplianceResult.of(score, compliant, violations, warnings);
        log(check.getAction(), result);
        return result;
    }

    private void log(String action, ComplianceResult result) {
        if (!result.isCompliant() || !result.getViolations().isEmpty()) {
            logger.error("合规检查未通过 [{}]: {}", action, result);
        } else if (!result.getWarnings().isEmpty()) {
            logger.warn("合规检查有警告 [{}]: {}", action, result);
        } else {
            logger.debug("合规检查通过 [{}]: score={}", action, result.getScore());
        }
    }

    public double getMinScore() {
        return minScore;
    }
}
