package com.pizhai.render.compliance;

/**
 * 渲染前的合规检查
 * 在获取浏览器实例之前调用，被拒绝的请求不占用任何浏览器资源
 */
@FunctionalInterface
public interface ComplianceGate {

    /**
     * 检查一次操作是否合规
     *
     * @param check 操作的元数据
     * @return 检查结果，不会为null
     */
    ComplianceResult check(ComplianceCheck check);

    /**
     * 总是放行的检查，得分为1
     */
    static ComplianceGate permitAll() {
        return check -> ComplianceResult.of(1.0, true, null, null);
    }
}
