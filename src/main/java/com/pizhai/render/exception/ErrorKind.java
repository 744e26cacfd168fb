package com.pizhai.render.exception;

/**
 * 渲染失败的错误分类
 * 每种分类对应一个稳定的错误码和建议的HTTP状态码
 */
public enum ErrorKind {

    /** 合规检查拒绝，未占用任何浏览器资源 */
    COMPLIANCE_REJECTED("COMPLIANCE_REJECTED", 403),

    /** 等待浏览器实例超过了获取超时 */
    POOL_EXHAUSTED("POOL_EXHAUSTED", 503),

    /** 浏览器池已关闭 */
    POOL_SHUT_DOWN("POOL_SHUT_DOWN", 503),

    /** 浏览器进程启动失败 */
    LAUNCH_FAILURE("LAUNCH_FAILURE", 500),

    /** HTML内容未能在超时时间内加载完成 */
    PAGE_LOAD_TIMEOUT("PAGE_LOAD_TIMEOUT", 504),

    /** 截图或PDF生成失败 */
    CAPTURE_FAILURE("CAPTURE_FAILURE", 500),

    /** 请求参数无效 */
    INVALID_REQUEST("INVALID_REQUEST", 400),

    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;

    ErrorKind(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
