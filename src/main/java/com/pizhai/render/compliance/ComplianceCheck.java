package com.pizhai.render.compliance;

/**
 * 合规检查的输入：操作名称和待渲染的内容
 */
public final class ComplianceCheck {
    private final String action;
    private final String markup;
    private final boolean skipAudit;
    private final boolean realData;

    private ComplianceCheck(Builder builder) {
        this.action = builder.action;
        this.markup = builder.markup;
        this.skipAudit = builder.skipAudit;
        this.realData = builder.realData;
    }

    /**
     * 为一次渲染操作创建检查
     *
     * @param action 操作名称，如 screenshot_generation
     * @param markup HTML内容
     */
    public static ComplianceCheck forRender(String action, String markup) {
        return builder().action(action).markup(markup).build();
    }

    public String getAction() {
        return action;
    }

    public String getMarkup() {
        return markup;
    }

    public boolean isSkipAudit() {
        return skipAudit;
    }

    /**
     * 内容是否来自真实数据，false表示写死的占位内容
     */
    public boolean isRealData() {
        return realData;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String action;
        private String markup;
        private boolean skipAudit = false;
        private boolean realData = true;

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder markup(String markup) {
            this.markup = markup;
            return this;
        }

        public Builder skipAudit(boolean skipAudit) {
            this.skipAudit = skipAudit;
            return this;
        }

        public Builder realData(boolean realData) {
            this.realData = realData;
            return this;
        }

        public ComplianceCheck build() {
            return new ComplianceCheck(this);
        }
    }
}
