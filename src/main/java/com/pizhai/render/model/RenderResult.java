package com.pizhai.render.model;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.pizhai.render.exception.ErrorKind;

import java.util.Base64;

/**
 * 渲染结果
 * 成功时携带产物数据，失败时携带错误分类和消息，渲染服务从不向调用方抛出异常
 */
public final class RenderResult {

    private static final Gson gson = new Gson();

    private final boolean success;
    private final byte[] artifact;
    private final String format;
    private final int width;
    private final int height;
    private final long renderDurationMs;
    private final double complianceScore;
    private final ErrorKind errorKind;
    private final String message;

    private RenderResult(boolean success, byte[] artifact, String format, int width, int height,
                         long renderDurationMs, double complianceScore, ErrorKind errorKind, String message) {
        this.success = success;
        this.artifact = artifact;
        this.format = format;
        this.width = width;
        this.height = height;
        this.renderDurationMs = renderDurationMs;
        this.complianceScore = complianceScore;
        this.errorKind = errorKind;
        this.message = message;
    }

    /**
     * 成功结果
     *
     * @param artifact         截图或PDF数据
     * @param format           "png"、"jpeg"或"pdf"
     * @param width            视口宽度，PDF为0
     * @param height           视口高度，PDF为0
     * @param renderDurationMs 渲染耗时
     * @param complianceScore  合规检查得分
     */
    public static RenderResult success(byte[] artifact, String format, int width, int height,
                                       long renderDurationMs, double complianceScore) {
        return new RenderResult(true, artifact != null ? artifact.clone() : null, format, width, height, renderDurationMs,
                complianceScore, null, null);
    }

    public static RenderResult failure(ErrorKind errorKind, String message) {
        return new RenderResult(false, null, null, 0, 0, 0, 0, errorKind, message);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return 产物数据的副本，失败结果为null
     */
    public byte[] getArtifact() {
        return artifact != null ? artifact.clone() : null;
    }

    public String getFormat() {
        return format;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public long getRenderDurationMs() {
        return renderDurationMs;
    }

    public double getComplianceScore() {
        return complianceScore;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    /**
     * 产物的MIME类型，失败结果返回null
     */
    public String getContentType() {
        if (!success) {
            return null;
        }
        return "pdf".equals(format) ? "application/pdf" : "image/" + format;
    }

    /**
     * 转换为JSON对象，产物以base64形式给出
     */
    public JsonObject toJsonObject() {
        JsonObject json = new JsonObject();
        json.addProperty("success", success);
        if (success) {
            JsonObject data = new JsonObject();
            data.addProperty("base64", Base64.getEncoder().encodeToString(artifact));
            data.addProperty("format", format);
            if (width > 0) {
                data.addProperty("width", width);
                data.addProperty("height", height);
            }
            data.addProperty("size", artifact.length);
            data.addProperty("renderTime", renderDurationMs);
            data.addProperty("complianceScore", complianceScore);
            json.add("data", data);
        } else {
            JsonObject error = new JsonObject();
            error.addProperty("message", message);
            error.addProperty("code", errorKind.getCode());
            json.add("error", error);
        }
        return json;
    }

    public String toJson() {
        return gson.toJson(toJsonObject());
    }

    @Override
    public String toString() {
        if (success) {
            return String.format("RenderResult[success, format=%s, %d bytes, %dx%d, %d ms]",
                    format, artifact.length, width, height, renderDurationMs);
        }
        return String.format("RenderResult[failed, kind=%s, message=%s]", errorKind, message);
    }
}
