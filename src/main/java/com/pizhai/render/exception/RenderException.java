package com.pizhai.render.exception;

/**
 * 渲染功能的自定义异常类
 */
public class RenderException extends RuntimeException {

    private final ErrorKind errorKind;

    public RenderException(String message) {
        this(ErrorKind.INTERNAL_ERROR, message);
    }

    public RenderException(String message, Throwable cause) {
        this(ErrorKind.INTERNAL_ERROR, message, cause);
    }

    public RenderException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public RenderException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    /**
     * 获取错误分类
     */
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public static class ChromeNotFoundException extends RenderException {
        public ChromeNotFoundException(String message) {
            super(ErrorKind.LAUNCH_FAILURE, message);
        }
    }

    public static class LaunchFailureException extends RenderException {
        public LaunchFailureException(String message) {
            super(ErrorKind.LAUNCH_FAILURE, message);
        }

        public LaunchFailureException(String message, Throwable cause) {
            super(ErrorKind.LAUNCH_FAILURE, message, cause);
        }
    }

    /**
     * CDP通信错误：WebSocket断开、命令超时或Chrome返回error
     */
    public static class ProtocolException extends RenderException {
        private final boolean timeout;

        public ProtocolException(String message) {
            this(message, false, null);
        }

        public ProtocolException(String message, Throwable cause) {
            this(message, false, cause);
        }

        public ProtocolException(String message, boolean timeout, Throwable cause) {
            super(ErrorKind.INTERNAL_ERROR, message, cause);
            this.timeout = timeout;
        }

        public boolean isTimeout() {
            return timeout;
        }
    }

    public static class PageLoadTimeoutException extends RenderException {
        public PageLoadTimeoutException(String message) {
            super(ErrorKind.PAGE_LOAD_TIMEOUT, message);
        }

        public PageLoadTimeoutException(String message, Throwable cause) {
            super(ErrorKind.PAGE_LOAD_TIMEOUT, message, cause);
        }
    }

    public static class CaptureFailureException extends RenderException {
        public CaptureFailureException(String message) {
            super(ErrorKind.CAPTURE_FAILURE, message);
        }

        public CaptureFailureException(String message, Throwable cause) {
            super(ErrorKind.CAPTURE_FAILURE, message, cause);
        }
    }

    public static class PoolExhaustedException extends RenderException {
        public PoolExhaustedException(String message) {
            super(ErrorKind.POOL_EXHAUSTED, message);
        }
    }

    public static class PoolShutdownException extends RenderException {
        public PoolShutdownException(String message) {
            super(ErrorKind.POOL_SHUT_DOWN, message);
        }
    }
}
