package cn.bafuka.notioncache.exception;

/**
 * Notion API 调用异常
 * 远程接口返回非 2xx 或网络失败时抛出
 *
 * @since 1.0
 */
public class NotionApiException extends RuntimeException {

    /**
     * HTTP 状态码，网络错误时为 0
     */
    private final int status;

    /**
     * 响应体原文
     */
    private final String responseBody;

    /**
     * 失败原因
     */
    private final FailureReason reason;

    public NotionApiException(String message, Throwable cause, int status,
                              String responseBody, FailureReason reason) {
        super(message, cause);
        this.status = status;
        this.responseBody = responseBody;
        this.reason = reason;
    }

    /**
     * 根据 HTTP 响应构造异常
     *
     * @param status       状态码
     * @param responseBody 响应体
     * @return 异常
     */
    public static NotionApiException fromResponse(int status, String responseBody) {
        return new NotionApiException(
                String.format("Notion API error (%d): %s", status, responseBody),
                null,
                status,
                responseBody,
                FailureReason.fromStatus(status)
        );
    }

    /**
     * 网络层失败
     *
     * @param cause 原始异常
     * @return 异常
     */
    public static NotionApiException network(Throwable cause) {
        return new NotionApiException(
                "Notion API request failed: " + cause.getMessage(),
                cause,
                0,
                null,
                FailureReason.NETWORK
        );
    }

    public int getStatus() {
        return status;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public FailureReason getReason() {
        return reason;
    }

    /**
     * 失败原因枚举
     */
    public enum FailureReason {
        /**
         * 认证失败或无权限
         */
        UNAUTHORIZED("认证失败"),

        /**
         * 资源不存在
         */
        NOT_FOUND("资源不存在"),

        /**
         * 触发限流
         */
        RATE_LIMITED("限流"),

        /**
         * 请求参数错误
         */
        VALIDATION("参数错误"),

        /**
         * 服务端错误
         */
        SERVER_ERROR("服务端错误"),

        /**
         * 网络错误
         */
        NETWORK("网络错误"),

        /**
         * 未知错误
         */
        UNKNOWN("未知错误");

        private final String description;

        FailureReason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }

        /**
         * 根据 HTTP 状态码判断失败原因
         *
         * @param status 状态码
         * @return 失败原因
         */
        public static FailureReason fromStatus(int status) {
            if (status == 401 || status == 403) {
                return UNAUTHORIZED;
            }
            if (status == 404) {
                return NOT_FOUND;
            }
            if (status == 429) {
                return RATE_LIMITED;
            }
            if (status == 400 || status == 409 || status == 422) {
                return VALIDATION;
            }
            if (status >= 500) {
                return SERVER_ERROR;
            }
            return UNKNOWN;
        }
    }

    @Override
    public String toString() {
        return "NotionApiException{" +
                "status=" + status +
                ", reason=" + reason +
                ", message=" + getMessage() +
                '}';
    }
}
