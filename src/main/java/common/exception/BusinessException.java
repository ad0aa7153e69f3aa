package common.exception;

/**
 * 业务异常 (参数非法、舱容表格式错误等)
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
