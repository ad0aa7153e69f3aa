package common.exception;

import common.Result;
import common.consts.ErrorCodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import service.gauging.GaugingErrorLog;

/**
 * 全局异常处理器
 * 捕获所有异常，记录日志，并以 Result 返回给调用方
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private final GaugingErrorLog errorLog;

    public GlobalExceptionHandler(GaugingErrorLog errorLog) {
        this.errorLog = errorLog;
    }

    /**
     * 无基础舱容：计量无法完成
     */
    @ExceptionHandler(NoBaseVolumeException.class)
    public Result handleNoBaseVolume(NoBaseVolumeException e) {
        log.warn("计量失败: {}", e.getMessage());
        errorLog.recordReadingError(e.getTankName(), e.getMessage(), e);
        return Result.error(Result.CODE_NOT_FOUND, e.getMessage());
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public Result handleBusinessException(BusinessException e) {
        log.warn("业务异常: {}", e.getMessage());
        errorLog.recordReadingError(null, "业务异常: " + e.getMessage(), e);
        return Result.error(Result.CODE_BAD_REQUEST, e.getMessage());
    }

    /**
     * 处理所有其他异常
     */
    @ExceptionHandler(Exception.class)
    public Result handleException(Exception e) {
        log.error("系统异常", e);
        errorLog.recordReadingError(null, "系统异常: " + e.getClass().getSimpleName(), e);
        return Result.error(ErrorCodes.SYSTEM_ERROR + ": " + e.getMessage());
    }
}
