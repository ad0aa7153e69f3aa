package service.gauging;

import common.config.GaugingConfig;
import lombok.Data;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 计量错误日志
 * 记录失败的计量与舱容表数据质量问题，供界面/记录层查询
 */
@Component
public class GaugingErrorLog {

    private final int capacity;

    private final Deque<ErrorLogEntry> errorBuffer;

    public GaugingErrorLog(GaugingConfig gaugingConfig) {
        this.capacity = Math.max(1, gaugingConfig.getErrorLog().getCapacity());
        this.errorBuffer = new ArrayDeque<>(capacity);
    }

    /**
     * 记录计量失败
     */
    public synchronized void recordReadingError(String tankName, String message, Throwable cause) {
        ErrorLogEntry entry = new ErrorLogEntry();
        entry.setErrorType(ErrorType.READING_ERROR);
        entry.setTankName(tankName);
        entry.setMessage(message);
        entry.setCause(cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : null);
        entry.setTimestamp(System.currentTimeMillis());

        addEntry(entry);
    }

    /**
     * 记录舱容表数据问题
     */
    public synchronized void recordCalibrationIssue(String source, String message) {
        ErrorLogEntry entry = new ErrorLogEntry();
        entry.setErrorType(ErrorType.CALIBRATION_ISSUE);
        entry.setSource(source);
        entry.setMessage(message);
        entry.setTimestamp(System.currentTimeMillis());

        addEntry(entry);
    }

    private void addEntry(ErrorLogEntry entry) {
        if (errorBuffer.size() >= capacity) {
            errorBuffer.removeFirst();
        }
        errorBuffer.addLast(entry);
    }

    /**
     * 查询指定时间 (毫秒时间戳) 之后的错误日志
     */
    public synchronized List<ErrorLogEntry> listSince(long sinceMillis) {
        List<ErrorLogEntry> result = new ArrayList<>();
        for (ErrorLogEntry entry : errorBuffer) {
            if (entry.getTimestamp() >= sinceMillis) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * 查询所有错误日志
     */
    public synchronized List<ErrorLogEntry> listAll() {
        return new ArrayList<>(errorBuffer);
    }

    public synchronized void clear() {
        errorBuffer.clear();
    }

    /**
     * 错误类型
     */
    public enum ErrorType {
        READING_ERROR,      // 计量失败
        CALIBRATION_ISSUE   // 舱容表数据问题
    }

    /**
     * 错误日志条目
     */
    @Data
    public static class ErrorLogEntry {
        private ErrorType errorType;
        private String tankName;
        private String source;     // 舱容表来源
        private String message;
        private String cause;
        private long timestamp;
    }
}
