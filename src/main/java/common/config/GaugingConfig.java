package common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 计量引擎配置
 * 舱容表位置与数值容差统一在这里管理，不在代码各处硬编码。
 *
 * 可通过 Spring 配置文件覆盖：
 *
 * gauging.calibration.location
 * gauging.calibration.load-on-startup
 * gauging.calibration.trim-tolerance
 * gauging.pipeline.clamp-negative-observed
 * gauging.error-log.capacity
 */
@Configuration
@ConfigurationProperties(prefix = "gauging")
@Data
public class GaugingConfig {

    private Calibration calibration = new Calibration();

    private Pipeline pipeline = new Pipeline();

    private ErrorLog errorLog = new ErrorLog();

    @Data
    public static class Calibration {
        /**
         * 归一化舱容表 CSV 文件，或包含 *_normalized.csv 的目录
         */
        private String location;

        /**
         * 启动时是否自动加载舱容表
         */
        private boolean loadOnStartup = false;

        /**
         * 纵倾精确匹配的容差 (米)
         */
        private double trimTolerance = 1e-6;
    }

    @Data
    public static class Pipeline {
        /**
         * 观测体积为负 (横倾修正数据异常) 时是否截断为 0
         */
        private boolean clampNegativeObserved = true;
    }

    @Data
    public static class ErrorLog {
        /**
         * 错误日志环形缓冲容量
         */
        private int capacity = 500;
    }
}
