package common.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.annotation.Configuration;
import service.calibration.CalibrationSyncService;

/**
 * 负责在 Spring 容器启动后，按配置把舱容表加载进舱容存储
 * 舱容表位置只从 GaugingConfig 显式传入，不依赖全局路径常量。
 */
@Configuration
@Slf4j
public class CalibrationStartupConfig implements InitializingBean {

    private final GaugingConfig gaugingConfig;
    private final CalibrationSyncService syncService;

    public CalibrationStartupConfig(GaugingConfig gaugingConfig, CalibrationSyncService syncService) {
        this.gaugingConfig = gaugingConfig;
        this.syncService = syncService;
    }

    @Override
    public void afterPropertiesSet() {
        GaugingConfig.Calibration cfg = gaugingConfig.getCalibration();
        if (!cfg.isLoadOnStartup()) {
            log.info("未开启启动加载舱容表 (gauging.calibration.load-on-startup=false)");
            return;
        }
        syncService.loadLocation(cfg.getLocation());
    }
}
