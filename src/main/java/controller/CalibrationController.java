package controller;

import common.Result;
import common.config.GaugingConfig;
import common.consts.ErrorCodes;
import lombok.extern.slf4j.Slf4j;
import model.dto.request.CalibrationSnapReq;
import model.dto.response.CalibrationLoadResp;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.calibration.CalibrationStore;
import service.calibration.CalibrationSyncService;

/**
 * 舱容表管理接口
 */
@RestController
@RequestMapping("/calibration")
@Slf4j
public class CalibrationController {

    private final CalibrationSyncService syncService;
    private final CalibrationStore calibrationStore;
    private final GaugingConfig gaugingConfig;

    public CalibrationController(CalibrationSyncService syncService,
                                 CalibrationStore calibrationStore,
                                 GaugingConfig gaugingConfig) {
        this.syncService = syncService;
        this.calibrationStore = calibrationStore;
        this.gaugingConfig = gaugingConfig;
    }

    /**
     * 接收 ETL 推送的全量舱容表
     */
    @PostMapping("/snap")
    public Result receiveSnapshot(@RequestBody CalibrationSnapReq request) {
        log.info("收到舱容表快照请求, ID: {}, 版本: {}, 时间: {}",
                request.getReqId(), request.getVersion(), request.getSendTime());
        CalibrationLoadResp resp = syncService.handleSnapshot(request);
        return Result.success("同步成功", resp);
    }

    /**
     * 从文件/目录重新加载，未指定时使用配置的位置
     */
    @PostMapping("/load")
    public Result load(@RequestParam(name = "location", required = false) String location) {
        String target = location != null ? location : gaugingConfig.getCalibration().getLocation();
        CalibrationLoadResp resp = syncService.loadLocation(target);
        return Result.success("加载成功", resp);
    }

    @GetMapping("/tanks")
    public Result listTanks() {
        return Result.success(calibrationStore.listTanks());
    }

    @GetMapping("/tanks/{name}")
    public Result describeTank(@PathVariable("name") String name) {
        return calibrationStore.describeTank(name)
                .map(Result::success)
                .orElseGet(() -> Result.error(Result.CODE_NOT_FOUND, ErrorCodes.TANK_NOT_FOUND + ": " + name));
    }

    /**
     * 单舱原始记录
     */
    @GetMapping("/tanks/{name}/rows")
    public Result listRows(@PathVariable("name") String name,
                           @RequestParam(name = "limit", defaultValue = "30") int limit) {
        if (calibrationStore.describeTank(name).isEmpty()) {
            return Result.error(Result.CODE_NOT_FOUND, ErrorCodes.TANK_NOT_FOUND + ": " + name);
        }
        return Result.success(calibrationStore.listRows(name, limit));
    }
}
