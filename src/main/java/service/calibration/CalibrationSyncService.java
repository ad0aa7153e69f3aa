package service.calibration;

import common.consts.ErrorCodes;
import common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import model.dto.request.CalibrationRowDto;
import model.dto.request.CalibrationSnapReq;
import model.dto.response.CalibrationLoadResp;
import org.springframework.stereotype.Service;
import service.calibration.impl.InMemoryCalibrationStore;
import service.gauging.GaugingErrorLog;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;

/**
 * 舱容表同步服务
 * 来源可以是 CSV 文件/目录，也可以是 ETL 推送的全量快照；每次都整体替换舱容存储
 */
@Service
@Slf4j
public class CalibrationSyncService {

    private final InMemoryCalibrationStore store;
    private final CalibrationCsvLoader csvLoader;
    private final CalibrationValidator validator;
    private final GaugingErrorLog errorLog;

    public CalibrationSyncService(InMemoryCalibrationStore store,
                                  CalibrationCsvLoader csvLoader,
                                  CalibrationValidator validator,
                                  GaugingErrorLog errorLog) {
        this.store = store;
        this.csvLoader = csvLoader;
        this.validator = validator;
        this.errorLog = errorLog;
    }

    /**
     * 处理全量快照
     */
    public CalibrationLoadResp handleSnapshot(CalibrationSnapReq req) {
        if (req == null || req.getRows() == null) {
            log.warn("收到空的舱容表快照，跳过处理");
            CalibrationLoadResp resp = new CalibrationLoadResp();
            resp.setSource(req == null ? null : req.getReqId());
            return resp;
        }
        String source = "snapshot:" + (req.getVersion() != null ? req.getVersion() : req.getReqId());
        return apply(source, req.getRows());
    }

    /**
     * 从文件或目录加载
     */
    public CalibrationLoadResp loadLocation(String location) {
        if (location == null || location.trim().isEmpty()) {
            throw new BusinessException(ErrorCodes.CALIBRATION_LOCATION_EMPTY);
        }
        Path path = Paths.get(location.trim());
        List<CalibrationRowDto> rows;
        try {
            rows = csvLoader.load(path);
        } catch (IOException e) {
            throw new UncheckedIOException("读取舱容表失败: " + path, e);
        }
        return apply(path.toString(), rows);
    }

    private CalibrationLoadResp apply(String source, List<CalibrationRowDto> rows) {
        long start = System.currentTimeMillis();
        List<CalibrationRowDto> safeRows = rows == null ? Collections.emptyList() : rows;

        CalibrationValidator.Outcome outcome = validator.validate(safeRows);
        for (String issue : outcome.getIssues()) {
            log.warn("舱容表数据问题 [{}]: {}", source, issue);
            errorLog.recordCalibrationIssue(source, issue);
        }

        store.replaceAll(outcome.getPoints());

        CalibrationLoadResp resp = new CalibrationLoadResp();
        resp.setSource(source);
        resp.setRowsRead(safeRows.size());
        resp.setPointsLoaded(outcome.getPoints().size());
        resp.setTankCount((int) outcome.tankCount());
        resp.setIssues(outcome.getIssues());

        log.info("舱容表加载完成 [{}]: 读取 {} 行, 入库 {} 条, {} 个舱, {} 个问题, 耗时 {} ms",
                source, resp.getRowsRead(), resp.getPointsLoaded(), resp.getTankCount(),
                outcome.getIssues().size(), System.currentTimeMillis() - start);
        return resp;
    }
}
