package service.gauging.impl;

import common.config.GaugingConfig;
import common.consts.AxisTypeEnum;
import common.consts.DensityUnitEnum;
import common.consts.ErrorCodes;
import common.exception.BusinessException;
import common.exception.NoBaseVolumeException;
import engine.HeelSpecParser;
import engine.VolumeCorrectionFactor;
import lombok.extern.slf4j.Slf4j;
import model.bo.HeelSpec;
import model.bo.ReadingResult;
import model.dto.request.BatchComputeReq;
import model.dto.request.ReadingComputeReq;
import model.dto.response.BatchComputeItemResp;
import org.springframework.stereotype.Service;
import service.gauging.BaseVolumeResolver;
import service.gauging.GaugingErrorLog;
import service.gauging.HeelCorrectionResolver;
import service.gauging.ReadingPipeline;

import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class ReadingPipelineImpl implements ReadingPipeline {

    private final BaseVolumeResolver baseVolumeResolver;
    private final HeelCorrectionResolver heelCorrectionResolver;
    private final GaugingErrorLog errorLog;
    private final boolean clampNegativeObserved;

    public ReadingPipelineImpl(BaseVolumeResolver baseVolumeResolver,
                               HeelCorrectionResolver heelCorrectionResolver,
                               GaugingErrorLog errorLog,
                               GaugingConfig gaugingConfig) {
        this.baseVolumeResolver = baseVolumeResolver;
        this.heelCorrectionResolver = heelCorrectionResolver;
        this.errorLog = errorLog;
        this.clampNegativeObserved = gaugingConfig.getPipeline().isClampNegativeObserved();
    }

    @Override
    public ReadingResult compute(String tankName, double trim, double levelCm, AxisTypeEnum axis,
                                 String heelRaw, double density15, double temperatureC) {
        // 1. 基础舱容 查不到则整次计量失败
        double base = baseVolumeResolver.resolve(tankName, trim, axis, levelCm)
                .orElseThrow(() -> new NoBaseVolumeException(tankName, trim, axis, levelCm));

        // 2. 横倾修正
        HeelSpec spec = HeelSpecParser.parse(heelRaw);
        double corr = heelCorrectionResolver.resolve(tankName, trim, axis, levelCm, spec);

        // 3. 观测体积 体积不能为负
        double observed = base + corr;
        if (observed < 0 && clampNegativeObserved) {
            log.warn("舱 [{}] 观测体积为负 (基础 {} + 修正 {})，按 0 处理", tankName, base, corr);
            observed = 0.0;
        }

        // 4. VCF 与质量
        double vcf = VolumeCorrectionFactor.compute(density15, temperatureC);
        double v15 = observed * vcf;
        double massKg = v15 * density15;

        log.debug("舱 [{}] {}={}cm 纵倾={} 横倾={} -> 基础={} 修正={} 观测={} VCF={} V15={} 质量={}kg",
                tankName, axis.getCode(), levelCm, trim, spec.getLabel(), base, corr, observed, vcf, v15, massKg);

        return new ReadingResult(tankName, axis, levelCm, trim, spec.getLabel(),
                base, corr, observed, density15, temperatureC, vcf, v15, massKg);
    }

    @Override
    public ReadingResult compute(ReadingComputeReq req) {
        if (req == null || req.getTankName() == null || req.getTankName().trim().isEmpty()) {
            throw new BusinessException(ErrorCodes.TANK_NAME_EMPTY);
        }
        String tankName = req.getTankName().trim();
        double level = requireFinite(req.getLevelCm(), ErrorCodes.LEVEL_REQUIRED, "levelCm");
        double trim = requireFinite(req.getTrim(), ErrorCodes.TRIM_REQUIRED, "trim");
        double temperature = requireFinite(req.getTemperatureC(), ErrorCodes.TEMPERATURE_REQUIRED, "temperatureC");
        double density = requireFinite(req.getDensity15(), ErrorCodes.DENSITY_REQUIRED, "density15");

        DensityUnitEnum unit = DensityUnitEnum.getByCode(req.getDensity15Unit());
        if (unit == null) {
            throw new BusinessException(ErrorCodes.INVALID_DENSITY_UNIT + ": " + req.getDensity15Unit());
        }
        double density15 = unit.toKgPerM3(density);
        if (density15 <= 0) {
            throw new BusinessException(ErrorCodes.DENSITY_NOT_POSITIVE + ": " + density15);
        }

        return compute(tankName, trim, level, resolveAxis(req), req.getHeel(), density15, temperature);
    }

    @Override
    public List<BatchComputeItemResp> computeAll(BatchComputeReq req) {
        List<BatchComputeItemResp> items = new ArrayList<>();
        if (req == null || req.getReadings() == null) {
            return items;
        }
        int row = 0;
        for (ReadingComputeReq reading : req.getReadings()) {
            row++;
            if (reading == null) {
                String msg = String.format(ErrorCodes.BATCH_ROW_EMPTY, row);
                log.warn("批量计量 {}", msg);
                errorLog.recordReadingError(null, msg, null);
                items.add(BatchComputeItemResp.failed(null, msg));
                continue;
            }
            ReadingComputeReq effective = withBatchDefaults(reading, req);
            try {
                items.add(BatchComputeItemResp.ok(effective.getTankName(), compute(effective)));
            } catch (NoBaseVolumeException | BusinessException e) {
                log.warn("批量计量 舱 [{}] 失败: {}", effective.getTankName(), e.getMessage());
                errorLog.recordReadingError(effective.getTankName(), e.getMessage(), e);
                items.add(BatchComputeItemResp.failed(effective.getTankName(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("批量计量 舱 [{}] 异常", effective.getTankName(), e);
                String msg = ErrorCodes.SYSTEM_ERROR + ": " + e.getClass().getSimpleName();
                errorLog.recordReadingError(effective.getTankName(), msg, e);
                items.add(BatchComputeItemResp.failed(effective.getTankName(), msg));
            }
        }
        log.info("批量计量完成: 共 {} 舱, 失败 {} 舱", items.size(),
                items.stream().filter(i -> !i.isSuccess()).count());
        return items;
    }

    // 单行未填写时使用整船公共的纵倾/横倾 不修改调用方的请求
    private static ReadingComputeReq withBatchDefaults(ReadingComputeReq reading, BatchComputeReq batch) {
        return new ReadingComputeReq(
                reading.getTankName(),
                reading.getTrim() != null ? reading.getTrim() : batch.getTrim(),
                reading.getLevelCm(),
                reading.getSounding(),
                reading.getAxis(),
                reading.getHeel() != null ? reading.getHeel() : batch.getHeel(),
                reading.getDensity15(),
                reading.getDensity15Unit(),
                reading.getTemperatureC());
    }

    private static AxisTypeEnum resolveAxis(ReadingComputeReq req) {
        if (req.getAxis() != null && !req.getAxis().trim().isEmpty()) {
            AxisTypeEnum axis = AxisTypeEnum.getByCode(req.getAxis());
            if (axis == null) {
                throw new BusinessException(ErrorCodes.INVALID_AXIS + ": " + req.getAxis());
            }
            return axis;
        }
        return AxisTypeEnum.of(req.getSounding() == null || req.getSounding());
    }

    private static double requireFinite(Double value, String missingMsg, String field) {
        if (value == null) {
            throw new BusinessException(missingMsg);
        }
        if (value.isNaN() || value.isInfinite()) {
            throw new BusinessException(ErrorCodes.NOT_FINITE + ": " + field);
        }
        return value;
    }
}
