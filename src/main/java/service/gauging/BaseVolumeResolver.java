package service.gauging;

import common.consts.AxisTypeEnum;
import engine.AxisInterpolator;
import lombok.extern.slf4j.Slf4j;
import model.entity.AxisPoint;
import org.springframework.stereotype.Component;
import service.calibration.CalibrationStore;

import java.util.List;
import java.util.OptionalDouble;

/**
 * 基础舱容解析
 * 先查精确纵倾；该纵倾没有数据时，取相邻两个纵倾分别插值后再沿纵倾线性插值。
 * 结果为空表示任何纵倾下都查不到 (NoBaseVolume)，由调用方决定是否报错。
 */
@Component
@Slf4j
public class BaseVolumeResolver {

    private final CalibrationStore calibrationStore;

    public BaseVolumeResolver(CalibrationStore calibrationStore) {
        this.calibrationStore = calibrationStore;
    }

    public OptionalDouble resolve(String tankName, double trim, AxisTypeEnum axis, double levelCm) {
        OptionalDouble exact = resolveAtTrim(tankName, trim, axis, levelCm);
        if (exact.isPresent()) {
            return exact;
        }
        return resolveCrossTrim(tankName, trim, axis, levelCm);
    }

    /**
     * 指定纵倾下沿读数插值
     */
    public OptionalDouble resolveAtTrim(String tankName, double trim, AxisTypeEnum axis, double levelCm) {
        List<AxisPoint> series = calibrationStore.findSeries(tankName, axis, trim, null);
        if (series.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(AxisInterpolator.interpolate(series, levelCm));
    }

    private OptionalDouble resolveCrossTrim(String tankName, double trim, AxisTypeEnum axis, double levelCm) {
        List<Double> trims = calibrationStore.availableTrims(tankName);
        if (trims.isEmpty()) {
            return OptionalDouble.empty();
        }
        double[] bracket = bracketTrims(trims, trim);
        double t0 = bracket[0];
        double t1 = bracket[1];
        if (t0 == t1) {
            log.debug("舱 [{}] 纵倾 {} 不在表内，取最近纵倾 {}", tankName, trim, t0);
            return resolveAtTrim(tankName, t0, axis, levelCm);
        }

        OptionalDouble v0 = resolveAtTrim(tankName, t0, axis, levelCm);
        OptionalDouble v1 = resolveAtTrim(tankName, t1, axis, levelCm);
        if (v0.isEmpty() || v1.isEmpty()) {
            // 只有一侧有数据时退化为用该侧
            if (v0.isPresent() || v1.isPresent()) {
                log.warn("舱 [{}] 纵倾 {} 插值只有一侧有数据 ({} / {})", tankName, trim, t0, t1);
            }
            return v0.isPresent() ? v0 : v1;
        }
        return OptionalDouble.of(AxisInterpolator.lerp(trim, t0, v0.getAsDouble(), t1, v1.getAsDouble()));
    }

    /**
     * 找到包住 trim 的两个纵倾 t0 <= trim <= t1；超出表范围时两端收缩为同一个最近值
     *
     * @param trims 升序的纵倾列表 (非空)
     */
    static double[] bracketTrims(List<Double> trims, double trim) {
        Double lo = null;
        Double hi = null;
        for (Double tv : trims) {
            if (tv <= trim) {
                lo = tv;
            }
            if (tv >= trim) {
                hi = tv;
                break;
            }
        }
        if (lo == null) {
            lo = trims.get(0);
        }
        if (hi == null) {
            hi = trims.get(trims.size() - 1);
        }
        return new double[]{lo, hi};
    }
}
