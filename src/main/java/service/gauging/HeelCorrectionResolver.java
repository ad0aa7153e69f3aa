package service.gauging;

import common.consts.AxisTypeEnum;
import common.consts.HeelSideEnum;
import engine.AxisInterpolator;
import lombok.extern.slf4j.Slf4j;
import model.bo.HeelSpec;
import model.entity.AxisPoint;
import org.springframework.stereotype.Component;
import service.calibration.CalibrationStore;

import java.util.List;
import java.util.OptionalDouble;

/**
 * 横倾修正解析
 * 查不到修正数据时修正量记为 0.0，不让整次计量失败。
 */
@Component
@Slf4j
public class HeelCorrectionResolver {

    private final CalibrationStore calibrationStore;

    public HeelCorrectionResolver(CalibrationStore calibrationStore) {
        this.calibrationStore = calibrationStore;
    }

    public double resolve(String tankName, double trim, AxisTypeEnum axis, double levelCm, HeelSpec spec) {
        if (spec == null) {
            return 0.0;
        }
        switch (spec.getKind()) {
            case DISCRETE:
                return discrete(tankName, trim, axis, levelCm, spec.getCode());
            case CONTINUOUS:
                return continuous(tankName, trim, axis, levelCm, spec.getSide(), spec.getDegrees());
            default:
                return 0.0;
        }
    }

    /**
     * 离散代码查表：先查该纵倾，查不到再查与纵倾无关的记录
     */
    public OptionalDouble lookupDiscrete(String tankName, double trim, AxisTypeEnum axis, double levelCm, String code) {
        List<AxisPoint> series = calibrationStore.findSeries(tankName, axis, trim, code);
        if (series.isEmpty()) {
            series = calibrationStore.findSeries(tankName, axis, null, code);
        }
        if (series.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(AxisInterpolator.interpolate(series, levelCm));
    }

    private double discrete(String tankName, double trim, AxisTypeEnum axis, double levelCm, String code) {
        OptionalDouble corr = lookupDiscrete(tankName, trim, axis, levelCm, code);
        if (corr.isEmpty()) {
            log.debug("舱 [{}] 无横倾代码 {} 的修正数据，按 0 处理", tankName, code);
        }
        return corr.orElse(0.0);
    }

    /**
     * 连续角度：0~1° 在 0 与 1° 锚点间插值，1~2° 在 1° 与 2° 锚点间插值
     */
    public double continuous(String tankName, double trim, AxisTypeEnum axis, double levelCm,
                             HeelSideEnum side, double degrees) {
        if (degrees <= 0) {
            return 0.0;
        }
        double deg = Math.min(degrees, HeelSpec.MAX_DEGREES);

        double c1 = discrete(tankName, trim, axis, levelCm, side.getOneDegreeCode());
        if (deg <= 1.0) {
            return deg * c1;
        }
        double c2 = discrete(tankName, trim, axis, levelCm, side.getTwoDegreeCode());
        return c1 + (deg - 1.0) * (c2 - c1);
    }
}
