package common.exception;

import common.consts.AxisTypeEnum;
import common.consts.ErrorCodes;

/**
 * 任何纵倾下都查不到基础舱容 对单次计量是致命错误，不重试
 */
public class NoBaseVolumeException extends RuntimeException {
    private final String tankName;
    private final double trim;
    private final AxisTypeEnum axis;
    private final double levelCm;

    public NoBaseVolumeException(String tankName, double trim, AxisTypeEnum axis, double levelCm) {
        super(String.format("%s: 舱 [%s] 纵倾 %s %s %s cm",
                ErrorCodes.NO_BASE_VOLUME, tankName, trim, axis.getDesc(), levelCm));
        this.tankName = tankName;
        this.trim = trim;
        this.axis = axis;
        this.levelCm = levelCm;
    }

    public String getTankName() {
        return tankName;
    }

    public double getTrim() {
        return trim;
    }

    public AxisTypeEnum getAxis() {
        return axis;
    }

    public double getLevelCm() {
        return levelCm;
    }
}
