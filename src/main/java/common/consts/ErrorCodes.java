package common.consts;

/**
 * 全局错误信息常量池
 */
public class ErrorCodes {
    // 基础错误
    public static final String SYSTEM_ERROR = "系统内部错误";

    // 舱容数据错误
    public static final String NO_BASE_VOLUME = "未找到基础舱容 (请检查舱名、纵倾以及测深/空距是否在舱容表范围内)";
    public static final String NO_CALIBRATION_DATA = "插值序列为空，无舱容表数据";
    public static final String CALIBRATION_LOCATION_EMPTY = "未配置舱容表位置 (gauging.calibration.location)";
    public static final String CALIBRATION_LOCATION_NOT_FOUND = "舱容表文件或目录不存在";
    public static final String CALIBRATION_MISSING_COLUMNS = "舱容表缺少必需列";
    public static final String TANK_NOT_FOUND = "舱容表中不存在指定的舱";

    // 参数错误
    public static final String TANK_NAME_EMPTY = "舱名不能为空";
    public static final String LEVEL_REQUIRED = "必须提供测深或空距读数 (cm)";
    public static final String TRIM_REQUIRED = "必须提供纵倾 (m)";
    public static final String TEMPERATURE_REQUIRED = "必须提供油温 (°C)";
    public static final String DENSITY_REQUIRED = "必须提供15°C密度";
    public static final String DENSITY_NOT_POSITIVE = "15°C密度必须大于0";
    public static final String NOT_FINITE = "数值必须为有限数";
    public static final String INVALID_AXIS = "非法的读数类型，仅支持 sounding(测深) 或 ullage(空距)";
    public static final String BATCH_ROW_EMPTY = "第 %d 行计量请求为空";
    public static final String INVALID_DENSITY_UNIT = "非法的密度单位，仅支持 kg/m3 或 kg/L";
}
