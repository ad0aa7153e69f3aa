package service.calibration;

import common.consts.AxisTypeEnum;
import model.dto.request.CalibrationRowDto;
import model.dto.snapshot.TankInfoDto;
import model.entity.AxisPoint;

import java.util.List;
import java.util.Optional;

/**
 * 舱容表只读查询
 * 计量引擎只依赖这个查询契约，不关心舱容表存放在哪里
 */
public interface CalibrationStore {

    /**
     * 查询某舱某纵倾/横倾代码下的插值序列
     * @param tankName 舱名
     * @param axis     测深 / 空距
     * @param trim     纵倾 (m)，为 null 时只匹配与纵倾无关的记录
     * @param heelCode 横倾代码，为 null 时查基础舱容，否则查修正量
     * @return 按读数升序的 (读数, 值) 序列，查不到时为空列表
     */
    List<AxisPoint> findSeries(String tankName, AxisTypeEnum axis, Double trim, String heelCode);

    /**
     * 该舱所有出现过的纵倾 (不含 null)，升序
     */
    List<Double> availableTrims(String tankName);

    /**
     * 所有舱名，升序
     */
    List<String> listTanks();

    /**
     * 单舱原始记录 最多 limit 条
     * 有纵倾的在前、横倾修正行在前，再按测深、空距升序
     */
    List<CalibrationRowDto> listRows(String tankName, int limit);

    /**
     * 单舱概况
     */
    Optional<TankInfoDto> describeTank(String tankName);
}
