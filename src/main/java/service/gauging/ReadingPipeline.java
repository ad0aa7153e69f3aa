package service.gauging;

import common.consts.AxisTypeEnum;
import model.bo.ReadingResult;
import model.dto.request.BatchComputeReq;
import model.dto.request.ReadingComputeReq;
import model.dto.response.BatchComputeItemResp;

import java.util.List;

/**
 * 计量流水线
 * 读数 -> 基础舱容 -> 横倾修正 -> 观测体积 -> VCF -> 15°C 体积 -> 质量
 * 无副作用，只读舱容数据，可并发调用
 */
public interface ReadingPipeline {

    /**
     * @param tankName     舱名
     * @param trim         纵倾 (m)
     * @param levelCm      测深/空距 (cm)
     * @param axis         读数类型
     * @param heelRaw      横倾输入，可为空
     * @param density15    15°C 密度 (kg/m3)
     * @param temperatureC 油温 (°C)
     * @throws common.exception.NoBaseVolumeException 查不到基础舱容
     */
    ReadingResult compute(String tankName, double trim, double levelCm, AxisTypeEnum axis,
                          String heelRaw, double density15, double temperatureC);

    /**
     * 校验请求并计算
     * @throws common.exception.BusinessException 参数非法
     */
    ReadingResult compute(ReadingComputeReq req);

    /**
     * 逐舱计算，单舱失败只记录在该舱结果中
     */
    List<BatchComputeItemResp> computeAll(BatchComputeReq req);
}
