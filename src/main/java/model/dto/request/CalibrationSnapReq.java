package model.dto.request;

import lombok.Data;

import java.util.List;

/**
 * 舱容表全量快照 (由 ETL 推送，整体替换当前舱容数据)
 */
@Data
public class CalibrationSnapReq {
    private String reqId;       // 请求ID
    private Long sendTime;      // 发送时间戳
    private String version;     // 舱容表版本
    private List<CalibrationRowDto> rows;
}
