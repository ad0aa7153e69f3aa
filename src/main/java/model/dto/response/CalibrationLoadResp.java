package model.dto.response;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 舱容表加载报告
 */
@Data
public class CalibrationLoadResp {
    private String source;          // 文件/目录/快照ID
    private int rowsRead;           // 读取的原始行数
    private int pointsLoaded;       // 实际入库的记录数
    private int tankCount;          // 舱数量
    private List<String> issues = new ArrayList<>(); // 数据质量问题
}
