package model.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单舱计量请求 (界面、记录层、批处理共用)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReadingComputeReq {
    private String tankName;        // 舱名
    private Double trim;            // 纵倾 (m)
    private Double levelCm;         // 测深或空距读数 (cm)
    private Boolean sounding;       // true=测深 false=空距 (与 axis 二选一，默认测深)
    private String axis;            // sounding / ullage
    private String heel;            // 横倾输入，如 P1、S-2、0.7P、-1.2、0
    private Double density15;       // 15°C 密度
    private String density15Unit;   // kg/m3 (默认) 或 kg/L
    private Double temperatureC;    // 油温 (°C)
}
