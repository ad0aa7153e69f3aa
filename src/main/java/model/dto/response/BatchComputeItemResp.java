package model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import model.bo.ReadingResult;

/**
 * 批量计量中单舱的结果 失败的舱只带错误信息，不影响其他舱
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchComputeItemResp {
    private String tankName;
    private boolean success;
    private ReadingResult result;
    private String error;

    public static BatchComputeItemResp ok(String tankName, ReadingResult result) {
        return new BatchComputeItemResp(tankName, true, result, null);
    }

    public static BatchComputeItemResp failed(String tankName, String error) {
        return new BatchComputeItemResp(tankName, false, null, error);
    }
}
