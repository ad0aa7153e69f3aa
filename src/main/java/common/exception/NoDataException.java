package common.exception;

import common.consts.ErrorCodes;

/**
 * 插值器收到空序列
 * 正常流程下解析器会先判断序列是否为空，出现即说明调用或数据有问题
 */
public class NoDataException extends RuntimeException {

    public NoDataException() {
        super(ErrorCodes.NO_CALIBRATION_DATA);
    }
}
