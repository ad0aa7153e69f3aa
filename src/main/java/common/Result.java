package common;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 统一响应结果
 * 计量计算失败属于业务结果，由调用方 (界面/批处理/记录层) 自行决定如何展示或中止
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Result {

    public static final int CODE_SUCCESS = 200;
    public static final int CODE_BAD_REQUEST = 400;
    public static final int CODE_NOT_FOUND = 404;
    public static final int CODE_ERROR = 500;

    private Integer code; // 200成功 400参数错误 404无舱容数据 500失败
    private String msg;   // 消息
    private Object data;  // 数据

    // 成功 (无数据)
    public static Result success() {
        return new Result(CODE_SUCCESS, "操作成功", null);
    }

    // 成功 (带数据)
    public static Result success(Object data) {
        return new Result(CODE_SUCCESS, "操作成功", data);
    }

    // 成功 (带消息和数据)
    public static Result success(String msg, Object data) {
        return new Result(CODE_SUCCESS, msg, data);
    }

    // 失败 (默认 500 状态码)
    public static Result error(String msg) {
        return new Result(CODE_ERROR, msg, null);
    }

    // 失败 (带自定义状态码和消息)
    public static Result error(Integer code, String msg) {
        return new Result(code, msg, null);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return code != null && code == CODE_SUCCESS;
    }
}
