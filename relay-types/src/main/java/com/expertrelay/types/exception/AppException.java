package com.expertrelay.types.exception;

import com.expertrelay.types.enums.ResponseCode;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 所有业务异常通过此类抛出，异常码取自 {@link ResponseCode}，便于上层按码区分处理：
 * 例如调度器据此识别存储不可用并中止本轮调度，而其它单会话错误只记录后跳过。
 * </p>
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 6032117593148870124L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    /**
     * 创建包含异常码的 AppException。
     *
     * @param code 异常码
     */
    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    /**
     * 使用响应码默认描述创建 AppException。
     *
     * @param responseCode 响应码
     */
    public AppException(ResponseCode responseCode) {
        this(responseCode.getCode(), responseCode.getInfo());
    }

    /**
     * 创建包含响应码和描述信息的 AppException。
     *
     * @param responseCode 响应码
     * @param message 异常描述信息
     */
    public AppException(ResponseCode responseCode, String message) {
        this(responseCode.getCode(), message);
    }

    /**
     * 创建包含响应码、描述信息和原因的 AppException。
     *
     * @param responseCode 响应码
     * @param message 异常描述信息
     * @param cause 异常原因
     */
    public AppException(ResponseCode responseCode, String message, Throwable cause) {
        this(responseCode.getCode(), message, cause);
    }

    /**
     * 创建包含异常码和描述信息的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     */
    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    /**
     * 创建包含异常码、描述信息和原因的 AppException。
     *
     * @param code 异常码
     * @param message 异常描述信息
     * @param cause 异常原因
     */
    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    /**
     * 判断异常码是否与给定响应码一致。
     */
    public boolean is(ResponseCode responseCode) {
        return responseCode != null && responseCode.getCode().equals(code);
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return "com.expertrelay.types.exception.AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
