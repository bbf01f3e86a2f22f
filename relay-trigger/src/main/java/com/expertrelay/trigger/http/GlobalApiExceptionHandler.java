package com.expertrelay.trigger.http;

import com.expertrelay.api.response.Response;
import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.EnumMap;
import java.util.Map;

/**
 * 统一 API 异常处理。
 * <p>
 * 业务错误码通过 {@link Response} 返回，同时映射到对应的 HTTP 状态，方便 webhook 前置服务做重试判断：
 * 存储或检索不可用返回 503，可重试；参数错误、查询不存在、重复提问为 4xx，不应重试。
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_INFO_LENGTH = 300;

    private static final Map<ResponseCode, HttpStatus> STATUS_MAPPING = new EnumMap<>(ResponseCode.class);

    static {
        STATUS_MAPPING.put(ResponseCode.ILLEGAL_PARAMETER, HttpStatus.BAD_REQUEST);
        STATUS_MAPPING.put(ResponseCode.QUERY_NOT_FOUND, HttpStatus.NOT_FOUND);
        STATUS_MAPPING.put(ResponseCode.DUPLICATE_PENDING, HttpStatus.CONFLICT);
        STATUS_MAPPING.put(ResponseCode.STORE_CONFLICT, HttpStatus.CONFLICT);
        STATUS_MAPPING.put(ResponseCode.STORE_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE);
        STATUS_MAPPING.put(ResponseCode.RETRIEVAL_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(AppException.class)
    public ResponseEntity<Response<Object>> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo());
        HttpStatus status = resolveStatus(code);
        if (status.is5xxServerError()) {
            log.error("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                    resolvePath(request), resolveMethod(request), resolveTraceId(), resolveRequestId(),
                    ex.getClass().getSimpleName(), code, info, ex);
        } else {
            log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                    resolvePath(request), resolveMethod(request), resolveTraceId(), resolveRequestId(),
                    ex.getClass().getSimpleName(), code, info);
        }
        return ResponseEntity.status(status).body(error(code, info));
    }

    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<Response<Object>> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = StringUtils.abbreviate(
                StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()), MAX_INFO_LENGTH);
        log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request), resolveMethod(request), resolveTraceId(), resolveRequestId(),
                ex.getClass().getSimpleName(), ResponseCode.ILLEGAL_PARAMETER.getCode(), info);
        return ResponseEntity.badRequest().body(error(ResponseCode.ILLEGAL_PARAMETER.getCode(), info));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Response<Object>> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request), resolveMethod(request), resolveTraceId(), resolveRequestId(),
                ex.getClass().getSimpleName(), ResponseCode.UN_ERROR.getCode(),
                StringUtils.abbreviate(ex.getMessage(), MAX_INFO_LENGTH), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error(ResponseCode.UN_ERROR.getCode(), ResponseCode.UN_ERROR.getInfo()));
    }

    static HttpStatus resolveStatus(String code) {
        for (Map.Entry<ResponseCode, HttpStatus> entry : STATUS_MAPPING.entrySet()) {
            if (entry.getKey().getCode().equals(code)) {
                return entry.getValue();
            }
        }
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }

    private Response<Object> error(String code, String info) {
        return Response.<Object>builder()
                .code(code)
                .info(info)
                .build();
    }

    private String resolvePath(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-");
    }

    private String resolveMethod(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-");
    }

    private String resolveTraceId() {
        return StringUtils.defaultIfBlank(MDC.get("traceId"), "-");
    }

    private String resolveRequestId() {
        return StringUtils.defaultIfBlank(MDC.get("requestId"), "-");
    }
}
