package com.expertrelay.infrastructure.repository.support;

import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.exception.AppException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;

import java.util.function.Supplier;

/**
 * 存储访问包装：连接类故障统一转换为 STORE_UNAVAILABLE，供上层中止当前工作单元。
 */
public final class StoreAccess {

    private StoreAccess() {
    }

    public static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessResourceException | QueryTimeoutException ex) {
            throw new AppException(ResponseCode.STORE_UNAVAILABLE,
                    "Conversation store unavailable during " + operation, ex);
        }
    }
}
