package com.mesenforcement.application;

import com.mesenforcement.application.exceptions.EnforcementUnavailableException;
import org.springframework.dao.DataAccessException;

import java.util.function.Supplier;

/**
 * Translates store failures into {@link EnforcementUnavailableException}.
 */
final class StoreCalls {

    private StoreCalls() {
    }

    static <T> T call(String failureMessage, Supplier<T> storeCall) {
        try {
            return storeCall.get();
        } catch (DataAccessException e) {
            throw new EnforcementUnavailableException(failureMessage, e);
        }
    }
}
