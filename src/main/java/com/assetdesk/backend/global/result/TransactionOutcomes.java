package com.assetdesk.backend.global.result;

import org.springframework.transaction.interceptor.TransactionAspectSupport;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Marks the surrounding transaction rollback-only when an operation returns an error value
 * instead of throwing.
 */
public final class TransactionOutcomes {

    private TransactionOutcomes() {
    }

    public static <T, E> Result<T, E> rollbackOnError(Result<T, E> result) {
        if (result.isErr() && TransactionSynchronizationManager.isActualTransactionActive()) {
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
        }
        return result;
    }
}
