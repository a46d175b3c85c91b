package com.seatgate.tenant.service;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

/** 再試行で回復しうるストア障害かどうかを判定する。 */
final class TenantStoreFailures {

  private TenantStoreFailures() {}

  static boolean isUnavailable(RuntimeException ex) {
    return ex instanceof DataAccessResourceFailureException
        || ex instanceof TransientDataAccessException
        || ex instanceof CannotCreateTransactionException
        || ex instanceof TransactionTimedOutException;
  }
}
