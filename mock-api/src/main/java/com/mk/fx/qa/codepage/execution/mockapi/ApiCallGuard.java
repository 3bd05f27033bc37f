package com.mk.fx.qa.codepage.execution.mockapi;

/**
 * Hook through which the owner of a {@link MockExternalApi} accounts for and records calls.
 *
 * <p>{@link #tryAcquire(ApiOperation)} is consulted before an operation runs. Returning {@code false}
 * rejects the call: it is not executed and {@link #onRejected(ApiOperation)} is invoked instead of
 * {@link #onCompleted(ApiCallRecord)}.
 */
public interface ApiCallGuard {

  boolean tryAcquire(ApiOperation operation);

  int limit();

  void onCompleted(ApiCallRecord call);

  void onRejected(ApiOperation operation);

  /** Guard that admits every call and records nothing. */
  static ApiCallGuard unlimited() {
    return new ApiCallGuard() {
      @Override
      public boolean tryAcquire(ApiOperation operation) {
        return true;
      }

      @Override
      public int limit() {
        return Integer.MAX_VALUE;
      }

      @Override
      public void onCompleted(ApiCallRecord call) {}

      @Override
      public void onRejected(ApiOperation operation) {}
    };
  }
}
