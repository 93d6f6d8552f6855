/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify;

/**
 * The closed set of failure kinds a backend adapter reports. Each kind states both retryability
 * flags explicitly.
 */
public enum ProviderErrorKind implements RetryableError {
  /** The backend is temporarily unable to serve requests (e.g. an internal database error). */
  BACKEND_UNAVAILABLE(true, true),
  /** The request did not reach the backend, or no response was received. */
  NETWORK_FAILURE(true, true),
  /** The backend rejected the request due to rate or channel limits. */
  RATE_LIMITED(true, true),
  /** No numbers are currently available; inventory may appear later. */
  NO_NUMBERS_AVAILABLE(true, true),
  /** The backend does not know the given task (it may have been released already). */
  TASK_NOT_FOUND(false, true),
  /** The rented number was banned, or the task expired, but the backend is healthy. */
  TASK_BANNED_OR_EXPIRED(false, true),
  INVALID_CREDENTIALS(false, false),
  ACCOUNT_BANNED(false, false),
  /** The request was invalid for this backend (bad price limit, bad action, etc.). */
  INVALID_CONFIGURATION(false, false),
  UNSUPPORTED_SERVICE(false, false),
  /** A response was received but could not be understood. */
  MALFORMED_RESPONSE(false, false),
  /** Unrecognized backend error text; treated as permanent. */
  UNKNOWN(false, false);

  private final boolean retryable;
  private final boolean retryOperation;

  ProviderErrorKind(boolean retryable, boolean retryOperation) {
    this.retryable = retryable;
    this.retryOperation = retryOperation;
  }

  @Override
  public boolean isRetryable() {
    return retryable;
  }

  @Override
  public boolean shouldRetryOperation() {
    return retryOperation;
  }
}
