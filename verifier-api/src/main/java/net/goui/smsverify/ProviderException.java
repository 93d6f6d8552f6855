/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A failure reported by a {@link Provider}. Backend adapters translate their own error responses
 * (plain text tokens, JSON error payloads, HTTP failures) into one of the {@link
 * ProviderErrorKind} values, keeping the original backend text where there was one.
 *
 * <p>Adapters may subclass this to carry backend specific detail, but the retryability of an
 * error is always that of its kind.
 */
public class ProviderException extends Exception implements RetryableError {
  private final ProviderErrorKind kind;
  @Nullable private final String rawResponse;

  public ProviderException(ProviderErrorKind kind, String message) {
    this(kind, message, null, null);
  }

  public ProviderException(ProviderErrorKind kind, String message, @Nullable Throwable cause) {
    this(kind, message, null, cause);
  }

  public ProviderException(
      ProviderErrorKind kind,
      String message,
      @Nullable String rawResponse,
      @Nullable Throwable cause) {
    super(message, cause);
    this.kind = checkNotNull(kind);
    this.rawResponse = rawResponse;
  }

  /**
   * Returns an error for backend output which could not be recognized. Such errors are never
   * retried, either for the same task or with a new number.
   */
  public static ProviderException unrecognized(String rawResponse) {
    return new ProviderException(
        ProviderErrorKind.UNKNOWN,
        "unrecognized backend response: " + rawResponse,
        rawResponse,
        null);
  }

  public final ProviderErrorKind getKind() {
    return kind;
  }

  /** Returns the backend response text which caused this error, if known. */
  public final Optional<String> getRawResponse() {
    return Optional.ofNullable(rawResponse);
  }

  @Override
  public final boolean isRetryable() {
    return kind.isRetryable();
  }

  @Override
  public final boolean shouldRetryOperation() {
    return kind.shouldRetryOperation();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + kind + "]: " + getMessage();
  }
}
