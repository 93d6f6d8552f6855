/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify.service;

import com.google.auto.value.AutoValue;
import java.time.Duration;
import net.goui.smsverify.TaskId;
import net.goui.smsverify.VerificationCode;

/** A verification code together with how long it took to arrive. */
@AutoValue
public abstract class ReceivedCode {
  static ReceivedCode of(TaskId taskId, VerificationCode code, Duration elapsed, int pollCount) {
    return new AutoValue_ReceivedCode(taskId, code, elapsed, pollCount);
  }

  public abstract TaskId getTaskId();

  public abstract VerificationCode getCode();

  /** Time from the start of waiting until the code was received. */
  public abstract Duration getElapsed();

  /** The number of polls made, including the one which returned the code. */
  public abstract int getPollCount();
}
