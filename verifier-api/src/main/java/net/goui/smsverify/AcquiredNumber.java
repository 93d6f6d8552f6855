/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify;

import com.google.auto.value.AutoValue;

/** The raw result of renting a number from a {@link Provider}. */
@AutoValue
public abstract class AcquiredNumber {
  public static AcquiredNumber of(TaskId taskId, FullNumber fullNumber) {
    return new AutoValue_AcquiredNumber(taskId, fullNumber);
  }

  public abstract TaskId getTaskId();

  public abstract FullNumber getFullNumber();
}
