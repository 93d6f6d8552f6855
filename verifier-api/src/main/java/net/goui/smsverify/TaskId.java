/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.smsverify;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/**
 * Opaque backend handle for a single number rental. A task ID is issued when a number is acquired
 * and is then used for every poll, finish or cancel request for that rental.
 */
@AutoValue
public abstract class TaskId {
  public static TaskId of(String id) {
    checkArgument(!id.isEmpty(), "task ID must not be empty");
    return new AutoValue_TaskId(id);
  }

  public abstract String getValue();

  @Override
  public final String toString() {
    return getValue();
  }
}
