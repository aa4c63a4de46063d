/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.cumulant.compile;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Misuse of the symbolic model, detected while constructing operators,
 * deriving, closing or scaling equations.
 *
 * <p>Each sub-class is a distinct fault. None is recoverable locally; the
 * exception carries the offending object for diagnostics.
 */
public abstract class DerivationException extends RuntimeException {
  private final @Nullable Object subject;

  protected DerivationException(String message, @Nullable Object subject) {
    super(message);
    this.subject = subject;
  }

  /**
   * Returns the object that caused the fault: an operator, index, average,
   * equation or equation set.
   */
  public @Nullable Object subject() {
    return subject;
  }

  @Override
  public String toString() {
    return subject == null
        ? super.toString()
        : super.toString() + " [" + subject + "]";
  }
}

// End DerivationException.java
