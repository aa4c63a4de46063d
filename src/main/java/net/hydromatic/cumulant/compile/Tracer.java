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

import net.hydromatic.cumulant.ast.Factor;

/** Called on various events while deriving and closing equation systems. */
public interface Tracer {
  /** Called when an equation has been derived. */
  void onEquation(Equation equation);

  /** Called when a scan finds an average that has no equation yet. */
  void onMissing(Factor.Average average);

  /** Called when a filter rejects an average, which becomes zero. */
  void onReject(Factor.Average average);

  /**
   * Called at the end of each closure scan, with the number of equations
   * that the scan added.
   */
  void onPass(int pass, int added);
}

// End Tracer.java
