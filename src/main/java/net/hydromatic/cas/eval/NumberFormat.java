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
package net.hydromatic.cas.eval;

/** How numbers are written. */
public enum NumberFormat {
  /** Never uses scientific notation; groups the integer part with
   * commas, as in "1,234,567.5". */
  PLAIN,

  /** Uses scientific notation if the magnitude is less than 1E-6 or at
   * least 1E6; never groups digits. */
  AUTOMATIC,

  /** Always uses scientific notation, except for zero. */
  SCIENTIFIC
}

// End NumberFormat.java
