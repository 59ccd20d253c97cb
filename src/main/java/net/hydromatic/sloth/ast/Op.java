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
package net.hydromatic.sloth.ast;

/** Sub-types of {@link AstNode} and of
 * {@link net.hydromatic.sloth.type.Type}. */
public enum Op {
  // expressions
  LIST,
  TUPLE,
  RECORD,
  SEL,
  SET,
  IF,
  COMP,
  VAR,
  TY_ABS,
  TY_APP,
  APPLY,
  FN,
  PROOF_ABS,
  PROOF_APP,
  WHERE,

  // selectors
  TUPLE_SEL("."),
  RECORD_SEL("."),
  LIST_SEL("@"),

  // comprehension matches
  FROM(" <- "),
  LET_MATCH(" = "),

  // declarations
  DECL(" = "),
  NON_REC_GROUP,
  REC_GROUP,
  NEWTYPE,
  MODULE,

  // types
  TY_VAR,
  PRIM_TYPE,
  SEQ_TYPE,
  TUPLE_TYPE(", "),
  RECORD_TYPE(", "),
  FUNCTION_TYPE(" -> "),
  NUM_TYPE,
  TYPE_FUN;

  /** Padded text of the operator, used when unparsing. */
  public final String padded;

  Op() {
    this("");
  }

  Op(String padded) {
    this.padded = padded;
  }
}

// End Op.java
