/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.plan.logical;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Operators joining two vectors. {@code and}, {@code or} and {@code unless} are set operators. */
@Getter
@RequiredArgsConstructor
public enum BinaryOperator {
  ADD("+"),
  SUB("-"),
  MUL("*"),
  DIV("/"),
  MOD("%"),
  POW("^"),
  EQL("=="),
  NEQ("!="),
  GTR(">"),
  LSS("<"),
  GTE(">="),
  LTE("<="),
  LAND("and"),
  LOR("or"),
  LUNLESS("unless");

  private final String symbol;

  public boolean isSetOperator() {
    return this == LAND || this == LOR || this == LUNLESS;
  }
}
