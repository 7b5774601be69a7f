/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.pwk.ir;

/**
 * Operators of the expression graph.
 *
 * Each opcode has a fixed input arity, checked when a node is built.
 */
public enum OpCode {
  CONST(0, "Const"),
  /** Identity marker, unwrapped by the builder */
  NOOP(1, "NoOp"),

  VAR_X(0, "x"), VAR_Y(0, "y"), VAR_T(0, "t"), VAR_C(0, "c"),
  /** Placeholder for an axis variable that is bound later */
  UNBOUND_VAR(0, "Unbound"),

  PLUS(2, "Plus"), MINUS(2, "Minus"), TIMES(2, "Times"),
  DIVIDE(2, "Divide"), POWER(2, "Power"), MOD(2, "Mod"),

  SIN(1, "Sin"), COS(1, "Cos"), TAN(1, "Tan"),
  ASIN(1, "ASin"), ACOS(1, "ACos"), ATAN(1, "ATan"), ATAN2(2, "ATan2"),
  EXP(1, "Exp"), LOG(1, "Log"),
  ABS(1, "Abs"), FLOOR(1, "Floor"), CEIL(1, "Ceil"), ROUND(1, "Round"),

  LT(2, "LT"), GT(2, "GT"), LTE(2, "LTE"), GTE(2, "GTE"),
  EQ(2, "EQ"), NEQ(2, "NEQ"),

  /** a && b: b if a is true, otherwise zero of b's type */
  AND(2, "And"),
  OR(2, "Or"),
  /** !a && b */
  NAND(2, "Nand"),

  INT_TO_FLOAT(1, "IntToFloat"), FLOAT_TO_INT(1, "FloatToInt"),

  /** input + ival */
  PLUS_IMM(1, "PlusImm"),
  /** input * ival */
  TIMES_IMM(1, "TimesImm"),

  /** Load from the float memory at an integer address */
  LOAD(1, "Load"),
  /** Load from address input + ival */
  LOAD_IMM(1, "LoadImm");

  private final int arity;
  private final String opName;

  private OpCode(int arity, String opName) {
    this.arity = arity;
    this.opName = opName;
  }

  public int arity() {
    return arity;
  }

  public String opName() {
    return opName;
  }

  /**
   * @return true for the four hash-consed iteration variables
   */
  public boolean isAxisVariable() {
    return this == VAR_X || this == VAR_Y || this == VAR_T || this == VAR_C;
  }

  /**
   * @return true if part of an additive chain for sum canonicalisation
   */
  public boolean isAdditive() {
    return this == PLUS || this == MINUS || this == PLUS_IMM;
  }

  public boolean isLoad() {
    return this == LOAD || this == LOAD_IMM;
  }

  public boolean isComparison() {
    switch (this) {
      case LT:
      case GT:
      case LTE:
      case GTE:
      case EQ:
      case NEQ:
        return true;
      default:
        return false;
    }
  }

  /**
   * @return true for unary operators that only operate on floats
   */
  public boolean isTranscendental() {
    switch (this) {
      case SIN:
      case COS:
      case TAN:
      case ASIN:
      case ACOS:
      case ATAN:
      case EXP:
      case LOG:
        return true;
      default:
        return false;
    }
  }

  /**
   * @return true if the operator carries an immediate operand
   */
  public boolean hasImmediate() {
    return this == PLUS_IMM || this == TIMES_IMM || this == LOAD_IMM;
  }
}
