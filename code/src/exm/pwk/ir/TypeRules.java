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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.pwk.common.exceptions.GraphConstructionError;
import exm.pwk.common.exceptions.GraphConstructionError.ErrorKind;

/**
 * Type inference for operators: maps input types to a result type and the
 * types each input must be coerced to.
 */
public class TypeRules {

  /**
   * Result of inference.  Either a result type with operand types, or a
   * passthrough meaning the operator is a no-op on one of its inputs.
   */
  public static class Inference {
    public final Type result;
    public final List<Type> operandTypes;
    /** Index of input to return unchanged, or -1 */
    public final int passthrough;

    private Inference(Type result, List<Type> operandTypes, int passthrough) {
      this.result = result;
      this.operandTypes = operandTypes;
      this.passthrough = passthrough;
    }

    public static Inference of(Type result, Type ...operandTypes) {
      return new Inference(result, Arrays.asList(operandTypes), -1);
    }

    public static Inference passthrough(int input) {
      return new Inference(null, Collections.<Type>emptyList(), input);
    }

    public boolean isPassthrough() {
      return passthrough >= 0;
    }

    @Override
    public String toString() {
      if (isPassthrough()) {
        return "passthrough(" + passthrough + ")";
      }
      return operandTypes + " -> " + result;
    }
  }

  /**
   * Infer types.  Arity must already have been checked.
   * @param op
   * @param inputs
   * @return
   */
  public static Inference infer(OpCode op, List<Node> inputs) {
    if (op.isTranscendental()) {
      return Inference.of(Type.FLOAT, Type.FLOAT);
    } else if (op.isComparison()) {
      Type t = widest(inputs.get(0).type(), inputs.get(1).type());
      return Inference.of(Type.BOOL, t, t);
    }

    switch (op) {
      case NOOP: {
        Type t = inputs.get(0).type();
        return Inference.of(t, t);
      }
      case VAR_X:
      case VAR_Y:
      case VAR_T:
      case VAR_C:
      case UNBOUND_VAR:
        return Inference.of(Type.INT);
      case PLUS:
      case MINUS:
      case TIMES:
      case POWER:
      case MOD: {
        Type t = Type.promote(inputs.get(0).type(), inputs.get(1).type());
        return Inference.of(t, t, t);
      }
      case DIVIDE:
      case ATAN2:
        return Inference.of(Type.FLOAT, Type.FLOAT, Type.FLOAT);
      case ABS: {
        Type t = inputs.get(0).type();
        if (t == Type.BOOL) {
          return Inference.passthrough(0);
        }
        return Inference.of(t, t);
      }
      case FLOOR:
      case CEIL:
      case ROUND:
        if (inputs.get(0).type() != Type.FLOAT) {
          return Inference.passthrough(0);
        }
        return Inference.of(Type.FLOAT, Type.FLOAT);
      case AND:
      case NAND: {
        // First arg is the condition, result has the type of the second
        Type t = inputs.get(1).type();
        return Inference.of(t, Type.BOOL, t);
      }
      case OR: {
        Type t = widest(inputs.get(0).type(), inputs.get(1).type());
        return Inference.of(t, t, t);
      }
      case INT_TO_FLOAT:
        checkCast(op, inputs.get(0), Type.INT);
        return Inference.of(Type.FLOAT, Type.INT);
      case FLOAT_TO_INT:
        checkCast(op, inputs.get(0), Type.FLOAT);
        return Inference.of(Type.INT, Type.FLOAT);
      case PLUS_IMM:
      case TIMES_IMM:
        return Inference.of(Type.INT, Type.INT);
      case LOAD:
      case LOAD_IMM:
        // Memory is an untyped float array indexed by int
        return Inference.of(Type.FLOAT, Type.INT);
      case CONST:
      default:
        throw new GraphConstructionError(ErrorKind.CONSTANT_VIA_BUILDER,
            "No type rule for " + op.opName());
    }
  }

  /**
   * Float if either is float, else int if either is int, else bool
   */
  private static Type widest(Type a, Type b) {
    if (a == Type.FLOAT || b == Type.FLOAT) {
      return Type.FLOAT;
    } else if (a == Type.INT || b == Type.INT) {
      return Type.INT;
    } else {
      return Type.BOOL;
    }
  }

  private static void checkCast(OpCode op, Node input, Type expected) {
    if (input.type() != expected) {
      throw new GraphConstructionError(ErrorKind.BAD_CAST,
          op.opName() + " can only take " + expected + " but got " +
          input.type());
    }
  }
}
