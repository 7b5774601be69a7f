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
package exm.pwk.ir.opt;

import java.util.List;

import exm.pwk.ir.Deps;
import exm.pwk.ir.Node;
import exm.pwk.ir.NodeGraph;
import exm.pwk.ir.OpCode;
import exm.pwk.ir.Type;

/**
 * Compile time evaluation of operators whose inputs are all literals
 */
public class ConstantFolder {

  /**
   * Try to do compile-time evaluation of operator
   *
   * @param graph graph to make the resulting literal in
   * @param op
   * @param t result type of op, after inference
   * @param inputs inputs to op, already coerced
   * @param ival immediate operand
   * @return literal node if op could be evaluated, null otherwise
   */
  public static Node fold(NodeGraph graph, OpCode op, Type t,
                          List<Node> inputs, int ival) {
    if (inputs.isEmpty() || !allLiterals(inputs)) {
      return null;
    }

    switch (op) {
      case PLUS:
        if (t == Type.FLOAT) {
          return graph.floatLit(f(inputs, 0) + f(inputs, 1));
        } else {
          return graph.intLit(i(inputs, 0) + i(inputs, 1));
        }
      case MINUS:
        if (t == Type.FLOAT) {
          return graph.floatLit(f(inputs, 0) - f(inputs, 1));
        } else {
          return graph.intLit(i(inputs, 0) - i(inputs, 1));
        }
      case TIMES:
        if (t == Type.FLOAT) {
          return graph.floatLit(f(inputs, 0) * f(inputs, 1));
        } else {
          return graph.intLit(i(inputs, 0) * i(inputs, 1));
        }
      case PLUS_IMM:
        return graph.intLit(i(inputs, 0) + ival);
      case TIMES_IMM:
        return graph.intLit(i(inputs, 0) * ival);
      case DIVIDE:
        return graph.floatLit(f(inputs, 0) / f(inputs, 1));
      case AND:
        if (t == Type.FLOAT) {
          return graph.floatLit(i(inputs, 0) != 0 ? f(inputs, 1) : 0.0f);
        } else {
          return graph.intLit(i(inputs, 0) != 0 ? i(inputs, 1) : 0);
        }
      case OR:
        // Float or combines masked values where at most one is nonzero
        if (t == Type.FLOAT) {
          return graph.floatLit(f(inputs, 0) + f(inputs, 1));
        } else {
          return graph.intLit(i(inputs, 0) | i(inputs, 1));
        }
      case NAND:
        if (t == Type.FLOAT) {
          return graph.floatLit(i(inputs, 0) == 0 ? f(inputs, 1) : 0.0f);
        } else {
          return graph.intLit(i(inputs, 0) == 0 ? i(inputs, 1) : 0);
        }
      case INT_TO_FLOAT:
        return graph.floatLit((float) i(inputs, 0));
      case FLOAT_TO_INT:
        return graph.intLit((int) f(inputs, 0));
      default:
        // Transcendentals, pow, rounding and comparisons are left alone
        return null;
    }
  }

  /**
   * Literals are the only nodes with a usable value.  Other nodes with no
   * dependencies (e.g. sin of a literal) are not folded.
   */
  private static boolean allLiterals(List<Node> inputs) {
    for (Node in: inputs) {
      if (in.deps() != Deps.NONE || !in.isConst()) {
        return false;
      }
    }
    return true;
  }

  private static int i(List<Node> inputs, int index) {
    return inputs.get(index).ival();
  }

  private static float f(List<Node> inputs, int index) {
    return inputs.get(index).fval();
  }
}
