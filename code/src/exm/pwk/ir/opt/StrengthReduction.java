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

import org.apache.log4j.Logger;

import exm.pwk.common.Logging;
import exm.pwk.ir.Node;
import exm.pwk.ir.NodeGraph;
import exm.pwk.ir.OpCode;
import exm.pwk.ir.Type;

/**
 * Algebraic rewrites that move lower level (less frequently changing)
 * subexpressions inwards, where later passes can hoist them.
 */
public class StrengthReduction {
  private static final Logger logger = Logging.getPWKLogger();

  /**
   * @param graph
   * @param op
   * @param t result type
   * @param inputs coerced inputs
   * @return an equivalent rewritten node, or null if no rule applies
   */
  public static Node reduce(NodeGraph graph, OpCode op, Type t,
                            List<Node> inputs) {
    switch (op) {
      case DIVIDE:
        return reciprocal(graph, inputs.get(0), inputs.get(1));
      case TIMES: {
        Node res = distribute(graph, inputs.get(0), inputs.get(1));
        if (res == null) {
          res = reassociate(graph, inputs.get(0), inputs.get(1));
        }
        return res;
      }
      default:
        return null;
    }
  }

  /**
   * x/y = x*(1/y) when y is lower level than x
   */
  private static Node reciprocal(NodeGraph graph, Node x, Node y) {
    if (y.level() >= x.level()) {
      return null;
    }
    return graph.build(OpCode.TIMES, x,
              graph.build(OpCode.DIVIDE, graph.floatLit(1.0f), y));
  }

  /**
   * (x+a)*b = x*b + a*b where a and b are both lower level than x, and
   * (x+imm)*b = x*b + b*imm
   */
  private static Node distribute(NodeGraph graph, Node left, Node right) {
    Node x = null, a = null, b = null;
    if (left.op() == OpCode.PLUS) {
      b = right;
      x = left.input(1);
      a = left.input(0);
    } else if (right.op() == OpCode.PLUS) {
      b = left;
      x = right.input(1);
      a = right.input(0);
    }

    if (x != null) {
      // x is the higher level of x and a
      if (x.level() < a.level()) {
        Node tmp = x;
        x = a;
        a = tmp;
      }

      // only worth rebalancing if a and b are both lower level than x,
      // e.g. (x+y)*3
      if (x.level() > a.level() && x.level() > b.level()) {
        return graph.build(OpCode.PLUS,
                           graph.build(OpCode.TIMES, x, b),
                           graph.build(OpCode.TIMES, a, b));
      }
    }

    Node sum = null, outer = null;
    if (left.op() == OpCode.PLUS_IMM) {
      sum = left;
      outer = right;
    } else if (right.op() == OpCode.PLUS_IMM) {
      sum = right;
      outer = left;
    }
    if (sum != null) {
      if (logger.isDebugEnabled()) {
        logger.debug("Distribute product over immediate sum: " + sum +
                     " * " + outer);
      }
      return graph.build(OpCode.PLUS,
                         graph.build(OpCode.TIMES, sum.input(0), outer),
                         graph.build(OpCode.TIMES, outer,
                                     graph.intLit(sum.ival())));
    }
    return null;
  }

  /**
   * (x*a)*b = x*(a*b) where a and b are lower level than x, so that
   * constant-like factors accumulate innermost.
   */
  private static Node reassociate(NodeGraph graph, Node left, Node right) {
    Node x = null, a = null, b = null;
    if (left.op() == OpCode.TIMES) {
      x = left.input(0);
      a = left.input(1);
      b = right;
    } else if (right.op() == OpCode.TIMES) {
      x = right.input(0);
      a = right.input(1);
      b = left;
    }

    if (x == null) {
      return null;
    }

    if (x.level() < a.level()) {
      Node tmp = x;
      x = a;
      a = tmp;
    }

    if (x.level() > a.level() && x.level() > b.level()) {
      return graph.build(OpCode.TIMES, x, graph.build(OpCode.TIMES, a, b));
    }
    return null;
  }
}
