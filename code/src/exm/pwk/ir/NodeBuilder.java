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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.pwk.common.Logging;
import exm.pwk.common.exceptions.GraphConstructionError;
import exm.pwk.common.exceptions.GraphConstructionError.ErrorKind;
import exm.pwk.ir.TypeRules.Inference;
import exm.pwk.ir.opt.ConstantFolder;
import exm.pwk.ir.opt.Fusion;
import exm.pwk.ir.opt.StrengthReduction;
import exm.pwk.ir.opt.SumCanonicalizer;

/**
 * The smart constructor behind {@link NodeGraph#build}.
 *
 * We progressively modify the inputs to finally return a node that is
 * equivalent to the requested op on the requested inputs.  Each stage may
 * return early with an equivalent node:
 * <ol>
 * <li>arity check</li>
 * <li>type inference and coercion of inputs</li>
 * <li>constant folding</li>
 * <li>strength reduction, then canonicalisation of sums feeding a
 *     non-additive operator</li>
 * <li>unique instances of axis variables, fresh placeholders</li>
 * <li>instruction fusion</li>
 * <li>common subexpression elimination</li>
 * </ol>
 * and finally a new node is allocated.
 */
class NodeBuilder {
  private final Logger logger = Logging.getPWKLogger();

  private final NodeGraph graph;
  private final BuilderOptions options;

  NodeBuilder(NodeGraph graph, BuilderOptions options) {
    this.graph = graph;
    this.options = options;
  }

  Node build(OpCode op, List<Node> requestedInputs, int ival, float fval) {
    if (op == OpCode.CONST) {
      throw new GraphConstructionError(ErrorKind.CONSTANT_VIA_BUILDER,
          "Literals must be made with intLit() or floatLit()");
    }
    if (requestedInputs.size() != op.arity()) {
      throw new GraphConstructionError(ErrorKind.BAD_ARITY,
          "Wrong number of inputs for opcode: " + op.opName() + " " +
          requestedInputs.size() + " (expected " + op.arity() + ")");
    }

    if (!op.hasImmediate()) {
      // Ignored by this operator, so must not split CSE
      ival = 0;
      fval = 0.0f;
    }

    // First, type inference and coercion
    Inference inf = TypeRules.infer(op, requestedInputs);
    if (inf.isPassthrough()) {
      return requestedInputs.get(inf.passthrough);
    }
    Type t = inf.result;
    List<Node> inputs = new ArrayList<Node>(requestedInputs.size());
    for (int i = 0; i < requestedInputs.size(); i++) {
      inputs.add(coerce(requestedInputs.get(i), inf.operandTypes.get(i)));
    }

    if (options.constantFold) {
      Node folded = ConstantFolder.fold(graph, op, t, inputs, ival);
      if (folded != null) {
        if (logger.isTraceEnabled()) {
          logger.trace("Constant fold: " + op.opName() + inputs + " => " +
                       folded);
        }
        return folded;
      }
    }

    if (op == OpCode.NOOP) {
      return inputs.get(0);
    }

    if (options.strengthReduce) {
      Node reduced = StrengthReduction.reduce(graph, op, t, inputs);
      if (reduced != null) {
        if (logger.isTraceEnabled()) {
          logger.trace("Strength reduce: " + op.opName() + inputs + " => " +
                       reduced);
        }
        return reduced;
      }
    }

    // Normalise sums whenever we hit a node that isn't a sum but might
    // have sums for children
    if (!op.isAdditive()) {
      for (int i = 0; i < inputs.size(); i++) {
        inputs.set(i, SumCanonicalizer.canonicalize(graph, inputs.get(i)));
      }
    }

    if (op.isAxisVariable()) {
      return graph.axisVariable(op, t);
    }

    // Unbound variables are unique: each one is later replaced
    // individually by binding
    if (op == OpCode.UNBOUND_VAR) {
      return graph.allocate(t, op, Collections.<Node>emptyList(), 0, 0.0f);
    }

    if (options.fuse) {
      Node fused = Fusion.fuse(graph, op, t, inputs, ival);
      if (fused != null) {
        if (logger.isTraceEnabled()) {
          logger.trace("Fuse: " + op.opName() + inputs + " => " + fused);
        }
        return fused;
      }
    }

    if (options.cse) {
      Node existing = graph.findExisting(op, t, inputs, ival, fval);
      if (existing != null) {
        return existing;
      }
    }

    return graph.allocate(t, op, inputs, ival, fval);
  }

  /**
   * Type coercion by inserting conversion operators
   */
  Node coerce(Node node, Type t) {
    if (t == node.type()) {
      return node;
    }

    if (node.type() == Type.INT) {
      if (t == Type.FLOAT) {
        return graph.build(OpCode.INT_TO_FLOAT, node);
      } else if (t == Type.BOOL) {
        return graph.build(OpCode.NEQ, node, graph.intLit(0));
      }
    } else if (node.type() == Type.BOOL) {
      if (t == Type.FLOAT) {
        return graph.build(OpCode.AND, node, graph.floatLit(1.0f));
      } else if (t == Type.INT) {
        return graph.build(OpCode.AND, node, graph.intLit(1));
      }
    } else if (node.type() == Type.FLOAT) {
      if (t == Type.BOOL) {
        return graph.build(OpCode.NEQ, node, graph.floatLit(0.0f));
      } else if (t == Type.INT) {
        return graph.build(OpCode.FLOAT_TO_INT, node);
      }
    }

    throw new GraphConstructionError(ErrorKind.BAD_COERCION,
        "Casting from " + node.type() + " to unknown type " + t);
  }
}
