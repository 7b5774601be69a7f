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

import exm.pwk.ir.Node;
import exm.pwk.ir.NodeGraph;
import exm.pwk.ir.OpCode;
import exm.pwk.ir.Type;

/**
 * Fuse an operator with an input into a single operator carrying an
 * immediate.
 */
public class Fusion {

  /**
   * @param graph
   * @param op
   * @param t result type
   * @param inputs coerced, canonicalised inputs
   * @param ival immediate of the requested node
   * @return fused node, or null if nothing to fuse
   */
  public static Node fuse(NodeGraph graph, OpCode op, Type t,
                          List<Node> inputs, int ival) {
    if (op.isLoad()) {
      return fuseLoad(graph, inputs.get(0), ival);
    } else if (op == OpCode.TIMES && t == Type.INT) {
      return fuseTimes(graph, inputs.get(0), inputs.get(1));
    }
    return null;
  }

  /**
   * Load of something plus an int constant becomes a load with offset
   */
  private static Node fuseLoad(NodeGraph graph, Node addr, int offset) {
    switch (addr.op()) {
      case PLUS: {
        Node left = addr.input(0);
        Node right = addr.input(1);
        if (left.isConst()) {
          return graph.buildImm(OpCode.LOAD_IMM, left.ival() + offset, right);
        } else if (right.isConst()) {
          return graph.buildImm(OpCode.LOAD_IMM, right.ival() + offset, left);
        }
        return null;
      }
      case MINUS: {
        Node right = addr.input(1);
        if (right.isConst()) {
          return graph.buildImm(OpCode.LOAD_IMM, offset - right.ival(),
                                addr.input(0));
        }
        return null;
      }
      case PLUS_IMM:
        return graph.buildImm(OpCode.LOAD_IMM, addr.ival() + offset,
                              addr.input(0));
      default:
        return null;
    }
  }

  /**
   * Times an int constant becomes a times immediate
   */
  private static Node fuseTimes(NodeGraph graph, Node left, Node right) {
    if (left.isConst()) {
      return graph.buildImm(OpCode.TIMES_IMM, left.ival(), right);
    } else if (right.isConst()) {
      return graph.buildImm(OpCode.TIMES_IMM, right.ival(), left);
    }
    return null;
  }
}
