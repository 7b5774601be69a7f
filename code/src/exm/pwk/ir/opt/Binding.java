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

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import exm.pwk.ir.Deps;
import exm.pwk.ir.Node;
import exm.pwk.ir.NodeGraph;
import exm.pwk.ir.OpCode;

/**
 * Resolve unbound placeholders to axis variables.  Placeholders are
 * matched by identity: each was allocated for exactly one site.
 */
public class Binding {

  private final NodeGraph graph;
  private final Map<Node, OpCode> targets = new IdentityHashMap<Node, OpCode>();
  private final Map<Node, Node> done = new IdentityHashMap<Node, Node>();

  private Binding(NodeGraph graph) {
    this.graph = graph;
  }

  /**
   * @param node expression to rewrite
   * @param x placeholder to become VAR_X, or null
   * @param y placeholder to become VAR_Y, or null
   * @param t placeholder to become VAR_T, or null
   * @param c placeholder to become VAR_C, or null
   * @return node with the placeholders replaced
   */
  public static Node bind(NodeGraph graph, Node node, Node x, Node y, Node t,
                          Node c) {
    Binding b = new Binding(graph);
    // If one placeholder is passed twice, x wins over y over c over t
    b.addTarget(t, OpCode.VAR_T);
    b.addTarget(c, OpCode.VAR_C);
    b.addTarget(y, OpCode.VAR_Y);
    b.addTarget(x, OpCode.VAR_X);
    return b.rewrite(node);
  }

  private void addTarget(Node placeholder, OpCode var) {
    if (placeholder != null) {
      targets.put(placeholder, var);
    }
  }

  private Node rewrite(Node node) {
    if (!node.dependsOn(Deps.UNBOUND)) {
      return node;
    }

    if (node.op() == OpCode.UNBOUND_VAR) {
      OpCode var = targets.get(node);
      if (var == null) {
        // Not one of ours: leave for a later bind
        return node;
      }
      return graph.var(var);
    }

    Node result = done.get(node);
    if (result == null) {
      List<Node> newInputs = new ArrayList<Node>(node.inputs().size());
      for (Node in: node.inputs()) {
        newInputs.add(rewrite(in));
      }
      result = graph.build(node.op(), newInputs, node.ival(), node.fval());
      done.put(node, result);
    }
    return result;
  }
}
