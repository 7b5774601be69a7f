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

import exm.pwk.common.exceptions.GraphConstructionError;
import exm.pwk.common.exceptions.GraphConstructionError.ErrorKind;
import exm.pwk.ir.Deps;
import exm.pwk.ir.Node;
import exm.pwk.ir.NodeGraph;
import exm.pwk.ir.OpCode;

/**
 * Specialise an expression by replacing an axis variable with a constant.
 *
 * Only the part of the graph that depends on the variable is rebuilt;
 * everything else is shared with the original expression.
 */
public class Substitution {

  private final NodeGraph graph;
  private final OpCode var;
  private final int dep;
  private final int val;

  /** Rewritten nodes, so shared subexpressions are rebuilt once */
  private final Map<Node, Node> done = new IdentityHashMap<Node, Node>();

  private Substitution(NodeGraph graph, OpCode var, int val) {
    this.graph = graph;
    this.var = var;
    this.dep = Deps.ofVariable(var);
    this.val = val;
  }

  /**
   * Make a new version of node with var replaced by val
   * @throws GraphConstructionError if var is not an axis variable
   */
  public static Node substitute(NodeGraph graph, Node node, OpCode var,
                                int val) {
    if (!var.isAxisVariable()) {
      throw new GraphConstructionError(ErrorKind.NOT_A_VARIABLE,
          var.opName() + " is not a variable!");
    }
    return new Substitution(graph, var, val).rewrite(node);
  }

  private Node rewrite(Node node) {
    if (node.op() == var) {
      return graph.intLit(val);
    }
    if (!node.dependsOn(dep)) {
      // no need to rebuild a subtree that doesn't depend on this variable
      return node;
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
