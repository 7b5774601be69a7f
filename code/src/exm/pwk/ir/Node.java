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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A node of the expression DAG.
 *
 * Nodes are only created by a {@link NodeGraph}, which owns them.  Apart
 * from the register hint and the collection mark, everything about a node
 * is fixed at construction: a rewrite that needs different inputs or
 * dependencies builds a new node.
 *
 * Equality is identity.  Hash-consing and CSE in the graph guarantee that
 * structurally equal expressions built the same way are the same node.
 */
public class Node {
  /** Reserved register hint for "not yet assigned" */
  public static final int NO_REG = -1;

  private final NodeGraph graph;

  /** Construction order within the graph */
  private final long id;

  private final OpCode op;
  private final Type type;
  private final ImmutableList<Node> inputs;

  /** Immediate operands, also the value of constants */
  private final int ival;
  private final float fval;

  private final int deps;
  private final int level;

  /** Vector width.  Always 1 for now */
  private final int width;

  private int reg;

  /** Used by the collector only */
  boolean marked;

  /** Cleared once the collector discards the node */
  private boolean live;

  Node(NodeGraph graph, long id, Type type, OpCode op, List<Node> inputs,
       int ival, float fval) {
    this.graph = graph;
    this.id = id;
    this.op = op;
    this.type = type;
    this.inputs = ImmutableList.copyOf(inputs);
    this.ival = ival;
    this.fval = fval;
    this.width = 1;
    this.reg = NO_REG;
    this.marked = false;
    this.live = true;

    int d = Deps.introducedBy(op);
    for (Node in: this.inputs) {
      d |= in.deps;
    }
    this.deps = d;
    this.level = Deps.level(d);
  }

  public NodeGraph graph() {
    return graph;
  }

  public long id() {
    return id;
  }

  public OpCode op() {
    return op;
  }

  public Type type() {
    return type;
  }

  public List<Node> inputs() {
    return inputs;
  }

  public Node input(int i) {
    return inputs.get(i);
  }

  /**
   * Nodes currently using this node as an input.  Only meaningful for CSE
   * and debugging.
   */
  public List<Node> outputs() {
    return graph.outputsOf(this);
  }

  public int ival() {
    return ival;
  }

  public float fval() {
    return fval;
  }

  public int deps() {
    return deps;
  }

  public boolean dependsOn(int depMask) {
    return (deps & depMask) != 0;
  }

  public int level() {
    return level;
  }

  public int width() {
    return width;
  }

  public int reg() {
    return reg;
  }

  /**
   * Set the register hint.  Has no effect on the graph.
   */
  public void setReg(int reg) {
    this.reg = reg;
  }

  public boolean isConst() {
    return op == OpCode.CONST;
  }

  public boolean isLive() {
    return live;
  }

  void kill() {
    this.live = false;
  }

  @Override
  public String toString() {
    return NodePrinter.renderExpression(this);
  }
}
