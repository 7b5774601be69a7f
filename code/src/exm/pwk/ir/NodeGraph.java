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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.pwk.common.Logging;
import exm.pwk.common.exceptions.GraphConstructionError;
import exm.pwk.common.exceptions.GraphConstructionError.ErrorKind;
import exm.pwk.ir.opt.Binding;
import exm.pwk.ir.opt.Substitution;
import exm.pwk.ir.opt.SumCanonicalizer;

/**
 * Context for one compilation: owns every node and the hash-consing tables
 * for literals and axis variables.
 *
 * Not thread safe.  Independent graphs can coexist, but nodes from one
 * graph must never be passed to another.
 */
public class NodeGraph {
  private final Logger logger = Logging.getPWKLogger();

  private final BuilderOptions options;
  private final NodeBuilder builder;

  /**
   * Every live node, in construction order
   */
  private List<Node> allNodes;

  private Map<Integer, Node> intInstances;
  private Map<Float, Node> floatInstances;
  private Map<OpCode, Node> varInstances;

  /**
   * Back edges from each node to its users.  Only used for CSE lookup.
   */
  private final ListMultimap<Node, Node> outputs;

  /**
   * Allocate node IDs in sequential order
   */
  private long nextNodeID;

  public NodeGraph() {
    this(BuilderOptions.defaults());
  }

  public NodeGraph(BuilderOptions options) {
    this.options = options;
    this.builder = new NodeBuilder(this, options);
    this.allNodes = new ArrayList<Node>();
    this.intInstances = new HashMap<Integer, Node>();
    this.floatInstances = new HashMap<Float, Node>();
    this.varInstances = new EnumMap<OpCode, Node>(OpCode.class);
    this.outputs = ArrayListMultimap.create();
    this.nextNodeID = 0;
    if (!options.cse) {
      Logging.uniqueWarn("Common subexpression elimination is off: " +
                         "equal expressions may be distinct nodes");
    }
  }

  public BuilderOptions options() {
    return options;
  }

  /**
   * @return the unique int literal node with this value
   */
  public Node intLit(int v) {
    Node n = intInstances.get(v);
    if (n == null) {
      n = allocate(Type.INT, OpCode.CONST, Collections.<Node>emptyList(),
                   v, 0.0f);
      intInstances.put(v, n);
    }
    return n;
  }

  /**
   * @return the unique float literal node with this value.  Values are
   *         distinguished by bit pattern, so 0.0 and -0.0 are different
   */
  public Node floatLit(float v) {
    Node n = floatInstances.get(v);
    if (n == null) {
      n = allocate(Type.FLOAT, OpCode.CONST, Collections.<Node>emptyList(),
                   0, v);
      floatInstances.put(v, n);
    }
    return n;
  }

  /**
   * Build a node equivalent to op applied to inputs, after type coercion,
   * constant folding, strength reduction, fusion and CSE.
   * @throws GraphConstructionError on a misuse of the opcode
   */
  public Node build(OpCode op, List<Node> inputs, int ival, float fval) {
    checkOwned(inputs);
    return builder.build(op, inputs, ival, fval);
  }

  public Node build(OpCode op, List<Node> inputs) {
    return build(op, inputs, 0, 0.0f);
  }

  public Node build(OpCode op, Node ...inputs) {
    return build(op, Arrays.asList(inputs), 0, 0.0f);
  }

  /**
   * Build an immediate-carrying operator, e.g. PLUS_IMM or LOAD_IMM
   */
  public Node buildImm(OpCode op, int ival, Node input) {
    return build(op, Collections.singletonList(input), ival, 0.0f);
  }

  /**
   * @return the unique node for an axis variable
   */
  public Node var(OpCode axis) {
    return build(axis);
  }

  /**
   * @return a fresh placeholder, never shared with any other request
   */
  public Node unbound() {
    return build(OpCode.UNBOUND_VAR);
  }

  /**
   * Coerce node to type, inserting conversion operators if needed
   */
  public Node coerce(Node node, Type type) {
    checkOwned(node);
    return builder.coerce(node, type);
  }

  /**
   * Normalisation to apply once a finished expression is handed on.
   */
  public Node optimize(Node node) {
    checkOwned(node);
    return SumCanonicalizer.canonicalize(this, node);
  }

  /**
   * Replace an axis variable with a constant throughout an expression
   */
  public Node substitute(Node node, OpCode var, int val) {
    checkOwned(node);
    return Substitution.substitute(this, node, var, val);
  }

  /**
   * Replace placeholders with axis variables.  Each argument is the
   * placeholder that stands for that axis, or null.
   */
  public Node bind(Node node, Node x, Node y, Node t, Node c) {
    checkOwned(node);
    return Binding.bind(this, node, x, y, t, c);
  }

  /**
   * Discard every node not reachable from roots.  Any node not reachable
   * from roots must not be used afterwards.
   */
  public void collectGarbage(Collection<Node> roots) {
    checkOwned(roots);
    new GarbageCollector(this).collect(roots);
  }

  /**
   * Discard all nodes
   */
  public void clear() {
    for (Node n: allNodes) {
      n.kill();
    }
    logger.debug("Cleared graph of " + allNodes.size() + " nodes");
    replaceContents(new ArrayList<Node>());
  }

  /**
   * @return number of live nodes
   */
  public int size() {
    return allNodes.size();
  }

  public boolean isLive(Node node) {
    return node.graph() == this && node.isLive();
  }

  /**
   * @return unmodifiable view of live nodes in construction order
   */
  public List<Node> nodes() {
    return Collections.unmodifiableList(allNodes);
  }

  List<Node> outputsOf(Node node) {
    return Collections.unmodifiableList(outputs.get(node));
  }

  /**
   * Create and register a new node.  No hash-consing or CSE is done here.
   */
  Node allocate(Type type, OpCode op, List<Node> inputs, int ival,
                float fval) {
    Node n = new Node(this, nextNodeID++, type, op, inputs, ival, fval);
    allNodes.add(n);
    for (Node in: n.inputs()) {
      outputs.put(in, n);
    }
    if (logger.isTraceEnabled()) {
      logger.trace("New node #" + n.id() + ": " + op.opName() + " " +
                   Deps.toString(n.deps()));
    }
    return n;
  }

  /**
   * @return the cached axis variable, creating it if needed
   */
  Node axisVariable(OpCode op, Type type) {
    assert(op.isAxisVariable()) : op;
    Node n = varInstances.get(op);
    if (n == null) {
      n = allocate(type, op, Collections.<Node>emptyList(), 0, 0.0f);
      varInstances.put(op, n);
    }
    return n;
  }

  /**
   * Look for an existing node among the users of the first input.
   * @return matching node, or null
   */
  Node findExisting(OpCode op, Type type, List<Node> inputs, int ival,
                    float fval) {
    if (inputs.isEmpty()) {
      return null;
    }
    for (Node candidate: outputs.get(inputs.get(0))) {
      if (candidate.ival() != ival) continue;
      if (Float.floatToIntBits(candidate.fval()) !=
          Float.floatToIntBits(fval)) continue;
      if (candidate.op() != op) continue;
      if (candidate.type() != type) continue;
      if (candidate.inputs().equals(inputs)) {
        return candidate;
      }
    }
    return null;
  }

  /**
   * Install a new set of live nodes, rebuilding the hash-consing tables
   * and output lists from them.  Nodes not in kept must already be dead.
   */
  void replaceContents(List<Node> kept) {
    Map<Integer, Node> newIntInstances = new HashMap<Integer, Node>();
    Map<Float, Node> newFloatInstances = new HashMap<Float, Node>();
    Map<OpCode, Node> newVarInstances =
                              new EnumMap<OpCode, Node>(OpCode.class);
    for (Node n: kept) {
      assert(n.isLive());
      if (n.op() == OpCode.CONST) {
        if (n.type() == Type.FLOAT) {
          newFloatInstances.put(n.fval(), n);
        } else {
          newIntInstances.put(n.ival(), n);
        }
      } else if (n.op().isAxisVariable()) {
        newVarInstances.put(n.op(), n);
      }
    }

    // Users always come after their inputs, so kept order is preserved
    outputs.clear();
    for (Node n: kept) {
      for (Node in: n.inputs()) {
        outputs.put(in, n);
      }
    }

    this.allNodes = kept;
    this.intInstances = newIntInstances;
    this.floatInstances = newFloatInstances;
    this.varInstances = newVarInstances;
  }

  List<Node> registry() {
    return allNodes;
  }

  void checkOwned(Collection<Node> nodes) {
    for (Node n: nodes) {
      checkOwned(n);
    }
  }

  void checkOwned(Node node) {
    if (node == null) {
      throw new NullPointerException("Null node passed to graph");
    }
    if (node.graph() != this) {
      throw new GraphConstructionError(ErrorKind.FOREIGN_NODE,
          "Node #" + node.id() + " belongs to a different graph");
    }
    if (!node.isLive()) {
      throw new GraphConstructionError(ErrorKind.STALE_NODE,
          "Node #" + node.id() + " (" + node.op().opName() +
          ") was already collected");
    }
  }
}
