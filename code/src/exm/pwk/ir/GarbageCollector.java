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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

import org.apache.log4j.Logger;

import exm.pwk.common.Logging;

/**
 * Mark and sweep over the node registry of a graph.
 *
 * Removes nodes that do not assist in the computation of the roots, then
 * rebuilds the hash-consing tables and output lists from what is left.
 */
class GarbageCollector {
  private final Logger logger = Logging.getPWKLogger();

  private final NodeGraph graph;

  GarbageCollector(NodeGraph graph) {
    this.graph = graph;
  }

  void collect(Collection<Node> roots) {
    List<Node> allNodes = graph.registry();

    // mark all nodes for death
    for (Node n: allNodes) {
      n.marked = true;
    }

    // unmark those that are necessary for the computation of the roots
    for (Node root: roots) {
      unmarkDescendants(root);
    }

    List<Node> kept = new ArrayList<Node>();
    int discarded = 0;
    for (Node n: allNodes) {
      if (n.marked) {
        n.kill();
        discarded++;
      } else {
        kept.add(n);
      }
    }

    graph.replaceContents(kept);

    if (logger.isDebugEnabled()) {
      logger.debug("Garbage collection: kept " + kept.size() +
                   " nodes, discarded " + discarded + " from " +
                   roots.size() + " roots");
    }
  }

  /**
   * Clear marks on node and its transitive inputs.  Stops at nodes already
   * unmarked, so shared subexpressions are visited once.
   */
  private void unmarkDescendants(Node root) {
    Deque<Node> stack = new ArrayDeque<Node>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Node n = stack.pop();
      if (!n.marked) {
        continue;
      }
      n.marked = false;
      for (Node in: n.inputs()) {
        if (in.marked) {
          stack.push(in);
        }
      }
    }
  }
}
