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
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.log4j.Logger;

import exm.pwk.common.Logging;
import exm.pwk.ir.Node;
import exm.pwk.ir.NodeGraph;
import exm.pwk.ir.OpCode;
import exm.pwk.ir.Type;

/**
 * Canonical form for chains of PLUS, MINUS and PLUS_IMM.
 *
 * The chain is flattened into signed terms.  Non-constant terms are
 * sorted by level, lowest first, then by construction order, then with
 * positive before negative, and re-added left to right.  Constant terms are folded into one literal,
 * which goes innermost for a float sum (so it can fold further) and
 * outermost for an int sum (so a load can absorb it as an offset).
 */
public class SumCanonicalizer {
  private static final Logger logger = Logging.getPWKLogger();

  /**
   * A term of a flattened sum
   */
  static class Term {
    final Node node;
    final boolean positive;

    Term(Node node, boolean positive) {
      this.node = node;
      this.positive = positive;
    }

    @Override
    public String toString() {
      return (positive ? "+" : "-") + node;
    }
  }

  private static final Comparator<Term> BY_LEVEL = new Comparator<Term>() {
    @Override
    public int compare(Term a, Term b) {
      int c = Integer.compare(a.node.level(), b.node.level());
      if (c != 0) {
        return c;
      }
      c = Long.compare(a.node.id(), b.node.id());
      if (c != 0) {
        return c;
      }
      // Same node added and subtracted: positive first
      return Boolean.compare(b.positive, a.positive);
    }
  };

  /**
   * @return canonical equivalent of node, or node itself if not a sum
   */
  public static Node canonicalize(NodeGraph graph, Node node) {
    if (!node.op().isAdditive()) {
      return node;
    }

    List<Term> terms = new ArrayList<Term>();
    collectSum(graph, node, true, terms);

    List<Term> constTerms = new ArrayList<Term>();
    List<Term> nonConstTerms = new ArrayList<Term>();
    for (Term term: terms) {
      if (term.node.isConst()) {
        constTerms.add(term);
      } else {
        nonConstTerms.add(term);
      }
    }

    if (nonConstTerms.isEmpty()) {
      // Only reachable with folding switched off
      return foldConstants(graph, node.type(), constTerms);
    }

    Collections.sort(nonConstTerms, BY_LEVEL);

    Node t = nonConstTerms.get(0).node;
    boolean tPos = nonConstTerms.get(0).positive;

    // If we're building a float sum, the const term is innermost
    if (node.type() == Type.FLOAT) {
      float c = 0.0f;
      for (Term term: constTerms) {
        if (term.positive) {
          c += term.node.fval();
        } else {
          c -= term.node.fval();
        }
      }
      if (c != 0.0f) {
        OpCode combine = tPos ? OpCode.PLUS : OpCode.MINUS;
        t = graph.build(combine, graph.floatLit(c), t);
        tPos = true;
      }
    }

    for (int i = 1; i < nonConstTerms.size(); i++) {
      Term next = nonConstTerms.get(i);
      if (tPos == next.positive) {
        t = graph.build(OpCode.PLUS, t, next.node);
      } else if (tPos) {
        t = graph.build(OpCode.MINUS, t, next.node);
      } else {
        tPos = true;
        t = graph.build(OpCode.MINUS, next.node, t);
      }
    }

    // If we're building an int sum, the const term is outermost so that
    // loads can pick it up
    if (node.type() == Type.INT) {
      int c = 0;
      for (Term term: constTerms) {
        if (term.positive) {
          c += term.node.ival();
        } else {
          c -= term.node.ival();
        }
      }
      if (c != 0) {
        if (tPos) {
          t = graph.buildImm(OpCode.PLUS_IMM, c, t);
        } else {
          t = graph.build(OpCode.MINUS, graph.intLit(c), t);
        }
        tPos = true;
      }
    }

    // Every term was subtracted and there was no constant to subtract from
    if (!tPos) {
      Node zero = node.type() == Type.FLOAT ? graph.floatLit(0.0f)
                                            : graph.intLit(0);
      t = graph.build(OpCode.MINUS, zero, t);
    }

    if (logger.isTraceEnabled() && t != node) {
      logger.trace("Rebalanced sum " + node + " => " + t);
    }
    return t;
  }

  private static void collectSum(NodeGraph graph, Node node, boolean positive,
                                 List<Term> terms) {
    switch (node.op()) {
      case PLUS:
        collectSum(graph, node.input(0), positive, terms);
        collectSum(graph, node.input(1), positive, terms);
        break;
      case MINUS:
        collectSum(graph, node.input(0), positive, terms);
        collectSum(graph, node.input(1), !positive, terms);
        break;
      case PLUS_IMM:
        collectSum(graph, node.input(0), positive, terms);
        terms.add(new Term(graph.intLit(node.ival()), positive));
        break;
      default:
        terms.add(new Term(node, positive));
        break;
    }
  }

  private static Node foldConstants(NodeGraph graph, Type type,
                                    List<Term> constTerms) {
    if (type == Type.FLOAT) {
      float c = 0.0f;
      for (Term term: constTerms) {
        c += term.positive ? term.node.fval() : -term.node.fval();
      }
      return graph.floatLit(c);
    } else {
      int c = 0;
      for (Term term: constTerms) {
        c += term.positive ? term.node.ival() : -term.node.ival();
      }
      return graph.intLit(c);
    }
  }
}
