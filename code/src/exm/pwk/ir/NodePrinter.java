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
import java.util.List;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

/**
 * Textual rendering of nodes for debugging.  Never modifies the graph.
 */
public class NodePrinter {

  /** Register hints from here up are float registers */
  public static final int FIRST_FLOAT_REG = 16;

  /**
   * Render node as an infix expression, e.g. (x+[(y*3)+2])
   */
  public static String renderExpression(Node node) {
    StringBuilder sb = new StringBuilder();
    renderExpression(node, sb);
    return sb.toString();
  }

  private static void renderExpression(Node node, StringBuilder sb) {
    switch (node.op()) {
      case CONST:
        sb.append(literal(node));
        break;
      case VAR_X:
      case VAR_Y:
      case VAR_T:
      case VAR_C:
        sb.append(node.op().opName());
        break;
      case UNBOUND_VAR:
        sb.append("<").append(Long.toHexString(node.id())).append(">");
        break;
      case PLUS:
        infix(node, "+", sb);
        break;
      case MINUS:
        infix(node, "-", sb);
        break;
      case TIMES:
        infix(node, "*", sb);
        break;
      case DIVIDE:
        infix(node, "/", sb);
        break;
      case PLUS_IMM:
        sb.append("(");
        renderExpression(node.input(0), sb);
        sb.append("+").append(node.ival()).append(")");
        break;
      case TIMES_IMM:
        sb.append("(");
        renderExpression(node.input(0), sb);
        sb.append("*").append(node.ival()).append(")");
        break;
      case LOAD_IMM:
        sb.append("[");
        renderExpression(node.input(0), sb);
        sb.append("+").append(node.ival()).append("]");
        break;
      case LOAD:
        sb.append("[");
        renderExpression(node.input(0), sb);
        sb.append("]");
        break;
      default:
        sb.append(node.op().opName());
        if (!node.inputs().isEmpty()) {
          sb.append("(");
          for (int i = 0; i < node.inputs().size(); i++) {
            if (i > 0) {
              sb.append(", ");
            }
            renderExpression(node.input(i), sb);
          }
          sb.append(")");
        }
        break;
    }
  }

  private static void infix(Node node, String op, StringBuilder sb) {
    sb.append("(");
    renderExpression(node.input(0), sb);
    sb.append(op);
    renderExpression(node.input(1), sb);
    sb.append(")");
  }

  /**
   * Render node as a register-style instruction using the register hints,
   * e.g. "xmm2 = xmm0 + xmm1".  Nodes without a hint are shown as v<id>,
   * literal inputs without a hint by value.
   */
  public static String renderInstruction(Node node) {
    List<String> args = new ArrayList<String>(node.inputs().size());
    for (Node in: node.inputs()) {
      args.add(operand(in));
    }

    StringBuilder sb = new StringBuilder();
    sb.append(register(node)).append(" = ");
    switch (node.op()) {
      case CONST:
        sb.append(literal(node));
        break;
      case PLUS:
        sb.append(args.get(0)).append(" + ").append(args.get(1));
        break;
      case MINUS:
        sb.append(args.get(0)).append(" - ").append(args.get(1));
        break;
      case TIMES:
        sb.append(args.get(0)).append(" * ").append(args.get(1));
        break;
      case DIVIDE:
        sb.append(args.get(0)).append(" / ").append(args.get(1));
        break;
      case PLUS_IMM:
        sb.append(args.get(0)).append(" + ").append(node.ival());
        break;
      case TIMES_IMM:
        sb.append(args.get(0)).append(" * ").append(node.ival());
        break;
      case LOAD_IMM:
        sb.append("Load ").append(args.get(0)).append(" + ")
          .append(node.ival());
        break;
      default:
        sb.append(node.op().opName());
        if (!args.isEmpty()) {
          sb.append(" ").append(StringUtils.join(args, " "));
        }
        break;
    }
    return sb.toString();
  }

  private static String operand(Node in) {
    if (in.reg() == Node.NO_REG && in.isConst()) {
      return literal(in);
    }
    return register(in);
  }

  private static String register(Node node) {
    int reg = node.reg();
    if (reg == Node.NO_REG) {
      return "v" + node.id();
    } else if (reg < FIRST_FLOAT_REG) {
      return "r" + reg;
    } else {
      return "xmm" + (reg - FIRST_FLOAT_REG);
    }
  }

  private static String literal(Node node) {
    if (node.type() == Type.FLOAT) {
      return String.format(Locale.ROOT, "%f", node.fval());
    }
    return Integer.toString(node.ival());
  }
}
