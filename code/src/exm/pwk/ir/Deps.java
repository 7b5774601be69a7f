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

import org.apache.commons.lang3.StringUtils;

/**
 * Dependency bitmask of a node: which iteration variables, memory or
 * unbound placeholders its value depends on.
 */
public class Deps {
  public static final int NONE = 0;
  public static final int X = 1;
  public static final int Y = 2;
  public static final int T = 4;
  public static final int C = 8;
  public static final int MEM = 16;
  public static final int UNBOUND = 32;

  public static final int LEVEL_NONE = 0;
  public static final int LEVEL_T = 1;
  public static final int LEVEL_Y = 2;
  public static final int LEVEL_X = 3;
  public static final int LEVEL_C_OR_MEM = 4;
  public static final int LEVEL_UNBOUND = 99;

  /**
   * Dependency that an operator introduces by itself, regardless of inputs
   */
  public static int introducedBy(OpCode op) {
    switch (op) {
      case VAR_X:
        return X;
      case VAR_Y:
        return Y;
      case VAR_T:
        return T;
      case VAR_C:
        return C;
      case LOAD:
      case LOAD_IMM:
        return MEM;
      case UNBOUND_VAR:
        return UNBOUND;
      default:
        return NONE;
    }
  }

  /**
   * Dependency bit of an axis variable
   * @return the bit, or NONE if op is not an axis variable
   */
  public static int ofVariable(OpCode op) {
    if (!op.isAxisVariable()) {
      return NONE;
    }
    return introducedBy(op);
  }

  /**
   * Total order used to canonicalise commutative rewrites.  Higher means
   * more specific, i.e. changes more often during kernel execution.
   */
  public static int level(int deps) {
    if ((deps & UNBOUND) != 0) {
      return LEVEL_UNBOUND;
    } else if ((deps & (C | MEM)) != 0) {
      return LEVEL_C_OR_MEM;
    } else if ((deps & X) != 0) {
      return LEVEL_X;
    } else if ((deps & Y) != 0) {
      return LEVEL_Y;
    } else if ((deps & T) != 0) {
      return LEVEL_T;
    } else {
      return LEVEL_NONE;
    }
  }

  public static String toString(int deps) {
    List<String> names = new ArrayList<String>();
    if ((deps & X) != 0) names.add("x");
    if ((deps & Y) != 0) names.add("y");
    if ((deps & T) != 0) names.add("t");
    if ((deps & C) != 0) names.add("c");
    if ((deps & MEM) != 0) names.add("mem");
    if ((deps & UNBOUND) != 0) names.add("unbound");
    return "{" + StringUtils.join(names, ",") + "}";
  }
}
