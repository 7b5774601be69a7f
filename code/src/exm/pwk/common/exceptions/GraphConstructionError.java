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
package exm.pwk.common.exceptions;

/**
 * Violation of the graph construction contract.  Callers are not expected
 * to recover from this: the compilation unit that hit it should be
 * abandoned.
 */
public class GraphConstructionError extends PWKRuntimeError {

  public static enum ErrorKind {
    /** Wrong number of inputs for an opcode */
    BAD_ARITY,
    /** Explicit cast applied to the wrong input type */
    BAD_CAST,
    /** Coercion requested between unrelated types */
    BAD_COERCION,
    /** Literal requested through the operator path */
    CONSTANT_VIA_BUILDER,
    /** Substitution target is not an axis variable */
    NOT_A_VARIABLE,
    /** Node belongs to a different graph */
    FOREIGN_NODE,
    /** Node was discarded by garbage collection or by clearing the graph */
    STALE_NODE,
  }

  private final ErrorKind kind;

  public GraphConstructionError(ErrorKind kind, String msg) {
    super(kind + ": " + msg);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }

  private static final long serialVersionUID = 1L;
}
