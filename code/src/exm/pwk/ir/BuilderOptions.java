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

import exm.pwk.common.Settings;
import exm.pwk.common.exceptions.InvalidOptionException;

/**
 * Snapshot of the optional builder stages, fixed for the lifetime of a
 * graph.
 */
public class BuilderOptions {
  public final boolean constantFold;
  public final boolean strengthReduce;
  public final boolean fuse;
  public final boolean cse;

  public BuilderOptions(boolean constantFold, boolean strengthReduce,
                        boolean fuse, boolean cse) {
    this.constantFold = constantFold;
    this.strengthReduce = strengthReduce;
    this.fuse = fuse;
    this.cse = cse;
  }

  /**
   * All stages enabled
   */
  public static BuilderOptions defaults() {
    return new BuilderOptions(true, true, true, true);
  }

  public static BuilderOptions fromSettings() throws InvalidOptionException {
    return new BuilderOptions(
        Settings.getBoolean(Settings.OPT_CONSTANT_FOLD),
        Settings.getBoolean(Settings.OPT_STRENGTH_REDUCE),
        Settings.getBoolean(Settings.OPT_FUSE),
        Settings.getBoolean(Settings.OPT_CSE));
  }

  @Override
  public String toString() {
    return "BuilderOptions[constantFold=" + constantFold +
           ", strengthReduce=" + strengthReduce + ", fuse=" + fuse +
           ", cse=" + cse + "]";
  }
}
