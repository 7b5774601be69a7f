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
 * Kernel inputs were missing, duplicated, or too many were given.
 */
public class InvalidKernelInputException extends UserException {

  /** Offending input, null if the problem is not tied to one input */
  private final String inputName;

  public InvalidKernelInputException(String kernel, String inputName,
                                     String message) {
    super(kernel, message);
    this.inputName = inputName;
  }

  public String inputName() {
    return inputName;
  }

  private static final long serialVersionUID = 1L;
}
