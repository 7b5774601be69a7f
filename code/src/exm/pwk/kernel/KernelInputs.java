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
package exm.pwk.kernel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import exm.pwk.common.Logging;
import exm.pwk.common.exceptions.InvalidKernelInputException;

/**
 * Match the values a caller supplies for a kernel against the kernel's
 * declared inputs.
 *
 * Inputs can be given by position or by name, and each declared input
 * must be given exactly once.  Named values that are not declared inputs
 * are passed through as generator parameters, which are always optional.
 *
 * @param <T> type of input values
 */
public class KernelInputs<T> {
  private static final Logger logger = Logging.getPWKLogger();

  private final String kernelName;
  private final ImmutableList<String> inputNames;
  private final ImmutableMap<String, Integer> inputPositions;

  public KernelInputs(String kernelName, List<String> inputNames) {
    this.kernelName = kernelName;
    this.inputNames = ImmutableList.copyOf(inputNames);
    Map<String, Integer> positions = new HashMap<String, Integer>();
    for (int i = 0; i < inputNames.size(); i++) {
      Integer prev = positions.put(inputNames.get(i), i);
      if (prev != null) {
        throw new IllegalArgumentException("Input " + inputNames.get(i) +
            " declared twice for kernel " + kernelName);
      }
    }
    this.inputPositions = ImmutableMap.copyOf(positions);
  }

  public List<String> inputNames() {
    return inputNames;
  }

  /**
   * Result of matching: one value per declared input, in declaration
   * order, plus any named values that were not inputs.
   */
  public static class Assignment<T> {
    public final List<T> inputs;
    public final Map<String, T> params;

    private Assignment(List<T> inputs, Map<String, T> params) {
      this.inputs = Collections.unmodifiableList(inputs);
      this.params = Collections.unmodifiableMap(params);
    }
  }

  /**
   * @param positional values for the first inputs, in order
   * @param named values by name, both inputs and generator parameters
   * @return the matched inputs
   * @throws InvalidKernelInputException if an input is missing, given both
   *          by position and by name, or too many positional values are
   *          given
   */
  public Assignment<T> assign(List<T> positional, Map<String, T> named)
      throws InvalidKernelInputException {
    List<T> inputs = new ArrayList<T>(Collections.<T>nCopies(
                                                inputNames.size(), null));
    Map<String, T> params = new LinkedHashMap<String, T>();

    // Process the named values first
    for (Entry<String, T> e: named.entrySet()) {
      Integer pos = inputPositions.get(e.getKey());
      if (pos != null) {
        inputs.set(pos, checkNonNull(e.getKey(), e.getValue()));
      } else {
        params.put(e.getKey(), e.getValue());
      }
    }

    if (positional.size() > inputNames.size()) {
      throw new InvalidKernelInputException(kernelName, null,
          "Expected at most " + inputNames.size() +
          " positional args, but saw " + positional.size() + ".");
    }
    for (int i = 0; i < positional.size(); i++) {
      String name = inputNames.get(i);
      if (inputs.get(i) != null) {
        throw new InvalidKernelInputException(kernelName, name,
            "Input named '" + name +
            "' was specified by both position and keyword.");
      }
      inputs.set(i, checkNonNull(name, positional.get(i)));
    }

    for (int i = 0; i < inputs.size(); i++) {
      if (inputs.get(i) == null) {
        String name = inputNames.get(i);
        throw new InvalidKernelInputException(kernelName, name,
            "Input named '" + name + "' was not specified.");
      }
    }

    if (logger.isDebugEnabled() && !params.isEmpty()) {
      logger.debug(kernelName + ": generator params " + params.keySet());
    }
    return new Assignment<T>(inputs, params);
  }

  private T checkNonNull(String name, T value)
      throws InvalidKernelInputException {
    if (value == null) {
      throw new InvalidKernelInputException(kernelName, name,
          "Input named '" + name + "' was given a null value.");
    }
    return value;
  }
}
