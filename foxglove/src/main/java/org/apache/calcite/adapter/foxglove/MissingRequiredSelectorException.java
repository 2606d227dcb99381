/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.foxglove;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Thrown before any upstream call when a query lacks the identifying
 * predicates an endpoint requires (for example a recording or a device
 * together with a time window).
 */
public class MissingRequiredSelectorException extends FoxgloveException {

  private final String resource;
  private final ImmutableList<String> alternatives;

  public MissingRequiredSelectorException(String resource, String message,
      List<String> alternatives) {
    super(resource + ": " + message + "; provide one of " + alternatives);
    this.resource = resource;
    this.alternatives = ImmutableList.copyOf(alternatives);
  }

  public String getResource() {
    return resource;
  }

  /** Predicate combinations that would make the query valid. */
  public List<String> getAlternatives() {
    return alternatives;
  }
}
