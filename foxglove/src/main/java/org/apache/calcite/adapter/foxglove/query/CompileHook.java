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
package org.apache.calcite.adapter.foxglove.query;

/**
 * Resource-specific step run by {@link QualifierCompiler} after the
 * qualifiers have been accumulated and before the request is finalized.
 *
 * <p>Hooks validate that an endpoint's mandatory selectors are present and
 * may complete the time window.
 */
public interface CompileHook {

  /** Hook that accepts every request as compiled. */
  CompileHook NONE = context -> { };

  /**
   * Inspects or completes the request being compiled.
   *
   * @throws org.apache.calcite.adapter.foxglove.MissingRequiredSelectorException
   *     if the upstream would reject the request
   */
  void apply(CompileContext context);
}
