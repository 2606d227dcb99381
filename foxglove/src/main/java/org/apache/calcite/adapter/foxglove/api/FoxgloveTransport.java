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
package org.apache.calcite.adapter.foxglove.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Executes requests against the Foxglove API.
 *
 * <p>Implementations authenticate every API call and throw
 * {@link org.apache.calcite.adapter.foxglove.UpstreamRequestFailedException}
 * on transport failures and non-2xx responses. No retries are expected.
 */
public interface FoxgloveTransport {

  /**
   * Issues {@code GET <baseUrl><path>?<params>} and parses the JSON body.
   */
  JsonNode get(String path, Map<String, String> params);

  /**
   * Issues {@code POST <baseUrl><path>} with a JSON body and parses the JSON
   * response.
   */
  JsonNode post(String path, JsonNode body);

  /**
   * Fetches the full body of a short-lived retrieval link returned by the
   * API. The link is absolute and already authorized.
   */
  byte[] download(String url);
}
