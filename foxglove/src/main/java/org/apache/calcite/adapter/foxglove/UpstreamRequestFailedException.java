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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown when a call to the Foxglove API fails, either because the server
 * answered with a non-2xx status or because the request could not be sent.
 */
public class UpstreamRequestFailedException extends FoxgloveException {

  /** Status used when no HTTP response was received. */
  public static final int NO_RESPONSE = -1;

  private final int statusCode;
  private final String method;
  private final String url;
  private final @Nullable String responseBody;

  public UpstreamRequestFailedException(int statusCode, String method,
      String url, @Nullable String responseBody) {
    super("Foxglove API " + method + " " + url + " failed with status "
        + statusCode + (responseBody == null ? "" : ": " + responseBody));
    this.statusCode = statusCode;
    this.method = method;
    this.url = url;
    this.responseBody = responseBody;
  }

  public UpstreamRequestFailedException(String method, String url,
      Throwable cause) {
    super("Foxglove API " + method + " " + url + " failed: "
        + cause.getMessage(), cause);
    this.statusCode = NO_RESPONSE;
    this.method = method;
    this.url = url;
    this.responseBody = null;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getMethod() {
    return method;
  }

  public String getUrl() {
    return url;
  }

  public @Nullable String getResponseBody() {
    return responseBody;
  }
}
