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

import org.apache.calcite.adapter.foxglove.FoxgloveException;
import org.apache.calcite.adapter.foxglove.UpstreamRequestFailedException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * {@link FoxgloveTransport} over {@link HttpClient}.
 *
 * <p>API calls carry a bearer token; retrieval links do not.
 */
public class FoxgloveHttpTransport implements FoxgloveTransport {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(FoxgloveHttpTransport.class);

  private static final int MAX_ERROR_BODY = 2000;

  private final FoxgloveConfig config;
  private final ObjectMapper mapper;
  private final HttpClient httpClient;

  public FoxgloveHttpTransport(FoxgloveConfig config, ObjectMapper mapper) {
    this.config = config;
    this.mapper = mapper;
    this.httpClient = HttpClient.newBuilder()
        .connectTimeout(config.getConnectTimeout())
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Override public JsonNode get(String path, Map<String, String> params) {
    String url = config.getBaseUrl() + path + query(params);
    HttpRequest request = apiRequest(url)
        .GET()
        .build();
    return parse("GET", url, send("GET", url, request));
  }

  @Override public JsonNode post(String path, JsonNode body) {
    String url = config.getBaseUrl() + path;
    String json;
    try {
      json = mapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new FoxgloveException("Cannot serialize request body", e);
    }
    HttpRequest request = apiRequest(url)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(json))
        .build();
    return parse("POST", url, send("POST", url, request));
  }

  @Override public byte[] download(String url) {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .timeout(config.getDownloadTimeout())
        .GET()
        .build();
    LOGGER.debug("GET {} (retrieval link)", url);
    HttpResponse<byte[]> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
    } catch (IOException e) {
      throw new UpstreamRequestFailedException("GET", url, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UpstreamRequestFailedException("GET", url, e);
    }
    if (!isSuccess(response.statusCode())) {
      throw new UpstreamRequestFailedException(response.statusCode(), "GET",
          url, truncate(new String(response.body(), StandardCharsets.UTF_8)));
    }
    LOGGER.debug("Downloaded {} bytes", response.body().length);
    return response.body();
  }

  private HttpRequest.Builder apiRequest(String url) {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .timeout(config.getRequestTimeout())
        .header("Accept", "application/json");
    String apiKey = config.getApiKey();
    if (apiKey != null) {
      builder.header("Authorization", "Bearer " + apiKey);
    }
    return builder;
  }

  private String send(String method, String url, HttpRequest request) {
    LOGGER.debug("{} {}", method, url);
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new UpstreamRequestFailedException(method, url, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UpstreamRequestFailedException(method, url, e);
    }
    if (!isSuccess(response.statusCode())) {
      LOGGER.warn("{} {} returned status {}", method, url,
          response.statusCode());
      throw new UpstreamRequestFailedException(response.statusCode(), method,
          url, truncate(response.body()));
    }
    return response.body();
  }

  private JsonNode parse(String method, String url, String body) {
    try {
      return mapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new UpstreamRequestFailedException(method, url, e);
    }
  }

  static String query(Map<String, String> params) {
    if (params.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> entry : params.entrySet()) {
      sb.append(sb.length() == 0 ? '?' : '&')
          .append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
          .append('=')
          .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
    }
    return sb.toString();
  }

  private static boolean isSuccess(int status) {
    return status >= 200 && status < 300;
  }

  private static String truncate(String body) {
    return body.length() <= MAX_ERROR_BODY ? body
        : body.substring(0, MAX_ERROR_BODY) + "...";
  }
}
