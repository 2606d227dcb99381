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
package org.apache.calcite.adapter.foxglove.mcap;

import org.apache.calcite.adapter.foxglove.FoxgloveException;

/**
 * Raised by a payload codec for a message it cannot decode. Converted by
 * {@link MessageDecoder} into an {@code _error} value for that message.
 */
public class PayloadDecodeFailedException extends FoxgloveException {

  private final PayloadEncoding encoding;

  public PayloadDecodeFailedException(PayloadEncoding encoding,
      String message, Throwable cause) {
    super(message, cause);
    this.encoding = encoding;
  }

  public PayloadDecodeFailedException(PayloadEncoding encoding,
      String message) {
    super(message);
    this.encoding = encoding;
  }

  public PayloadEncoding getEncoding() {
    return encoding;
  }

  /** Text stored in the {@code _error} field, e.g. {@code protobuf_decode_failed: ...}. */
  public String diagnostic() {
    return encoding.label() + "_decode_failed: " + getMessage();
  }
}
