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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.google.protobuf.Any;
import com.google.protobuf.DescriptorProtos;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.google.protobuf.Descriptors;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.FileDescriptor;
import com.google.protobuf.Duration;
import com.google.protobuf.DynamicMessage;
import com.google.protobuf.Empty;
import com.google.protobuf.FieldMask;
import com.google.protobuf.Int32Value;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Struct;
import com.google.protobuf.Timestamp;
import com.google.protobuf.util.JsonFormat;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes protobuf payloads using the {@code FileDescriptorSet} carried by
 * their MCAP schema record.
 *
 * <p>Descriptors are built once per schema id and reused for the rest of
 * the stream. Output follows the protobuf JSON mapping with proto field
 * names, and fields holding their default value are always present.
 */
class ProtobufPayloadDecoder {

  /** Files that may be referenced without being included in the set. */
  private static final Map<String, FileDescriptor> WELL_KNOWN_FILES =
      ImmutableMap.<String, FileDescriptor>builder()
          .put("google/protobuf/any.proto", Any.getDescriptor().getFile())
          .put("google/protobuf/duration.proto", Duration.getDescriptor().getFile())
          .put("google/protobuf/empty.proto", Empty.getDescriptor().getFile())
          .put("google/protobuf/field_mask.proto", FieldMask.getDescriptor().getFile())
          .put("google/protobuf/struct.proto", Struct.getDescriptor().getFile())
          .put("google/protobuf/timestamp.proto", Timestamp.getDescriptor().getFile())
          .put("google/protobuf/wrappers.proto", Int32Value.getDescriptor().getFile())
          .put("google/protobuf/descriptor.proto", DescriptorProtos.getDescriptor())
          .build();

  private final ObjectMapper mapper;
  private final Map<Integer, Resolved> cache = new HashMap<>();
  private final Map<Integer, PayloadDecodeFailedException> unusable = new HashMap<>();

  ProtobufPayloadDecoder(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  JsonNode decode(McapSchema schema, byte[] payload) {
    final Resolved resolved = resolve(schema);
    try {
      DynamicMessage message = DynamicMessage.parseFrom(resolved.descriptor, payload);
      String json = resolved.printer.print(message);
      return mapper.readTree(json);
    } catch (InvalidProtocolBufferException e) {
      throw new PayloadDecodeFailedException(PayloadEncoding.PROTOBUF,
          e.getMessage(), e);
    } catch (JsonProcessingException e) {
      throw new PayloadDecodeFailedException(PayloadEncoding.PROTOBUF,
          "cannot read printed message: " + e.getOriginalMessage(), e);
    }
  }

  private Resolved resolve(McapSchema schema) {
    Resolved resolved = cache.get(schema.id());
    if (resolved != null) {
      return resolved;
    }
    PayloadDecodeFailedException failure = unusable.get(schema.id());
    if (failure != null) {
      throw new PayloadDecodeFailedException(PayloadEncoding.PROTOBUF,
          failure.getMessage(), failure);
    }
    try {
      resolved = build(schema);
    } catch (PayloadDecodeFailedException e) {
      unusable.put(schema.id(), e);
      throw e;
    }
    cache.put(schema.id(), resolved);
    return resolved;
  }

  private static Resolved build(McapSchema schema) {
    final FileDescriptorSet set;
    try {
      set = FileDescriptorSet.parseFrom(schema.data());
    } catch (InvalidProtocolBufferException e) {
      throw new PayloadDecodeFailedException(PayloadEncoding.PROTOBUF,
          "schema " + schema.name() + " is not a FileDescriptorSet: "
              + e.getMessage(), e);
    }
    final Map<String, FileDescriptorProto> protos = new LinkedHashMap<>();
    for (FileDescriptorProto proto : set.getFileList()) {
      protos.put(proto.getName(), proto);
    }
    final Map<String, FileDescriptor> built = new LinkedHashMap<>();
    for (String name : protos.keySet()) {
      buildFile(name, protos, built, new ArrayList<>());
    }
    Descriptor descriptor = null;
    for (FileDescriptor file : built.values()) {
      descriptor = findMessage(file, schema.name());
      if (descriptor != null) {
        break;
      }
    }
    if (descriptor == null) {
      throw new PayloadDecodeFailedException(PayloadEncoding.PROTOBUF,
          "message type " + schema.name() + " not found in schema "
              + schema.id());
    }
    JsonFormat.TypeRegistry.Builder registry = JsonFormat.TypeRegistry.newBuilder();
    for (FileDescriptor file : built.values()) {
      registry.add(file.getMessageTypes());
    }
    JsonFormat.Printer printer = JsonFormat.printer()
        .usingTypeRegistry(registry.build())
        .includingDefaultValueFields()
        .preservingProtoFieldNames()
        .omittingInsignificantWhitespace();
    return new Resolved(descriptor, printer);
  }

  private static FileDescriptor buildFile(String name,
      Map<String, FileDescriptorProto> protos, Map<String, FileDescriptor> built,
      List<String> path) {
    FileDescriptor file = built.get(name);
    if (file != null) {
      return file;
    }
    FileDescriptorProto proto = protos.get(name);
    if (proto == null) {
      FileDescriptor wellKnown = WELL_KNOWN_FILES.get(name);
      if (wellKnown == null) {
        throw new PayloadDecodeFailedException(PayloadEncoding.PROTOBUF,
            "missing dependency " + name);
      }
      return wellKnown;
    }
    if (path.contains(name)) {
      throw new PayloadDecodeFailedException(PayloadEncoding.PROTOBUF,
          "circular dependency through " + name);
    }
    path.add(name);
    List<FileDescriptor> dependencies = new ArrayList<>();
    for (String dependency : proto.getDependencyList()) {
      dependencies.add(buildFile(dependency, protos, built, path));
    }
    path.remove(path.size() - 1);
    try {
      file = FileDescriptor.buildFrom(proto,
          dependencies.toArray(new FileDescriptor[0]));
    } catch (Descriptors.DescriptorValidationException e) {
      throw new PayloadDecodeFailedException(PayloadEncoding.PROTOBUF,
          "invalid descriptor " + name + ": " + e.getMessage(), e);
    }
    built.put(name, file);
    return file;
  }

  /** Finds a (possibly nested) message type by its fully-qualified name. */
  static @Nullable Descriptor findMessage(FileDescriptor file, String fullName) {
    String pkg = file.getPackage();
    String relative;
    if (pkg.isEmpty()) {
      relative = fullName;
    } else if (fullName.startsWith(pkg + ".")) {
      relative = fullName.substring(pkg.length() + 1);
    } else {
      return null;
    }
    String[] parts = relative.split("\\.");
    Descriptor descriptor = file.findMessageTypeByName(parts[0]);
    for (int i = 1; i < parts.length && descriptor != null; i++) {
      descriptor = descriptor.findNestedTypeByName(parts[i]);
    }
    return descriptor;
  }

  /** Descriptor and printer for one schema. */
  private static class Resolved {
    final Descriptor descriptor;
    final JsonFormat.Printer printer;

    Resolved(Descriptor descriptor, JsonFormat.Printer printer) {
      this.descriptor = descriptor;
      this.printer = printer;
    }
  }
}
