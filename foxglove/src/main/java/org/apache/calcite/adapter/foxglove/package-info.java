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

/**
 * Calcite adapter for the Foxglove robotics data API.
 *
 * <p>Devices, recordings, attachments, events, topics, coverage and stream
 * messages are exposed as tables. Equality, time-window and metadata
 * predicates, column projections and single-key ordering are pushed into the
 * API request; every returned row is still checked against the predicates.
 */
@PackageMarker
package org.apache.calcite.adapter.foxglove;

import org.apache.calcite.avatica.util.PackageMarker;
