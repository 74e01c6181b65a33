/*
 * Copyright 2024 Roman Khlebnov
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
 * limitations under the License.
 */

package io.github.suppierk.es.json;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/**
 * Persisted form of an {@link io.github.suppierk.es.cqrs.EventEnvelope}: the event payload is kept
 * as an embedded JSON string, so the record can be read and filtered without knowing the event
 * type.
 *
 * @param aggregateId of the aggregate the event belongs to
 * @param aggregateType tag of the aggregate the event belongs to
 * @param version of the aggregate after the event
 * @param payload serialized event
 * @param meta caller supplied metadata
 * @param createdAt creation timestamp
 */
@JsonPropertyOrder({"aggregate_id", "aggregate_type", "version", "payload", "meta", "created_at"})
public record EventRecord(
    @JsonProperty("aggregate_id") String aggregateId,
    @JsonProperty("aggregate_type") String aggregateType,
    @JsonProperty("version") long version,
    @JsonProperty("payload") String payload,
    @JsonProperty("meta") Map<String, String> meta,
    @JsonProperty("created_at") String createdAt) {}
