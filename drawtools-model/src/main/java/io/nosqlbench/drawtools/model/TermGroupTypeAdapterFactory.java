/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.drawtools.model;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.internal.Streams;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.Map;

/**
 * GSON TypeAdapterFactory for polymorphic {@link TermGroup} serialization.
 *
 * <p>Each term group is written as a JSON object whose first field is a
 * {@code "kind"} discriminator taken from {@link TermKind#getJsonName()},
 * followed by the record components of the concrete variant.
 *
 * <h2>Architecture</h2>
 *
 * <pre>{@code
 *  SERIALIZE                              DESERIALIZE
 *  ─────────                              ───────────
 *  FixedEffects                           { "kind": "fixed", ... }
 *        │                                         │
 *        ▼                                         ▼
 *  1. Take kind().getJsonName()           1. Read "kind" field
 *  2. Serialize record components         2. Resolve TermKind
 *  3. Put "kind" first                    3. Validate against requested type
 *        │                                4. Deserialize with delegate
 *        ▼                                         │
 *  {                                               ▼
 *    "kind": "fixed",                     FixedEffects
 *    "coefficients": ["Intercept"]
 *  }
 * }</pre>
 *
 * @see TermKind
 * @see ModelDescriptions
 */
public final class TermGroupTypeAdapterFactory implements TypeAdapterFactory {

    private static final String KIND_FIELD = "kind";

    private TermGroupTypeAdapterFactory() {
    }

    /**
     * Creates a factory covering every {@link TermKind}.
     *
     * @return a new factory
     */
    public static TermGroupTypeAdapterFactory create() {
        return new TermGroupTypeAdapterFactory();
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!TermGroup.class.isAssignableFrom(type.getRawType())) {
            return null;
        }
        Class<?> requested = type.getRawType();

        return new TypeAdapter<T>() {
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }
                TermGroup group = (TermGroup) value;
                TypeAdapter<T> delegate = (TypeAdapter<T>) gson.getDelegateAdapter(
                    TermGroupTypeAdapterFactory.this, TypeToken.get(group.kind().getType()));
                JsonElement tree = delegate.toJsonTree(value);

                JsonObject result = new JsonObject();
                result.addProperty(KIND_FIELD, group.kind().getJsonName());
                if (tree.isJsonObject()) {
                    for (Map.Entry<String, JsonElement> entry : tree.getAsJsonObject().entrySet()) {
                        if (!KIND_FIELD.equals(entry.getKey())) {
                            result.add(entry.getKey(), entry.getValue());
                        }
                    }
                }
                Streams.write(result, out);
            }

            @Override
            public T read(JsonReader in) throws IOException {
                JsonElement element = JsonParser.parseReader(in);
                if (element.isJsonNull()) {
                    return null;
                }
                if (!element.isJsonObject()) {
                    throw new JsonParseException("Term group must be a JSON object: " + element);
                }
                JsonObject obj = element.getAsJsonObject();
                if (!obj.has(KIND_FIELD)) {
                    throw new JsonParseException("Missing '" + KIND_FIELD + "' field in term group: " + obj);
                }

                TermKind kind;
                try {
                    kind = TermKind.fromJsonName(obj.get(KIND_FIELD).getAsString());
                } catch (IllegalArgumentException e) {
                    throw new JsonParseException(e.getMessage(), e);
                }
                if (!requested.isAssignableFrom(kind.getType())) {
                    throw new JsonParseException("Term group kind '" + kind.getJsonName()
                        + "' cannot be read as " + requested.getSimpleName());
                }

                TypeAdapter<?> delegate = gson.getDelegateAdapter(
                    TermGroupTypeAdapterFactory.this, TypeToken.get(kind.getType()));
                return (T) delegate.fromJsonTree(obj);
            }
        };
    }
}
