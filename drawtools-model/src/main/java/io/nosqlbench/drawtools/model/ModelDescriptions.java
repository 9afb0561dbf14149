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

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/// JSON reading and writing of [ModelDescription] trees.
///
/// ## Format
///
/// Record components map to snake_case keys; term groups carry a `kind`
/// discriminator (see [TermGroupTypeAdapterFactory]):
///
/// ```json
/// {
///   "responses": [{
///     "response": "",
///     "distributional_parameters": ["mu", "sigma"],
///     "predictors": [{
///       "dpar": "mu",
///       "terms": [{"kind": "fixed", "coefficients": ["Intercept", "x1"]}]
///     }]
///   }],
///   "terms": [{
///     "kind": "group_level",
///     "terms": [{"id": 1, "group": "site", "coefficient": "Intercept", "coefficient_index": 1}],
///     "levels": {"site": ["A", "B", "C"]}
///   }]
/// }
/// ```
///
/// ## Thread Safety
///
/// The shared [Gson] instance is thread-safe.
public final class ModelDescriptions {

    private static final Logger logger = LogManager.getLogger(ModelDescriptions.class);

    private static final Gson GSON = builder().setPrettyPrinting().create();

    private ModelDescriptions() {
    }

    /// @return a builder with the naming policy and term group adapter registered
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .disableHtmlEscaping()
            .registerTypeAdapterFactory(TermGroupTypeAdapterFactory.create());
    }

    public static Gson gson() {
        return GSON;
    }

    /// Parses a model description from JSON text.
    ///
    /// @param json the JSON text
    /// @return the parsed description
    /// @throws ModelDescriptionException if the text is not a valid description
    public static ModelDescription parse(String json) throws ModelDescriptionException {
        Objects.requireNonNull(json, "json cannot be null");
        ModelDescription description;
        try {
            description = GSON.fromJson(json, ModelDescription.class);
        } catch (JsonParseException e) {
            throw new ModelDescriptionException("Invalid model description JSON: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // record constructors reject inconsistent trees, Gson wraps their exceptions
            throw new ModelDescriptionException("Invalid model description: " + e.getMessage(), e);
        }
        if (description == null) {
            throw new ModelDescriptionException("Model description is empty");
        }
        return description;
    }

    /// Loads a model description from a JSON file.
    ///
    /// @param path the file to read
    /// @return the parsed description
    /// @throws IOException if reading fails
    /// @throws ModelDescriptionException if the content is not a valid description
    public static ModelDescription load(Path path) throws IOException, ModelDescriptionException {
        Objects.requireNonNull(path, "path cannot be null");
        if (!Files.exists(path)) {
            throw new ModelDescriptionException("Model description file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            StringBuilder sb = new StringBuilder();
            char[] buffer = new char[8192];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                sb.append(buffer, 0, read);
            }
            ModelDescription description = parse(sb.toString());
            logger.debug("Loaded model description with {} responses from {}", description.responses().size(), path);
            return description;
        }
    }

    /// Writes a model description as pretty-printed JSON.
    ///
    /// @param path the file to write
    /// @param description the description to save
    /// @throws IOException if writing fails
    public static void save(Path path, ModelDescription description) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(description, "description cannot be null");
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(description, writer);
        }
        logger.debug("Saved model description to {}", path);
    }

    public static String toJson(ModelDescription description) {
        return GSON.toJson(description);
    }
}
