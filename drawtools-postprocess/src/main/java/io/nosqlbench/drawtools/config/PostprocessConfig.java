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

package io.nosqlbench.drawtools.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON-serializable settings of the draw post-processing pipeline.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "whitespace_filler": ".",
 *   "strict_renaming": false,
 *   "intercepts_first": true,
 *   "parallel_chains": false,
 *   "derived_quantities": true
 * }
 * }</pre>
 *
 * <p>Every key is optional; missing keys keep their defaults.
 */
public class PostprocessConfig {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    /** Replacement for whitespace inside level labels */
    @SerializedName("whitespace_filler")
    private String whitespaceFiller = ".";

    /** Throw instead of truncating when a rename operation is mismatched */
    @SerializedName("strict_renaming")
    private boolean strictRenaming = false;

    @SerializedName("intercepts_first")
    private boolean interceptsFirst = true;

    @SerializedName("parallel_chains")
    private boolean parallelChains = false;

    @SerializedName("derived_quantities")
    private boolean derivedQuantities = true;

    public PostprocessConfig() {
    }

    public static PostprocessConfig defaults() {
        return new PostprocessConfig();
    }

    /**
     * Parses a configuration from JSON.
     *
     * @param json the JSON text
     * @return the configuration, with defaults for missing keys
     * @throws JsonParseException if the JSON is malformed
     */
    public static PostprocessConfig parse(String json) {
        PostprocessConfig config = GSON.fromJson(json, PostprocessConfig.class);
        return config == null ? defaults() : config.validated();
    }

    public static PostprocessConfig load(Reader reader) {
        PostprocessConfig config = GSON.fromJson(reader, PostprocessConfig.class);
        return config == null ? defaults() : config.validated();
    }

    /**
     * Loads a configuration file.
     *
     * @param path the JSON file
     * @return the configuration
     * @throws IOException if the file cannot be read
     */
    public static PostprocessConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return load(reader);
        }
    }

    public void save(Path path) throws IOException {
        Files.writeString(path, toJson());
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    private PostprocessConfig validated() {
        if (whitespaceFiller == null) {
            throw new JsonParseException("whitespace_filler cannot be null");
        }
        return this;
    }

    public String getWhitespaceFiller() {
        return whitespaceFiller;
    }

    public PostprocessConfig setWhitespaceFiller(String whitespaceFiller) {
        this.whitespaceFiller = whitespaceFiller;
        return this;
    }

    public boolean isStrictRenaming() {
        return strictRenaming;
    }

    public PostprocessConfig setStrictRenaming(boolean strictRenaming) {
        this.strictRenaming = strictRenaming;
        return this;
    }

    public boolean isInterceptsFirst() {
        return interceptsFirst;
    }

    public PostprocessConfig setInterceptsFirst(boolean interceptsFirst) {
        this.interceptsFirst = interceptsFirst;
        return this;
    }

    public boolean isParallelChains() {
        return parallelChains;
    }

    public PostprocessConfig setParallelChains(boolean parallelChains) {
        this.parallelChains = parallelChains;
        return this;
    }

    public boolean isDerivedQuantities() {
        return derivedQuantities;
    }

    public PostprocessConfig setDerivedQuantities(boolean derivedQuantities) {
        this.derivedQuantities = derivedQuantities;
        return this;
    }
}
