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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class PostprocessConfigTest {

    @Test
    void defaults() {
        PostprocessConfig config = PostprocessConfig.defaults();
        assertEquals(".", config.getWhitespaceFiller());
        assertFalse(config.isStrictRenaming());
        assertTrue(config.isInterceptsFirst());
        assertFalse(config.isParallelChains());
        assertTrue(config.isDerivedQuantities());
    }

    @Test
    void missingKeysKeepDefaults() {
        PostprocessConfig config = PostprocessConfig.parse("""
            {
              "strict_renaming": true,
              "whitespace_filler": "_"
            }
            """);
        assertTrue(config.isStrictRenaming());
        assertEquals("_", config.getWhitespaceFiller());
        assertTrue(config.isInterceptsFirst());
        assertTrue(config.isDerivedQuantities());
    }

    @Test
    void emptyDocumentGivesDefaults() {
        assertEquals(".", PostprocessConfig.parse("").getWhitespaceFiller());
    }

    @Test
    void saveAndLoadRoundTrip(@TempDir Path tempDir) throws Exception {
        PostprocessConfig config = PostprocessConfig.defaults()
            .setInterceptsFirst(false)
            .setParallelChains(true)
            .setDerivedQuantities(false);
        Path path = tempDir.resolve("postprocess.json");
        config.save(path);

        assertTrue(Files.readString(path).contains("\"intercepts_first\": false"));
        PostprocessConfig loaded = PostprocessConfig.load(path);
        assertFalse(loaded.isInterceptsFirst());
        assertTrue(loaded.isParallelChains());
        assertFalse(loaded.isDerivedQuantities());
        assertEquals(".", loaded.getWhitespaceFiller());
    }
}
