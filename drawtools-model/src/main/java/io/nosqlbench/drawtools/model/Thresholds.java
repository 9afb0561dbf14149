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

import java.util.List;

/// Ordinal threshold groups of a response.
///
/// @param groups the threshold groups in backend order
public record Thresholds(List<Group> groups) implements TermGroup {

    public Thresholds {
        groups = Copies.list(groups);
    }

    /// @param name the group label, empty for an ungrouped model
    /// @param thresholds threshold labels of this group
    public record Group(String name, List<String> thresholds) {
        public Group {
            name = Copies.text(name);
            thresholds = Copies.list(thresholds);
        }
    }

    /// Thresholds are regrouped only when at least one group is named.
    public boolean isGrouped() {
        return groups.stream().anyMatch(g -> !g.name().isEmpty());
    }

    @Override
    public TermKind kind() {
        return TermKind.THRESHOLDS;
    }
}
