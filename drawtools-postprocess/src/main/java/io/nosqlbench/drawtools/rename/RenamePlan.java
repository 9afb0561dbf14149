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

package io.nosqlbench.drawtools.rename;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/// Ordered list of [RenameOperation]s, built fresh for one store and
/// discarded after it has been applied.
public final class RenamePlan {

    private final List<RenameOperation> operations;

    private RenamePlan(List<RenameOperation> operations) {
        this.operations = List.copyOf(operations);
    }

    public static RenamePlan of(List<RenameOperation> operations) {
        return new RenamePlan(operations);
    }

    public static RenamePlan empty() {
        return new RenamePlan(List.of());
    }

    public List<RenameOperation> operations() {
        return operations;
    }

    public int size() {
        return operations.size();
    }

    /// @return operations selecting at least one column
    public List<RenameOperation> effective() {
        return operations.stream().filter(op -> !op.isNoOp()).toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Accumulates operations in emission order.
    public static final class Builder {
        private final List<RenameOperation> operations = new ArrayList<>();

        private Builder() {
        }

        public Builder add(RenameOperation operation) {
            operations.add(operation);
            return this;
        }

        public Builder addAll(Collection<RenameOperation> more) {
            operations.addAll(more);
            return this;
        }

        public RenamePlan build() {
            return new RenamePlan(operations);
        }
    }
}
