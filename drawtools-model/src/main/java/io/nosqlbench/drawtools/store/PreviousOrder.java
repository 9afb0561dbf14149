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

package io.nosqlbench.drawtools.store;

import java.util.List;

/// Snapshot of the backend's parameter layout taken before renaming.
///
/// @param parameters the parameter index at snapshot time
/// @param flatNames the flat name table at snapshot time
public record PreviousOrder(List<Parameter> parameters, List<String> flatNames) {

    public PreviousOrder {
        parameters = List.copyOf(parameters);
        flatNames = List.copyOf(flatNames);
    }
}
