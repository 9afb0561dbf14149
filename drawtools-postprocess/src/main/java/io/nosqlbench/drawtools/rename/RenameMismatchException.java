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

/// Thrown in strict mode when a rename operation provides a different number
/// of replacement names than it matched columns.
public class RenameMismatchException extends RuntimeException {

    private final int operationIndex;
    private final int matched;
    private final int provided;

    public RenameMismatchException(int operationIndex, int matched, int provided) {
        super("Rename operation " + operationIndex + " matched " + matched
            + " columns but provides " + provided + " names");
        this.operationIndex = operationIndex;
        this.matched = matched;
        this.provided = provided;
    }

    public int getOperationIndex() {
        return operationIndex;
    }

    public int getMatched() {
        return matched;
    }

    public int getProvided() {
        return provided;
    }
}
