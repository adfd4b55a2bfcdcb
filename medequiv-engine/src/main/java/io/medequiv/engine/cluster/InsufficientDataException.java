package io.medequiv.engine.cluster;

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

import io.medequiv.engine.EquivalenceEngineException;

/// Thrown when a fit receives fewer vectors than the requested cluster count.
public class InsufficientDataException extends EquivalenceEngineException {

    private final int available;
    private final int required;

    /// @param available number of vectors supplied
    /// @param required number of vectors needed
    public InsufficientDataException(int available, int required) {
        super("cannot fit " + required + " clusters with " + available + " vectors");
        this.available = available;
        this.required = required;
    }

    /// @return number of vectors supplied
    public int available() {
        return available;
    }

    /// @return number of vectors needed
    public int required() {
        return required;
    }
}
