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

/// Thrown when a clustering run cannot keep every cluster populated.
///
/// A single restart failing this way is recoverable; the exception escapes
/// [KMeansClusterModel#fit] only when no restart survives.
public class DegenerateClusterException extends EquivalenceEngineException {

    /// @param message the failure description
    public DegenerateClusterException(String message) {
        super(message);
    }
}
