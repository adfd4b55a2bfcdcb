package io.medequiv.engine;

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

/// Base type for the named failure conditions of the equivalence engine.
///
/// Each subtype identifies one class of problem so that a caller can tell
/// bad input data apart from an unanswerable query or an impossible
/// configuration:
///
/// | Subtype | Scope | Fatal to |
/// |---------|-------|----------|
/// | `InvalidQuantityException` | one record | nothing, the record is excluded |
/// | `InsufficientDataException` | one fit | the fit |
/// | `DegenerateClusterException` | one restart | the fit, only if every restart fails |
/// | `UnresolvableQueryException` | one query | the query |
/// | `InvalidConfigurationException` | configuration | everything using it |
public class EquivalenceEngineException extends RuntimeException {

    /// Create an exception with a message
    /// @param message the failure description
    public EquivalenceEngineException(String message) {
        super(message);
    }

    /// Create an exception with a message and cause
    /// @param message the failure description
    /// @param cause the underlying cause
    public EquivalenceEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
