package io.medequiv.engine.resolve;

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

/// Thrown when a query subject has no place in the model: an unknown CUM, a
/// record excluded from training, or an ad-hoc record that cannot be encoded.
public class UnresolvableQueryException extends EquivalenceEngineException {

    private final String cum;

    /// @param cum the query CUM, may be null for vector queries
    /// @param reason why the query cannot be answered
    public UnresolvableQueryException(String cum, String reason) {
        super("cannot resolve " + cum + ": " + reason);
        this.cum = cum;
    }

    /// @param cum the query CUM
    /// @param reason why the query cannot be answered
    /// @param cause the underlying failure
    public UnresolvableQueryException(String cum, String reason, Throwable cause) {
        super("cannot resolve " + cum + ": " + reason, cause);
        this.cum = cum;
    }

    /// @return the query CUM
    public String cum() {
        return cum;
    }
}
