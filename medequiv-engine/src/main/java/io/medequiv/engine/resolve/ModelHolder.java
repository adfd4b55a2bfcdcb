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

import io.medequiv.engine.train.HomologationModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/// Publishes the current model to readers.
///
/// Publishing builds the resolver and its index first and then swaps a single
/// reference, so a reader sees either the old model or the new one, never a
/// mix. Callers that issue several queries against the same generation should
/// read [#resolver()] once and reuse it.
public final class ModelHolder {

    private static final Logger logger = LogManager.getLogger(ModelHolder.class);

    private final AtomicReference<EquivalenceResolver> current = new AtomicReference<>();

    /// @param model the model to publish
    /// @return the resolver now serving queries
    public EquivalenceResolver publish(HomologationModel model) {
        EquivalenceResolver resolver = new EquivalenceResolver(model);
        EquivalenceResolver previous = current.getAndSet(resolver);
        logger.info("published model generation {} (replaced {})", model.snapshot().generation(),
            previous == null ? "none" : previous.model().snapshot().generation());
        return resolver;
    }

    /// @return the resolver of the current model
    /// @throws IllegalStateException if nothing has been published
    public EquivalenceResolver resolver() {
        EquivalenceResolver resolver = current.get();
        if (resolver == null) {
            throw new IllegalStateException("no model has been published");
        }
        return resolver;
    }

    /// @return the current model, if any
    public Optional<HomologationModel> model() {
        return Optional.ofNullable(current.get()).map(EquivalenceResolver::model);
    }
}
