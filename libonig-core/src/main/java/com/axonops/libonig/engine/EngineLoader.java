/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.libonig.engine;

import com.axonops.libonig.api.EngineInitializationException;
import com.axonops.libonig.encoding.CodeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Brings engines up and down.
 *
 * <p>Initialization is idempotent. Explicit scopes ({@link #acquire}/{@link #release}) are
 * reference counted: the engine is torn down when the last scope that initialized it closes.
 * An engine initialized lazily by {@link #ensureInitialized} stays up.
 */
public final class EngineLoader {
    private static final Logger logger = LoggerFactory.getLogger(EngineLoader.class);

    private static final Map<OnigEngine, ScopeState> scopes = new IdentityHashMap<>();

    private EngineLoader() {
        // Utility class
    }

    /**
     * Initializes the engine for all code units unless it is already up.
     *
     * @throws EngineInitializationException if the engine fails to initialize
     */
    public static void ensureInitialized(OnigEngine engine) {
        if (engine.isInitialized()) {
            return;
        }
        synchronized (EngineLoader.class) {
            if (engine.isInitialized()) {
                return;
            }
            logger.debug("Onig: Initializing engine lazily");
            initialize(engine, EnumSet.allOf(CodeUnit.class));
        }
    }

    /**
     * Opens an initialization scope.
     *
     * @param codeUnits units to prepare; empty means all
     */
    public static synchronized void acquire(OnigEngine engine, Set<CodeUnit> codeUnits) {
        ScopeState state = scopes.computeIfAbsent(engine, e -> new ScopeState());
        if (state.depth == 0 && !engine.isInitialized()) {
            initialize(engine, codeUnits);
            state.ownsEngine = true;
        }
        state.depth++;
        logger.trace("Onig: Engine scope opened, depth {}", state.depth);
    }

    /**
     * Closes a scope opened by {@link #acquire}.
     */
    public static synchronized void release(OnigEngine engine) {
        ScopeState state = scopes.get(engine);
        if (state == null || state.depth == 0) {
            logger.error("Onig: Engine scope released more times than acquired");
            return;
        }
        state.depth--;
        logger.trace("Onig: Engine scope closed, depth {}", state.depth);
        if (state.depth == 0) {
            scopes.remove(engine);
            if (state.ownsEngine) {
                engine.teardown();
            }
        }
    }

    /**
     * Current scope nesting for the engine.
     */
    public static synchronized int scopeDepth(OnigEngine engine) {
        ScopeState state = scopes.get(engine);
        return state == null ? 0 : state.depth;
    }

    private static void initialize(OnigEngine engine, Set<CodeUnit> codeUnits) {
        try {
            engine.initialize(codeUnits);
        } catch (RuntimeException e) {
            logger.error("Onig: Failed to initialize engine", e);
            throw new EngineInitializationException("Failed to initialize engine: " + e.getMessage(), e);
        }
        if (!engine.isInitialized()) {
            throw new EngineInitializationException("Engine reported not initialized after initialize()");
        }
    }

    private static final class ScopeState {
        private int depth;
        private boolean ownsEngine;
    }
}
