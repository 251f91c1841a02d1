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

import com.axonops.libonig.api.PatternCompilationException;
import com.axonops.libonig.encoding.CodeUnit;
import com.axonops.libonig.encoding.EngineBuffer;
import org.jcodings.exception.JCodingsException;
import org.joni.Matcher;
import org.joni.Option;
import org.joni.Regex;
import org.joni.Region;
import org.joni.Syntax;
import org.joni.exception.JOniException;
import org.joni.exception.SyntaxException;
import org.joni.exception.ValueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Production engine backed by Joni.
 *
 * <p>Compiled patterns are plain Java objects; {@link #free(EngineHandle)} only marks the handle
 * so later use is rejected.</p>
 */
public enum JoniEngine implements OnigEngine {
    INSTANCE;

    private static final Logger logger = LoggerFactory.getLogger(JoniEngine.class);

    private volatile Set<CodeUnit> initializedUnits = Collections.emptySet();

    @Override
    public synchronized void initialize(Set<CodeUnit> codeUnits) {
        Set<CodeUnit> units = codeUnits.isEmpty() ? EnumSet.allOf(CodeUnit.class) : EnumSet.copyOf(codeUnits);
        for (CodeUnit unit : units) {
            // forces the encoding tables to load
            logger.debug("Onig: Preparing encoding {} for {} units", unit.engineEncoding(), unit);
        }
        initializedUnits = Collections.unmodifiableSet(units);
        logger.info("Onig: Engine initialized: {} for {}", version(), units);
    }

    @Override
    public synchronized void teardown() {
        initializedUnits = Collections.emptySet();
        logger.info("Onig: Engine torn down");
    }

    @Override
    public boolean isInitialized() {
        return !initializedUnits.isEmpty();
    }

    @Override
    public EngineHandle compile(byte[] pattern, Set<EngineOption> options, SyntaxFamily syntax, CodeUnit codeUnit) {
        try {
            Regex regex = new Regex(pattern, 0, pattern.length, compileOptions(options),
                codeUnit.engineEncoding(), syntaxFor(syntax));
            return new JoniHandle(regex, codeUnit);
        } catch (ValueException e) {
            throw new PatternCompilationException(ERR_INVALID_VALUE, JoniErrorTypes.classify(e.getMessage()), e.getMessage());
        } catch (SyntaxException e) {
            throw new PatternCompilationException(ERR_SYNTAX, JoniErrorTypes.classify(e.getMessage()), e.getMessage());
        } catch (JOniException | JCodingsException e) {
            throw new PatternCompilationException(ERR_INVALID_VALUE, JoniErrorTypes.classify(e.getMessage()), e.getMessage());
        }
    }

    @Override
    public void free(EngineHandle handle) {
        unwrap(handle).freed = true;
    }

    @Override
    public int captureCount(EngineHandle handle) {
        return unwrap(handle).regex.numberOfCaptures();
    }

    @Override
    public int nameToIndex(EngineHandle handle, byte[] name) {
        Regex regex = unwrap(handle).regex;
        if (regex.numberOfNames() == 0) {
            return -1;
        }
        try {
            return regex.nameToBackrefNumber(name, 0, name.length, null);
        } catch (JOniException e) {
            return -1;
        }
    }

    @Override
    public int search(EngineHandle handle, EngineBuffer buffer, int windowBegin, int windowEnd,
                      Set<EngineOption> options, EngineRegion region) {
        Matcher matcher = unwrap(handle).regex.matcher(buffer.bytes(), buffer.offset(), buffer.end());
        int result;
        try {
            result = matcher.search(buffer.offset() + windowBegin, buffer.offset() + windowEnd, searchOptions(options));
        } catch (JOniException e) {
            return ERR_INTERNAL;
        }
        if (result < 0) {
            region.clear();
            return MISMATCH;
        }
        copyRegion(matcher, region);
        return result;
    }

    @Override
    public int match(EngineHandle handle, EngineBuffer buffer, int at, Set<EngineOption> options, EngineRegion region) {
        Matcher matcher = unwrap(handle).regex.matcher(buffer.bytes(), buffer.offset(), buffer.end());
        int result;
        try {
            result = matcher.match(buffer.offset() + at, buffer.end(), searchOptions(options));
        } catch (JOniException e) {
            return ERR_INTERNAL;
        }
        if (result < 0) {
            region.clear();
            return MISMATCH;
        }
        copyRegion(matcher, region);
        return result;
    }

    @Override
    public String errorMessage(int code) {
        return switch (code) {
            case MISMATCH -> "mismatch";
            case ERR_INTERRUPTED -> "match interrupted";
            case ERR_INTERNAL -> "internal engine error";
            case ERR_SYNTAX -> "invalid pattern syntax";
            case ERR_INVALID_VALUE -> "invalid value in pattern";
            default -> "unknown engine error " + code;
        };
    }

    @Override
    public String version() {
        String version = Regex.class.getPackage().getImplementationVersion();
        return "joni " + (version != null ? version : "(unknown version)");
    }

    private static void copyRegion(Matcher matcher, EngineRegion region) {
        Region joniRegion = matcher.getRegion();
        if (joniRegion == null) {
            region.set(matcher.getBegin(), matcher.getEnd());
        } else {
            region.set(joniRegion.numRegs, joniRegion.beg.clone(), joniRegion.end.clone());
        }
    }

    private static JoniHandle unwrap(EngineHandle handle) {
        if (!(handle instanceof JoniHandle joniHandle)) {
            throw new IllegalArgumentException("Onig: Handle was not created by this engine: " + handle);
        }
        if (joniHandle.freed) {
            throw new IllegalStateException("Onig: Pattern handle has been freed");
        }
        return joniHandle;
    }

    private static int compileOptions(Set<EngineOption> options) {
        int flags = Option.NONE;
        for (EngineOption option : options) {
            flags |= switch (option) {
                case IGNORE_CASE -> Option.IGNORECASE;
                case EXTEND -> Option.EXTEND;
                case DOT_ALL -> Option.MULTILINE;
                case SINGLE_LINE -> Option.SINGLELINE;
                case NEGATE_SINGLE_LINE -> Option.NEGATE_SINGLELINE;
                case DONT_CAPTURE_GROUP -> Option.DONT_CAPTURE_GROUP;
                case NOT_BOL, NOT_EOL -> Option.NONE;
            };
        }
        return flags;
    }

    private static int searchOptions(Set<EngineOption> options) {
        int flags = Option.NONE;
        if (options.contains(EngineOption.NOT_BOL)) {
            flags |= Option.NOTBOL;
        }
        if (options.contains(EngineOption.NOT_EOL)) {
            flags |= Option.NOTEOL;
        }
        return flags;
    }

    private static Syntax syntaxFor(SyntaxFamily family) {
        return switch (family) {
            case POSIX_BASIC -> Syntax.PosixBasic;
            case POSIX_EXTENDED -> Syntax.PosixExtended;
            case GREP -> Syntax.Grep;
            case NATIVE -> Syntax.RUBY;
        };
    }

    private static final class JoniHandle implements EngineHandle {
        private final Regex regex;
        private final CodeUnit codeUnit;
        private volatile boolean freed;

        JoniHandle(Regex regex, CodeUnit codeUnit) {
            this.regex = regex;
            this.codeUnit = codeUnit;
        }

        @Override
        public CodeUnit codeUnit() {
            return codeUnit;
        }

        @Override
        public boolean isFreed() {
            return freed;
        }

        @Override
        public String toString() {
            return "JoniHandle{" + codeUnit + ", captures=" + regex.numberOfCaptures() + ", freed=" + freed + "}";
        }
    }
}
