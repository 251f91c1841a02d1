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

package com.axonops.libonig.locale;

/**
 * POSIX bracket class names understood by {@link PosixClassExpander}.
 *
 * @since 1.0.0
 */
public enum PosixClass {
    DIGIT("digit"),
    ALPHA("alpha"),
    ALNUM("alnum"),
    SPACE("space"),
    UPPER("upper"),
    LOWER("lower"),
    PUNCT("punct"),
    XDIGIT("xdigit"),
    CNTRL("cntrl"),
    PRINT("print"),
    GRAPH("graph");

    private final String className;

    PosixClass(String className) {
        this.className = className;
    }

    /**
     * Name as written between {@code [:} and {@code :]}.
     */
    public String className() {
        return className;
    }

    /**
     * Looks up a class by its exact lower-case name.
     *
     * @return the class, or null when the name is not recognized
     */
    public static PosixClass forName(String name) {
        for (PosixClass c : values()) {
            if (c.className.equals(name)) {
                return c;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "[:" + className + ":]";
    }
}
