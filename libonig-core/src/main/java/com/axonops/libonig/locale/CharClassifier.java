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

import java.util.Locale;
import java.util.Objects;

/**
 * Locale character classification used to expand POSIX bracket classes.
 *
 * @since 1.0.0
 */
public interface CharClassifier {

    /**
     * Whether the code point belongs to the class in this locale.
     */
    boolean is(PosixClass posixClass, int codePoint);

    /**
     * Classifier for a locale. {@link Locale#ROOT} classifies like the C locale (ASCII only);
     * every other locale uses Unicode properties from {@link Character}.
     */
    static CharClassifier forLocale(Locale locale) {
        Objects.requireNonNull(locale, "locale cannot be null");
        return Locale.ROOT.equals(locale) ? AsciiClassifier.INSTANCE : UnicodeClassifier.INSTANCE;
    }

    /**
     * C-locale classification.
     */
    enum AsciiClassifier implements CharClassifier {
        INSTANCE;

        @Override
        public boolean is(PosixClass posixClass, int c) {
            if (c < 0 || c > 0x7F) {
                return false;
            }
            return switch (posixClass) {
                case DIGIT -> c >= '0' && c <= '9';
                case UPPER -> c >= 'A' && c <= 'Z';
                case LOWER -> c >= 'a' && c <= 'z';
                case ALPHA -> is(PosixClass.UPPER, c) || is(PosixClass.LOWER, c);
                case ALNUM -> is(PosixClass.ALPHA, c) || is(PosixClass.DIGIT, c);
                case SPACE -> c == ' ' || (c >= '\t' && c <= '\r');
                case XDIGIT -> is(PosixClass.DIGIT, c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
                case CNTRL -> c < 0x20 || c == 0x7F;
                case PRINT -> c >= 0x20 && c < 0x7F;
                case GRAPH -> c > 0x20 && c < 0x7F;
                case PUNCT -> is(PosixClass.GRAPH, c) && !is(PosixClass.ALNUM, c);
            };
        }
    }

    /**
     * Unicode classification through {@link Character}.
     */
    enum UnicodeClassifier implements CharClassifier {
        INSTANCE;

        @Override
        public boolean is(PosixClass posixClass, int c) {
            if (!Character.isValidCodePoint(c)) {
                return false;
            }
            return switch (posixClass) {
                case DIGIT -> c >= '0' && c <= '9';
                case UPPER -> Character.isUpperCase(c);
                case LOWER -> Character.isLowerCase(c);
                case ALPHA -> Character.isLetter(c);
                case ALNUM -> Character.isLetterOrDigit(c);
                case SPACE -> Character.isWhitespace(c) || Character.isSpaceChar(c);
                case XDIGIT -> AsciiClassifier.INSTANCE.is(PosixClass.XDIGIT, c);
                case CNTRL -> Character.isISOControl(c);
                case GRAPH -> Character.isDefined(c) && !Character.isISOControl(c)
                    && !Character.isWhitespace(c) && !Character.isSpaceChar(c);
                case PRINT -> is(PosixClass.GRAPH, c) || Character.isSpaceChar(c);
                case PUNCT -> is(PosixClass.GRAPH, c) && !Character.isLetterOrDigit(c);
            };
        }
    }
}
