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

import com.axonops.libonig.api.ErrorType;
import org.joni.exception.ErrorMessages;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies Joni and jcodings compile errors by their message text. The engine formats named
 * values into messages at {@code %n}, so each template matches on the text around it.
 */
final class JoniErrorTypes {

    private static final String PLACEHOLDER = "%n";
    private static final List<Template> TEMPLATES = new ArrayList<>();

    static {
        map(ErrorType.CTYPE,
            ErrorMessages.INVALID_POSIX_BRACKET_TYPE,
            ErrorMessages.ERR_INVALID_CHAR_PROPERTY_NAME);
        map(ErrorType.ESCAPE,
            ErrorMessages.END_PATTERN_AT_ESCAPE,
            ErrorMessages.END_PATTERN_AT_META,
            ErrorMessages.END_PATTERN_AT_CONTROL,
            ErrorMessages.META_CODE_SYNTAX,
            ErrorMessages.CONTROL_CODE_SYNTAX,
            ErrorMessages.TOO_SHORT_DIGITS,
            ErrorMessages.INVALID_WIDE_CHAR_VALUE,
            ErrorMessages.TOO_SHORT_MULTI_BYTE_STRING,
            ErrorMessages.PROPERTY_NAME_NEVER_TERMINATED,
            ErrorMessages.TOO_BIG_SB_CHAR_VALUE,
            ErrorMessages.ERR_TOO_BIG_WIDE_CHAR_VALUE,
            ErrorMessages.ERR_TOO_LONG_WIDE_CHAR_VALUE,
            ErrorMessages.ERR_INVALID_CODE_POINT_VALUE);
        map(ErrorType.BACKREF,
            ErrorMessages.TOO_BIG_BACKREF_NUMBER,
            ErrorMessages.INVALID_BACKREF,
            ErrorMessages.NUMBERED_BACKREF_OR_CALL_NOT_ALLOWED,
            ErrorMessages.UNDEFINED_NAME_REFERENCE,
            ErrorMessages.UNDEFINED_GROUP_REFERENCE,
            ErrorMessages.MULTIPLEX_DEFINITION_NAME_CALL);
        map(ErrorType.BRACK,
            ErrorMessages.END_PATTERN_AT_LEFT_BRACKET,
            ErrorMessages.PREMATURE_END_OF_CHAR_CLASS,
            ErrorMessages.EMPTY_CHAR_CLASS);
        map(ErrorType.PAREN,
            ErrorMessages.UNMATCHED_CLOSE_PARENTHESIS,
            ErrorMessages.END_PATTERN_WITH_UNMATCHED_PARENTHESIS,
            ErrorMessages.END_PATTERN_IN_GROUP);
        map(ErrorType.RANGE,
            ErrorMessages.CHAR_CLASS_VALUE_AT_END_OF_RANGE,
            ErrorMessages.CHAR_CLASS_VALUE_AT_START_OF_RANGE,
            ErrorMessages.UNMATCHED_RANGE_SPECIFIER_IN_CHAR_CLASS,
            ErrorMessages.EMPTY_RANGE_IN_CHAR_CLASS,
            ErrorMessages.MISMATCH_CODE_LENGTH_IN_CLASS_RANGE);
        map(ErrorType.BADREPEAT,
            ErrorMessages.TARGET_OF_REPEAT_OPERATOR_NOT_SPECIFIED,
            ErrorMessages.TARGET_OF_REPEAT_OPERATOR_INVALID,
            ErrorMessages.NESTED_REPEAT_NOT_ALLOWED,
            ErrorMessages.NESTED_REPEAT_OPERATOR);
        map(ErrorType.BADBRACE,
            ErrorMessages.END_PATTERN_AT_LEFT_BRACE,
            ErrorMessages.INVALID_REPEAT_RANGE_PATTERN,
            ErrorMessages.TOO_BIG_NUMBER_FOR_REPEAT_RANGE,
            ErrorMessages.UPPER_SMALLER_THAN_LOWER_IN_REPEAT_RANGE);
        map(ErrorType.COMPLEXITY,
            ErrorMessages.TOO_MANY_CAPTURE_GROUPS,
            ErrorMessages.TOO_MANY_MULTI_BYTE_RANGES,
            ErrorMessages.TOO_BIG_NUMBER,
            ErrorMessages.NEVER_ENDING_RECURSION,
            ErrorMessages.GROUP_NUMBER_OVER_FOR_CAPTURE_HISTORY,
            ErrorMessages.OVER_THREAD_PASS_LIMIT_COUNT);
    }

    private JoniErrorTypes() {
    }

    private static void map(ErrorType type, String... messages) {
        for (String message : messages) {
            TEMPLATES.add(new Template(message, type));
        }
    }

    /**
     * Category of an engine compile error message; {@link ErrorType#BADPATTERN} when unknown.
     */
    static ErrorType classify(String message) {
        if (message == null) {
            return ErrorType.BADPATTERN;
        }
        for (Template template : TEMPLATES) {
            if (template.matches(message)) {
                return template.type;
            }
        }
        return ErrorType.BADPATTERN;
    }

    private static final class Template {
        final String head;
        final String tail;
        final boolean exact;
        final ErrorType type;

        Template(String message, ErrorType type) {
            int at = message.indexOf(PLACEHOLDER);
            this.exact = at < 0;
            this.head = exact ? message : message.substring(0, at);
            this.tail = exact ? "" : message.substring(at + PLACEHOLDER.length());
            this.type = type;
        }

        boolean matches(String message) {
            if (exact) {
                return message.equals(head);
            }
            return message.length() >= head.length() + tail.length()
                && message.startsWith(head) && message.endsWith(tail);
        }
    }
}
