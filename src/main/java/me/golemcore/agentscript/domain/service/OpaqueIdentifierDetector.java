package me.golemcore.agentscript.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Tells vendor record ids apart from human-readable API names.
 *
 * <p>
 * A token is a record id when it is 15 or 18 ASCII alphanumeric characters
 * and either starts with a digit or contains three consecutive digits. A
 * token with an underscore or a space is always a readable name.
 */
@Component
public class OpaqueIdentifierDetector {

    private static final Pattern ALPHANUMERIC = Pattern.compile("[A-Za-z0-9]+");
    private static final Pattern DIGIT_RUN = Pattern.compile("\\d{3,}");

    public boolean isOpaque(String token) {
        if (token == null) {
            return false;
        }
        int length = token.length();
        if (length != 15 && length != 18) {
            return false;
        }
        if (!ALPHANUMERIC.matcher(token).matches()) {
            return false;
        }
        return Character.isDigit(token.charAt(0)) || DIGIT_RUN.matcher(token).find();
    }

    public boolean isReadable(String token) {
        return token != null && (token.indexOf('_') >= 0 || token.indexOf(' ') >= 0);
    }

    /**
     * Whether a raw action source may be emitted as the action's
     * {@code source} field.
     */
    public boolean isPublishableSource(String token) {
        return isReadable(token) && !isOpaque(token);
    }
}
