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

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Ordered fallback over optional text values: the first non-blank candidate
 * wins.
 */
public final class FirstPresent {

    private FirstPresent() {
    }

    public static Optional<String> of(String... candidates) {
        return of(Arrays.asList(candidates));
    }

    public static Optional<String> of(List<String> candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public static String orElse(String fallback, String... candidates) {
        return of(candidates).orElse(fallback);
    }
}
