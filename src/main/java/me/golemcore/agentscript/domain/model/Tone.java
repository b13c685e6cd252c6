package me.golemcore.agentscript.domain.model;

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

import java.util.Locale;

/**
 * Persona tone of the converted agent. Unknown or missing source values
 * resolve to {@link #NEUTRAL}.
 */
public enum Tone {

    CASUAL, FORMAL, NEUTRAL;

    public static Tone fromSource(String raw) {
        if (raw == null || raw.isBlank()) {
            return NEUTRAL;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (Tone tone : values()) {
            if (tone.name().equals(normalized)) {
                return tone;
            }
        }
        return NEUTRAL;
    }

    public static boolean isRecognized(String raw) {
        return raw != null && !raw.isBlank() && fromSource(raw).name().equalsIgnoreCase(raw.trim());
    }
}
