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

/**
 * Type information of one source schema property, as needed for type
 * mapping.
 *
 * @param type
 *            declared source type, may be {@code null}
 * @param items
 *            item descriptor for array types, may be {@code null}
 * @param complexTypeHint
 *            explicit complex type name supplied by the source, may be
 *            {@code null}
 */
public record PropertyDescriptor(String type, PropertyDescriptor items, String complexTypeHint) {

    public static PropertyDescriptor of(String type) {
        return new PropertyDescriptor(type, null, null);
    }
}
