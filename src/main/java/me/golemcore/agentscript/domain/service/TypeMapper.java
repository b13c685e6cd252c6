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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentscript.domain.model.ConversionRules;
import me.golemcore.agentscript.domain.model.MappedType;
import me.golemcore.agentscript.domain.model.PropertyDescriptor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps source property types to the target type vocabulary and computes the
 * {@code complex_data_type_name} annotation.
 *
 * <p>
 * Annotation precedence: {@code list[object]} always gets the record info
 * type; {@code object} gets the source hint, else the record info type;
 * primitives come from the primitive table; anything else has none.
 */
@Component
@Slf4j
public class TypeMapper {

    private static final String OBJECT = "object";
    private static final String ARRAY = "array";
    private static final String LIST_OF_OBJECT = "list[object]";
    private static final Pattern LIST_TYPE = Pattern.compile("^list\\[(.+)]$");

    public MappedType map(PropertyDescriptor descriptor, ConversionRules rules) {
        String type = resolve(descriptor, rules.getTypeMappings(), rules.getComplexTypeNames(), false);
        String hint = descriptor != null ? descriptor.complexTypeHint() : null;
        return new MappedType(type, complexTypeName(type, hint, rules.getComplexTypeNames()));
    }

    String complexTypeName(String type, String hint, ConversionRules.ComplexTypeNames names) {
        if (LIST_OF_OBJECT.equals(type)) {
            return names.getRecordInfo();
        }
        if (OBJECT.equals(type)) {
            return hint != null && !hint.isBlank() ? hint : names.getRecordInfo();
        }
        return names.getPrimitive().get(type);
    }

    private String resolve(PropertyDescriptor descriptor, ConversionRules.TypeMappings mappings,
            ConversionRules.ComplexTypeNames names, boolean item) {
        if (descriptor == null || descriptor.type() == null || descriptor.type().isBlank()) {
            return OBJECT;
        }
        if (names.getRichText().equals(descriptor.complexTypeHint())) {
            return OBJECT;
        }
        String raw = descriptor.type().trim().toLowerCase(Locale.ROOT);
        Matcher list = LIST_TYPE.matcher(raw);
        if (list.matches()) {
            return item ? OBJECT : "list[" + resolve(PropertyDescriptor.of(list.group(1)), mappings, names, true) + "]";
        }
        if (ARRAY.equals(raw)) {
            return item ? OBJECT : "list[" + resolve(descriptor.items(), mappings, names, true) + "]";
        }
        if (OBJECT.equals(raw)) {
            return OBJECT;
        }
        String primitive = mappings.getPrimitive().get(raw);
        if (primitive != null) {
            return primitive;
        }
        log.debug("[TypeMapper] Unrecognized type '{}', using {}", descriptor.type(), mappings.getDefaultType());
        return mappings.getDefaultType();
    }
}
