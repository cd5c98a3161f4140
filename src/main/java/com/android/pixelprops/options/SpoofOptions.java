/*
 * Copyright (C) 2024 The Android Open Source Project
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.android.pixelprops.options;

import com.android.annotations.NonNull;
import com.android.annotations.Nullable;
import com.android.annotations.concurrency.Immutable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * The user's spoofing selection, read from persisted preferences or any other flat property map.
 *
 * <p>Properties that do not name an option are ignored. A string option whose value is blank is
 * treated as unset.
 */
@Immutable
public final class SpoofOptions {

    private final ImmutableMap<BooleanOption, Boolean> booleanOptions;
    private final ImmutableMap<StringOption, String> stringOptions;
    private final ImmutableMap<StringListOption, ImmutableList<String>> stringListOptions;

    public SpoofOptions(@NonNull Map<String, ?> properties) {
        booleanOptions = readOptions(BooleanOption.values(), properties);
        stringOptions = readOptions(StringOption.values(), properties);
        stringListOptions = readOptions(StringListOption.values(), properties);
    }

    /** Returns options with every value at its default. */
    @NonNull
    public static SpoofOptions defaults() {
        return new SpoofOptions(ImmutableMap.of());
    }

    @NonNull
    public static SpoofOptions fromProperties(@NonNull Properties properties) {
        ImmutableMap.Builder<String, Object> map = ImmutableMap.builder();
        for (String name : properties.stringPropertyNames()) {
            map.put(name, properties.getProperty(name));
        }
        return new SpoofOptions(map.build());
    }

    @NonNull
    private static <OptionT extends Option<ValueT>, ValueT>
            ImmutableMap<OptionT, ValueT> readOptions(
                    @NonNull OptionT[] values, @NonNull Map<String, ?> properties) {
        Map<String, OptionT> optionLookup =
                Arrays.stream(values).collect(Collectors.toMap(Option::getPropertyName, v -> v));
        ImmutableMap.Builder<OptionT, ValueT> valuesBuilder = ImmutableMap.builder();
        for (Map.Entry<String, ?> property : properties.entrySet()) {
            OptionT option = optionLookup.get(property.getKey());
            if (option != null && property.getValue() != null) {
                ValueT value = option.parse(property.getValue());
                if (value instanceof String && ((String) value).isEmpty()) {
                    continue;
                }
                valuesBuilder.put(option, value);
            }
        }
        return valuesBuilder.build();
    }

    public boolean get(@NonNull BooleanOption option) {
        return booleanOptions.getOrDefault(option, option.getDefaultValue());
    }

    @Nullable
    public String get(@NonNull StringOption option) {
        return stringOptions.getOrDefault(option, option.getDefaultValue());
    }

    @Nullable
    public ImmutableList<String> get(@NonNull StringListOption option) {
        return stringListOptions.getOrDefault(option, option.getDefaultValue());
    }

    public ImmutableMap<BooleanOption, Boolean> getExplicitlySetBooleanOptions() {
        return booleanOptions;
    }

    public ImmutableMap<StringOption, String> getExplicitlySetStringOptions() {
        return stringOptions;
    }

    public ImmutableMap<StringListOption, ImmutableList<String>>
            getExplicitlySetStringListOptions() {
        return stringListOptions;
    }
}
