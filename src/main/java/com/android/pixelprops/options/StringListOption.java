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
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

public enum StringListOption implements Option<ImmutableList<String>> {
    /**
     * Labels of the feature groups to spoof, comma separated. Unset means every group up to the
     * one the selected device expects.
     */
    FEATURE_GROUPS("pixelprops.featureGroups"),
    ;

    private static final Splitter SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    @NonNull private final String propertyName;

    StringListOption(@NonNull String propertyName) {
        this.propertyName = propertyName;
    }

    @Override
    @NonNull
    public String getPropertyName() {
        return propertyName;
    }

    @Override
    @Nullable
    public ImmutableList<String> getDefaultValue() {
        return null;
    }

    @Override
    @NonNull
    public ImmutableList<String> parse(@NonNull Object value) {
        if (value instanceof CharSequence) {
            return ImmutableList.copyOf(SPLITTER.split((CharSequence) value));
        }
        if (value instanceof Iterable) {
            ImmutableList.Builder<String> builder = ImmutableList.builder();
            for (Object item : (Iterable<?>) value) {
                String str = String.valueOf(item).trim();
                if (!str.isEmpty()) {
                    builder.add(str);
                }
            }
            return builder.build();
        }
        throw new IllegalArgumentException(
                "Cannot parse property "
                        + propertyName
                        + "='"
                        + value
                        + "' of type '"
                        + value.getClass()
                        + "' as a list of strings.");
    }
}
