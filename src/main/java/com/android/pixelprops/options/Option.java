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

/** A typed setting read from a flat property map. */
public interface Option<T> {

    @NonNull
    String getPropertyName();

    @Nullable
    T getDefaultValue();

    /**
     * Converts a raw property value to the option's type.
     *
     * @throws IllegalArgumentException if the value cannot be converted
     */
    @NonNull
    T parse(@NonNull Object value);
}
