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

public enum StringOption implements Option<String> {
    /** Name of the device to impersonate; unset means the catalogue default. */
    DEVICE_NAME("pixelprops.deviceName"),

    /** Label of an Android version reported instead of the device's own release. */
    ANDROID_VERSION("pixelprops.androidVersion"),
    ;

    @NonNull private final String propertyName;

    StringOption(@NonNull String propertyName) {
        this.propertyName = propertyName;
    }

    @Override
    @NonNull
    public String getPropertyName() {
        return propertyName;
    }

    @Override
    @Nullable
    public String getDefaultValue() {
        return null;
    }

    @Override
    @NonNull
    public String parse(@NonNull Object value) {
        if (value instanceof CharSequence || value instanceof Number) {
            return value.toString().trim();
        }
        throw new IllegalArgumentException(
                "Cannot parse property "
                        + propertyName
                        + "='"
                        + value
                        + "' of type '"
                        + value.getClass()
                        + "' as string.");
    }
}
