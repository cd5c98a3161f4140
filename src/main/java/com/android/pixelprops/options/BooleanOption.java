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

public enum BooleanOption implements Option<Boolean> {
    SPOOF_BUILD_PROPS("pixelprops.spoofBuildProps", true),
    SPOOF_ANDROID_VERSION("pixelprops.spoofAndroidVersion", true),
    SPOOF_FEATURE_FLAGS("pixelprops.spoofFeatureFlags", true),
    VERBOSE_LOGGING("pixelprops.verboseLogging", false),
    ;

    @NonNull private final String propertyName;
    private final boolean defaultValue;

    BooleanOption(@NonNull String propertyName, boolean defaultValue) {
        this.propertyName = propertyName;
        this.defaultValue = defaultValue;
    }

    @Override
    @NonNull
    public String getPropertyName() {
        return propertyName;
    }

    @Override
    @NonNull
    public Boolean getDefaultValue() {
        return defaultValue;
    }

    @Override
    @NonNull
    public Boolean parse(@NonNull Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof CharSequence) {
            String str = value.toString().trim();
            if ("true".equalsIgnoreCase(str)) {
                return true;
            }
            if ("false".equalsIgnoreCase(str)) {
                return false;
            }
        }
        throw new IllegalArgumentException(
                "Cannot parse property "
                        + propertyName
                        + "='"
                        + value
                        + "' of type '"
                        + value.getClass()
                        + "' as boolean.");
    }
}
