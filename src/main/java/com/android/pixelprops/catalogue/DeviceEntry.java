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

package com.android.pixelprops.catalogue;

import com.android.annotations.NonNull;
import com.android.annotations.Nullable;
import com.android.annotations.concurrency.Immutable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A device identity that can be spoofed.
 *
 * <p>The build properties are raw {@code android.os.Build} field overrides such as {@code BRAND},
 * {@code MODEL} or {@code FINGERPRINT}. The feature group is referenced by label and resolved
 * through the owning {@link DeviceCatalogue}; a label that matches no group simply resolves to no
 * features.
 */
@Immutable
public final class DeviceEntry {
    public static final String PROP_BRAND = "BRAND";
    public static final String PROP_MANUFACTURER = "MANUFACTURER";
    public static final String PROP_DEVICE = "DEVICE";
    public static final String PROP_PRODUCT = "PRODUCT";
    public static final String PROP_MODEL = "MODEL";
    public static final String PROP_FINGERPRINT = "FINGERPRINT";

    @NonNull private final String mDeviceName;
    @NonNull private final ImmutableMap<String, String> mProperties;
    @NonNull private final String mFeatureGroupLabel;
    @Nullable private final AndroidVersion mAndroidVersion;

    public DeviceEntry(
            @NonNull String deviceName,
            @NonNull Map<String, String> properties,
            @NonNull String featureGroupLabel,
            @Nullable AndroidVersion androidVersion) {
        mDeviceName = Preconditions.checkNotNull(deviceName);
        mProperties = ImmutableMap.copyOf(properties);
        mFeatureGroupLabel = Preconditions.checkNotNull(featureGroupLabel);
        mAndroidVersion = androidVersion;
    }

    /** Returns the name shown to the user, for example "Pixel 8 Pro". */
    @NonNull
    public String getDeviceName() {
        return mDeviceName;
    }

    /** Returns the build properties to spoof, keyed by {@code Build} field name. */
    @NonNull
    public ImmutableMap<String, String> getProperties() {
        return mProperties;
    }

    /**
     * Returns the label of the newest {@link FeatureGroup} this device expects. Every group up to
     * and including this one is spoofed.
     */
    @NonNull
    public String getFeatureGroupLabel() {
        return mFeatureGroupLabel;
    }

    /** Returns the Android release this device reports, if any. */
    @NonNull
    public Optional<AndroidVersion> getAndroidVersion() {
        return Optional.ofNullable(mAndroidVersion);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof DeviceEntry)) {
            return false;
        }

        DeviceEntry entry = (DeviceEntry) o;
        return Objects.equals(mDeviceName, entry.mDeviceName)
                && Objects.equals(mProperties, entry.mProperties)
                && Objects.equals(mFeatureGroupLabel, entry.mFeatureGroupLabel)
                && Objects.equals(mAndroidVersion, entry.mAndroidVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mDeviceName, mProperties, mFeatureGroupLabel, mAndroidVersion);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("deviceName", mDeviceName)
                .add("properties", mProperties)
                .add("featureGroupLabel", mFeatureGroupLabel)
                .add("androidVersion", mAndroidVersion)
                .toString();
    }
}
