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

package com.android.pixelprops.spoof;

import com.android.annotations.NonNull;
import com.android.annotations.Nullable;
import com.android.annotations.concurrency.Immutable;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Objects;

/**
 * The values installed into the target application for one device selection.
 *
 * <p>{@link #getBuildProperties()} overrides {@code android.os.Build} fields,
 * {@link #getVersionFields()} overrides {@code android.os.Build.VERSION} fields and
 * {@link #getFeatureFlags()} lists the system features reported as present.
 */
@Immutable
public final class SpoofProfile {
    @NonNull private final String mDeviceName;
    @NonNull private final ImmutableMap<String, String> mBuildProperties;
    @NonNull private final ImmutableMap<String, Object> mVersionFields;
    @NonNull private final ImmutableSet<String> mFeatureFlags;

    public SpoofProfile(
            @NonNull String deviceName,
            @NonNull ImmutableMap<String, String> buildProperties,
            @NonNull ImmutableMap<String, Object> versionFields,
            @NonNull ImmutableSet<String> featureFlags) {
        mDeviceName = deviceName;
        mBuildProperties = buildProperties;
        mVersionFields = versionFields;
        mFeatureFlags = featureFlags;
    }

    /** Returns a profile that leaves the target application untouched. */
    @NonNull
    public static SpoofProfile empty(@NonNull String deviceName) {
        return new SpoofProfile(
                deviceName, ImmutableMap.of(), ImmutableMap.of(), ImmutableSet.of());
    }

    /** Returns the device name this profile was requested for. */
    @NonNull
    public String getDeviceName() {
        return mDeviceName;
    }

    @NonNull
    public ImmutableMap<String, String> getBuildProperties() {
        return mBuildProperties;
    }

    @NonNull
    public ImmutableMap<String, Object> getVersionFields() {
        return mVersionFields;
    }

    @NonNull
    public ImmutableSet<String> getFeatureFlags() {
        return mFeatureFlags;
    }

    /** Answers a feature-existence query such as {@code PackageManager#hasSystemFeature}. */
    public boolean hasFeature(@Nullable String name) {
        return name != null && mFeatureFlags.contains(name);
    }

    public boolean isEmpty() {
        return mBuildProperties.isEmpty() && mVersionFields.isEmpty() && mFeatureFlags.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof SpoofProfile)) {
            return false;
        }

        SpoofProfile profile = (SpoofProfile) o;
        return Objects.equals(mDeviceName, profile.mDeviceName)
                && Objects.equals(mBuildProperties, profile.mBuildProperties)
                && Objects.equals(mVersionFields, profile.mVersionFields)
                && Objects.equals(mFeatureFlags, profile.mFeatureFlags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mDeviceName, mBuildProperties, mVersionFields, mFeatureFlags);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("deviceName", mDeviceName)
                .add("buildProperties", mBuildProperties)
                .add("versionFields", mVersionFields)
                .add("featureFlags", mFeatureFlags)
                .toString();
    }
}
