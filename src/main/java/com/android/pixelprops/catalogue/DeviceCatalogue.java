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
import com.android.utils.ILogger;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The tables of Android versions, feature groups and devices that can be spoofed.
 *
 * <p>Every table keeps the order its entries were added in, and that order is the release
 * chronology: a feature group added later belongs to a newer Pixel generation. "All features up to
 * X" is therefore computed from table positions, never from the labels themselves.
 *
 * <p>Lookups never fail. A label or name that matches nothing yields an empty {@link Optional} or
 * an empty collection, which callers must treat as a normal outcome (the {@link #NONE} device has
 * neither a version nor features).
 *
 * <p>Instances are created through {@link Builder} and are never modified afterwards, so they can
 * be shared between threads without synchronization.
 */
@Immutable
public final class DeviceCatalogue {

    /** Name of the sentinel device meaning "do not spoof", and of its feature group. */
    public static final String NONE = "None";

    @NonNull private final ImmutableList<AndroidVersion> mVersions;
    @NonNull private final ImmutableList<FeatureGroup> mFeatureGroups;
    @NonNull private final ImmutableList<DeviceEntry> mDevices;
    @NonNull private final String mDefaultDeviceName;
    @NonNull private final ImmutableList<FeatureGroup> mDefaultFeatures;

    private DeviceCatalogue(@NonNull Builder builder) {
        mVersions = builder.mVersions.build();
        mFeatureGroups = builder.mFeatureGroups.build();
        mDevices = builder.mDevices.build();
        mDefaultDeviceName = builder.mDefaultDeviceName;
        mDefaultFeatures =
                getDevice(mDefaultDeviceName)
                        .map(device -> getFeatureGroupsUpTo(device.getFeatureGroupLabel()))
                        .orElse(ImmutableList.of());
    }

    @NonNull
    public static Builder builder(@NonNull ILogger logger) {
        return new Builder(logger);
    }

    /** Returns all Android versions, oldest first. */
    @NonNull
    public ImmutableList<AndroidVersion> getVersions() {
        return mVersions;
    }

    /** Returns all feature groups, oldest first. */
    @NonNull
    public ImmutableList<FeatureGroup> getFeatureGroups() {
        return mFeatureGroups;
    }

    /** Returns all devices in the order they are offered to the user. */
    @NonNull
    public ImmutableList<DeviceEntry> getDevices() {
        return mDevices;
    }

    /** Returns the device names in the order they are offered to the user. */
    @NonNull
    public ImmutableList<String> getDeviceNames() {
        ImmutableList.Builder<String> names = ImmutableList.builder();
        for (DeviceEntry device : mDevices) {
            names.add(device.getDeviceName());
        }
        return names.build();
    }

    /** Returns the version with the given label. The comparison is exact and case-sensitive. */
    @NonNull
    public Optional<AndroidVersion> getVersion(@Nullable String label) {
        for (AndroidVersion version : mVersions) {
            if (version.getLabel().equals(label)) {
                return Optional.of(version);
            }
        }
        return Optional.empty();
    }

    /** Returns the device with the given name. A {@code null} name matches nothing. */
    @NonNull
    public Optional<DeviceEntry> getDevice(@Nullable String deviceName) {
        for (DeviceEntry device : mDevices) {
            if (device.getDeviceName().equals(deviceName)) {
                return Optional.of(device);
            }
        }
        return Optional.empty();
    }

    /** Returns the feature group with the given label. */
    @NonNull
    public Optional<FeatureGroup> getFeatureGroup(@Nullable String label) {
        int index = indexOfFeatureGroup(label);
        return index == -1 ? Optional.empty() : Optional.of(mFeatureGroups.get(index));
    }

    /**
     * Returns every feature group from the oldest one up to and including {@code label}.
     *
     * <p>For example with groups "Pixel 2016" to "Pixel 2023", asking for "Pixel 2020" returns the
     * groups from index 0 to the index of "Pixel 2020", both inclusive. An unknown label returns an
     * empty list.
     */
    @NonNull
    public ImmutableList<FeatureGroup> getFeatureGroupsUpTo(@Nullable String label) {
        int levelIndex = indexOfFeatureGroup(label);
        if (levelIndex == -1) {
            return ImmutableList.of();
        }
        return mFeatureGroups.subList(0, levelIndex + 1);
    }

    /**
     * Returns the labels of the feature groups the given device expects, oldest first. These are
     * the toggles the user sees and what gets persisted as the selection.
     */
    @NonNull
    public ImmutableList<String> getFeatureGroupLabelsUpToDevice(@Nullable String deviceName) {
        ImmutableList.Builder<String> labels = ImmutableList.builder();
        for (FeatureGroup group : getFeatureGroupsUpToDevice(deviceName)) {
            labels.add(group.getLabel());
        }
        return labels.build();
    }

    /**
     * Returns the flags of every feature group up to the one the given device expects. Unknown
     * devices, and devices whose group does not resolve, have no features.
     */
    @NonNull
    public ImmutableSet<String> getFeaturesUpToDevice(@Nullable String deviceName) {
        ImmutableSet.Builder<String> features = ImmutableSet.builder();
        for (FeatureGroup group : getFeatureGroupsUpToDevice(deviceName)) {
            features.addAll(group.getFlags());
        }
        return features.build();
    }

    /** Returns the name of the device selected when the user has not chosen one. */
    @NonNull
    public String getDefaultDeviceName() {
        return mDefaultDeviceName;
    }

    /** Returns the feature groups expected by {@link #getDefaultDeviceName()}. */
    @NonNull
    public ImmutableList<FeatureGroup> getDefaultFeatures() {
        return mDefaultFeatures;
    }

    @NonNull
    private ImmutableList<FeatureGroup> getFeatureGroupsUpToDevice(@Nullable String deviceName) {
        return getDevice(deviceName)
                .map(device -> getFeatureGroupsUpTo(device.getFeatureGroupLabel()))
                .orElse(ImmutableList.of());
    }

    private int indexOfFeatureGroup(@Nullable String label) {
        for (int i = 0; i < mFeatureGroups.size(); i++) {
            if (mFeatureGroups.get(i).getLabel().equals(label)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Collects the catalogue tables. Entries must be added in release order; each table rejects a
     * label (or device name) that it already holds.
     */
    public static final class Builder {
        @NonNull private final ILogger mLog;

        private final ImmutableList.Builder<AndroidVersion> mVersions = ImmutableList.builder();
        private final ImmutableList.Builder<FeatureGroup> mFeatureGroups = ImmutableList.builder();
        private final ImmutableList.Builder<DeviceEntry> mDevices = ImmutableList.builder();

        private final Set<String> mVersionLabels = new HashSet<>();
        private final Set<String> mFeatureGroupLabels = new HashSet<>();
        private final Set<String> mDeviceNames = new HashSet<>();

        @NonNull private String mDefaultDeviceName = NONE;

        private Builder(@NonNull ILogger log) {
            mLog = Preconditions.checkNotNull(log);
        }

        @NonNull
        public Builder addVersion(@NonNull AndroidVersion version) {
            Preconditions.checkArgument(
                    mVersionLabels.add(version.getLabel()),
                    "Duplicate Android version %s",
                    version.getLabel());
            mVersions.add(version);
            return this;
        }

        @NonNull
        public Builder addVersions(@NonNull List<AndroidVersion> versions) {
            for (AndroidVersion version : versions) {
                addVersion(version);
            }
            return this;
        }

        @NonNull
        public Builder addFeatureGroup(@NonNull FeatureGroup group) {
            Preconditions.checkArgument(
                    mFeatureGroupLabels.add(group.getLabel()),
                    "Duplicate feature group %s",
                    group.getLabel());
            mFeatureGroups.add(group);
            return this;
        }

        @NonNull
        public Builder addDevice(@NonNull DeviceEntry device) {
            Preconditions.checkArgument(
                    mDeviceNames.add(device.getDeviceName()),
                    "Duplicate device %s",
                    device.getDeviceName());
            mDevices.add(device);
            return this;
        }

        @NonNull
        public Builder setDefaultDeviceName(@NonNull String deviceName) {
            mDefaultDeviceName = Preconditions.checkNotNull(deviceName);
            return this;
        }

        /**
         * Creates the catalogue. References that do not resolve are reported as warnings but are
         * kept; lookups through them degrade to empty results.
         */
        @NonNull
        public DeviceCatalogue build() {
            DeviceCatalogue catalogue = new DeviceCatalogue(this);
            for (String issue : CatalogueValidator.validate(catalogue)) {
                mLog.warning("%s", issue);
            }
            mLog.verbose(
                    "Catalogue created with %1$d devices, %2$d feature groups, %3$d versions",
                    catalogue.mDevices.size(),
                    catalogue.mFeatureGroups.size(),
                    catalogue.mVersions.size());
            return catalogue;
        }
    }
}
