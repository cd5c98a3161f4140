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
import com.android.pixelprops.catalogue.AndroidVersion;
import com.android.pixelprops.catalogue.DeviceCatalogue;
import com.android.pixelprops.catalogue.DeviceEntry;
import com.android.pixelprops.catalogue.FeatureGroup;
import com.android.pixelprops.options.BooleanOption;
import com.android.pixelprops.options.SpoofOptions;
import com.android.pixelprops.options.StringListOption;
import com.android.pixelprops.options.StringOption;
import com.android.utils.ILogger;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;

/**
 * Turns a {@link SpoofOptions} selection into the {@link SpoofProfile} handed to the hooks.
 *
 * <p>Nothing here fails: an unknown device gives an empty profile, an unknown version override
 * falls back to the device's own version and unknown feature groups are skipped. Each of these is
 * reported as a warning.
 */
public class SpoofProfileResolver {
    @NonNull private final DeviceCatalogue mCatalogue;
    @NonNull private final ILogger mLog;

    public SpoofProfileResolver(@NonNull DeviceCatalogue catalogue, @NonNull ILogger log) {
        mCatalogue = Preconditions.checkNotNull(catalogue);
        mLog = Preconditions.checkNotNull(log);
    }

    @NonNull
    public SpoofProfile resolve(@NonNull SpoofOptions options) {
        String deviceName = options.get(StringOption.DEVICE_NAME);
        if (deviceName == null) {
            deviceName = mCatalogue.getDefaultDeviceName();
        }

        Optional<DeviceEntry> device = mCatalogue.getDevice(deviceName);
        if (!device.isPresent()) {
            mLog.warning("Unknown device %s, nothing will be spoofed", deviceName);
            return SpoofProfile.empty(deviceName);
        }

        ImmutableMap<String, String> buildProperties =
                options.get(BooleanOption.SPOOF_BUILD_PROPS)
                        ? device.get().getProperties()
                        : ImmutableMap.of();

        ImmutableMap<String, Object> versionFields =
                options.get(BooleanOption.SPOOF_ANDROID_VERSION)
                        ? resolveVersion(device.get(), options.get(StringOption.ANDROID_VERSION))
                                .map(AndroidVersion::getBuildVersionFields)
                                .orElse(ImmutableMap.of())
                        : ImmutableMap.of();

        ImmutableSet<String> featureFlags =
                options.get(BooleanOption.SPOOF_FEATURE_FLAGS)
                        ? resolveFeatures(deviceName, options.get(StringListOption.FEATURE_GROUPS))
                        : ImmutableSet.of();

        SpoofProfile profile =
                new SpoofProfile(deviceName, buildProperties, versionFields, featureFlags);
        if (options.get(BooleanOption.VERBOSE_LOGGING)) {
            mLog.info("Spoofing %s", profile);
        } else {
            mLog.verbose(
                    "Spoofing %1$s: %2$d properties, %3$d version fields, %4$d features",
                    deviceName,
                    buildProperties.size(),
                    versionFields.size(),
                    featureFlags.size());
        }
        return profile;
    }

    @NonNull
    private Optional<AndroidVersion> resolveVersion(
            @NonNull DeviceEntry device, @Nullable String overrideLabel) {
        if (overrideLabel != null) {
            Optional<AndroidVersion> override = mCatalogue.getVersion(overrideLabel);
            if (override.isPresent()) {
                return override;
            }
            mLog.warning(
                    "Unknown Android version %1$s, using the version of %2$s instead",
                    overrideLabel, device.getDeviceName());
        }
        return device.getAndroidVersion();
    }

    @NonNull
    private ImmutableSet<String> resolveFeatures(
            @NonNull String deviceName, @Nullable ImmutableList<String> groupLabels) {
        if (groupLabels == null) {
            return mCatalogue.getFeaturesUpToDevice(deviceName);
        }

        ImmutableSet.Builder<String> features = ImmutableSet.builder();
        for (String label : groupLabels) {
            Optional<FeatureGroup> group = mCatalogue.getFeatureGroup(label);
            if (group.isPresent()) {
                features.addAll(group.get().getFlags());
            } else {
                mLog.warning("Unknown feature group %s", label);
            }
        }
        return features.build();
    }
}
