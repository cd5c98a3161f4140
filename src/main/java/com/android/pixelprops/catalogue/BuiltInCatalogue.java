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

import static com.android.pixelprops.catalogue.DeviceEntry.PROP_BRAND;
import static com.android.pixelprops.catalogue.DeviceEntry.PROP_DEVICE;
import static com.android.pixelprops.catalogue.DeviceEntry.PROP_FINGERPRINT;
import static com.android.pixelprops.catalogue.DeviceEntry.PROP_MANUFACTURER;
import static com.android.pixelprops.catalogue.DeviceEntry.PROP_MODEL;
import static com.android.pixelprops.catalogue.DeviceEntry.PROP_PRODUCT;

import com.android.annotations.NonNull;
import com.android.pixelprops.catalogue.AndroidVersion.VersionCodes;
import com.android.utils.ILogger;
import com.android.utils.NullLogger;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The devices, feature groups and Android versions bundled with the module.
 *
 * <p>Build values come from the PixelProps collection; feature flags come from the Pixel
 * sysconfig feature drops. Entries are listed oldest first and new ones must be appended.
 */
public final class BuiltInCatalogue {

    public static final String PIXEL_8_PRO = "Pixel 8 Pro";

    public static final String PIXEL_2023 = "Pixel 2023";

    public static final String DEFAULT_DEVICE_NAME = PIXEL_8_PRO;

    /** All major Android versions. The Pixel 1 series launched with Nougat, the lowest one. */
    public static final ImmutableList<AndroidVersion> ANDROID_VERSIONS =
            ImmutableList.of(
                    new AndroidVersion("Nougat 7.1.2", "7.1.2", VersionCodes.N_MR1),
                    new AndroidVersion("Oreo 8.1.0", "8.1.0", VersionCodes.O_MR1),
                    new AndroidVersion("Pie 9.0", "9", VersionCodes.P),
                    new AndroidVersion("Q 10.0", "10", VersionCodes.Q),
                    new AndroidVersion("R 11.0", "11", VersionCodes.R),
                    new AndroidVersion("S 12.0", "12", VersionCodes.S),
                    // 12L
                    new AndroidVersion("S 12.1", "12.1", VersionCodes.S_V2),
                    new AndroidVersion("T 13.0", "13", VersionCodes.TIRAMISU),
                    new AndroidVersion("U 14.0", "14", VersionCodes.UPSIDE_DOWN_CAKE),
                    new AndroidVersion("V 15.0", "15", VersionCodes.VANILLA_ICE_CREAM));

    private BuiltInCatalogue() {}

    /** Returns the bundled catalogue, created on first use. */
    @NonNull
    public static DeviceCatalogue get() {
        return Holder.INSTANCE;
    }

    /**
     * Creates a new copy of the bundled catalogue, reporting consistency problems to {@code log}.
     */
    @NonNull
    public static DeviceCatalogue create(@NonNull ILogger log) {
        DeviceCatalogue.Builder builder = DeviceCatalogue.builder(log);
        builder.addVersions(ANDROID_VERSIONS);

        builder.addFeatureGroup(
                // Pixel 8 (Pro)
                new FeatureGroup(
                        PIXEL_2023,
                        "com.google.android.feature.PIXEL_2023_EXPERIENCE",
                        "com.google.android.apps.photos.PIXEL_2023_PRELOAD"));

        builder.addDevice(
                new DeviceEntry(
                        DeviceCatalogue.NONE, ImmutableMap.of(), DeviceCatalogue.NONE, null));
        builder.addDevice(
                new DeviceEntry(
                        PIXEL_8_PRO,
                        ImmutableMap.<String, String>builder()
                                .put(PROP_BRAND, "google")
                                .put(PROP_MANUFACTURER, "Google")
                                .put(PROP_DEVICE, "husky")
                                .put(PROP_PRODUCT, "husky")
                                .put(PROP_MODEL, "Pixel 8 Pro")
                                .put(
                                        PROP_FINGERPRINT,
                                        "google/husky/husky:14/UQ1A.240205.004/11269751:user/release-keys")
                                .build(),
                        PIXEL_2023,
                        findVersion("U 14.0")));

        return builder.setDefaultDeviceName(DEFAULT_DEVICE_NAME).build();
    }

    @NonNull
    private static AndroidVersion findVersion(@NonNull String label) {
        for (AndroidVersion version : ANDROID_VERSIONS) {
            if (version.getLabel().equals(label)) {
                return version;
            }
        }
        throw new IllegalStateException("Android version " + label + " is not bundled");
    }

    private static final class Holder {
        static final DeviceCatalogue INSTANCE = create(new NullLogger());
    }
}
