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
import com.google.common.collect.ImmutableList;
import java.util.Optional;

/** Consistency checks run over a {@link DeviceCatalogue} once it has been assembled. */
public final class CatalogueValidator {
    private CatalogueValidator() {}

    /**
     * Returns a human readable message for every reference in the catalogue that does not
     * resolve. An empty list means the catalogue is consistent.
     *
     * <p>The {@link DeviceCatalogue#NONE} device points at a group that intentionally does not
     * exist and is not reported.
     */
    @NonNull
    public static ImmutableList<String> validate(@NonNull DeviceCatalogue catalogue) {
        ImmutableList.Builder<String> issues = ImmutableList.builder();
        for (DeviceEntry device : catalogue.getDevices()) {
            String label = device.getFeatureGroupLabel();
            if (!DeviceCatalogue.NONE.equals(label)
                    && !catalogue.getFeatureGroup(label).isPresent()) {
                issues.add(
                        String.format(
                                "Device %1$s refers to unknown feature group %2$s; "
                                        + "no features will be spoofed for it",
                                device.getDeviceName(), label));
            }

            Optional<AndroidVersion> version = device.getAndroidVersion();
            if (version.isPresent() && !catalogue.getVersions().contains(version.get())) {
                issues.add(
                        String.format(
                                "Device %1$s uses Android version %2$s which is not listed",
                                device.getDeviceName(), version.get().getLabel()));
            }
        }

        if (!catalogue.getDevice(catalogue.getDefaultDeviceName()).isPresent()) {
            issues.add(
                    String.format(
                            "Default device %1$s is not in the catalogue",
                            catalogue.getDefaultDeviceName()));
        }
        return issues.build();
    }
}
