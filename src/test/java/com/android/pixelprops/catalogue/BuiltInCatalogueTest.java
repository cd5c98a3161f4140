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

import static com.google.common.truth.Truth.assertThat;

import com.android.pixelprops.testutils.RecordingLogger;
import org.junit.Test;

public class BuiltInCatalogueTest {

    private final DeviceCatalogue catalogue = BuiltInCatalogue.get();

    @Test
    public void sharedInstance() {
        assertThat(BuiltInCatalogue.get()).isSameInstanceAs(catalogue);
    }

    @Test
    public void pixel8ProFeatures() {
        assertThat(catalogue.getFeaturesUpToDevice("Pixel 8 Pro"))
                .containsExactly(
                        "com.google.android.feature.PIXEL_2023_EXPERIENCE",
                        "com.google.android.apps.photos.PIXEL_2023_PRELOAD");
    }

    @Test
    public void pixel8ProProperties() {
        DeviceEntry device = catalogue.getDevice("Pixel 8 Pro").get();

        assertThat(device.getProperties())
                .containsExactly(
                        "BRAND", "google",
                        "MANUFACTURER", "Google",
                        "DEVICE", "husky",
                        "PRODUCT", "husky",
                        "MODEL", "Pixel 8 Pro",
                        "FINGERPRINT",
                                "google/husky/husky:14/UQ1A.240205.004/11269751:user/release-keys");
        assertThat(device.getAndroidVersion()).hasValue(catalogue.getVersion("U 14.0").get());
    }

    @Test
    public void versionByLabel() {
        AndroidVersion version = catalogue.getVersion("U 14.0").get();

        assertThat(version.getLabel()).isEqualTo("U 14.0");
        assertThat(version.getRelease()).isEqualTo("14");
        assertThat(version.getApiLevel()).isEqualTo(34);
    }

    @Test
    public void versionsAreChronological() {
        int previous = 0;
        for (AndroidVersion version : catalogue.getVersions()) {
            assertThat(version.getApiLevel()).isGreaterThan(previous);
            previous = version.getApiLevel();
        }
        assertThat(catalogue.getVersions()).hasSize(10);
        assertThat(catalogue.getVersion("S 12.1").get().getRelease()).isEqualTo("12.1");
    }

    @Test
    public void noneDevice() {
        DeviceEntry none = catalogue.getDevice("None").get();

        assertThat(none.getProperties()).isEmpty();
        assertThat(none.getFeatureGroupLabel()).isEqualTo("None");
        assertThat(none.getAndroidVersion().isPresent()).isFalse();
        assertThat(catalogue.getFeaturesUpToDevice("None")).isEmpty();
    }

    @Test
    public void unknownDevice() {
        assertThat(catalogue.getDevice("Nonexistent Device").isPresent()).isFalse();
        assertThat(catalogue.getFeaturesUpToDevice("Nonexistent Device")).isEmpty();
    }

    @Test
    public void defaults() {
        assertThat(catalogue.getDefaultDeviceName()).isEqualTo("Pixel 8 Pro");
        assertThat(catalogue.getDefaultFeatures())
                .containsExactly(catalogue.getFeatureGroup("Pixel 2023").get());
        assertThat(catalogue.getDeviceNames()).containsExactly("None", "Pixel 8 Pro").inOrder();
    }

    @Test
    public void bundledCatalogueIsConsistent() {
        RecordingLogger logger = new RecordingLogger();
        DeviceCatalogue fresh = BuiltInCatalogue.create(logger);

        assertThat(logger.warnings).isEmpty();
        assertThat(CatalogueValidator.validate(fresh)).isEmpty();
        assertThat(fresh.getDevices()).isEqualTo(catalogue.getDevices());
    }
}
