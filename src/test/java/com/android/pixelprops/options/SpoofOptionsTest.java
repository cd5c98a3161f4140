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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Properties;
import org.junit.Test;

public class SpoofOptionsTest {

    @Test
    public void defaults() {
        SpoofOptions options = SpoofOptions.defaults();

        assertThat(options.get(BooleanOption.SPOOF_BUILD_PROPS)).isTrue();
        assertThat(options.get(BooleanOption.SPOOF_ANDROID_VERSION)).isTrue();
        assertThat(options.get(BooleanOption.SPOOF_FEATURE_FLAGS)).isTrue();
        assertThat(options.get(BooleanOption.VERBOSE_LOGGING)).isFalse();
        assertThat(options.get(StringOption.DEVICE_NAME)).isNull();
        assertThat(options.get(StringOption.ANDROID_VERSION)).isNull();
        assertThat(options.get(StringListOption.FEATURE_GROUPS)).isNull();
        assertThat(options.getExplicitlySetBooleanOptions()).isEmpty();
    }

    @Test
    public void readsTypedValues() {
        SpoofOptions options =
                new SpoofOptions(
                        ImmutableMap.of(
                                "pixelprops.deviceName", " Pixel 8 Pro ",
                                "pixelprops.spoofAndroidVersion", "FALSE",
                                "pixelprops.verboseLogging", Boolean.TRUE,
                                "pixelprops.featureGroups", "Pixel 2022, ,Pixel 2023,",
                                "unrelated.property", "ignored"));

        assertThat(options.get(StringOption.DEVICE_NAME)).isEqualTo("Pixel 8 Pro");
        assertThat(options.get(BooleanOption.SPOOF_ANDROID_VERSION)).isFalse();
        assertThat(options.get(BooleanOption.VERBOSE_LOGGING)).isTrue();
        assertThat(options.get(StringListOption.FEATURE_GROUPS))
                .containsExactly("Pixel 2022", "Pixel 2023")
                .inOrder();
        assertThat(options.getExplicitlySetStringOptions())
                .containsExactly(StringOption.DEVICE_NAME, "Pixel 8 Pro");
    }

    @Test
    public void blankStringIsUnset() {
        SpoofOptions options =
                new SpoofOptions(ImmutableMap.of("pixelprops.androidVersion", "   "));

        assertThat(options.get(StringOption.ANDROID_VERSION)).isNull();
        assertThat(options.getExplicitlySetStringOptions()).isEmpty();
    }

    @Test
    public void emptyFeatureGroupListDisablesEveryGroup() {
        SpoofOptions options = new SpoofOptions(ImmutableMap.of("pixelprops.featureGroups", ""));

        assertThat(options.get(StringListOption.FEATURE_GROUPS)).isEmpty();
    }

    @Test
    public void featureGroupsFromIterable() {
        SpoofOptions options =
                new SpoofOptions(
                        ImmutableMap.of(
                                "pixelprops.featureGroups",
                                ImmutableList.of("Pixel 2023", " ", "Pixel 2021 ")));

        assertThat(options.get(StringListOption.FEATURE_GROUPS))
                .containsExactly("Pixel 2023", "Pixel 2021")
                .inOrder();
    }

    @Test
    public void fromProperties() {
        Properties properties = new Properties();
        properties.setProperty("pixelprops.spoofFeatureFlags", "false");
        properties.setProperty("pixelprops.androidVersion", "T 13.0");

        SpoofOptions options = SpoofOptions.fromProperties(properties);

        assertThat(options.get(BooleanOption.SPOOF_FEATURE_FLAGS)).isFalse();
        assertThat(options.get(StringOption.ANDROID_VERSION)).isEqualTo("T 13.0");
    }

    @Test
    public void malformedBoolean() {
        IllegalArgumentException e =
                assertThrows(
                        IllegalArgumentException.class,
                        () ->
                                new SpoofOptions(
                                        ImmutableMap.of("pixelprops.spoofBuildProps", "yes")));
        assertThat(e).hasMessageThat().contains("pixelprops.spoofBuildProps");
    }

    @Test
    public void malformedString() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new SpoofOptions(ImmutableMap.of("pixelprops.deviceName", new Object())));
    }
}
