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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

public class AndroidVersionTest {

    @Test
    public void buildVersionFields() {
        AndroidVersion version = new AndroidVersion("S 12.1", "12.1", 32);

        assertThat(version.getBuildVersionFields())
                .containsExactly("RELEASE", "12.1", "SDK_INT", 32, "SDK", "32")
                .inOrder();
        assertThat(version.getBuildVersionFields().get(AndroidVersion.FIELD_SDK_INT))
                .isInstanceOf(Integer.class);
    }

    @Test
    public void equalsAndHashCode() {
        AndroidVersion a = new AndroidVersion("U 14.0", "14", 34);
        AndroidVersion b = new AndroidVersion("U 14.0", "14", 34);
        AndroidVersion c = new AndroidVersion("U 14.0 QPR", "14", 34);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(c);
        assertThat(a.toString()).isEqualTo("U 14.0 (Android 14, API 34)");
    }

    @Test
    public void rejectsNonPositiveApiLevel() {
        assertThrows(IllegalArgumentException.class, () -> new AndroidVersion("Bad", "0", 0));
    }

    @Test
    public void buildVersionFieldsAreImmutable() {
        ImmutableMap<String, Object> fields =
                new AndroidVersion("T 13.0", "13", 33).getBuildVersionFields();
        assertThrows(UnsupportedOperationException.class, () -> fields.put("SDK", "1"));
    }
}
