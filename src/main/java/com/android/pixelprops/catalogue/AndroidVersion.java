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
import com.android.annotations.concurrency.Immutable;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Locale;

/**
 * <p>
 * An Android platform release that a spoofed device reports.
 * </p>
 * A version is defined by a display label, the user-visible release string and the API level.
 * <ul><li>The label is only shown to the user (for example "U 14.0") and identifies the version
 * inside a {@link DeviceCatalogue}. It is never spoofed.</li>
 * <li>The release corresponds to {@code ro.build.version.release}, e.g. "14", "12.1" or
 * "8.1.0".</li>
 * <li>The API level corresponds to {@code ro.build.version.sdk}.</li></ul>
 */
@Immutable
public final class AndroidVersion {
    /**
     * SDK version codes mirroring ones found in Build#VERSION_CODES on Android, limited to the
     * releases a Pixel can launch with.
     */
    public static class VersionCodes {
        public static final int N_MR1 = 25;
        public static final int O_MR1 = 27;
        public static final int P = 28;
        public static final int Q = 29;
        public static final int R = 30;
        public static final int S = 31;
        public static final int S_V2 = 32;
        public static final int TIRAMISU = 33;
        public static final int UPSIDE_DOWN_CAKE = 34;
        public static final int VANILLA_ICE_CREAM = 35;
    }

    /** Name of the {@code Build.VERSION} field holding the release string. */
    public static final String FIELD_RELEASE = "RELEASE";
    /** Name of the {@code Build.VERSION} field holding the API level as an int. */
    public static final String FIELD_SDK_INT = "SDK_INT";
    /** Name of the deprecated {@code Build.VERSION} field holding the API level as a string. */
    public static final String FIELD_SDK = "SDK";

    @NonNull private final String mLabel;
    @NonNull private final String mRelease;
    private final int mApiLevel;

    public AndroidVersion(@NonNull String label, @NonNull String release, int apiLevel) {
        mLabel = Preconditions.checkNotNull(label);
        mRelease = Preconditions.checkNotNull(release);
        Preconditions.checkArgument(apiLevel > 0, "Invalid API level %s for %s", apiLevel, label);
        mApiLevel = apiLevel;
    }

    /** Returns the label shown to the user. */
    @NonNull
    public String getLabel() {
        return mLabel;
    }

    /** Returns the value of {@code Build.VERSION.RELEASE}. */
    @NonNull
    public String getRelease() {
        return mRelease;
    }

    /** Returns the API level as an integer. */
    public int getApiLevel() {
        return mApiLevel;
    }

    /**
     * Returns the {@code Build.VERSION} fields to overwrite, keyed by field name.
     *
     * <p>{@code SDK_INT} maps to an {@link Integer} and the other two fields to strings, matching
     * the types of the real fields.
     */
    @NonNull
    public ImmutableMap<String, Object> getBuildVersionFields() {
        return ImmutableMap.of(
                FIELD_RELEASE, mRelease,
                FIELD_SDK_INT, mApiLevel,
                FIELD_SDK, Integer.toString(mApiLevel));
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof AndroidVersion)) {
            return false;
        }
        AndroidVersion other = (AndroidVersion) obj;
        return mApiLevel == other.mApiLevel
                && Objects.equal(mLabel, other.mLabel)
                && Objects.equal(mRelease, other.mRelease);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(mLabel, mRelease, mApiLevel);
    }

    /**
     * Returns a string with the label, release and API level.
     * Useful for debugging.
     */
    @Override
    public String toString() {
        return String.format(
                Locale.US, "%1$s (Android %2$s, API %3$d)", mLabel, mRelease, mApiLevel);
    }
}
