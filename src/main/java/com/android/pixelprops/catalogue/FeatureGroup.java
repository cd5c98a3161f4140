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
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Objects;

/**
 * The feature flags introduced by one Pixel generation, for example "Pixel 2023".
 *
 * <p>The label is what the user toggles and what gets persisted. The flags are derived from it and
 * are reported as present to feature queries made by the spoofed application.
 */
@Immutable
public final class FeatureGroup {
    @NonNull private final String mLabel;
    @NonNull private final ImmutableList<String> mFlags;

    public FeatureGroup(@NonNull String label, @NonNull Iterable<String> flags) {
        mLabel = Preconditions.checkNotNull(label);
        mFlags = ImmutableList.copyOf(flags);
    }

    public FeatureGroup(@NonNull String label, @NonNull String... flags) {
        this(label, ImmutableList.copyOf(flags));
    }

    @NonNull
    public String getLabel() {
        return mLabel;
    }

    @NonNull
    public ImmutableList<String> getFlags() {
        return mFlags;
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof FeatureGroup)) {
            return false;
        }

        FeatureGroup group = (FeatureGroup) o;
        return Objects.equals(mLabel, group.mLabel) && Objects.equals(mFlags, group.mFlags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mLabel, mFlags);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("label", mLabel)
                .add("flags", mFlags)
                .toString();
    }
}
