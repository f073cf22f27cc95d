/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.anomalydiagnostics.inputtypes;

import static com.anomalydiagnostics.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Identifies one independent series. A key is the ordered list of values of the
 * grouping columns; ungrouped input uses the implicit key without values.
 */
@Getter
@EqualsAndHashCode
public final class GroupKey {

    public static final String SEPARATOR = " ";

    private static final GroupKey IMPLICIT = new GroupKey(Collections.emptyList());

    private final List<String> values;

    private GroupKey(List<String> values) {
        this.values = values;
    }

    public static GroupKey implicit() {
        return IMPLICIT;
    }

    public static GroupKey of(List<String> values) {
        checkNotNull(values, "values must not be null");
        if (values.isEmpty()) {
            return IMPLICIT;
        }
        for (String value : values) {
            checkNotNull(value, "group values must not be null");
        }
        return new GroupKey(Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public static GroupKey of(String... values) {
        List<String> list = new ArrayList<>();
        Collections.addAll(list, values);
        return of(list);
    }

    public boolean isImplicit() {
        return values.isEmpty();
    }

    /**
     * @return the values joined by a single space, the empty string for the
     *         implicit key
     */
    public String label() {
        return String.join(SEPARATOR, values);
    }

    @Override
    public String toString() {
        return isImplicit() ? "<ungrouped>" : label();
    }
}
