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

package com.amazon.celldegradation.config;

import static com.amazon.celldegradation.CommonUtils.checkParameter;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.amazon.celldegradation.exceptions.InvalidParameterException;

/**
 * Typed, read only access to the method specific parameters of a smoother or
 * detector. Values arrive from JSON as numbers or strings; a value of the wrong
 * kind is a configuration error.
 */
public class Parameters {

    private final Map<String, Object> values;

    public Parameters(Map<String, Object> values) {
        this.values = (values == null) ? Collections.emptyMap() : new HashMap<>(values);
    }

    public static Parameters empty() {
        return new Parameters(null);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public double getDouble(String key, double defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                throw new InvalidParameterException("parameter " + key + " is not a number: " + value, e);
            }
        }
        checkParameter(false, "parameter " + key + " is not a number: " + value);
        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        double value = getDouble(key, defaultValue);
        checkParameter(value == Math.rint(value) && Math.abs(value) <= Integer.MAX_VALUE,
                "parameter " + key + " must be an integer, found " + value);
        return (int) value;
    }

    public long getLong(String key, long defaultValue) {
        double value = getDouble(key, defaultValue);
        checkParameter(value == Math.rint(value), "parameter " + key + " must be an integer, found " + value);
        return (long) value;
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return (value == null) ? defaultValue : value.toString();
    }

    /**
     * Rejects keys outside the allowed set, so that a misspelt hyperparameter
     * fails instead of silently falling back to its default.
     */
    public void checkKnown(Collection<String> allowed, String owner) {
        for (String key : values.keySet()) {
            checkParameter(allowed.contains(key), "unknown parameter " + key + " for " + owner);
        }
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
