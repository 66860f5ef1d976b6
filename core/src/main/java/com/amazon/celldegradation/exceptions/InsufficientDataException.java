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

package com.amazon.celldegradation.exceptions;

import lombok.Getter;

/**
 * Thrown when a channel has too few valid samples to be cleaned, smoothed or
 * turned into features. Fatal for the channel only.
 */
@Getter
public class InsufficientDataException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String channel;
    private final int available;
    private final int required;

    public InsufficientDataException(String channel, int available, int required) {
        super(String.format("channel %s has %d valid samples, at least %d are required", channel, available,
                required));
        this.channel = channel;
        this.available = available;
        this.required = required;
    }
}
