/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.rolegraph.exceptions;

import java.util.HashMap;
import java.util.Map;

/**
 * Stable codes for every failure surfaced by the authorization engine. Callers that translate
 * errors for a client protocol should switch on these rather than on exception classes.
 */
public enum ExceptionCode
{
    INVALID_REQUEST     (0x2200),
    INVALID_NAME        (0x2201),
    INVALID_GRANTEE     (0x2202),
    CYCLE               (0x2203),
    DEPENDENCY          (0x2204),
    PERMISSION_DENIED   (0x2100),
    NOT_AUTHORIZED      (0x2101),
    STORE_TIMEOUT       (0x1300);

    public final int value;
    private static final Map<Integer, ExceptionCode> valueToCode = new HashMap<>(ExceptionCode.values().length);
    static
    {
        for (ExceptionCode code : ExceptionCode.values())
            valueToCode.put(code.value, code);
    }

    ExceptionCode(int value)
    {
        this.value = value;
    }

    public static ExceptionCode fromValue(int value)
    {
        ExceptionCode code = valueToCode.get(value);
        if (code == null)
            throw new IllegalArgumentException(String.format("Unknown error code %d", value));
        return code;
    }
}
