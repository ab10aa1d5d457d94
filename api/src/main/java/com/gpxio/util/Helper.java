/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.gpxio.util;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Small string and collection helpers shared by the model, the reader and the writer.
 */
public class Helper {

    private Helper() {
    }

    public static boolean isEmpty(String str) {
        return str == null || str.trim().length() == 0;
    }

    public static String camelCaseToUnderScore(String key) {
        if (key.isEmpty())
            return key;

        StringBuilder sb = new StringBuilder(key.length());
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (Character.isUpperCase(c))
                sb.append("_").append(Character.toLowerCase(c));
            else
                sb.append(c);
        }

        return sb.toString();
    }

    /**
     * Formats the specified value without exponent, e.g. 0.000001 instead of 1.0E-6, as
     * xsd:decimal does not allow the scientific notation.
     */
    public static String toDecimalString(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value))
            return Double.toString(value);

        String str = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        // 4 is written as 4.0
        if (str.indexOf('.') < 0)
            return str + ".0";
        return str;
    }

    public static <T> List<T> immutableCopy(List<T> list) {
        if (list.isEmpty())
            return Collections.emptyList();
        return Collections.unmodifiableList(new ArrayList<>(list));
    }
}
