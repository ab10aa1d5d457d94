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
package com.gpxio;

import java.util.Objects;

/**
 * Information about the copyright holder and any license governing use of the file.
 */
public final class Copyright {
    private final String author;
    private final Integer year;
    private final String license;

    public Copyright(String author, Integer year, String license) {
        if (year != null && (year < 0 || year > 9999))
            throw new IllegalArgumentException("copyright year must have at most 4 digits but was " + year);
        this.author = author;
        this.year = year;
        this.license = license;
    }

    public String getAuthor() {
        return author;
    }

    public Integer getYear() {
        return year;
    }

    /**
     * @return link to the external file containing the license text
     */
    public String getLicense() {
        return license;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Copyright that = (Copyright) o;
        return Objects.equals(author, that.author) && Objects.equals(year, that.year)
                && Objects.equals(license, that.license);
    }

    @Override
    public int hashCode() {
        return Objects.hash(author, year, license);
    }

    @Override
    public String toString() {
        return "Copyright{author='" + author + "', year=" + year + ", license='" + license + "'}";
    }
}
