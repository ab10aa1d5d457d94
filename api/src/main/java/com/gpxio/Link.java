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
 * A link to an external resource (web page, digital photo, video clip, etc.) with additional
 * information.
 */
public final class Link {
    private final String href;
    private final String text;
    private final String type;

    public Link(String href) {
        this(href, null, null);
    }

    /**
     * @param href URL of the hyperlink, required
     * @param text text of the hyperlink or null
     * @param type mime type of the content like image/jpeg or null
     */
    public Link(String href, String text, String type) {
        this.href = Objects.requireNonNull(href, "href is required");
        this.text = text;
        this.type = type;
    }

    public String getHref() {
        return href;
    }

    public String getText() {
        return text;
    }

    public String getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Link link = (Link) o;
        return href.equals(link.href) && Objects.equals(text, link.text) && Objects.equals(type, link.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(href, text, type);
    }

    @Override
    public String toString() {
        return "Link{" +
                "href='" + href + '\'' +
                ", text='" + text + '\'' +
                ", type='" + type + '\'' +
                '}';
    }
}
