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

import com.gpxio.util.Helper;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Information about the GPX file: author, copyright restrictions, keywords etc. In GPX 1.1 this
 * is the metadata element, in GPX 1.0 the same information is spread over the children of the
 * gpx element.
 */
public final class Metadata {
    private final String name;
    private final String description;
    private final Person author;
    private final Copyright copyright;
    private final List<Link> links;
    private final OffsetDateTime time;
    private final String keywords;
    private final Bounds bounds;
    private final String extensions;

    private Metadata(Builder b) {
        this.name = b.name;
        this.description = b.description;
        this.author = b.author;
        this.copyright = b.copyright;
        this.links = Helper.immutableCopy(b.links);
        this.time = b.time;
        this.keywords = b.keywords;
        this.bounds = b.bounds;
        this.extensions = b.extensions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Person getAuthor() {
        return author;
    }

    public Copyright getCopyright() {
        return copyright;
    }

    public List<Link> getLinks() {
        return links;
    }

    /**
     * @return the creation time of the file in UTC or null
     */
    public OffsetDateTime getTime() {
        return time;
    }

    public String getKeywords() {
        return keywords;
    }

    public Bounds getBounds() {
        return bounds;
    }

    public String getExtensions() {
        return extensions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Metadata m = (Metadata) o;
        return Objects.equals(name, m.name) && Objects.equals(description, m.description)
                && Objects.equals(author, m.author) && Objects.equals(copyright, m.copyright)
                && links.equals(m.links) && Objects.equals(time, m.time)
                && Objects.equals(keywords, m.keywords) && Objects.equals(bounds, m.bounds)
                && Objects.equals(extensions, m.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, author, time, bounds);
    }

    @Override
    public String toString() {
        return "Metadata{name='" + name + "', author=" + author + ", time=" + time + ", bounds=" + bounds + '}';
    }

    public static class Builder {
        private String name;
        private String description;
        private Person author;
        private Copyright copyright;
        private final List<Link> links = new ArrayList<>();
        private OffsetDateTime time;
        private String keywords;
        private Bounds bounds;
        private String extensions;

        public Builder setName(String name) {
            this.name = name;
            return this;
        }

        public Builder setDescription(String description) {
            this.description = description;
            return this;
        }

        public Builder setAuthor(Person author) {
            this.author = author;
            return this;
        }

        public Builder setCopyright(Copyright copyright) {
            this.copyright = copyright;
            return this;
        }

        public Builder addLink(Link link) {
            links.add(Objects.requireNonNull(link));
            return this;
        }

        public Builder setTime(OffsetDateTime time) {
            this.time = time;
            return this;
        }

        public Builder setKeywords(String keywords) {
            this.keywords = keywords;
            return this;
        }

        public Builder setBounds(Bounds bounds) {
            this.bounds = bounds;
            return this;
        }

        public Builder setExtensions(String extensions) {
            this.extensions = extensions;
            return this;
        }

        /**
         * @return true if no field was set
         */
        public boolean isEmpty() {
            return name == null && description == null && author == null && copyright == null
                    && links.isEmpty() && time == null && keywords == null && bounds == null
                    && extensions == null;
        }

        public Metadata build() {
            return new Metadata(this);
        }
    }
}
