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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An ordered list of points describing a path, split into segments.
 */
public final class Track {
    private final String name;
    private final String comment;
    private final String description;
    private final String source;
    private final List<Link> links;
    private final Integer number;
    private final String type;
    private final List<TrackSegment> segments;
    private final String extensions;

    private Track(Builder b) {
        this.name = b.name;
        this.comment = b.comment;
        this.description = b.description;
        this.source = b.source;
        this.links = Helper.immutableCopy(b.links);
        this.number = b.number;
        this.type = b.type;
        this.segments = Helper.immutableCopy(b.segments);
        this.extensions = b.extensions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return name;
    }

    public String getComment() {
        return comment;
    }

    public String getDescription() {
        return description;
    }

    public String getSource() {
        return source;
    }

    public List<Link> getLinks() {
        return links;
    }

    /**
     * GPS track number.
     */
    public Integer getNumber() {
        return number;
    }

    public String getType() {
        return type;
    }

    public List<TrackSegment> getSegments() {
        return segments;
    }

    public String getExtensions() {
        return extensions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Track t = (Track) o;
        return Objects.equals(name, t.name) && Objects.equals(comment, t.comment)
                && Objects.equals(description, t.description) && Objects.equals(source, t.source)
                && links.equals(t.links) && Objects.equals(number, t.number)
                && Objects.equals(type, t.type) && segments.equals(t.segments)
                && Objects.equals(extensions, t.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, segments);
    }

    @Override
    public String toString() {
        return "Track{name='" + name + "', segments=" + segments.size() + '}';
    }

    public static class Builder {
        private String name;
        private String comment;
        private String description;
        private String source;
        private final List<Link> links = new ArrayList<>();
        private Integer number;
        private String type;
        private final List<TrackSegment> segments = new ArrayList<>();
        private String extensions;

        public Builder setName(String name) {
            this.name = name;
            return this;
        }

        public Builder setComment(String comment) {
            this.comment = comment;
            return this;
        }

        public Builder setDescription(String description) {
            this.description = description;
            return this;
        }

        public Builder setSource(String source) {
            this.source = source;
            return this;
        }

        public Builder addLink(Link link) {
            links.add(Objects.requireNonNull(link));
            return this;
        }

        public Builder setNumber(Integer number) {
            if (number != null && number < 0)
                throw new IllegalArgumentException("track number must not be negative: " + number);
            this.number = number;
            return this;
        }

        public Builder setType(String type) {
            this.type = type;
            return this;
        }

        public Builder addSegment(TrackSegment segment) {
            segments.add(Objects.requireNonNull(segment));
            return this;
        }

        public Builder setExtensions(String extensions) {
            this.extensions = extensions;
            return this;
        }

        public Track build() {
            return new Track(this);
        }
    }
}
