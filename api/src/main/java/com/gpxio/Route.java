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
 * An ordered list of waypoints representing a series of turn points leading to a destination.
 */
public final class Route {
    private final String name;
    private final String comment;
    private final String description;
    private final String source;
    private final List<Link> links;
    private final Integer number;
    private final String type;
    private final List<Waypoint> points;
    private final String extensions;

    private Route(Builder b) {
        this.name = b.name;
        this.comment = b.comment;
        this.description = b.description;
        this.source = b.source;
        this.links = Helper.immutableCopy(b.links);
        this.number = b.number;
        this.type = b.type;
        this.points = Helper.immutableCopy(b.points);
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

    public Integer getNumber() {
        return number;
    }

    public String getType() {
        return type;
    }

    public List<Waypoint> getPoints() {
        return points;
    }

    public String getExtensions() {
        return extensions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Route r = (Route) o;
        return Objects.equals(name, r.name) && Objects.equals(comment, r.comment)
                && Objects.equals(description, r.description) && Objects.equals(source, r.source)
                && links.equals(r.links) && Objects.equals(number, r.number)
                && Objects.equals(type, r.type) && points.equals(r.points)
                && Objects.equals(extensions, r.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, points);
    }

    @Override
    public String toString() {
        return "Route{name='" + name + "', points=" + points.size() + '}';
    }

    public static class Builder {
        private String name;
        private String comment;
        private String description;
        private String source;
        private final List<Link> links = new ArrayList<>();
        private Integer number;
        private String type;
        private final List<Waypoint> points = new ArrayList<>();
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
                throw new IllegalArgumentException("route number must not be negative: " + number);
            this.number = number;
            return this;
        }

        public Builder setType(String type) {
            this.type = type;
            return this;
        }

        public Builder addPoint(Waypoint point) {
            points.add(Objects.requireNonNull(point));
            return this;
        }

        public Builder setExtensions(String extensions) {
            this.extensions = extensions;
            return this;
        }

        public Route build() {
            return new Route(this);
        }
    }
}
