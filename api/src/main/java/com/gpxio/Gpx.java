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
 * The root of a GPX document: waypoints, routes and tracks plus optional metadata.
 */
public final class Gpx {
    private final GpxVersion version;
    private final String creator;
    private final Metadata metadata;
    private final List<Waypoint> waypoints;
    private final List<Track> tracks;
    private final List<Route> routes;
    private final String extensions;

    private Gpx(Builder b) {
        this.version = b.version;
        this.creator = b.creator;
        this.metadata = b.metadata;
        this.waypoints = Helper.immutableCopy(b.waypoints);
        this.tracks = Helper.immutableCopy(b.tracks);
        this.routes = Helper.immutableCopy(b.routes);
        this.extensions = b.extensions;
    }

    public static Builder builder(GpxVersion version) {
        return new Builder(version);
    }

    public GpxVersion getVersion() {
        return version;
    }

    /**
     * @return the name or URL of the software that created the document or null
     */
    public String getCreator() {
        return creator;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public List<Waypoint> getWaypoints() {
        return waypoints;
    }

    public List<Track> getTracks() {
        return tracks;
    }

    public List<Route> getRoutes() {
        return routes;
    }

    public String getExtensions() {
        return extensions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Gpx gpx = (Gpx) o;
        return version == gpx.version && Objects.equals(creator, gpx.creator)
                && Objects.equals(metadata, gpx.metadata) && waypoints.equals(gpx.waypoints)
                && tracks.equals(gpx.tracks) && routes.equals(gpx.routes)
                && Objects.equals(extensions, gpx.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, creator, metadata, waypoints, tracks, routes);
    }

    @Override
    public String toString() {
        return "Gpx{version=" + version + ", creator='" + creator + "', waypoints=" + waypoints.size()
                + ", tracks=" + tracks.size() + ", routes=" + routes.size() + '}';
    }

    public static class Builder {
        private GpxVersion version;
        private String creator;
        private Metadata metadata;
        private final List<Waypoint> waypoints = new ArrayList<>();
        private final List<Track> tracks = new ArrayList<>();
        private final List<Route> routes = new ArrayList<>();
        private String extensions;

        Builder(GpxVersion version) {
            this.version = Objects.requireNonNull(version);
        }

        public Builder setVersion(GpxVersion version) {
            this.version = Objects.requireNonNull(version);
            return this;
        }

        public GpxVersion getVersion() {
            return version;
        }

        public Builder setCreator(String creator) {
            this.creator = creator;
            return this;
        }

        public Builder setMetadata(Metadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder addWaypoint(Waypoint waypoint) {
            waypoints.add(Objects.requireNonNull(waypoint));
            return this;
        }

        public Builder addTrack(Track track) {
            tracks.add(Objects.requireNonNull(track));
            return this;
        }

        public Builder addRoute(Route route) {
            routes.add(Objects.requireNonNull(route));
            return this;
        }

        public Builder setExtensions(String extensions) {
            this.extensions = extensions;
            return this;
        }

        public Gpx build() {
            return new Gpx(this);
        }
    }
}
