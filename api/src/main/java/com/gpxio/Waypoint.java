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
 * A waypoint, point of interest, or named feature on a map. The same type is used for the points
 * of tracks (trkpt) and routes (rtept).
 * <p>
 * Only the coordinate is required. Latitude must be within [-90, 90] and longitude within
 * [-180, 180).
 */
public final class Waypoint {
    public static final int MAX_DGPS_ID = 1023;

    private final double lat;
    private final double lon;
    private final Double elevation;
    private final Double speed;
    private final Double course;
    private final OffsetDateTime time;
    private final Double magneticVariation;
    private final Double geoidHeight;
    private final String name;
    private final String comment;
    private final String description;
    private final String source;
    private final List<Link> links;
    private final String symbol;
    private final String type;
    private final Fix fix;
    private final Integer satellites;
    private final Double hdop;
    private final Double vdop;
    private final Double pdop;
    private final Double ageOfDgpsData;
    private final Integer dgpsId;
    private final String extensions;

    private Waypoint(Builder b) {
        this.lat = b.lat;
        this.lon = b.lon;
        this.elevation = b.elevation;
        this.speed = b.speed;
        this.course = b.course;
        this.time = b.time;
        this.magneticVariation = b.magneticVariation;
        this.geoidHeight = b.geoidHeight;
        this.name = b.name;
        this.comment = b.comment;
        this.description = b.description;
        this.source = b.source;
        this.links = Helper.immutableCopy(b.links);
        this.symbol = b.symbol;
        this.type = b.type;
        this.fix = b.fix;
        this.satellites = b.satellites;
        this.hdop = b.hdop;
        this.vdop = b.vdop;
        this.pdop = b.pdop;
        this.ageOfDgpsData = b.ageOfDgpsData;
        this.dgpsId = b.dgpsId;
        this.extensions = b.extensions;
    }

    public static Builder builder(double lat, double lon) {
        return new Builder(lat, lon);
    }

    public static boolean isValidLatitude(double lat) {
        return lat >= -90 && lat <= 90;
    }

    /**
     * The upper bound is exclusive, 180 has to be written as -180.
     */
    public static boolean isValidLongitude(double lon) {
        return lon >= -180 && lon < 180;
    }

    public static boolean isValidDgpsId(int dgpsId) {
        return dgpsId >= 0 && dgpsId <= MAX_DGPS_ID;
    }

    public double getLat() {
        return lat;
    }

    public double getLon() {
        return lon;
    }

    /**
     * @return elevation in meters or null
     */
    public Double getElevation() {
        return elevation;
    }

    /**
     * Speed in meters per second, only part of GPX 1.0.
     */
    public Double getSpeed() {
        return speed;
    }

    /**
     * Course in degrees, only part of GPX 1.0.
     */
    public Double getCourse() {
        return course;
    }

    /**
     * @return the timestamp in UTC or null
     */
    public OffsetDateTime getTime() {
        return time;
    }

    public Double getMagneticVariation() {
        return magneticVariation;
    }

    /**
     * Height in meters of geoid (mean sea level) above WGS84 earth ellipsoid.
     */
    public Double getGeoidHeight() {
        return geoidHeight;
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

    public String getSymbol() {
        return symbol;
    }

    public String getType() {
        return type;
    }

    public Fix getFix() {
        return fix;
    }

    public Integer getSatellites() {
        return satellites;
    }

    public Double getHdop() {
        return hdop;
    }

    public Double getVdop() {
        return vdop;
    }

    public Double getPdop() {
        return pdop;
    }

    /**
     * Number of seconds since last DGPS update.
     */
    public Double getAgeOfDgpsData() {
        return ageOfDgpsData;
    }

    public Integer getDgpsId() {
        return dgpsId;
    }

    /**
     * @return the raw XML content of the extensions element or null
     */
    public String getExtensions() {
        return extensions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Waypoint w = (Waypoint) o;
        return Double.compare(lat, w.lat) == 0 && Double.compare(lon, w.lon) == 0
                && Objects.equals(elevation, w.elevation)
                && Objects.equals(speed, w.speed)
                && Objects.equals(course, w.course)
                && Objects.equals(time, w.time)
                && Objects.equals(magneticVariation, w.magneticVariation)
                && Objects.equals(geoidHeight, w.geoidHeight)
                && Objects.equals(name, w.name)
                && Objects.equals(comment, w.comment)
                && Objects.equals(description, w.description)
                && Objects.equals(source, w.source)
                && links.equals(w.links)
                && Objects.equals(symbol, w.symbol)
                && Objects.equals(type, w.type)
                && Objects.equals(fix, w.fix)
                && Objects.equals(satellites, w.satellites)
                && Objects.equals(hdop, w.hdop)
                && Objects.equals(vdop, w.vdop)
                && Objects.equals(pdop, w.pdop)
                && Objects.equals(ageOfDgpsData, w.ageOfDgpsData)
                && Objects.equals(dgpsId, w.dgpsId)
                && Objects.equals(extensions, w.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lat, lon, elevation, time, name, fix);
    }

    @Override
    public String toString() {
        return "Waypoint{" + lat + "," + lon
                + (elevation != null ? ", ele=" + elevation : "")
                + (time != null ? ", time=" + time : "")
                + (name != null ? ", name='" + name + '\'' : "")
                + '}';
    }

    public static class Builder {
        private final double lat;
        private final double lon;
        private Double elevation;
        private Double speed;
        private Double course;
        private OffsetDateTime time;
        private Double magneticVariation;
        private Double geoidHeight;
        private String name;
        private String comment;
        private String description;
        private String source;
        private final List<Link> links = new ArrayList<>();
        private String symbol;
        private String type;
        private Fix fix;
        private Integer satellites;
        private Double hdop;
        private Double vdop;
        private Double pdop;
        private Double ageOfDgpsData;
        private Integer dgpsId;
        private String extensions;

        Builder(double lat, double lon) {
            if (!isValidLatitude(lat))
                throw new IllegalArgumentException("latitude " + lat + " is not within [-90, 90]");
            if (!isValidLongitude(lon))
                throw new IllegalArgumentException("longitude " + lon + " is not within [-180, 180)");
            this.lat = lat;
            this.lon = lon;
        }

        public Builder setElevation(Double elevation) {
            this.elevation = elevation;
            return this;
        }

        public Builder setSpeed(Double speed) {
            this.speed = speed;
            return this;
        }

        public Builder setCourse(Double course) {
            this.course = course;
            return this;
        }

        public Builder setTime(OffsetDateTime time) {
            this.time = time;
            return this;
        }

        public Builder setMagneticVariation(Double magneticVariation) {
            this.magneticVariation = magneticVariation;
            return this;
        }

        public Builder setGeoidHeight(Double geoidHeight) {
            this.geoidHeight = geoidHeight;
            return this;
        }

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

        public Builder setSymbol(String symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder setType(String type) {
            this.type = type;
            return this;
        }

        public Builder setFix(Fix fix) {
            this.fix = fix;
            return this;
        }

        public Builder setSatellites(Integer satellites) {
            if (satellites != null && satellites < 0)
                throw new IllegalArgumentException("number of satellites must not be negative: " + satellites);
            this.satellites = satellites;
            return this;
        }

        public Builder setHdop(Double hdop) {
            this.hdop = hdop;
            return this;
        }

        public Builder setVdop(Double vdop) {
            this.vdop = vdop;
            return this;
        }

        public Builder setPdop(Double pdop) {
            this.pdop = pdop;
            return this;
        }

        public Builder setAgeOfDgpsData(Double ageOfDgpsData) {
            this.ageOfDgpsData = ageOfDgpsData;
            return this;
        }

        public Builder setDgpsId(Integer dgpsId) {
            if (dgpsId != null && !isValidDgpsId(dgpsId))
                throw new IllegalArgumentException("dgpsid must be within [0, " + MAX_DGPS_ID + "] but was " + dgpsId);
            this.dgpsId = dgpsId;
            return this;
        }

        public Builder setExtensions(String extensions) {
            this.extensions = extensions;
            return this;
        }

        public Waypoint build() {
            return new Waypoint(this);
        }
    }
}
