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

import com.gpxio.reader.GpxReader;
import com.gpxio.util.exceptions.GpxException;
import com.gpxio.writer.GpxWriter;
import org.openjdk.jmh.annotations.*;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
public class ReadWriteBenchmark {
    private GpxReader reader;
    private GpxWriter writer;

    @Param({"1.0", "1.1"})
    String version;

    @Setup
    public void setup() {
        reader = new GpxReader();
        writer = new GpxWriter();
    }

    @State(Scope.Thread)
    public static class TrackState {
        @Param({"10000"})
        int numPoints;

        Gpx gpx;
        byte[] bytes;
        long checksum;

        @Setup
        public void setup(ReadWriteBenchmark myBenchmark) throws GpxException {
            long seed = 123;
            gpx = createRecordedTrack(GpxVersion.find(myBenchmark.version), numPoints, new Random(seed));
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            myBenchmark.writer.write(gpx, out);
            bytes = out.toByteArray();
        }

        @TearDown(Level.Iteration)
        public void finish() {
            LoggerFactory.getLogger(ReadWriteBenchmark.class).info("checksum: " + checksum);
        }
    }

    @Benchmark
    @BenchmarkMode({Mode.AverageTime})
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public long measureRead(TrackState state) throws GpxException {
        Gpx gpx = reader.read(new ByteArrayInputStream(state.bytes));
        return state.checksum = gpx.getTracks().get(0).getSegments().get(0).getPoints().size();
    }

    @Benchmark
    @BenchmarkMode({Mode.AverageTime})
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public long measureWrite(TrackState state) throws GpxException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(state.bytes.length);
        writer.write(state.gpx, out);
        return state.checksum = out.size();
    }

    /**
     * A random walk around Munich with a point per second, like a recording of a GPS device.
     */
    private static Gpx createRecordedTrack(GpxVersion version, int numPoints, Random rnd) {
        OffsetDateTime time = OffsetDateTime.of(2022, 1, 1, 8, 0, 0, 0, ZoneOffset.UTC);
        double lat = 48.1351, lon = 11.5820, ele = 520;
        List<Waypoint> points = new ArrayList<>(numPoints);
        for (int i = 0; i < numPoints; i++) {
            lat += (rnd.nextDouble() - 0.5) * 1e-4;
            lon += (rnd.nextDouble() - 0.5) * 1e-4;
            ele += rnd.nextDouble() - 0.5;
            points.add(Waypoint.builder(lat, lon)
                    .setElevation(Math.round(ele * 10) / 10.0)
                    .setTime(time.plusSeconds(i))
                    .setSatellites(4 + rnd.nextInt(8))
                    .setHdop(Math.round(rnd.nextDouble() * 50) / 10.0)
                    .setExtensions("<hr xmlns=\"urn:heart-rate\">" + (90 + rnd.nextInt(60)) + "</hr>")
                    .build());
        }
        return Gpx.builder(version)
                .setCreator("benchmark")
                .setMetadata(Metadata.builder().setName("recording").setTime(time).build())
                .addTrack(Track.builder().setName("ride").addSegment(new TrackSegment(points)).build())
                .build();
    }

    public static void main(String[] args) throws GpxException {
        // used to run/debug manually without JMH
        ReadWriteBenchmark b = new ReadWriteBenchmark();
        b.version = "1.1";
        b.setup();
        TrackState s = new TrackState();
        s.numPoints = 10_000;
        s.setup(b);

        for (int run = 0; run < 20; run++) {
            long start = System.nanoTime();
            b.measureRead(s);
            long read = System.nanoTime();
            b.measureWrite(s);
            long end = System.nanoTime();
            System.out.println("read: " + (read - start) / 1_000_000 + "ms, write: " + (end - read) / 1_000_000 + "ms");
        }
    }
}
