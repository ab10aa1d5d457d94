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
package com.gpxio.reader;

import com.gpxio.util.exceptions.GpxException;
import com.gpxio.util.exceptions.InvalidValueException;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;

import static java.time.temporal.ChronoField.HOUR_OF_DAY;
import static java.time.temporal.ChronoField.MINUTE_OF_HOUR;
import static java.time.temporal.ChronoField.NANO_OF_SECOND;
import static java.time.temporal.ChronoField.SECOND_OF_MINUTE;

/**
 * Reads an xsd:dateTime like 2001-10-26T21:32:52Z or 2001-10-26T21:32:52.123+02:00 and
 * normalizes it to UTC.
 */
public class TimeParser {
    private static final DateTimeFormatter FORMATTER = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .appendValue(HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(MINUTE_OF_HOUR, 2)
            .appendLiteral(':')
            .appendValue(SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HH:MM", "Z")
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT)
            .withChronology(IsoChronology.INSTANCE);

    private TimeParser() {
    }

    public static OffsetDateTime parse(ParseContext context) throws GpxException {
        return toTime(StringParser.parse(context, "time"), context.getConfig().isLenientTime());
    }

    /**
     * @param lenient if true a time without offset is accepted as UTC
     */
    public static OffsetDateTime toTime(String value, boolean lenient) throws InvalidValueException {
        TemporalAccessor parsed;
        try {
            parsed = FORMATTER.parseBest(value.trim(), OffsetDateTime::from, LocalDateTime::from);
        } catch (DateTimeParseException ex) {
            throw new InvalidValueException("cannot parse time: " + value, "time", value, ex);
        }

        if (parsed instanceof OffsetDateTime)
            return ((OffsetDateTime) parsed).withOffsetSameInstant(ZoneOffset.UTC);
        if (!lenient)
            throw new InvalidValueException("time without offset: " + value, "time", value);
        return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
    }
}
