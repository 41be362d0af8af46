/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.colbridge.options;

import org.colbridge.annotation.Public;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.colbridge.options.MemorySize.MemoryUnit.BYTES;
import static org.colbridge.options.MemorySize.MemoryUnit.GIGA_BYTES;
import static org.colbridge.options.MemorySize.MemoryUnit.KILO_BYTES;
import static org.colbridge.options.MemorySize.MemoryUnit.MEGA_BYTES;
import static org.colbridge.options.MemorySize.MemoryUnit.TERA_BYTES;
import static org.colbridge.utils.Preconditions.checkArgument;
import static org.colbridge.utils.Preconditions.checkNotNull;

/**
 * 以字节为单位的内存大小。
 *
 * <p>支持解析 {@code "64 mb"}、{@code "1g"}、{@code "512"}(字节)等格式,单位按 1024 进制计算。
 * {@link #MAX_VALUE} 表示不限制。
 */
@Public
public class MemorySize implements java.io.Serializable, Comparable<MemorySize> {

    private static final long serialVersionUID = 1L;

    public static final MemorySize ZERO = new MemorySize(0L);

    public static final MemorySize MAX_VALUE = new MemorySize(Long.MAX_VALUE);

    private static final List<MemoryUnit> ORDERED_UNITS =
            Arrays.asList(BYTES, KILO_BYTES, MEGA_BYTES, GIGA_BYTES, TERA_BYTES);

    private final long bytes;

    public MemorySize(long bytes) {
        checkArgument(bytes >= 0, "bytes must be >= 0");
        this.bytes = bytes;
    }

    public static MemorySize ofMebiBytes(long mebiBytes) {
        return new MemorySize(mebiBytes << 20);
    }

    public static MemorySize ofKibiBytes(long kibiBytes) {
        return new MemorySize(kibiBytes << 10);
    }

    public static MemorySize ofBytes(long bytes) {
        return new MemorySize(bytes);
    }

    public long getBytes() {
        return bytes;
    }

    public long getKibiBytes() {
        return bytes >> 10;
    }

    public int getMebiBytes() {
        return (int) (bytes >> 20);
    }

    @Override
    public int hashCode() {
        return (int) (bytes ^ (bytes >>> 32));
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this
                || (obj != null
                        && obj.getClass() == this.getClass()
                        && ((MemorySize) obj).bytes == this.bytes);
    }

    /** 以能整除的最大单位输出,例如 {@code "64 mb"}。 */
    @Override
    public String toString() {
        MemoryUnit unit = BYTES;
        for (MemoryUnit candidate : ORDERED_UNITS) {
            if (bytes % candidate.getMultiplier() == 0) {
                unit = candidate;
            }
        }
        if (bytes == 0) {
            unit = BYTES;
        }
        return String.format("%d %s", bytes / unit.getMultiplier(), unit.getUnits()[1]);
    }

    @Override
    public int compareTo(MemorySize that) {
        return Long.compare(this.bytes, that.bytes);
    }

    public static MemorySize parse(String text) throws IllegalArgumentException {
        return new MemorySize(parseBytes(text));
    }

    public static long parseBytes(String text) throws IllegalArgumentException {
        checkNotNull(text, "text");

        final String trimmed = text.trim();
        checkArgument(!trimmed.isEmpty(), "argument is an empty- or whitespace-only string");

        final int len = trimmed.length();
        int pos = 0;

        char current;
        while (pos < len && (current = trimmed.charAt(pos)) >= '0' && current <= '9') {
            pos++;
        }

        final String number = trimmed.substring(0, pos);
        final String unit = trimmed.substring(pos).trim().toLowerCase(Locale.US);

        if (number.isEmpty()) {
            throw new NumberFormatException("text does not start with a number");
        }

        final long value;
        try {
            value = Long.parseLong(number);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "The value '"
                            + number
                            + "' cannot be re represented as 64bit number (numeric overflow).");
        }

        final long multiplier = parseUnit(unit).map(MemoryUnit::getMultiplier).orElse(1L);
        final long result = value * multiplier;

        if (result / multiplier != value) {
            throw new IllegalArgumentException(
                    "The value '"
                            + text
                            + "' cannot be re represented as 64bit number of bytes (numeric overflow).");
        }

        return result;
    }

    private static Optional<MemoryUnit> parseUnit(String unit) {
        for (MemoryUnit memoryUnit : ORDERED_UNITS) {
            if (Arrays.asList(memoryUnit.getUnits()).contains(unit)) {
                return Optional.of(memoryUnit);
            }
        }
        if (!unit.isEmpty()) {
            throw new IllegalArgumentException(
                    "Memory size unit '"
                            + unit
                            + "' does not match any of the recognized units: "
                            + MemoryUnit.getAllUnits());
        }
        return Optional.empty();
    }

    /** 内存单位,第一个别名用于解析,第二个用于输出。 */
    public enum MemoryUnit {
        BYTES(new String[] {"b", "bytes"}, 1L),
        KILO_BYTES(new String[] {"k", "kb", "kibibytes"}, 1024L),
        MEGA_BYTES(new String[] {"m", "mb", "mebibytes"}, 1024L * 1024L),
        GIGA_BYTES(new String[] {"g", "gb", "gibibytes"}, 1024L * 1024L * 1024L),
        TERA_BYTES(new String[] {"t", "tb", "tebibytes"}, 1024L * 1024L * 1024L * 1024L);

        private final String[] units;

        private final long multiplier;

        MemoryUnit(String[] units, long multiplier) {
            this.units = units;
            this.multiplier = multiplier;
        }

        public String[] getUnits() {
            return units;
        }

        public long getMultiplier() {
            return multiplier;
        }

        public static String getAllUnits() {
            return Arrays.stream(values())
                    .map(unit -> "(" + String.join(" | ", unit.getUnits()) + ")")
                    .collect(Collectors.joining(" / "));
        }
    }
}
