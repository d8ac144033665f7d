/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.lamina.metadata;

/**
 * Logical types that provide semantic meaning to physical types.
 * Sealed interface allows for parameterized types (e.g., DECIMAL with scale/precision).
 * <p>
 * Annotations are informational: values are stored and returned in their physical
 * representation. The schema builder only checks that an annotation fits the physical type.
 * </p>
 */
public sealed interface LogicalType
        permits LogicalType.StringType, LogicalType.EnumType, LogicalType.UuidType, LogicalType.IntType,
        LogicalType.DecimalType, LogicalType.DateType, LogicalType.TimeType, LogicalType.TimestampType,
        LogicalType.JsonType {

    /**
     * Returns true if this annotation may be applied to a column of the given physical type.
     */
    boolean appliesTo(PhysicalType type);

    // Simple types (no parameters)
    record StringType() implements LogicalType {
        @Override
        public boolean appliesTo(PhysicalType type) {
            return type == PhysicalType.BYTE_ARRAY;
        }
    }

    record EnumType() implements LogicalType {
        @Override
        public boolean appliesTo(PhysicalType type) {
            return type == PhysicalType.BYTE_ARRAY;
        }
    }

    record JsonType() implements LogicalType {
        @Override
        public boolean appliesTo(PhysicalType type) {
            return type == PhysicalType.BYTE_ARRAY;
        }
    }

    record UuidType() implements LogicalType {
        @Override
        public boolean appliesTo(PhysicalType type) {
            return type == PhysicalType.FIXED_LEN_BYTE_ARRAY;
        }
    }

    record DateType() implements LogicalType {
        @Override
        public boolean appliesTo(PhysicalType type) {
            return type == PhysicalType.INT32;
        }
    }

    // Parameterized: Integer types with bitWidth and sign
    record IntType(int bitWidth, boolean isSigned) implements LogicalType {
        public IntType {
            if (bitWidth != 8 && bitWidth != 16 && bitWidth != 32 && bitWidth != 64) {
                throw new IllegalArgumentException("Invalid bit width: " + bitWidth);
            }
        }

        @Override
        public boolean appliesTo(PhysicalType type) {
            return bitWidth == 64 ? type == PhysicalType.INT64 : type == PhysicalType.INT32;
        }
    }

    // Parameterized: Decimal with scale and precision
    record DecimalType(int scale, int precision) implements LogicalType {
        public DecimalType {
            if (precision <= 0) {
                throw new IllegalArgumentException("Precision must be positive: " + precision);
            }
            if (scale < 0) {
                throw new IllegalArgumentException("Scale cannot be negative: " + scale);
            }
        }

        @Override
        public boolean appliesTo(PhysicalType type) {
            return type == PhysicalType.INT32 || type == PhysicalType.INT64
                    || type == PhysicalType.BYTE_ARRAY || type == PhysicalType.FIXED_LEN_BYTE_ARRAY;
        }
    }

    // Parameterized: Time with unit and UTC adjustment
    record TimeType(boolean isAdjustedToUTC, TimeUnit unit) implements LogicalType {
        @Override
        public boolean appliesTo(PhysicalType type) {
            return unit == TimeUnit.MILLIS ? type == PhysicalType.INT32 : type == PhysicalType.INT64;
        }
    }

    // Parameterized: Timestamp with unit and UTC adjustment
    record TimestampType(boolean isAdjustedToUTC, TimeUnit unit) implements LogicalType {
        @Override
        public boolean appliesTo(PhysicalType type) {
            return type == PhysicalType.INT64;
        }
    }

    enum TimeUnit { MILLIS, MICROS, NANOS }
}
