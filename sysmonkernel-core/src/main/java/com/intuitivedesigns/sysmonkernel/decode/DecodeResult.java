/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.decode;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of decoding one payload: a full record or a drop, never anything partial.
 */
public sealed interface DecodeResult permits DecodeResult.Decoded, DecodeResult.Dropped {

    boolean isDecoded();

    Optional<DecodedRecord> record();

    record Decoded(DecodedRecord value) implements DecodeResult {
        public Decoded {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isDecoded() {
            return true;
        }

        @Override
        public Optional<DecodedRecord> record() {
            return Optional.of(value);
        }
    }

    record Dropped(DropReason reason, String detail) implements DecodeResult {
        public Dropped {
            Objects.requireNonNull(reason, "reason");
            detail = detail == null ? "" : detail;
        }

        @Override
        public boolean isDecoded() {
            return false;
        }

        @Override
        public Optional<DecodedRecord> record() {
            return Optional.empty();
        }
    }
}
