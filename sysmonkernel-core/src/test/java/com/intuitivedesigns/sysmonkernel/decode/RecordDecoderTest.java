/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.decode;

import com.intuitivedesigns.sysmonkernel.diagnostics.DropDiagnostic;
import com.intuitivedesigns.sysmonkernel.diagnostics.RecordingDiagnosticsSink;
import com.intuitivedesigns.sysmonkernel.schema.RecordType;
import com.intuitivedesigns.sysmonkernel.schema.SchemaRegistry;
import com.intuitivedesigns.sysmonkernel.term.Atom;
import com.intuitivedesigns.sysmonkernel.term.Binary;
import com.intuitivedesigns.sysmonkernel.term.Pid;
import com.intuitivedesigns.sysmonkernel.term.TermDecodeException;
import com.intuitivedesigns.sysmonkernel.term.TermEncoder;
import com.intuitivedesigns.sysmonkernel.term.Tuple;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecordDecoderTest {

    private final TermEncoder encoder = new TermEncoder();
    private RecordingDiagnosticsSink diagnostics;
    private RecordDecoder decoder;

    @BeforeEach
    void setUp() {
        diagnostics = new RecordingDiagnosticsSink();
        decoder = new RecordDecoder(new SchemaRegistry(), diagnostics);
    }

    @Test
    void decodesNodeRoleIntoNamedFields() {
        Map<Object, Object> data = Map.of(Atom.of("foo"), "bar");
        Tuple ts = Tuple.of(1L, 2L, 3L);

        DecodeResult result = decoder.decode(RawRecord.of(Atom.of("node_role"), "nodeA", ts, data));

        DecodedRecord record = assertInstanceOf(DecodeResult.Decoded.class, result).value();
        assertEquals(RecordType.NODE_ROLE, record.type());
        assertEquals(List.of("node", "ts", "data"), record.fieldNames());
        assertEquals("nodeA", record.get("node"));
        assertEquals(ts, record.get("ts"));
        assertEquals(data, record.get("data"));
        assertEquals(0, diagnostics.count());
    }

    @Test
    void opStatWithWrongArityIsDropped() {
        DecodeResult result = decoder.decode(RawRecord.of(Atom.of("op_stat"),
                "node-1", Tuple.of(1700000000L, 0L, 0L), "some/path", 50L));

        DecodeResult.Dropped dropped = assertInstanceOf(DecodeResult.Dropped.class, result);
        assertEquals(DropReason.ARITY_MISMATCH, dropped.reason());
        assertFalse(result.isDecoded());
        assertTrue(result.record().isEmpty());

        assertEquals(1, diagnostics.count());
        DropDiagnostic d = diagnostics.last();
        assertEquals(DropReason.ARITY_MISMATCH, d.reason());
        assertEquals(Atom.of("op_stat"), d.tag());
        assertEquals(4, d.values().size());
    }

    @Test
    void appliesTransformsInSchemaOrder() {
        DecodeResult result = decoder.decode(RawRecord.of(Atom.of("op_stat"),
                "x".repeat(80),
                Tuple.of(Atom.of("queue"), 12L),
                List.of(109L, 115L),
                Atom.UNDEFINED,
                Atom.of("n@h"),
                Tuple.of(1700L, 5L, 6L)));

        DecodedRecord record = result.record().orElseThrow();
        assertEquals(List.of("name", "data", "unit", "sess", "node", "ts"), record.fieldNames());
        assertEquals("x".repeat(60), record.get("name"));
        assertEquals("{queue,12}", record.get("data"));
        assertEquals("ms", record.get("unit"));
        assertEquals(List.of(), record.get("sess"));
        assertEquals(Atom.of("n@h"), record.get("node"));
        assertEquals(Tuple.of(1700L, 5L, 6L), record.get("ts"));
    }

    @Test
    void decodesProcTopFromBytes() {
        Atom node = Atom.of("n@h");
        Tuple term = Tuple.of(Atom.of("erl_top"),
                node,
                Tuple.of(1L, 2L, 3L),
                new Pid(node, 85, 0, 1),
                10L, 20L, 30L, 40L, 0L,
                Tuple.of(Atom.of("gen_server"), Atom.of("loop"), 7L),
                Tuple.of(Atom.of("proc_lib"), Atom.of("init_p"), 5L),
                List.of(),
                233L, 376L, 987L,
                List.of(Tuple.of(Atom.of("gen"), Atom.of("do_call"), 4L, List.of())),
                new Pid(node, 50, 0, 1));

        DecodedRecord record = decoder.decode(encoder.encode(term)).record().orElseThrow();

        assertEquals(RecordType.PROC_TOP, record.type());
        assertEquals("<0.85.0>", record.get("pid"));
        assertEquals("gen_server:loop/7", record.get("current_function"));
        assertEquals("proc_lib:init_p/5", record.get("initial_call"));
        assertEquals("", record.get("registered_name"));
        assertEquals("[{gen,do_call,4,[]}]", record.get("current_stacktrace"));
        assertEquals(new Pid(node, 50, 0, 1), record.get("group_leader"));
        assertEquals(16, record.fields().size());
    }

    @Test
    void decodedRecordIsImmutable() {
        DecodedRecord record = decoder.decode(RawRecord.of(Atom.of("node_role"), "n", Tuple.of(1L, 2L, 3L), "d"))
                .record().orElseThrow();
        assertThrows(UnsupportedOperationException.class, () -> record.fields().put("extra", 1));
    }

    @Test
    void unparsablePayloadIsDecodeError() {
        byte[] garbage = {1, 2, 3};

        DecodeResult result = decoder.decode(garbage);

        assertEquals(DropReason.DECODE_ERROR, ((DecodeResult.Dropped) result).reason());
        DropDiagnostic d = diagnostics.last();
        assertEquals(1, diagnostics.count());
        assertArrayEquals(garbage, d.payload());
        assertInstanceOf(TermDecodeException.class, d.error());
    }

    @Test
    void corruptAtomInsideRecordIsDecodeError() {
        // {node_role, <invalid UTF-8 atom>, {1,2,3}, []}
        byte[] bytes = {(byte) 131, 104, 4,
                119, 9, 'n', 'o', 'd', 'e', '_', 'r', 'o', 'l', 'e',
                119, 2, (byte) 0xC3, 0x28,
                104, 3, 97, 1, 97, 2, 97, 3,
                106};

        DecodeResult.Dropped dropped = assertInstanceOf(DecodeResult.Dropped.class, decoder.decode(bytes));

        assertEquals(DropReason.DECODE_ERROR, dropped.reason());
        assertEquals(1, diagnostics.count(DropReason.DECODE_ERROR));
        assertInstanceOf(TermDecodeException.class, diagnostics.last().error());
    }

    @Test
    void nonTupleOrEmptyTupleIsDecodeError() {
        assertEquals(DropReason.DECODE_ERROR,
                ((DecodeResult.Dropped) decoder.decode(encoder.encode(Atom.of("node_role")))).reason());
        assertEquals(DropReason.DECODE_ERROR,
                ((DecodeResult.Dropped) decoder.decode(encoder.encode(Tuple.of()))).reason());
        assertEquals(DropReason.DECODE_ERROR, ((DecodeResult.Dropped) decoder.decode((byte[]) null)).reason());
        assertEquals(3, diagnostics.count(DropReason.DECODE_ERROR));
    }

    @Test
    void unknownTagIsReportedWithTagAndValues() {
        DecodeResult result = decoder.decode(encoder.encode(Tuple.of(Atom.of("mystery"), 1L, 2L)));

        assertEquals(DropReason.UNKNOWN_TYPE, ((DecodeResult.Dropped) result).reason());
        DropDiagnostic d = diagnostics.last();
        assertEquals(Atom.of("mystery"), d.tag());
        assertEquals(List.of(1L, 2L), d.values());
    }

    @Test
    void nonAtomTagIsUnknownType() {
        DecodeResult result = decoder.decode(encoder.encode(Tuple.of(Binary.of("node_role"), "n", Tuple.of(1L, 2L, 3L), "d")));
        assertEquals(DropReason.UNKNOWN_TYPE, ((DecodeResult.Dropped) result).reason());
    }

    @Test
    void malformedTimestampIsTransformError() {
        byte[] payload = encoder.encode(Tuple.of(Atom.of("node_role"), "n", 1700000000L, "d"));

        DecodeResult result = decoder.decode(payload);

        assertEquals(DropReason.TRANSFORM_ERROR, ((DecodeResult.Dropped) result).reason());
        DropDiagnostic d = diagnostics.last();
        assertEquals(1, diagnostics.count());
        assertNotNull(d.error());
        assertArrayEquals(payload, d.payload());
        assertEquals(Atom.of("node_role"), d.tag());
    }

    @Test
    void everyFailureKindDropsOnceAndProcessingContinues() {
        List<byte[]> inputs = List.of(
                new byte[]{(byte) 131, 104},
                encoder.encode(Tuple.of(Atom.of("nope"), 1L)),
                encoder.encode(Tuple.of(Atom.of("node_role"), "n")),
                encoder.encode(Tuple.of(Atom.of("node_role"), "n", Tuple.of(1L), "d")),
                encoder.encode(Tuple.of(Atom.of("node_role"), "n", Tuple.of(1L, 2L, 3L), "d")));

        List<DecodeResult> results = inputs.stream().map(decoder::decode).toList();

        assertEquals(DropReason.DECODE_ERROR, ((DecodeResult.Dropped) results.get(0)).reason());
        assertEquals(DropReason.UNKNOWN_TYPE, ((DecodeResult.Dropped) results.get(1)).reason());
        assertEquals(DropReason.ARITY_MISMATCH, ((DecodeResult.Dropped) results.get(2)).reason());
        assertEquals(DropReason.TRANSFORM_ERROR, ((DecodeResult.Dropped) results.get(3)).reason());
        assertTrue(results.get(4).isDecoded());
        assertEquals(4, diagnostics.count());
    }

    @Test
    void arityMustMatchForEveryType() {
        SchemaRegistry registry = decoder.registry();
        for (RecordType type : RecordType.values()) {
            int arity = registry.lookup(type).arity();
            for (int n : new int[]{0, arity - 1, arity + 1}) {
                Object[] values = new Object[n];
                DecodeResult result = decoder.decode(RawRecord.of(Atom.of(type.tag()), values));
                assertEquals(DropReason.ARITY_MISMATCH, ((DecodeResult.Dropped) result).reason(), type + "/" + n);
            }
        }
        assertEquals(RecordType.values().length * 3, diagnostics.count());
    }
}
