package io.fusionlite.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TypeTraitsTest {

    @Test
    void integer_types_round_and_saturate() {
        assertEquals(255, TypeTraits.UINT8.clamp(300));
        assertEquals(0, TypeTraits.UINT8.clamp(-4));
        assertEquals(3, TypeTraits.UINT8.clamp(2.5));
        assertEquals(-3, TypeTraits.INT8.clamp(-2.5));
        assertEquals(-128, TypeTraits.INT8.clamp(-1000));
        assertEquals(65535, TypeTraits.UINT16.clamp(1e9));
    }

    @Test
    void float_types_are_normalized() {
        assertEquals(0.25, TypeTraits.FLOAT32.clamp(0.25));
        assertEquals(1.0, TypeTraits.FLOAT64.clamp(1.5));
        assertEquals(0.0, TypeTraits.FLOAT64.clamp(Double.NaN));
        assertFalse(TypeTraits.FLOAT32.isInteger());
    }

    @Test
    void parse_accepts_any_case_and_rejects_unknown() {
        assertEquals(PixelType.UINT16, PixelType.parse("uint16"));
        assertEquals(PixelType.FLOAT32, PixelType.parse(" Float32 "));
        assertThrows(UnsupportedTypeException.class, () -> PixelType.parse("uint12"));
        assertThrows(UnsupportedTypeException.class, () -> PixelType.parse("invalid"));
        assertThrows(UnsupportedTypeException.class, () -> PixelType.parse(null));
    }

    @Test
    void invalid_has_no_traits() {
        assertThrows(UnsupportedTypeException.class, () -> TypeTraits.of(PixelType.INVALID));
        assertEquals(0, PixelType.INVALID.byteSize());
        assertEquals(2, PixelType.INT16.byteSize());
    }
}
