package io.fusionlite.fusion;

import io.fusionlite.core.PixelType;
import io.fusionlite.core.TypeTraits;
import io.fusionlite.core.TypedFactory;
import io.fusionlite.core.UnsupportedTypeException;
import io.fusionlite.core.image.Image;
import io.fusionlite.core.image.ImageStore;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Forwarding and copy/move/swap/assign behavior of the typed proxy.
 */
class FusorProxyTest {

    private static final int DATE = 20200101;

    private static ImageStore inputs(double value) {
        var img = new Image(3, 2, PixelType.UINT16);
        img.fill(value);
        var store = new ImageStore();
        store.set("L8", DATE, img);
        return store;
    }

    /** Family that builds the first {@code okCalls} fusors, then fails. */
    private static final class FlakyFamily implements TypedFactory<DataFusor> {
        final AtomicInteger calls = new AtomicInteger();
        final int okCalls;

        FlakyFamily(int okCalls) {
            this.okCalls = okCalls;
        }

        @Override
        public <V extends Number> DataFusor create(TypeTraits<V> traits) {
            if (calls.incrementAndGet() > okCalls) {
                throw new IllegalStateException("factory exhausted");
            }
            return new OffsetFusor<>(traits);
        }
    }

    @Test
    void forwards_every_call_to_the_owned_fusor() {
        var proxy = new TypedFusorProxy(OffsetFusor.FAMILY, PixelType.UINT16);
        var store = inputs(100);

        proxy.processOptions(new OffsetOptions(5));
        proxy.setSrcImages(store);
        proxy.predict(DATE);

        assertEquals(5, ((OffsetOptions) proxy.getOptions()).getOffset());
        assertSame(store, proxy.srcImages());
        assertEquals(105, proxy.outputImage().get(2, 1));

        var replacement = new Image(1, 1, PixelType.UINT16);
        proxy.setOutputImage(replacement);
        assertSame(replacement, proxy.outputImage());
    }

    @Test
    void specialization_follows_the_discriminant() {
        var store = inputs(250);
        var u8 = new TypedFusorProxy(OffsetFusor.FAMILY, PixelType.UINT8);
        var u16 = new TypedFusorProxy(OffsetFusor.FAMILY, PixelType.UINT16);

        for (var p : new TypedFusorProxy[]{u8, u16}) {
            p.processOptions(new OffsetOptions(10));
            p.setSrcImages(store);
            p.predict(DATE);
        }

        assertEquals(255, u8.outputImage().get(0, 0), "uint8 fusor saturates");
        assertEquals(260, u16.outputImage().get(0, 0));
        assertEquals(PixelType.UINT8, u8.type());
    }

    @Test
    void strategy_failures_pass_through_unchanged() {
        var proxy = new TypedFusorProxy(OffsetFusor.FAMILY, PixelType.INT32);
        proxy.setSrcImages(inputs(1));
        proxy.processOptions(new OffsetOptions(1).failAt(DATE));

        var e = assertThrows(IllegalStateException.class, () -> proxy.predict(DATE));
        assertEquals("no prediction possible for date " + DATE, e.getMessage());

        assertThrows(IllegalArgumentException.class, () -> proxy.processOptions(new Options()));
    }

    @Test
    void copy_rebuilds_through_the_factory_and_shares_no_state() {
        var store = inputs(40);
        var a = new TypedFusorProxy(OffsetFusor.FAMILY, PixelType.UINT16);
        a.processOptions(new OffsetOptions(2));
        a.setSrcImages(store);
        a.predict(DATE);

        int before = OffsetFusor.CONSTRUCTED.get();
        var b = new TypedFusorProxy(a);
        assertEquals(before + 1, OffsetFusor.CONSTRUCTED.get(), "copy invokes the factory once");
        assertEquals(a.type(), b.type());

        b.processOptions(new OffsetOptions(2));
        b.setSrcImages(store);
        b.predict(DATE);
        assertTrue(a.outputImage().contentEquals(b.outputImage()), "same inputs, same result");
        assertNotSame(a.outputImage(), b.outputImage());

        b.outputImage().set(0, 0, 0);
        b.processOptions(new OffsetOptions(9));
        assertEquals(42, a.outputImage().get(0, 0));
        assertEquals(2, ((OffsetOptions) a.getOptions()).getOffset());
    }

    @Test
    void unsupported_type_builds_nothing() {
        int before = OffsetFusor.CONSTRUCTED.get();

        assertThrows(UnsupportedTypeException.class,
                () -> new TypedFusorProxy(OffsetFusor.FAMILY, PixelType.INVALID));
        assertEquals(before, OffsetFusor.CONSTRUCTED.get());
    }

    @Test
    void move_transfers_fusor_without_factory_call() {
        var a = new TypedFusorProxy(OffsetFusor.FAMILY, PixelType.INT16);
        a.processOptions(new OffsetOptions(3));

        int before = OffsetFusor.CONSTRUCTED.get();
        var b = TypedFusorProxy.moveFrom(a);

        assertEquals(before, OffsetFusor.CONSTRUCTED.get());
        assertEquals(PixelType.INT16, b.type());
        assertEquals(3, ((OffsetOptions) b.getOptions()).getOffset(), "state moves with the fusor");
        assertThrows(IllegalStateException.class, a::getOptions, "moved-from proxy is unusable");
    }

    @Test
    void swap_exchanges_fusor_and_discriminant() {
        var a = new TypedFusorProxy(OffsetFusor.FAMILY, PixelType.UINT8);
        var b = new TypedFusorProxy(OffsetFusor.FAMILY, PixelType.FLOAT32);
        a.processOptions(new OffsetOptions(1));
        b.processOptions(new OffsetOptions(7));

        a.swap(b);

        assertEquals(PixelType.FLOAT32, a.type());
        assertEquals(PixelType.UINT8, b.type());
        assertEquals(7, ((OffsetOptions) a.getOptions()).getOffset());
        assertEquals(1, ((OffsetOptions) b.getOptions()).getOffset());
    }

    @Test
    void assign_replaces_state_with_a_fresh_rebuild() {
        var target = new TypedFusorProxy(OffsetFusor.FAMILY, PixelType.UINT8);
        var source = new TypedFusorProxy(OffsetFusor.FAMILY, PixelType.INT32);
        source.processOptions(new OffsetOptions(11));

        assertSame(target, target.assign(source));

        assertEquals(PixelType.INT32, target.type());
        assertEquals(0, ((OffsetOptions) target.getOptions()).getOffset(), "options are not copied, the fusor is rebuilt");
        assertEquals(11, ((OffsetOptions) source.getOptions()).getOffset());
    }

    @Test
    void failed_assign_leaves_target_untouched() {
        var flaky = new FlakyFamily(1);
        var source = new TypedFusorProxy(flaky, PixelType.UINT16);
        var target = new TypedFusorProxy(OffsetFusor.FAMILY, PixelType.UINT8);
        target.processOptions(new OffsetOptions(4));
        Options optionsBefore = target.getOptions();

        var e = assertThrows(IllegalStateException.class, () -> target.assign(source));
        assertEquals("factory exhausted", e.getMessage());

        assertEquals(PixelType.UINT8, target.type());
        assertSame(optionsBefore, target.getOptions());
        assertEquals(2, flaky.calls.get());
    }

    @Test
    void simple_factory_entry_point_dispatches() {
        DataFusor f = FusorProxy.create(OffsetFusor.FAMILY, PixelType.FLOAT64);

        assertTrue(f instanceof OffsetFusor<?>);
        assertSame(TypeTraits.FLOAT64, ((OffsetFusor<?>) f).traits());
    }
}
