package io.fullerstack.perf.core.monitor;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.*;

class SubscriberRegistryTest {

    private final SubscriberRegistry<String> registry = new SubscriberRegistry<>();

    @Test
    void idsStartAtOneAndIncrease() {
        long first = registry.register(s -> { });
        long second = registry.register(s -> { });

        assertThat(first).isEqualTo(1);
        assertThat(second).isEqualTo(2);
    }

    @Test
    void idsAreNeverReusedAfterRemoval() {
        long first = registry.register(s -> { });
        registry.remove(first);

        long next = registry.register(s -> { });

        assertThat(next).isGreaterThan(first);
    }

    @Test
    void removeUnknownIdIsNoOp() {
        registry.register(s -> { });

        assertThat(registry.remove(999)).isFalse();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void rejectsNullCallback() {
        assertThatThrownBy(() -> registry.register(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("callback cannot be null");
    }

    @Test
    void notifiesInRegistrationOrder() {
        List<String> received = new ArrayList<>();
        registry.register(s -> received.add("a:" + s));
        registry.register(s -> received.add("b:" + s));

        int delivered = registry.notifyAll("x");

        assertThat(delivered).isEqualTo(2);
        assertThat(received).containsExactly("a:x", "b:x");
    }

    @Test
    void removedCallbackReceivesNothing() {
        List<String> received = new ArrayList<>();
        long id = registry.register(received::add);
        registry.remove(id);

        assertThat(registry.notifyAll("x")).isZero();
        assertThat(received).isEmpty();
    }

    @Test
    void throwingCallbackDoesNotStopOthers() {
        List<String> received = new ArrayList<>();
        registry.register(s -> {
            throw new IllegalStateException("boom");
        });
        registry.register(received::add);

        int delivered = registry.notifyAll("x");

        assertThat(delivered).isEqualTo(1);
        assertThat(received).containsExactly("x");
    }

    @Test
    void callbackCanRemoveItselfAndLaterSubscribers() {
        List<String> received = new ArrayList<>();
        AtomicLong selfId = new AtomicLong();
        AtomicLong laterId = new AtomicLong();
        Consumer<String> selfRemoving = s -> {
            received.add("self:" + s);
            registry.remove(selfId.get());
            registry.remove(laterId.get());
        };
        selfId.set(registry.register(selfRemoving));
        laterId.set(registry.register(s -> received.add("later:" + s)));

        registry.notifyAll("first");
        registry.notifyAll("second");

        assertThat(received).containsExactly("self:first");
        assertThat(registry.size()).isZero();
    }

    @Test
    void containsTracksMembership() {
        long id = registry.register(s -> { });

        assertThat(registry.contains(id)).isTrue();
        registry.remove(id);
        assertThat(registry.contains(id)).isFalse();
    }
}
