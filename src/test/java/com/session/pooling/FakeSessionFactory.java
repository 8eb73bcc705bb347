package com.session.pooling;

import com.session.pooling.session.SessionFactory;
import com.session.pooling.session.SessionFactoryException;
import com.session.pooling.session.SessionHandle;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory session factory recording every create and destroy.
 */
public class FakeSessionFactory implements SessionFactory {

    private final AtomicInteger counter = new AtomicInteger();
    private final AtomicInteger failingCreates = new AtomicInteger();
    private final AtomicBoolean failDestroy = new AtomicBoolean(false);
    private final List<FakeHandle> created = new CopyOnWriteArrayList<>();
    private final List<FakeHandle> destroyed = new CopyOnWriteArrayList<>();
    private final AtomicReference<Runnable> probeHook = new AtomicReference<>();

    @Override
    public SessionHandle create(String target) {
        if (failingCreates.get() > 0 && failingCreates.getAndDecrement() > 0) {
            throw new SessionFactoryException("backend " + target + " unreachable");
        }
        FakeHandle handle = new FakeHandle(target + "#" + counter.incrementAndGet(), this::runProbeHook);
        created.add(handle);
        return handle;
    }

    @Override
    public void destroy(SessionHandle handle) {
        if (failDestroy.get()) {
            throw new SessionFactoryException("teardown refused");
        }
        FakeHandle fake = (FakeHandle) handle;
        fake.open.set(false);
        destroyed.add(fake);
    }

    /**
     * Makes the next {@code count} creations fail.
     */
    public void failNextCreates(int count) {
        failingCreates.set(count);
    }

    /**
     * Runs {@code hook} once, during the next liveness probe of any handle.
     */
    public void onNextProbe(Runnable hook) {
        probeHook.set(hook);
    }

    private void runProbeHook() {
        Runnable hook = probeHook.getAndSet(null);
        if (hook != null) {
            hook.run();
        }
    }

    public void failDestroy(boolean fail) {
        failDestroy.set(fail);
    }

    public int createdCount() {
        return created.size();
    }

    public int destroyedCount() {
        return destroyed.size();
    }

    public List<FakeHandle> created() {
        return created;
    }

    public List<FakeHandle> destroyed() {
        return destroyed;
    }

    public static class FakeHandle implements SessionHandle {
        private final String name;
        private final AtomicBoolean open = new AtomicBoolean(true);
        private final Runnable onProbe;

        FakeHandle(String name, Runnable onProbe) {
            this.name = name;
            this.onProbe = onProbe;
        }

        public String name() {
            return name;
        }

        public void close() {
            open.set(false);
        }

        @Override
        public boolean isOpen() {
            onProbe.run();
            return open.get();
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
