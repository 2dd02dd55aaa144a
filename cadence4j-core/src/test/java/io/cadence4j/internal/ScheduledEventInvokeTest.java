package io.cadence4j.internal;

import io.cadence4j.CancellableInvocable;
import io.cadence4j.Invocable;
import io.cadence4j.core.CancellationSource;
import io.cadence4j.core.CancellationToken;
import io.cadence4j.core.FactoryInstanceResolver;
import io.cadence4j.core.InstanceResolutionException;
import io.cadence4j.core.InstanceResolver;
import io.cadence4j.core.ResolutionScope;
import io.cadence4j.core.ScheduleConfigurationException;
import io.cadence4j.core.Unscheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScheduledEventInvokeTest {

    private Unscheduler unscheduler;
    private AtomicInteger runs;

    @BeforeEach
    void setUp() {
        unscheduler = mock(Unscheduler.class);
        when(unscheduler.tryUnschedule(anyString())).thenReturn(true);
        runs = new AtomicInteger();
    }

    @Test
    void invokeShouldRunActionAndMarkAsRun() throws Exception {
        ScheduledEvent event = ScheduledEvent.withAction(runs::incrementAndGet, unscheduler);
        event.everyMinute();

        event.invoke(CancellationToken.NONE);

        assertEquals(1, runs.get());
        assertTrue(event.hasRunAtLeastOnce());
        verify(unscheduler, never()).tryUnschedule(anyString());
    }

    @Test
    void invokeShouldAwaitAsyncTask() throws Exception {
        ScheduledEvent event = ScheduledEvent.withAsyncTask(
                () -> CompletableFuture.runAsync(runs::incrementAndGet), unscheduler);
        event.everyMinute();

        event.invoke(CancellationToken.NONE);

        assertEquals(1, runs.get());
    }

    @Test
    void asyncTaskFailureShouldPropagateUnwrapped() {
        IOException failure = new IOException("disk full");
        ScheduledEvent event = ScheduledEvent.withAsyncTask(
                () -> CompletableFuture.failedFuture(failure), unscheduler);
        event.everyMinute();

        IOException thrown = assertThrows(IOException.class, () -> event.invoke(CancellationToken.NONE));
        assertSame(failure, thrown);
    }

    @Test
    void falsePredicateShouldSkipWorkButStillMarkAsRun() throws Exception {
        ScheduledEvent event = ScheduledEvent.withAction(runs::incrementAndGet, unscheduler);
        event.everyMinute().when(() -> false);

        event.invoke(CancellationToken.NONE);

        assertEquals(0, runs.get());
        assertTrue(event.hasRunAtLeastOnce());
    }

    @Test
    void asyncPredicateShouldGateWork() throws Exception {
        AtomicInteger allowed = new AtomicInteger(0);
        ScheduledEvent event = ScheduledEvent.withAction(runs::incrementAndGet, unscheduler);
        event.everyMinute().whenAsync(() -> CompletableFuture.supplyAsync(() -> allowed.get() > 0));

        event.invoke(CancellationToken.NONE);
        allowed.set(1);
        event.invoke(CancellationToken.NONE);

        assertEquals(1, runs.get());
    }

    @Test
    void skippedOnceEventShouldStillBeUnscheduled() throws Exception {
        ScheduledEvent event = ScheduledEvent.withAction(runs::incrementAndGet, unscheduler);
        event.everyMinute().when(() -> false).once();

        event.invoke(CancellationToken.NONE);

        assertEquals(0, runs.get());
        verify(unscheduler).tryUnschedule(event.overlappingUniqueIdentifier());
    }

    @Test
    void onceEventShouldRequestUnscheduleWithItsIdentifier() throws Exception {
        ScheduledEvent event = ScheduledEvent.withAction(runs::incrementAndGet, unscheduler);
        event.everyMinute().assignUniqueIdentifier("cleanup").once();

        event.invoke(CancellationToken.NONE);

        verify(unscheduler, times(1)).tryUnschedule("cleanup");
    }

    @Test
    void failingOnceEventShouldStayScheduledUntilItSucceeds() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        ScheduledEvent event = ScheduledEvent.withAction(() -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("first attempt fails");
            }
        }, unscheduler);
        event.everyMinute().once();

        assertThrows(IllegalStateException.class, () -> event.invoke(CancellationToken.NONE));
        assertFalse(event.hasRunAtLeastOnce());
        verify(unscheduler, never()).tryUnschedule(anyString());

        event.invoke(CancellationToken.NONE);
        assertTrue(event.hasRunAtLeastOnce());
        verify(unscheduler, times(1)).tryUnschedule(anyString());
    }

    @Test
    void failingPredicateShouldPropagate() {
        ScheduledEvent event = ScheduledEvent.withAction(runs::incrementAndGet, unscheduler);
        event.everyMinute().when(() -> {
            throw new IllegalArgumentException("bad predicate");
        });

        assertThrows(IllegalArgumentException.class, () -> event.invoke(CancellationToken.NONE));
        assertEquals(0, runs.get());
        assertFalse(event.hasRunAtLeastOnce());
    }

    @Test
    void invocableShouldBeResolvedInvokedAndScopeClosed() throws Exception {
        CountingInvocable invocable = new CountingInvocable();
        ResolutionScope scope = mock(ResolutionScope.class);
        when(scope.resolve(CountingInvocable.class, null)).thenReturn(invocable);
        InstanceResolver resolver = mock(InstanceResolver.class);
        when(resolver.createScope()).thenReturn(scope);

        ScheduledEvent event = ScheduledEvent.withInvocable(CountingInvocable.class, resolver, unscheduler);
        event.everyMinute();
        event.invoke(CancellationToken.NONE);

        assertEquals(1, invocable.count);
        verify(scope).close();
        assertEquals(CountingInvocable.class, event.invocableType().orElseThrow());
    }

    @Test
    void scopeShouldBeClosedWhenInvocableFails() {
        ResolutionScope scope = mock(ResolutionScope.class);
        when(scope.resolve(FailingInvocable.class, null)).thenReturn(new FailingInvocable());
        InstanceResolver resolver = mock(InstanceResolver.class);
        when(resolver.createScope()).thenReturn(scope);

        ScheduledEvent event = ScheduledEvent.withInvocable(FailingInvocable.class, resolver, unscheduler);
        event.everyMinute().once();

        assertThrows(IOException.class, () -> event.invoke(CancellationToken.NONE));
        verify(scope).close();
        assertFalse(event.hasRunAtLeastOnce());
        verify(unscheduler, never()).tryUnschedule(anyString());
    }

    @Test
    void resolutionFailureShouldPropagateAndCloseScope() {
        ResolutionScope scope = mock(ResolutionScope.class);
        when(scope.resolve(any(), any())).thenThrow(new InstanceResolutionException("no bean"));
        InstanceResolver resolver = mock(InstanceResolver.class);
        when(resolver.createScope()).thenReturn(scope);

        ScheduledEvent event = ScheduledEvent.withInvocable(CountingInvocable.class, resolver, unscheduler);
        event.everyMinute();

        assertThrows(InstanceResolutionException.class, () -> event.invoke(CancellationToken.NONE));
        verify(scope).close();
    }

    @Test
    void cancellableInvocableShouldReceiveToken() throws Exception {
        CancellationSource source = new CancellationSource();
        CancellationAware invocable = new CancellationAware();
        FactoryInstanceResolver resolver = new FactoryInstanceResolver()
                .register(CancellationAware.class, () -> invocable);

        ScheduledEvent event = ScheduledEvent.withInvocable(CancellationAware.class, resolver, unscheduler);
        event.everyMinute();
        source.cancel();
        event.invoke(source.token());

        assertSame(source.token(), invocable.token);
        assertTrue(invocable.sawCancellation);
    }

    @Test
    void constructorParametersShouldReachResolver() throws Exception {
        FactoryInstanceResolver resolver = new FactoryInstanceResolver()
                .registerWithParams(GreetingInvocable.class, params -> new GreetingInvocable((String) params[0]));

        ScheduledEvent event = ScheduledEvent.withInvocableAndParams(
                GreetingInvocable.class, new Object[]{"hello"}, resolver, unscheduler);
        event.everyMinute();
        event.invoke(CancellationToken.NONE);

        assertEquals("hello", GreetingInvocable.lastGreeting);
    }

    @Test
    void nonInvocableTypeShouldBeRejectedAtConfigurationTime() {
        assertThrows(ScheduleConfigurationException.class, () -> ScheduledEvent.withInvocableAndParams(
                String.class, new Object[]{"x"}, new FactoryInstanceResolver(), unscheduler));
    }

    @Test
    void identifiersShouldBeUniqueUnlessAssigned() {
        ScheduledEvent first = ScheduledEvent.withAction(() -> { }, unscheduler);
        ScheduledEvent second = ScheduledEvent.withAction(() -> { }, unscheduler);
        assertFalse(first.overlappingUniqueIdentifier().equals(second.overlappingUniqueIdentifier()));

        first.everyMinute().preventOverlapping("X");
        second.everyMinute().preventOverlapping("X");
        assertEquals(first.overlappingUniqueIdentifier(), second.overlappingUniqueIdentifier());
        assertTrue(first.shouldPreventOverlapping());

        ScheduledEvent named = ScheduledEvent.withAction(() -> { }, unscheduler);
        named.everyMinute().assignUniqueIdentifier("X");
        assertEquals("X", named.overlappingUniqueIdentifier());
        assertFalse(named.shouldPreventOverlapping());
    }

    @Test
    void identifierShouldBeFixedOnceInvocationStarted() throws Exception {
        ScheduledEvent event = ScheduledEvent.withAction(() -> {
            throw new IllegalStateException("boom");
        }, unscheduler);
        event.everyMinute().assignUniqueIdentifier("cleanup");

        assertThrows(IllegalStateException.class, () -> event.invoke(CancellationToken.NONE));

        assertThrows(ScheduleConfigurationException.class, () -> event.assignUniqueIdentifier("renamed"));
        assertThrows(ScheduleConfigurationException.class, () -> event.preventOverlapping("renamed"));
        assertEquals("cleanup", event.overlappingUniqueIdentifier());
        assertFalse(event.shouldPreventOverlapping());
    }

    @Test
    void runOnceAtStartShouldOnlySetHint() throws Exception {
        ScheduledEvent event = ScheduledEvent.withAction(runs::incrementAndGet, unscheduler);
        assertFalse(event.shouldRunOnceAtStart());
        event.hourly().runOnceAtStart();
        assertTrue(event.shouldRunOnceAtStart());
        assertEquals(0, runs.get());
    }

    static class CountingInvocable implements Invocable {
        int count;

        @Override
        public void invoke() {
            count++;
        }
    }

    static class FailingInvocable implements Invocable {
        @Override
        public void invoke() throws IOException {
            throw new IOException("remote unavailable");
        }
    }

    static class CancellationAware implements CancellableInvocable {
        CancellationToken token;
        boolean sawCancellation;

        @Override
        public void setCancellationToken(CancellationToken token) {
            this.token = token;
        }

        @Override
        public void invoke() {
            sawCancellation = token.isCancellationRequested();
        }
    }

    static class GreetingInvocable implements Invocable {
        static volatile String lastGreeting;
        private final String greeting;

        GreetingInvocable(String greeting) {
            this.greeting = greeting;
        }

        @Override
        public void invoke() {
            lastGreeting = greeting;
        }
    }
}
