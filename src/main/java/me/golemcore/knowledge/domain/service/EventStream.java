package me.golemcore.knowledge.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.knowledge.domain.model.EventStreamOptions;
import me.golemcore.knowledge.domain.model.MemoryEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Live view of submitted events.
 *
 * <p>
 * Each received event passes the filter, then the transform. Unbuffered
 * streams emit every event as {@code data}; buffered streams collect events
 * and emit a {@code batch} once the buffer holds {@code bufferSize} events, or
 * on {@link #flush()}. Emissions reach both the registered callbacks and the
 * {@link Flux} views.
 */
@Slf4j
public class EventStream implements AutoCloseable {

    private final EventStreamOptions options;
    private final Consumer<EventStream> onClose;

    private final Object bufferLock = new Object();
    private final List<MemoryEvent> buffer = new ArrayList<>();

    private final List<Consumer<MemoryEvent>> dataListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<List<MemoryEvent>>> batchListeners = new CopyOnWriteArrayList<>();
    private final Sinks.Many<MemoryEvent> dataSink = Sinks.many().multicast().onBackpressureBuffer();
    private final Sinks.Many<List<MemoryEvent>> batchSink = Sinks.many().multicast().onBackpressureBuffer();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    EventStream(EventStreamOptions options, Consumer<EventStream> onClose) {
        this.options = options != null ? options : EventStreamOptions.defaults();
        this.onClose = onClose;
    }

    public EventStream onData(Consumer<MemoryEvent> listener) {
        dataListeners.add(listener);
        return this;
    }

    public EventStream onBatch(Consumer<List<MemoryEvent>> listener) {
        batchListeners.add(listener);
        return this;
    }

    public Flux<MemoryEvent> data() {
        return dataSink.asFlux();
    }

    public Flux<List<MemoryEvent>> batches() {
        return batchSink.asFlux();
    }

    public boolean isClosed() {
        return closed.get();
    }

    void accept(MemoryEvent event) {
        if (closed.get()) {
            return;
        }

        MemoryEvent processed;
        try {
            if (options.getFilter() != null && !options.getFilter().test(event)) {
                return;
            }
            processed = options.getTransform() != null ? options.getTransform().apply(event) : event;
        } catch (RuntimeException e) {
            log.warn("[Events] Stream filter/transform failed for event {}: {}", event.getId(), e.getMessage());
            return;
        }

        if (!options.isBuffered()) {
            emitData(processed);
            return;
        }

        List<MemoryEvent> full = null;
        synchronized (bufferLock) {
            buffer.add(processed);
            if (buffer.size() >= options.getBufferSize()) {
                full = List.copyOf(buffer);
                buffer.clear();
            }
        }
        if (full != null) {
            emitBatch(full);
        }
    }

    /**
     * Emit whatever is buffered as a batch. No-op when the buffer is empty.
     */
    public void flush() {
        List<MemoryEvent> pending;
        synchronized (bufferLock) {
            if (buffer.isEmpty()) {
                return;
            }
            pending = List.copyOf(buffer);
            buffer.clear();
        }
        emitBatch(pending);
    }

    /**
     * Flush pending events, stop receiving new ones and complete the Flux
     * views.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        flush();
        if (onClose != null) {
            onClose.accept(this);
        }
        dataSink.tryEmitComplete();
        batchSink.tryEmitComplete();
    }

    private void emitData(MemoryEvent event) {
        for (Consumer<MemoryEvent> listener : dataListeners) {
            notifyListener(listener, event);
        }
        dataSink.tryEmitNext(event);
    }

    private void emitBatch(List<MemoryEvent> batch) {
        for (Consumer<List<MemoryEvent>> listener : batchListeners) {
            notifyListener(listener, batch);
        }
        batchSink.tryEmitNext(batch);
    }

    private <T> void notifyListener(Consumer<T> listener, T value) {
        try {
            listener.accept(value);
        } catch (RuntimeException e) {
            log.warn("[Events] Stream listener failed: {}", e.getMessage(), e);
        }
    }
}
