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

import me.golemcore.knowledge.domain.model.MemoryEvent;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;

/**
 * Priority-ordered event queue. Higher priorities are served first; entries of
 * equal priority keep submission order because a new entry is inserted before
 * the first entry with a strictly lower priority.
 */
class EventPriorityQueue {

    private final LinkedList<Entry> entries = new LinkedList<>();

    synchronized void enqueue(MemoryEvent event, double priority) {
        ListIterator<Entry> iterator = entries.listIterator();
        while (iterator.hasNext()) {
            if (iterator.next().priority() < priority) {
                iterator.previous();
                break;
            }
        }
        iterator.add(new Entry(event, priority));
    }

    /**
     * Removes up to {@code max} events from the head of the queue.
     */
    synchronized List<MemoryEvent> drain(int max) {
        List<MemoryEvent> drained = new ArrayList<>(Math.min(Math.max(max, 0), entries.size()));
        while (drained.size() < max && !entries.isEmpty()) {
            drained.add(entries.removeFirst().event());
        }
        return drained;
    }

    synchronized int size() {
        return entries.size();
    }

    synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    private record Entry(MemoryEvent event, double priority) {
    }
}
