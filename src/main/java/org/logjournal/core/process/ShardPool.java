/*
 * Copyright 2014 the original author or authors.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */


package org.logjournal.core.process;

import org.logjournal.core.lifecycle.Stoppable;
import org.logjournal.core.support.Closeables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.IntFunction;

/**
 * A fixed-size pool of writer shards. A stream is always routed to the same shard, which keeps the writes of a stream in
 * order.
 *
 * @author LogJournal contributors
 */
final class ShardPool<S extends AbstractWriterShard> implements Stoppable {
    private final List<S> shards;

    ShardPool(final int size, final IntFunction<S> shardFactory) {
        if (size <= 0) {
            throw new IllegalArgumentException("Pool size must be positive [size=" + size + "]");
        }

        final List<S> created = new ArrayList<>(size);
        try {
            for (int i = 0; i < size; i++) {
                created.add(shardFactory.apply(i));
            }
        } catch (final RuntimeException e) {
            created.forEach(Closeables::closeSilently);
            throw e;
        }
        this.shards = Collections.unmodifiableList(created);
    }

    int indexFor(final String streamId) {
        return JournalHelper.shardIndex(streamId, shards.size());
    }

    S shardFor(final String streamId) {
        return shards.get(indexFor(streamId));
    }

    List<S> shards() {
        return shards;
    }

    int size() {
        return shards.size();
    }

    @Override
    public void stop() {
        shards.forEach(Closeables::closeSilently);
    }

    /**
     * Hands the new configuration to every shard. Each shard swaps on its own, there is no point in time where all shards switch
     * together.
     */
    CompletableFuture<Void> updateConfig(final WriterConfig config) {
        return CompletableFuture.allOf(shards.stream()
                .map(shard -> shard.updateConfig(config))
                .toArray(CompletableFuture[]::new));
    }
}
