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


package org.logjournal.core;

/**
 * Decides when the future returned by {@link LogJournal#write(java.util.List)} completes.
 *
 * @author LogJournal contributors
 */
public enum WriteAcknowledgement {
    /**
     * Complete as soon as every group has been queued on its writer shard. Append failures are only logged by the shards.
     */
    DISPATCHED,

    /**
     * Complete when the journal writer shards have appended every record. A slot fails with the first failing record of its
     * atomic write. Event republication is not awaited.
     */
    PERSISTED
}
