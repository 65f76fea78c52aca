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


package org.logjournal.core.support;

import org.logjournal.core.EventTopicMapper;

import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The built-in event topic mappers.
 *
 * @author LogJournal contributors
 */
public final class EventTopicMappers {
    public static final String DEFAULT_EVENT_TOPIC = "events";

    private EventTopicMappers() {
        // empty
    }

    /**
     * Publishes every event to the {@link #DEFAULT_EVENT_TOPIC}.
     */
    public static EventTopicMapper defaultMapper() {
        return fixed(DEFAULT_EVENT_TOPIC);
    }

    /**
     * Publishes nothing, disables event republication.
     */
    public static EventTopicMapper empty() {
        return event -> Collections.emptyList();
    }

    /**
     * Publishes every event to the given topics.
     */
    public static EventTopicMapper fixed(final String... topics) {
        requireNonNull(topics, "Topics must not be null");
        final List<String> fixedTopics = List.of(topics);
        return event -> fixedTopics;
    }

    /**
     * Publishes every event to a topic named after its stream.
     */
    public static EventTopicMapper streamId() {
        return event -> Collections.singletonList(JournalTopics.journalTopic(event.streamId()));
    }
}
