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

import org.junit.Test;
import org.logjournal.core.Event;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Tests on topic naming and the built-in event topic mappers.
 *
 * @author LogJournal contributors
 */
public class EventTopicMappersTest {
    private final Event event = new DefaultEvent("order:42", 1L, new byte[]{1});

    @Test
    public void defaultMapperPublishesToEvents() {
        assertEquals(Collections.singletonList("events"), EventTopicMappers.defaultMapper().topicsFor(event));
    }

    @Test
    public void emptyMapperPublishesNowhere() {
        assertTrue(EventTopicMappers.empty().topicsFor(event).isEmpty());
    }

    @Test
    public void fixedMapperPublishesToAllTopics() {
        assertEquals(Arrays.asList("audit", "billing"), EventTopicMappers.fixed("audit", "billing").topicsFor(event));
    }

    @Test
    public void illegalCharactersAreReplaced() {
        assertEquals("order_42", JournalTopics.journalTopic("order:42"));
        assertEquals("tenant_1_order-7.v2", JournalTopics.journalTopic("tenant/1 order-7.v2"));
        assertEquals("Order_1", JournalTopics.journalTopic("Order_1"));
    }

    @Test
    public void streamIdMapperUsesTheJournalTopic() {
        assertEquals(Collections.singletonList("order_42"), EventTopicMappers.streamId().topicsFor(event));
    }
}
