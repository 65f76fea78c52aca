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

import org.logjournal.core.Event;
import org.logjournal.core.EventSerializer;
import org.logjournal.core.JournalRecord;
import org.logjournal.core.RecordSerializer;
import org.logjournal.core.SerializationException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;

/**
 * Serializer based on Java object streams. Records and events must be {@link Serializable}, which the default implementations
 * are.
 *
 * @author LogJournal contributors
 */
public class ObjectStreamSerializer implements RecordSerializer, EventSerializer {
    @Override
    public Event deserializeEvent(final byte[] data) {
        return deserialize(data, Event.class);
    }

    @Override
    public JournalRecord deserializeRecord(final byte[] data) {
        return deserialize(data, JournalRecord.class);
    }

    @Override
    public byte[] serialize(final Event event) {
        return write(event);
    }

    @Override
    public byte[] serialize(final JournalRecord record) {
        return write(record);
    }

    private <T> T deserialize(final byte[] data, final Class<T> type) {
        if (data == null) {
            throw new SerializationException("Deserialization failed, no data");
        }

        try (ObjectInputStream is = new ObjectInputStream(new ByteArrayInputStream(data))) {
            final Object obj = is.readObject();
            if (type.isInstance(obj)) {
                return type.cast(obj);
            }
            throw new SerializationException("Deserialization failed, incorrect type "
                    + (obj != null ? obj.getClass() : "null"));
        } catch (final IOException | ClassNotFoundException e) {
            throw new SerializationException("Unable to deserialize " + type.getSimpleName(), e);
        }
    }

    private byte[] write(final Object obj) {
        if (!(obj instanceof Serializable)) {
            throw new SerializationException("Serialization failed, not serializable "
                    + (obj != null ? obj.getClass() : "null"));
        }

        try (final ByteArrayOutputStream bos = new ByteArrayOutputStream();
             final ObjectOutputStream os = new ObjectOutputStream(bos)) {

            os.writeObject(obj);
            os.flush();
            return bos.toByteArray();
        } catch (final IOException e) {
            throw new SerializationException("Unable to serialize " + obj.getClass().getSimpleName(), e);
        }
    }
}
