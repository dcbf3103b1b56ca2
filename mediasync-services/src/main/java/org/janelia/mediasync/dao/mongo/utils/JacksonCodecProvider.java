package org.janelia.mediasync.dao.mongo.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.bson.codecs.Codec;
import org.bson.codecs.configuration.CodecProvider;
import org.bson.codecs.configuration.CodecRegistry;
import org.janelia.mediasync.model.HasIdentifier;

/**
 * Provides Jackson based codecs for the persisted entities.
 */
public class JacksonCodecProvider implements CodecProvider {

    private final ObjectMapper objectMapper;

    public JacksonCodecProvider(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> Codec<T> get(Class<T> clazz, CodecRegistry registry) {
        if (HasIdentifier.class.isAssignableFrom(clazz)) {
            return new JacksonCodec<>(objectMapper, registry, clazz);
        }
        return null;
    }
}
