package org.janelia.mediasync.dao.mongo.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.MongoClientSettings;
import org.bson.codecs.configuration.CodecRegistries;
import org.bson.codecs.configuration.CodecRegistry;

public class RegistryHelper {

    public static CodecRegistry createCodecRegistry(ObjectMapper mongoObjectMapper) {
        return CodecRegistries.fromRegistries(
                MongoClientSettings.getDefaultCodecRegistry(),
                CodecRegistries.fromProviders(new JacksonCodecProvider(mongoObjectMapper))
        );
    }

}
