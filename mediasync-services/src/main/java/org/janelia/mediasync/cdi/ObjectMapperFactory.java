package org.janelia.mediasync.cdi;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.introspect.VisibilityChecker;
import com.fasterxml.jackson.databind.json.JsonMapper;

import static com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility.ANY;
import static com.fasterxml.jackson.databind.MapperFeature.AUTO_DETECT_GETTERS;
import static com.fasterxml.jackson.databind.MapperFeature.AUTO_DETECT_IS_GETTERS;
import static com.fasterxml.jackson.databind.MapperFeature.AUTO_DETECT_SETTERS;

public class ObjectMapperFactory {
    private static final ObjectMapperFactory INSTANCE = new ObjectMapperFactory();

    private final ObjectMapper defaultObjectMapper;

    ObjectMapperFactory() {
        defaultObjectMapper = newObjectMapper();
    }

    public static ObjectMapperFactory instance() {
        return INSTANCE;
    }

    public ObjectMapper getDefaultObjectMapper() {
        return defaultObjectMapper;
    }

    public ObjectMapper newObjectMapper() {
        return newMapperBuilder()
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .build();
    }

    private JsonMapper.Builder newMapperBuilder() {
        return JsonMapper.builder()
                .configure(SerializationFeature.WRITE_ENUMS_USING_TO_STRING, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .serializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Field based mapper used by the mongo codec. Dates are written as epoch milliseconds so that
     * they sort correctly inside the database.
     */
    public ObjectMapper newMongoCompatibleObjectMapper() {
        JsonMapper.Builder mapperBuilder = newMapperBuilder()
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, true)
                .disable(AUTO_DETECT_SETTERS)
                .disable(AUTO_DETECT_GETTERS)
                .disable(AUTO_DETECT_IS_GETTERS);
        VisibilityChecker<?> visibilityChecker = mapperBuilder.build().getVisibilityChecker();
        return mapperBuilder.visibility(visibilityChecker.withFieldVisibility(ANY))
                .build();
    }
}
